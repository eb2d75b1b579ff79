package com.fedivotes.infrastructure.metrics;

import com.fedivotes.application.port.out.MetricsPort;
import com.fedivotes.domain.model.ObjectKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

@Component
public class AppMetrics implements MetricsPort {

    private final Map<ObjectKind, Counter> voteRequests = new EnumMap<>(ObjectKind.class);
    private final Counter objectsNotFound;
    private final Timer fetchDuration;

    public AppMetrics(MeterRegistry registry) {
        for (ObjectKind kind : ObjectKind.values()) {
            voteRequests.put(kind, Counter.builder("vote_requests_total")
                .description("Total number of vote lookups")
                .tag("kind", kind.name().toLowerCase(Locale.ROOT))
                .register(registry));
        }

        this.objectsNotFound = Counter.builder("vote_objects_not_found_total")
            .description("Lookups whose URL did not resolve to a local object")
            .register(registry);

        this.fetchDuration = Timer.builder("vote_fetch_duration_seconds")
            .description("Time taken by the concurrent aggregate and ledger reads")
            .register(registry);
    }

    @Override
    public void incrementVoteRequests(ObjectKind kind) {
        voteRequests.get(kind).increment();
    }

    @Override
    public void incrementObjectsNotFound() {
        objectsNotFound.increment();
    }

    @Override
    public <T> T recordFetchDuration(Supplier<T> operation) {
        return fetchDuration.record(operation);
    }
}
