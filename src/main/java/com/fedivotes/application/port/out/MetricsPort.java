package com.fedivotes.application.port.out;

import com.fedivotes.domain.model.ObjectKind;

import java.util.function.Supplier;

/**
 * Port for recording application metrics.
 * Abstracts the metrics infrastructure from application services.
 */
public interface MetricsPort {

    void incrementVoteRequests(ObjectKind kind);

    void incrementObjectsNotFound();

    <T> T recordFetchDuration(Supplier<T> operation);
}
