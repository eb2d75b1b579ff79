package com.fedivotes.adapter.out.cache;

import com.fedivotes.application.port.out.AggregateQueryPort;
import com.fedivotes.application.port.out.VoteAggregateRepository;
import com.fedivotes.domain.model.LocalId;
import com.fedivotes.domain.model.ObjectKind;
import com.fedivotes.domain.model.VoteAggregate;
import com.fedivotes.infrastructure.cache.TtlCache;
import com.fedivotes.infrastructure.cache.TtlCacheFactory;
import com.fedivotes.infrastructure.config.AppProperties;
import com.fedivotes.infrastructure.exception.VoteDataSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Memoizes aggregate rows per (kind, local id). The aggregate query text is a function
 * of the kind alone, so the kind stands in for the text in the key.
 */
@Component
public class CachedAggregateReader implements AggregateQueryPort {

    private static final Logger log = LoggerFactory.getLogger(CachedAggregateReader.class);

    private final VoteAggregateRepository aggregateRepository;
    private final TtlCache<AggregateKey, VoteAggregate> cache;

    public CachedAggregateReader(
            VoteAggregateRepository aggregateRepository,
            TtlCacheFactory cacheFactory,
            AppProperties appProperties) {
        this.aggregateRepository = aggregateRepository;
        this.cache = cacheFactory.create("aggregate", appProperties.getVotes().getCache().getAggregate());
    }

    @Override
    public VoteAggregate fetchAggregate(ObjectKind kind, LocalId localId) {
        return cache.getOrCompute(new AggregateKey(kind, localId), () -> read(kind, localId));
    }

    private VoteAggregate read(ObjectKind kind, LocalId localId) {
        try {
            return aggregateRepository.findAggregate(kind, localId)
                .orElseGet(() -> {
                    log.warn("No aggregate row for {} {}, reporting zero counts", kind, localId);
                    return VoteAggregate.empty();
                });
        } catch (DataAccessException e) {
            throw new VoteDataSourceException("Failed to read aggregate of " + kind + " " + localId, e);
        }
    }

    record AggregateKey(ObjectKind kind, LocalId localId) {}
}
