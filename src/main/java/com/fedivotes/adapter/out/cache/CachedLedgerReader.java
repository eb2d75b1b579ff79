package com.fedivotes.adapter.out.cache;

import com.fedivotes.application.port.out.LedgerQueryPort;
import com.fedivotes.application.port.out.VoteLedgerRepository;
import com.fedivotes.application.port.out.VoteLedgerRepository.VoteRow;
import com.fedivotes.domain.model.LocalId;
import com.fedivotes.domain.model.VoteQueryShape;
import com.fedivotes.infrastructure.cache.TtlCache;
import com.fedivotes.infrastructure.cache.TtlCacheFactory;
import com.fedivotes.infrastructure.config.AppProperties;
import com.fedivotes.infrastructure.exception.VoteDataSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Memoizes vote lists per distinct query. Vote lists change faster than ids or
 * aggregates, so this cache is configured with the shortest TTL.
 */
@Component
public class CachedLedgerReader implements LedgerQueryPort {

    private static final Logger log = LoggerFactory.getLogger(CachedLedgerReader.class);

    private final VoteLedgerRepository ledgerRepository;
    private final TtlCache<LedgerKey, List<VoteRow>> cache;

    public CachedLedgerReader(
            VoteLedgerRepository ledgerRepository,
            TtlCacheFactory cacheFactory,
            AppProperties appProperties) {
        this.ledgerRepository = ledgerRepository;
        this.cache = cacheFactory.create("ledger", appProperties.getVotes().getCache().getLedger());
    }

    @Override
    public List<VoteRow> fetchVotes(VoteQueryShape shape, LocalId localId, String authorName) {
        // names are folded once here; the same value keys the cache and is bound to the query
        String folded = shape.authorFiltered() ? authorName.toLowerCase(Locale.ROOT) : null;
        return cache.getOrCompute(new LedgerKey(shape, localId, folded), () -> read(shape, localId, folded));
    }

    private List<VoteRow> read(VoteQueryShape shape, LocalId localId, String authorName) {
        try {
            List<VoteRow> rows = List.copyOf(ledgerRepository.findVotes(shape, localId, authorName));
            log.debug("Read {} vote rows for {} {} ({})", rows.size(), shape.kind(), localId, shape.filter());
            return rows;
        } catch (DataAccessException e) {
            throw new VoteDataSourceException("Failed to read votes of " + shape.kind() + " " + localId, e);
        }
    }

    record LedgerKey(VoteQueryShape shape, LocalId localId, String authorName) {}
}
