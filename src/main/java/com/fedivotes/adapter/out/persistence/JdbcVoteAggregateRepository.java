package com.fedivotes.adapter.out.persistence;

import com.fedivotes.application.port.out.VoteAggregateRepository;
import com.fedivotes.domain.model.LocalId;
import com.fedivotes.domain.model.ObjectKind;
import com.fedivotes.domain.model.VoteAggregate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Reads the precomputed score row. Every call borrows its own pooled connection
 * and returns it before this method exits, so it can run alongside a ledger read.
 */
@Repository
public class JdbcVoteAggregateRepository implements VoteAggregateRepository {

    private static final RowMapper<VoteAggregate> ROW_MAPPER = (rs, rowNum) -> new VoteAggregate(
        rs.getLong("score"),
        rs.getLong("upvotes"),
        rs.getLong("downvotes")
    );

    private final JdbcTemplate jdbc;

    public JdbcVoteAggregateRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Optional<VoteAggregate> findAggregate(ObjectKind kind, LocalId localId) {
        return jdbc.query(
            VoteSqlBuilder.aggregateQuery(kind),
            ROW_MAPPER,
            localId.value()
        ).stream().findFirst();
    }
}
