package com.fedivotes.adapter.out.persistence;

import com.fedivotes.application.port.out.VoteLedgerRepository;
import com.fedivotes.domain.model.LocalId;
import com.fedivotes.domain.model.VoteQueryShape;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class JdbcVoteLedgerRepository implements VoteLedgerRepository {

    private static final RowMapper<VoteRow> ROW_MAPPER = (rs, rowNum) -> new VoteRow(
        rs.getString("name"),
        rs.getInt("score"),
        rs.getString("actor_id"),
        rs.getTimestamp("published").toInstant()
    );

    private final JdbcTemplate jdbc;

    public JdbcVoteLedgerRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public List<VoteRow> findVotes(VoteQueryShape shape, LocalId localId, String authorName) {
        String sql = VoteSqlBuilder.ledgerQuery(shape);
        if (shape.authorFiltered()) {
            return jdbc.query(sql, ROW_MAPPER, localId.value(), authorName);
        }
        return jdbc.query(sql, ROW_MAPPER, localId.value());
    }
}
