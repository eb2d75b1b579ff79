package com.fedivotes.adapter.out.persistence;

import com.fedivotes.application.port.out.ObjectRepository;
import com.fedivotes.domain.model.FederatedUrl;
import com.fedivotes.domain.model.LocalId;
import com.fedivotes.domain.model.ObjectKind;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public class JdbcObjectRepository implements ObjectRepository {

    private static final RowMapper<LocalId> ROW_MAPPER = (rs, rowNum) -> new LocalId(rs.getLong("id"));

    private final JdbcTemplate jdbc;

    public JdbcObjectRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Optional<LocalId> findLocalId(FederatedUrl url, ObjectKind kind) {
        return jdbc.query(
            VoteSqlBuilder.identityQuery(kind),
            ROW_MAPPER,
            url.value()
        ).stream().findFirst();
    }
}
