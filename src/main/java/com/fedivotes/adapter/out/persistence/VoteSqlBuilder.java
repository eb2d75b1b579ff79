package com.fedivotes.adapter.out.persistence;

import com.fedivotes.domain.model.ObjectKind;
import com.fedivotes.domain.model.VoteQueryShape;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Renders the parameterized SQL read against the Lemmy schema.
 * Output depends only on the arguments; identical shapes yield identical text.
 *
 * <p>Ledger queries bind the local id as parameter 1 and, when the shape is author-filtered,
 * the voter name as parameter 2. Voter names compare case-insensitively.
 */
public final class VoteSqlBuilder {

    private static final Map<VoteQueryShape, String> LEDGER_QUERIES = new ConcurrentHashMap<>();

    private VoteSqlBuilder() {}

    public static String identityQuery(ObjectKind kind) {
        return "SELECT id FROM public." + table(kind) + " WHERE ap_id = ?";
    }

    public static String aggregateQuery(ObjectKind kind) {
        return "SELECT agg.score, agg.upvotes, agg.downvotes"
            + " FROM public." + table(kind) + "_aggregates agg"
            + " WHERE agg." + table(kind) + "_id = ?";
    }

    public static String ledgerQuery(VoteQueryShape shape) {
        return LEDGER_QUERIES.computeIfAbsent(shape, VoteSqlBuilder::renderLedgerQuery);
    }

    private static String renderLedgerQuery(VoteQueryShape shape) {
        String table = table(shape.kind());
        StringBuilder sql = new StringBuilder()
            .append("SELECT pe.name, lk.score, pe.actor_id, lk.published")
            .append(" FROM public.").append(table).append("_like lk")
            .append(" JOIN public.person pe ON lk.person_id = pe.id")
            .append(" WHERE lk.").append(table).append("_id = ?");

        switch (shape.filter()) {
            case UPVOTES -> sql.append(" AND lk.score = 1");
            case DOWNVOTES -> sql.append(" AND lk.score = -1");
            case ALL -> {
                // no score predicate
            }
        }

        if (shape.authorFiltered()) {
            sql.append(" AND lower(pe.name) = ?");
        }

        // person id breaks ties between votes cast in the same instant
        sql.append(" ORDER BY lk.published ").append(shape.sort().ascending() ? "ASC" : "DESC")
            .append(", pe.id ASC");
        return sql.toString();
    }

    private static String table(ObjectKind kind) {
        return switch (kind) {
            case POST -> "post";
            case COMMENT -> "comment";
        };
    }
}
