package com.fedivotes.application.port.out;

import com.fedivotes.domain.model.LocalId;
import com.fedivotes.domain.model.VoteQueryShape;

import java.time.Instant;
import java.util.List;

public interface VoteLedgerRepository {

    /**
     * Reads the vote rows of one object in the order the shape asks for.
     *
     * @param authorName lower-cased voter name, bound as the second parameter when {@code shape.authorFiltered()},
     *                   otherwise ignored
     */
    List<VoteRow> findVotes(VoteQueryShape shape, LocalId localId, String authorName);

    record VoteRow(String voterName, int score, String actorId, Instant published) {}
}
