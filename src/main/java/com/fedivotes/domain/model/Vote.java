package com.fedivotes.domain.model;

import java.time.Instant;

/**
 * A single vote cast on a post or comment.
 *
 * @param voterName display name of the voter
 * @param score     +1 for an upvote, -1 for a downvote
 * @param actorId   federation URI of the voter
 * @param createdAt when the vote was cast
 */
public record Vote(
    String voterName,
    int score,
    String actorId,
    Instant createdAt
) {

    /**
     * Creation time as fractional Unix epoch seconds.
     */
    public double createdUtc() {
        return createdAt.getEpochSecond() + createdAt.getNano() / 1_000_000_000d;
    }
}
