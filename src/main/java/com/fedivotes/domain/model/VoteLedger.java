package com.fedivotes.domain.model;

import java.util.List;

/**
 * Aggregate counters plus the full filtered and sorted vote list of one object.
 */
public record VoteLedger(
    VoteAggregate aggregate,
    List<Vote> votes
) {
    public VoteLedger {
        votes = List.copyOf(votes);
    }

    public int totalCount() {
        return votes.size();
    }
}
