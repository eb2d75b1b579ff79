package com.fedivotes.domain.model;

/**
 * Precomputed score counters of a post or comment.
 * The data source keeps {@code totalScore == upvotes - downvotes}; it is not recomputed here.
 */
public record VoteAggregate(
    long totalScore,
    long upvotes,
    long downvotes
) {
    private static final VoteAggregate EMPTY = new VoteAggregate(0, 0, 0);

    public static VoteAggregate empty() {
        return EMPTY;
    }
}
