package com.fedivotes.domain.model;

/**
 * Local primary key of a resolved post or comment.
 * Join key between a federated URL and the local vote tables.
 */
public record LocalId(long value) {

    public LocalId {
        if (value <= 0) {
            throw new IllegalStateException("LocalId must be positive, was " + value);
        }
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
