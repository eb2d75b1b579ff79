package com.fedivotes.domain.model;

/**
 * Everything that determines the text of a ledger query.
 * Two equal shapes always render to the same SQL, so the shape doubles as a cache discriminator.
 */
public record VoteQueryShape(
    ObjectKind kind,
    VoteFilter filter,
    SortOption sort,
    boolean authorFiltered
) {

    public static VoteQueryShape of(ObjectKind kind, VoteFilter filter, SortOption sort, String authorName) {
        return new VoteQueryShape(kind, filter, sort, authorName != null);
    }
}
