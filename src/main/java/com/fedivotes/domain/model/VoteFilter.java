package com.fedivotes.domain.model;

import com.fedivotes.domain.error.ValidationError.QueryParamError;

/**
 * Selects which votes of the ledger are returned.
 */
public enum VoteFilter {
    ALL("All"),
    UPVOTES("Upvotes"),
    DOWNVOTES("Downvotes");

    private final String wireValue;

    VoteFilter(String wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * Parses the request value ("All", "Upvotes", "Downvotes", case-insensitive).
     * A missing value selects {@link #ALL}.
     */
    public static Result<VoteFilter, QueryParamError> parse(String value) {
        if (value == null || value.isBlank()) {
            return Result.success(ALL);
        }
        String trimmed = value.trim();
        for (VoteFilter filter : values()) {
            if (filter.wireValue.equalsIgnoreCase(trimmed) || filter.name().equalsIgnoreCase(trimmed)) {
                return Result.success(filter);
            }
        }
        return Result.failure(new QueryParamError.UnknownVoteFilter(trimmed));
    }
}
