package com.fedivotes.domain.model;

import com.fedivotes.domain.error.ValidationError.QueryParamError;

/**
 * Ordering of returned votes by creation time.
 */
public enum SortOption {
    CREATED_ASC("datetime_asc"),
    CREATED_DESC("datetime_desc");

    private final String wireValue;

    SortOption(String wireValue) {
        this.wireValue = wireValue;
    }

    public boolean ascending() {
        return this == CREATED_ASC;
    }

    /**
     * Parses the request value ("datetime_asc" or "datetime_desc").
     * A missing value selects newest-first.
     */
    public static Result<SortOption, QueryParamError> parse(String value) {
        if (value == null || value.isBlank()) {
            return Result.success(CREATED_DESC);
        }
        String trimmed = value.trim();
        for (SortOption option : values()) {
            if (option.wireValue.equalsIgnoreCase(trimmed) || option.name().equalsIgnoreCase(trimmed)) {
                return Result.success(option);
            }
        }
        return Result.failure(new QueryParamError.UnknownSortOption(trimmed));
    }
}
