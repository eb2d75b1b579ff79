package com.fedivotes.domain.model;

import com.fedivotes.domain.error.ValidationError.PaginationError;

/**
 * Validated offset/limit pair requested by a client.
 */
public record PageWindow(int offset, int limit) {

    /**
     * Applies defaults and bounds to raw request parameters.
     * A missing offset means 0, a missing limit means {@code defaultLimit}.
     */
    public static Result<PageWindow, PaginationError> parse(Integer offset, Integer limit, int defaultLimit, int maxLimit) {
        int effectiveOffset = offset != null ? offset : 0;
        int effectiveLimit = limit != null ? limit : defaultLimit;

        if (effectiveOffset < 0) {
            return Result.failure(new PaginationError.NegativeOffset(effectiveOffset));
        }
        if (effectiveLimit < 1 || effectiveLimit > maxLimit) {
            return Result.failure(new PaginationError.LimitOutOfRange(effectiveLimit, maxLimit));
        }
        return Result.success(new PageWindow(effectiveOffset, effectiveLimit));
    }
}
