package com.fedivotes.domain.error;

/**
 * Sealed type representing rejected request input.
 * These are expected outcomes, not exceptional cases.
 */
public sealed interface ValidationError {

    String message();

    String code();

    // Federated URL errors
    sealed interface UrlError extends ValidationError {

        record Empty() implements UrlError {
            public static final Empty INSTANCE = new Empty();
            @Override
            public String message() {
                return "URL cannot be empty";
            }

            @Override
            public String code() {
                return "URL_EMPTY";
            }
        }

        record InvalidFormat(String value) implements UrlError {
            @Override
            public String message() {
                return "Not a valid absolute URL: " + value;
            }

            @Override
            public String code() {
                return "URL_INVALID_FORMAT";
            }
        }

        record NotHttps(String value) implements UrlError {
            @Override
            public String message() {
                return "URL must start with https://: " + value;
            }

            @Override
            public String code() {
                return "URL_NOT_HTTPS";
            }
        }
    }

    // Filter and sort selectors
    sealed interface QueryParamError extends ValidationError {

        record UnknownVoteFilter(String value) implements QueryParamError {
            @Override
            public String message() {
                return "Unknown vote filter '" + value + "' (expected All, Upvotes or Downvotes)";
            }

            @Override
            public String code() {
                return "VOTE_FILTER_INVALID";
            }
        }

        record UnknownSortOption(String value) implements QueryParamError {
            @Override
            public String message() {
                return "Unknown sort option '" + value + "' (expected datetime_asc or datetime_desc)";
            }

            @Override
            public String code() {
                return "SORT_OPTION_INVALID";
            }
        }
    }

    // Offset/limit bounds
    sealed interface PaginationError extends ValidationError {

        record NegativeOffset(int offset) implements PaginationError {
            @Override
            public String message() {
                return "offset must be zero or positive (was " + offset + ")";
            }

            @Override
            public String code() {
                return "OFFSET_NEGATIVE";
            }
        }

        record LimitOutOfRange(int limit, int maxLimit) implements PaginationError {
            @Override
            public String message() {
                return "limit must be between 1 and " + maxLimit + " (was " + limit + ")";
            }

            @Override
            public String code() {
                return "LIMIT_OUT_OF_RANGE";
            }
        }
    }
}
