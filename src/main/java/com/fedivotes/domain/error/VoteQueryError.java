package com.fedivotes.domain.error;

/**
 * Sealed type representing expected reasons a vote lookup is refused before touching the ledger.
 */
public sealed interface VoteQueryError {

    /**
     * Wraps a validation error of the submitted URL.
     */
    record ValidationFailed(ValidationError error) implements VoteQueryError {
        @Override
        public String message() {
            return error.message();
        }

        @Override
        public String code() {
            return error.code();
        }
    }

    record UnknownInstance(String host) implements VoteQueryError {
        @Override
        public String message() {
            return "Not a known Lemmy instance: " + host;
        }

        @Override
        public String code() {
            return "UNKNOWN_INSTANCE";
        }
    }

    /**
     * The upstream federation API could not resolve the object.
     *
     * @param status HTTP status returned upstream
     * @param detail upstream error text
     */
    record UpstreamRejected(int status, String detail) implements VoteQueryError {
        @Override
        public String message() {
            return detail + ". Make sure you are passing an ActivityPub link.";
        }

        @Override
        public String code() {
            return "UPSTREAM_REJECTED";
        }
    }

    String message();

    String code();
}
