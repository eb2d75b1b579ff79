package com.fedivotes.infrastructure.exception;

/**
 * The vote database could not be read: connection failure, query failure or timeout.
 */
public class VoteDataSourceException extends BusinessException {

    public VoteDataSourceException(String message, Throwable cause) {
        super("DATA_SOURCE_ERROR", message, cause);
    }
}
