package com.fedivotes.domain.model;

/**
 * The two kinds of federated objects that carry votes.
 * Selects which like/aggregate table family is queried.
 */
public enum ObjectKind {
    POST,
    COMMENT
}
