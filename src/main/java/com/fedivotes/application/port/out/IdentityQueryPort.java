package com.fedivotes.application.port.out;

import com.fedivotes.domain.model.FederatedUrl;
import com.fedivotes.domain.model.LocalId;
import com.fedivotes.domain.model.ObjectKind;

/**
 * Resolves federated URLs to local ids.
 * Implementations may memoize; callers must not assume a fresh read.
 */
public interface IdentityQueryPort {

    /**
     * @throws com.fedivotes.infrastructure.exception.ObjectNotFoundException if no local row matches
     * @throws com.fedivotes.infrastructure.exception.VoteDataSourceException if the lookup fails
     */
    LocalId resolve(FederatedUrl url, ObjectKind kind);

    /**
     * Drops a memoized resolution before its expiry.
     */
    void invalidate(FederatedUrl url, ObjectKind kind);
}
