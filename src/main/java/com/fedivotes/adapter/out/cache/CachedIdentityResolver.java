package com.fedivotes.adapter.out.cache;

import com.fedivotes.application.port.out.IdentityQueryPort;
import com.fedivotes.application.port.out.ObjectRepository;
import com.fedivotes.domain.model.FederatedUrl;
import com.fedivotes.domain.model.LocalId;
import com.fedivotes.domain.model.ObjectKind;
import com.fedivotes.infrastructure.cache.TtlCache;
import com.fedivotes.infrastructure.cache.TtlCacheFactory;
import com.fedivotes.infrastructure.config.AppProperties;
import com.fedivotes.infrastructure.exception.ObjectNotFoundException;
import com.fedivotes.infrastructure.exception.VoteDataSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Memoizes URL to local id resolution. Unknown URLs are not remembered,
 * so an object that appears later resolves on the next request.
 */
@Component
public class CachedIdentityResolver implements IdentityQueryPort {

    private static final Logger log = LoggerFactory.getLogger(CachedIdentityResolver.class);

    private final ObjectRepository objectRepository;
    private final TtlCache<IdentityKey, LocalId> cache;

    public CachedIdentityResolver(
            ObjectRepository objectRepository,
            TtlCacheFactory cacheFactory,
            AppProperties appProperties) {
        this.objectRepository = objectRepository;
        this.cache = cacheFactory.create("identity", appProperties.getVotes().getCache().getIdentity());
    }

    @Override
    public LocalId resolve(FederatedUrl url, ObjectKind kind) {
        return cache.getOrCompute(new IdentityKey(url, kind), () -> lookup(url, kind));
    }

    @Override
    public void invalidate(FederatedUrl url, ObjectKind kind) {
        cache.invalidate(new IdentityKey(url, kind));
        log.info("Invalidated resolution of {} {}", kind, url);
    }

    private LocalId lookup(FederatedUrl url, ObjectKind kind) {
        LocalId localId;
        try {
            localId = objectRepository.findLocalId(url, kind)
                .orElseThrow(() -> new ObjectNotFoundException(kind, url));
        } catch (DataAccessException e) {
            throw new VoteDataSourceException("Failed to resolve " + kind + " " + url, e);
        }
        log.debug("Resolved {} {} to local id {}", kind, url, localId);
        return localId;
    }

    record IdentityKey(FederatedUrl url, ObjectKind kind) {}
}
