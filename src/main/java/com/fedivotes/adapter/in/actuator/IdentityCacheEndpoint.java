package com.fedivotes.adapter.in.actuator;

import com.fedivotes.application.port.out.IdentityQueryPort;
import com.fedivotes.domain.model.FederatedUrl;
import com.fedivotes.domain.model.ObjectKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.endpoint.InvalidEndpointRequestException;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.WriteOperation;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Operator hook for dropping a memoized URL resolution before its TTL runs out,
 * e.g. after an object was purged and re-federated under a new id.
 * {@code POST /actuator/identitycache} with {@code {"url": "...", "kind": "post"}}.
 */
@Component
@Endpoint(id = "identitycache")
public class IdentityCacheEndpoint {

    private static final Logger log = LoggerFactory.getLogger(IdentityCacheEndpoint.class);

    private final IdentityQueryPort identityQueryPort;

    public IdentityCacheEndpoint(IdentityQueryPort identityQueryPort) {
        this.identityQueryPort = identityQueryPort;
    }

    @WriteOperation
    public Map<String, Object> invalidate(String url, String kind) {
        var urlResult = FederatedUrl.parse(url);
        if (urlResult.isFailure()) {
            throw new InvalidEndpointRequestException(urlResult.errorOrNull().message(), urlResult.errorOrNull().code());
        }
        ObjectKind objectKind = parseKind(kind);
        FederatedUrl federatedUrl = urlResult.getOrThrow();

        identityQueryPort.invalidate(federatedUrl, objectKind);
        log.info("Identity cache entry dropped: kind={}, url={}", objectKind, federatedUrl);
        return Map.of("url", federatedUrl.value(), "kind", objectKind.name().toLowerCase(Locale.ROOT), "invalidated", true);
    }

    private static ObjectKind parseKind(String kind) {
        try {
            return ObjectKind.valueOf(kind.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidEndpointRequestException("Unknown object kind: " + kind, "kind must be post or comment");
        }
    }
}
