package com.fedivotes.application.service;

import com.fedivotes.application.port.in.VerifyFederatedObjectUseCase;
import com.fedivotes.application.port.out.FederationLookupPort;
import com.fedivotes.application.port.out.FederationLookupPort.LookupResult;
import com.fedivotes.application.port.out.InstanceAllowlistPort;
import com.fedivotes.domain.error.VoteQueryError;
import com.fedivotes.domain.model.FederatedUrl;
import com.fedivotes.domain.model.ObjectKind;
import com.fedivotes.domain.model.Result;
import com.fedivotes.infrastructure.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Checks a submitted URL before any database work: well-formed https URL,
 * host on the instance allowlist, and resolvable upstream. The last two checks
 * are switched on by configuration.
 */
@Service
public class FederatedObjectService implements VerifyFederatedObjectUseCase {

    private static final Logger log = LoggerFactory.getLogger(FederatedObjectService.class);

    private final InstanceAllowlistPort allowlist;
    private final FederationLookupPort federationLookup;
    private final AppProperties appProperties;

    public FederatedObjectService(
            InstanceAllowlistPort allowlist,
            FederationLookupPort federationLookup,
            AppProperties appProperties) {
        this.allowlist = allowlist;
        this.federationLookup = federationLookup;
        this.appProperties = appProperties;
    }

    @Override
    public Result<FederatedUrl, VoteQueryError> verify(String rawUrl, ObjectKind kind) {
        var urlResult = FederatedUrl.parse(rawUrl);
        if (urlResult.isFailure()) {
            log.warn("Rejected {} URL: {}", kind, urlResult.errorOrNull().message());
            return urlResult.mapError(VoteQueryError.ValidationFailed::new);
        }
        FederatedUrl url = urlResult.getOrThrow();

        AppProperties.Federation federation = appProperties.getFederation();
        if (federation.getAllowlist().isEnabled() && !allowlist.isKnownInstance(url.host())) {
            log.warn("Rejected {} URL from unknown instance {} (allowlist size={})", kind, url.host(), allowlist.size());
            return Result.failure(new VoteQueryError.UnknownInstance(url.host()));
        }

        if (federation.getLookup().isEnabled()) {
            LookupResult lookup = federationLookup.resolveObject(url);
            if (!lookup.isOk()) {
                log.warn("Upstream could not resolve {} {}: status={}, error={}", kind, url, lookup.status(), lookup.error());
                String detail = lookup.error() != null ? lookup.error() : "External API Error";
                return Result.failure(new VoteQueryError.UpstreamRejected(lookup.status(), detail));
            }
        }

        return Result.success(url);
    }
}
