package com.fedivotes.application.port.out;

import com.fedivotes.domain.model.FederatedUrl;

/**
 * Asks the upstream federation API whether a URL resolves to a real remote object.
 *
 * In production: implemented by an HTTP client against a Lemmy instance.
 */
public interface FederationLookupPort {

    LookupResult resolveObject(FederatedUrl url);

    /**
     * @param status HTTP status of the upstream answer
     * @param error  upstream error text, null on success
     */
    record LookupResult(int status, String error) {

        public static LookupResult ok() {
            return new LookupResult(200, null);
        }

        public boolean isOk() {
            return status == 200;
        }
    }
}
