package com.fedivotes.domain.model;

import com.fedivotes.domain.error.ValidationError.UrlError;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Value Object for the ActivityPub id of a remote post or comment.
 * Holds the URL exactly as submitted (trimmed), because lookups match the stored ap_id verbatim.
 */
public record FederatedUrl(String value) {

    private static final String REQUIRED_SCHEME = "https";

    public FederatedUrl {
        if (value == null) {
            throw new IllegalStateException("FederatedUrl value cannot be null - use parse() for validation");
        }
    }

    /**
     * Parses a user-supplied URL, returning a Result for expected validation failures.
     */
    public static Result<FederatedUrl, UrlError> parse(String value) {
        if (value == null || value.isBlank()) {
            return Result.failure(UrlError.Empty.INSTANCE);
        }
        String trimmed = value.trim();
        URI uri;
        try {
            uri = new URI(trimmed);
        } catch (URISyntaxException e) {
            return Result.failure(new UrlError.InvalidFormat(trimmed));
        }
        if (uri.getHost() == null) {
            return Result.failure(new UrlError.InvalidFormat(trimmed));
        }
        if (!REQUIRED_SCHEME.equalsIgnoreCase(uri.getScheme())) {
            return Result.failure(new UrlError.NotHttps(trimmed));
        }
        return Result.success(new FederatedUrl(trimmed));
    }

    /**
     * Lower-cased host name of the instance that owns the object.
     */
    public String host() {
        return URI.create(value).getHost().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return value;
    }
}
