package com.fedivotes.adapter.out.federation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fedivotes.application.port.out.FederationLookupPort;
import com.fedivotes.domain.model.FederatedUrl;
import com.fedivotes.infrastructure.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Lemmy HTTP API client. Logs in once with the configured account, keeps the JWT,
 * and logs in again when the instance answers 401.
 */
@Component
public class LemmyFederationClient implements FederationLookupPort {

    private static final Logger log = LoggerFactory.getLogger(LemmyFederationClient.class);

    private static final String LOGIN_PATH = "/api/v3/user/login";
    private static final String RESOLVE_PATH = "/api/v3/resolve_object";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final AppProperties appProperties;
    private final AtomicReference<String> jwt = new AtomicReference<>();

    public LemmyFederationClient(
            @Qualifier("federationRestTemplate") RestTemplate restTemplate,
            ObjectMapper objectMapper,
            AppProperties appProperties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.appProperties = appProperties;
    }

    @Override
    public LookupResult resolveObject(FederatedUrl url) {
        try {
            LookupResult result = resolveWithToken(url, token());
            if (result.status() == HttpStatus.UNAUTHORIZED.value()) {
                log.info("Upstream rejected the session token, logging in again");
                jwt.set(null);
                result = resolveWithToken(url, token());
            }
            return result;
        } catch (RestClientException e) {
            log.warn("Upstream lookup of {} failed: {}", url, e.getMessage());
            return new LookupResult(HttpStatus.BAD_GATEWAY.value(), "Upstream federation API unreachable");
        }
    }

    private LookupResult resolveWithToken(FederatedUrl url, String token) {
        URI uri = UriComponentsBuilder.fromUriString(baseUrl())
            .path(RESOLVE_PATH)
            .queryParam("q", url.value())
            .encode()
            .build()
            .toUri();
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(token);
        try {
            restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers), JsonNode.class);
            return LookupResult.ok();
        } catch (HttpStatusCodeException e) {
            return new LookupResult(e.getStatusCode().value(), errorText(e.getResponseBodyAsString()));
        }
    }

    private String token() {
        String current = jwt.get();
        if (current != null) {
            return current;
        }
        String fresh = login();
        jwt.set(fresh);
        return fresh;
    }

    private String login() {
        AppProperties.Lookup lookup = appProperties.getFederation().getLookup();
        Map<String, Object> body = new HashMap<>();
        body.put("username_or_email", lookup.getUsername());
        body.put("password", lookup.getPassword());
        body.put("totp_2fa_token", null);

        JsonNode response = restTemplate.postForObject(baseUrl() + LOGIN_PATH, body, JsonNode.class);
        if (response == null || !response.hasNonNull("jwt")) {
            throw new RestClientException("Login to " + baseUrl() + " returned no token");
        }
        log.info("Logged in to upstream federation API at {}", baseUrl());
        return response.get("jwt").asText();
    }

    private String errorText(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            return node.hasNonNull("error") ? node.get("error").asText() : null;
        } catch (JsonProcessingException e) {
            log.debug("Upstream error body is not JSON: {}", body);
            return null;
        }
    }

    private String baseUrl() {
        return appProperties.getFederation().getLookup().getBaseUrl();
    }
}
