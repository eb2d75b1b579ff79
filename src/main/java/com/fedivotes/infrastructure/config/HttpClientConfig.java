package com.fedivotes.infrastructure.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP client for the upstream federation API and the instance list source.
 */
@Configuration
public class HttpClientConfig {

    private static final String USER_AGENT = "fedivotes";

    @Bean
    public RestTemplate federationRestTemplate(RestTemplateBuilder builder, AppProperties appProperties) {
        AppProperties.Lookup lookup = appProperties.getFederation().getLookup();
        return builder
                .connectTimeout(lookup.getConnectTimeout())
                .readTimeout(lookup.getReadTimeout())
                .defaultHeader(HttpHeaders.USER_AGENT, USER_AGENT)
                .build();
    }
}
