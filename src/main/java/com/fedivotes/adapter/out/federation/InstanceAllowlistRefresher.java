package com.fedivotes.adapter.out.federation;

import com.fedivotes.application.port.out.InstanceAllowlistPort;
import com.fedivotes.infrastructure.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Set;

/**
 * Loads the instance allowlist at startup and refreshes it on a schedule.
 * A failed refresh keeps the previous list.
 */
@Component
public class InstanceAllowlistRefresher {

    private static final Logger log = LoggerFactory.getLogger(InstanceAllowlistRefresher.class);

    private final InstanceAllowlistPort allowlist;
    private final RestTemplate restTemplate;
    private final AppProperties appProperties;

    public InstanceAllowlistRefresher(
            InstanceAllowlistPort allowlist,
            @Qualifier("federationRestTemplate") RestTemplate restTemplate,
            AppProperties appProperties) {
        this.allowlist = allowlist;
        this.restTemplate = restTemplate;
        this.appProperties = appProperties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void loadOnStartup() {
        refresh();
    }

    @Scheduled(cron = "${app.federation.allowlist.refresh-cron:0 0 0 * * *}")
    public void refresh() {
        AppProperties.Allowlist config = appProperties.getFederation().getAllowlist();
        if (!config.isEnabled()) {
            return;
        }
        try {
            String csv = restTemplate.getForObject(config.getSourceUrl(), String.class);
            Set<String> hosts = InstanceListParser.parse(csv);
            if (hosts.isEmpty()) {
                log.warn("Instance list from {} was empty, keeping {} known instances", config.getSourceUrl(), allowlist.size());
                return;
            }
            allowlist.replaceAll(hosts);
            log.info("Instance allowlist refreshed: {} instances", hosts.size());
        } catch (RestClientException | IllegalArgumentException e) {
            log.warn("Instance allowlist refresh failed, keeping {} known instances: {}", allowlist.size(), e.getMessage());
        }
    }
}
