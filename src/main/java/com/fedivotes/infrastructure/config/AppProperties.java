package com.fedivotes.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private Votes votes = new Votes();
    private Federation federation = new Federation();

    public Votes getVotes() {
        return votes;
    }

    public void setVotes(Votes votes) {
        this.votes = votes;
    }

    public Federation getFederation() {
        return federation;
    }

    public void setFederation(Federation federation) {
        this.federation = federation;
    }

    public static class Votes {
        private int defaultPageSize = 50;
        private int maxPageSize = 250;
        private Duration fetchTimeout = Duration.ofSeconds(10);
        private int fetchPoolSize = 16;
        private Caches cache = new Caches();

        public int getDefaultPageSize() {
            return defaultPageSize;
        }

        public void setDefaultPageSize(int defaultPageSize) {
            this.defaultPageSize = defaultPageSize;
        }

        public int getMaxPageSize() {
            return maxPageSize;
        }

        public void setMaxPageSize(int maxPageSize) {
            this.maxPageSize = maxPageSize;
        }

        public Duration getFetchTimeout() {
            return fetchTimeout;
        }

        public void setFetchTimeout(Duration fetchTimeout) {
            this.fetchTimeout = fetchTimeout;
        }

        public int getFetchPoolSize() {
            return fetchPoolSize;
        }

        public void setFetchPoolSize(int fetchPoolSize) {
            this.fetchPoolSize = fetchPoolSize;
        }

        public Caches getCache() {
            return cache;
        }

        public void setCache(Caches cache) {
            this.cache = cache;
        }
    }

    public static class Caches {
        private CacheSpec identity = new CacheSpec(Duration.ofSeconds(180), 256);
        private CacheSpec aggregate = new CacheSpec(Duration.ofSeconds(180), 256);
        private CacheSpec ledger = new CacheSpec(Duration.ofSeconds(60), 256);

        public CacheSpec getIdentity() {
            return identity;
        }

        public void setIdentity(CacheSpec identity) {
            this.identity = identity;
        }

        public CacheSpec getAggregate() {
            return aggregate;
        }

        public void setAggregate(CacheSpec aggregate) {
            this.aggregate = aggregate;
        }

        public CacheSpec getLedger() {
            return ledger;
        }

        public void setLedger(CacheSpec ledger) {
            this.ledger = ledger;
        }
    }

    public static class CacheSpec {
        private Duration ttl;
        private long maxSize;

        public CacheSpec() {
        }

        public CacheSpec(Duration ttl, long maxSize) {
            this.ttl = ttl;
            this.maxSize = maxSize;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public long getMaxSize() {
            return maxSize;
        }

        public void setMaxSize(long maxSize) {
            this.maxSize = maxSize;
        }
    }

    public static class Federation {
        private Allowlist allowlist = new Allowlist();
        private Lookup lookup = new Lookup();

        public Allowlist getAllowlist() {
            return allowlist;
        }

        public void setAllowlist(Allowlist allowlist) {
            this.allowlist = allowlist;
        }

        public Lookup getLookup() {
            return lookup;
        }

        public void setLookup(Lookup lookup) {
            this.lookup = lookup;
        }
    }

    public static class Allowlist {
        private boolean enabled;
        private String sourceUrl;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getSourceUrl() {
            return sourceUrl;
        }

        public void setSourceUrl(String sourceUrl) {
            this.sourceUrl = sourceUrl;
        }
    }

    public static class Lookup {
        private boolean enabled;
        private String baseUrl;
        private String username;
        private String password;
        private Duration connectTimeout = Duration.ofSeconds(3);
        private Duration readTimeout = Duration.ofSeconds(6);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }
    }
}
