package com.fedivotes.integration.base;

import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.TestPropertySource;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.PostgreSQLContainer;

/**
 * Base class for all integration tests.
 * Starts a PostgreSQL container carrying the subset of the Lemmy schema that votes are read from.
 *
 * Uses a lazy-initialized singleton container - shared across all tests, only started
 * when Docker is available. The lookup caches live as long as the Spring context, so tests
 * use fresh URLs instead of relying on cleanup to reset them.
 */
@TestPropertySource(properties = {
    "spring.sql.init.mode=always",
    "spring.sql.init.schema-locations=classpath:db/lemmy-schema.sql"
})
public abstract class PostgresTestBase {

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    private static volatile boolean containerStarted = false;
    private static volatile boolean containerFailed = false;

    /**
     * Clean all data before each test.
     * Order matters due to foreign key constraints: likes/aggregates -> objects -> people
     */
    @BeforeEach
    void cleanAllData() {
        jdbcTemplate.update("DELETE FROM post_like");
        jdbcTemplate.update("DELETE FROM comment_like");
        jdbcTemplate.update("DELETE FROM post_aggregates");
        jdbcTemplate.update("DELETE FROM comment_aggregates");
        jdbcTemplate.update("DELETE FROM post");
        jdbcTemplate.update("DELETE FROM comment");
        jdbcTemplate.update("DELETE FROM person");
    }

    public static boolean isDockerAvailable() {
        if (containerFailed) {
            return false;
        }
        try {
            return DockerClientFactory.instance().isDockerAvailable();
        } catch (Exception e) {
            return false;
        }
    }

    // Lifecycle managed via shutdown hook, not try-with-resources
    @SuppressWarnings("resource")
    private static class ContainerHolder {
        static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
                .withReuse(true);
    }

    private static synchronized void startContainerIfNeeded() {
        if (containerStarted || containerFailed) {
            return;
        }
        try {
            ContainerHolder.postgres.start();
            containerStarted = true;
            Runtime.getRuntime().addShutdownHook(new Thread(ContainerHolder.postgres::close));
        } catch (RuntimeException e) {
            containerFailed = true;
            throw e;
        }
    }

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        if (!isDockerAvailable()) {
            // Provide dummy values so context can load (tests will be skipped)
            registry.add("spring.datasource.url", () -> "jdbc:postgresql://localhost:5432/dummy");
            registry.add("spring.datasource.username", () -> "dummy");
            registry.add("spring.datasource.password", () -> "dummy");
            return;
        }

        startContainerIfNeeded();
        registry.add("spring.datasource.url", ContainerHolder.postgres::getJdbcUrl);
        registry.add("spring.datasource.username", ContainerHolder.postgres::getUsername);
        registry.add("spring.datasource.password", ContainerHolder.postgres::getPassword);
    }
}
