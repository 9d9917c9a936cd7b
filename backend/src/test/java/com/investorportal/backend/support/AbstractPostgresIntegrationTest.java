package com.investorportal.backend.support;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

import org.junit.jupiter.api.AfterEach;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.init.ScriptException;
import org.springframework.jdbc.datasource.init.ScriptUtils;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Shared PostgreSQL container for DB-backed integration tests, skipped when Docker is absent. Flyway migrates the schema on
 * context start; after every test the mutable tables are emptied and the RBAC catalog is re-seeded.
 */
@Testcontainers(disabledWithoutDocker = true)
public abstract class AbstractPostgresIntegrationTest {

    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16.4")
            .withDatabaseName("investor_portal_test")
            .withUsername("portal")
            .withPassword("portal");

    static {
        // one container for the whole run so the cached application context keeps a live database
        if (DockerClientFactory.instance().isDockerAvailable()) {
            POSTGRES.start();
        }
    }

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);

        registry.add("auth.jwt.access-secret", () -> TestAuthProperties.ACCESS_SECRET);
        registry.add("auth.jwt.refresh-secret", () -> TestAuthProperties.REFRESH_SECRET);
    }

    @AfterEach
    void resetDatabase() {
        try (Connection connection = DriverManager.getConnection(
                POSTGRES.getJdbcUrl(),
                POSTGRES.getUsername(),
                POSTGRES.getPassword());
             Statement stmt = connection.createStatement()) {
            stmt.execute("""
                    TRUNCATE TABLE audit_log, role_assignment, user_role, role_permission,
                                   permission, role, user_session, user_profile, portal_user CASCADE
                    """);
            ScriptUtils.executeSqlScript(connection, new ClassPathResource("db/migration/V2__seed_rbac_catalog.sql"));
        } catch (SQLException | ScriptException ex) {
            throw new IllegalStateException("Failed to reset database after test", ex);
        }
    }
}
