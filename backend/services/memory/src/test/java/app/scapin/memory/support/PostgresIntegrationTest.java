package app.scapin.memory.support;

import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.BeforeAll;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

/**
 * Base for tests that need the real {@code app_memory} schema. Skipped, not failed, when no
 * Postgres answers.
 */
public abstract class PostgresIntegrationTest {

    private static final PostgresTarget TARGET = PostgresTarget.fromEnvironment(System.getenv());
    private static Boolean reachable;

    @BeforeAll
    static void requireMemoryDatabase() {
        Assumptions.assumeTrue(isReachable(), () -> "Postgres is not reachable as " + TARGET.describe());
    }

    @DynamicPropertySource
    static void memoryDatabase(DynamicPropertyRegistry registry) {
        Assumptions.assumeTrue(isReachable(), () -> "Postgres is not reachable as " + TARGET.describe());

        registry.add("spring.datasource.url", TARGET::url);
        registry.add("spring.datasource.username", TARGET::user);
        registry.add("spring.datasource.password", TARGET::password);
        registry.add("spring.flyway.url", TARGET::url);
        registry.add("spring.flyway.user", TARGET::user);
        registry.add("spring.flyway.password", TARGET::password);
    }

    private static synchronized boolean isReachable() {
        if (reachable == null) {
            reachable = TARGET.reachable();
        }
        return reachable;
    }
}
