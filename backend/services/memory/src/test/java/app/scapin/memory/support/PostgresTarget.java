package app.scapin.memory.support;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Map;
import java.util.Properties;

/**
 * Database the integration tests run against. {@code MEMORY_DB_*} wins over the Spring datasource
 * variables, which win over the local compose defaults.
 */
record PostgresTarget(String url, String user, String password) {

    static final String DEFAULT_URL = "jdbc:postgresql://localhost:5432/scapin";
    static final String DEFAULT_USER = "scapin";
    private static final int CONNECT_TIMEOUT_SECONDS = 2;

    static PostgresTarget fromEnvironment(Map<String, String> env) {
        return new PostgresTarget(
                pick(env, DEFAULT_URL, "MEMORY_DB_URL", "SPRING_DATASOURCE_URL"),
                pick(env, DEFAULT_USER, "MEMORY_DB_USER", "SPRING_DATASOURCE_USERNAME", "POSTGRES_USER"),
                pick(env, "", "MEMORY_DB_PASSWORD", "SPRING_DATASOURCE_PASSWORD", "POSTGRES_PASSWORD")
        );
    }

    boolean reachable() {
        Properties info = new Properties();
        info.setProperty("user", user);
        info.setProperty("password", password);
        info.setProperty("connectTimeout", String.valueOf(CONNECT_TIMEOUT_SECONDS));
        try (Connection connection = DriverManager.getConnection(url, info)) {
            return connection.isValid(CONNECT_TIMEOUT_SECONDS);
        } catch (SQLException ex) {
            return false;
        }
    }

    String describe() {
        return user + "@" + url;
    }

    private static String pick(Map<String, String> env, String fallback, String... keys) {
        for (String key : keys) {
            String value = env.get(key);
            if (value != null && !value.isBlank()) {
                return value.strip();
            }
        }
        return fallback;
    }
}
