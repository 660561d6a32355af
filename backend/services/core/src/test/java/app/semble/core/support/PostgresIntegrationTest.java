package app.semble.core.support;

import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

/**
 * Points Spring tests at the Postgres instance described by the environment.
 * Subclasses guard themselves with {@code @EnabledIfEnvironmentVariable(named = "SPRING_DATASOURCE_URL")}.
 */
public abstract class PostgresIntegrationTest {

    private static final String ENV_URL = System.getenv("SPRING_DATASOURCE_URL");
    private static final String ENV_USERNAME = firstNonBlank(System.getenv("SPRING_DATASOURCE_USERNAME"), System.getenv("POSTGRES_USER"));
    private static final String ENV_PASSWORD = firstNonBlank(System.getenv("SPRING_DATASOURCE_PASSWORD"), System.getenv("POSTGRES_PASSWORD"));

    @DynamicPropertySource
    static void configureDataSource(DynamicPropertyRegistry registry) {
        String url = ENV_URL != null && !ENV_URL.isBlank() ? ENV_URL : "jdbc:postgresql://localhost:5432/semble";
        String user = ENV_USERNAME != null ? ENV_USERNAME : "semble";
        String password = ENV_PASSWORD != null ? ENV_PASSWORD : "";

        registry.add("spring.datasource.url", () -> url);
        registry.add("spring.datasource.username", () -> user);
        registry.add("spring.datasource.password", () -> password);
        registry.add("spring.flyway.url", () -> url);
        registry.add("spring.flyway.user", () -> user);
        registry.add("spring.flyway.password", () -> password);
    }

    private static String firstNonBlank(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isBlank()) {
                return candidate;
            }
        }
        return null;
    }
}
