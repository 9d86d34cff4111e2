package com.warden.database.migration;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Flyway settings for the control-plane schema.
 *
 * <p>Migrations normally run over the application's own {@code DataSource}. Setting {@code url}
 * runs them over a dedicated connection instead, for deployments where the schema owner differs
 * from the runtime user.
 *
 * <pre>{@code
 * warden:
 *   flyway:
 *     enabled: true
 *     locations: classpath:db/migration
 *     url: jdbc:postgresql://localhost:5432/warden   # optional
 *     username: warden_owner
 *     password: secret
 * }</pre>
 *
 * @param url JDBC URL for migrations; blank to reuse the application data source
 * @param username migration user, used with {@code url}
 * @param password migration password, used with {@code url}
 * @param locations Flyway migration locations
 * @param enabled whether migrations run on startup
 */
@Validated
@ConfigurationProperties(prefix = "warden.flyway")
public record FlywayConfigProperties(
        String url, String username, String password, @NotBlank String locations, boolean enabled) {

    public static final String DEFAULT_LOCATIONS = "classpath:db/migration";

    public FlywayConfigProperties {
        if (locations == null || locations.isBlank()) {
            locations = DEFAULT_LOCATIONS;
        }
    }

    public boolean hasDedicatedConnection() {
        return url != null && !url.isBlank();
    }
}
