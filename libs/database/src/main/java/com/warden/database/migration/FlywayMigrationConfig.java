package com.warden.database.migration;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationInitializer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Creates the Flyway instance for the control-plane schema and migrates on startup.
 *
 * <p>Replaces Spring Boot's {@link FlywayAutoConfiguration}, which services disable with {@code
 * spring.flyway.enabled: false}. Beans that need the schema in place take the {@link
 * FlywayMigrationInitializer} as a dependency.
 */
@Configuration
@EnableConfigurationProperties(FlywayConfigProperties.class)
@ConditionalOnProperty(prefix = "warden.flyway", name = "enabled", havingValue = "true")
public class FlywayMigrationConfig {

    private static final Logger log = LoggerFactory.getLogger(FlywayMigrationConfig.class);

    public static final String FLYWAY_BEAN = "wardenFlyway";

    public static final String INITIALIZER_BEAN = "wardenFlywayInitializer";

    @Bean(name = FLYWAY_BEAN)
    public Flyway wardenFlyway(FlywayConfigProperties properties, DataSource applicationDataSource) {
        return createFlyway(properties, applicationDataSource);
    }

    @Bean(name = INITIALIZER_BEAN)
    public FlywayMigrationInitializer wardenFlywayInitializer(Flyway wardenFlyway) {
        return new FlywayMigrationInitializer(wardenFlyway);
    }

    static Flyway createFlyway(FlywayConfigProperties properties, DataSource applicationDataSource) {
        DataSource dataSource = applicationDataSource;
        if (properties.hasDedicatedConnection()) {
            log.info("Running migrations over dedicated connection {}", properties.url());
            dataSource =
                    DataSourceBuilder.create()
                            .url(properties.url())
                            .username(properties.username())
                            .password(properties.password())
                            .build();
        }
        return Flyway.configure()
                .dataSource(dataSource)
                .locations(properties.locations())
                .baselineOnMigrate(true)
                .cleanDisabled(true)
                .load();
    }
}
