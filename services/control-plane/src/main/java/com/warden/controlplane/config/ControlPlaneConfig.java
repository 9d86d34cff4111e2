package com.warden.controlplane.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.warden.controlplane.domain.PermissionResolver;
import com.warden.controlplane.domain.ProjectContextResolver;
import com.warden.controlplane.domain.health.DatabaseHealthCheck;
import com.warden.controlplane.domain.profile.ProfileService;
import com.warden.controlplane.domain.profile.ProfileValidator;
import com.warden.controlplane.domain.project.ProjectService;
import com.warden.controlplane.domain.provider.ProviderService;
import com.warden.controlplane.domain.ruletype.RuleTypeService;
import com.warden.controlplane.domain.user.InvitationService;
import com.warden.controlplane.domain.user.RoleService;
import com.warden.controlplane.domain.user.UserService;
import com.warden.controlplane.infrastructure.events.EventDispatcherLifecycle;
import com.warden.controlplane.infrastructure.events.EventLogSubscriber;
import com.warden.database.Store;
import com.warden.database.jdbc.JdbcStore;
import com.warden.database.migration.FlywayMigrationConfig;
import com.warden.eventmodel.BoundedEventPublisher;
import com.warden.eventmodel.EventDispatcher;
import com.warden.eventmodel.EventPublisher;
import com.warden.observability.HealthCheckRegistry;
import com.warden.observability.MetricFactory;
import com.warden.observability.SpanHelper;
import com.warden.security.TokenValidator;
import io.jsonwebtoken.security.Keys;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import javax.sql.DataSource;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationInitializer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

/** Wires the store, the token validator and the domain services. */
@Configuration
@Import(FlywayMigrationConfig.class)
public class ControlPlaneConfig {

    static final String INSTRUMENTATION_SCOPE = "com.warden.controlplane";

    private static final Duration EVENT_POLL_INTERVAL = Duration.ofMillis(250);

    /** The JSON mapper shared by the wire codec, the store and the domain services. */
    public static ObjectMapper jsonMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        return jsonMapper();
    }

    /** Created after migrations when {@code warden.flyway.enabled} is set. */
    @Bean
    public Store store(
            DataSource dataSource,
            ObjectMapper objectMapper,
            Clock clock,
            ObjectProvider<FlywayMigrationInitializer> migrations) {
        // resolving the initializer runs pending migrations before the first query
        migrations.getIfAvailable();
        return new JdbcStore(dataSource, objectMapper, clock);
    }

    @Bean
    public TokenValidator tokenValidator(ControlPlaneProperties properties, Clock clock) {
        ControlPlaneProperties.Auth auth = properties.auth();
        if (auth == null) {
            throw new IllegalStateException("warden.service.auth must be configured");
        }
        return TokenValidator.withSecretKey(
                Keys.hmacShaKeyFor(auth.signingKey().getBytes(StandardCharsets.UTF_8)),
                auth.issuer(),
                auth.audience(),
                clock);
    }

    @Bean
    public PermissionResolver permissionResolver(Store store) {
        return new PermissionResolver(store);
    }

    @Bean
    public ProjectContextResolver projectContextResolver(Store store) {
        return new ProjectContextResolver(store);
    }

    @Bean
    public BoundedEventPublisher eventPublisher(ControlPlaneProperties properties) {
        ControlPlaneProperties.Events events = properties.events();
        return new BoundedEventPublisher(events.capacity(), events.offerTimeout());
    }

    @Bean
    public EventDispatcherLifecycle eventDispatcher(
            BoundedEventPublisher publisher, MetricFactory metrics) {
        return new EventDispatcherLifecycle(
                new EventDispatcher(
                        publisher, new EventLogSubscriber(metrics), EVENT_POLL_INTERVAL));
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, ControlPlaneProperties properties) {
        return new MetricFactory(registry, properties.name());
    }

    @Bean
    public SpanHelper spanHelper() {
        return new SpanHelper(GlobalOpenTelemetry.getTracer(INSTRUMENTATION_SCOPE));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService healthCheckExecutor() {
        return Executors.newFixedThreadPool(2);
    }

    @Bean
    public HealthCheckRegistry healthCheckRegistry(
            Store store, ExecutorService healthCheckExecutor, Clock clock) {
        HealthCheckRegistry registry =
                new HealthCheckRegistry(HealthCheckRegistry.DEFAULT_TIMEOUT_MS, clock);
        registry.register(
                DatabaseHealthCheck.NAME, new DatabaseHealthCheck(store, healthCheckExecutor));
        return registry;
    }

    @Bean
    public RuleTypeService ruleTypeService(Store store, ObjectMapper objectMapper) {
        return new RuleTypeService(store, objectMapper);
    }

    @Bean
    public ProfileService profileService(
            Store store,
            ObjectMapper objectMapper,
            EventPublisher eventPublisher,
            ControlPlaneProperties properties) {
        return new ProfileService(
                store,
                new ProfileValidator(objectMapper),
                eventPublisher,
                objectMapper,
                properties.name());
    }

    @Bean
    public ProjectService projectService(Store store, ObjectMapper objectMapper) {
        return new ProjectService(store, objectMapper);
    }

    @Bean
    public ProviderService providerService(Store store) {
        return new ProviderService(store);
    }

    @Bean
    public UserService userService(Store store, ObjectMapper objectMapper) {
        return new UserService(store, objectMapper);
    }

    @Bean
    public RoleService roleService(Store store) {
        return new RoleService(store);
    }

    @Bean
    public InvitationService invitationService(
            Store store,
            ObjectMapper objectMapper,
            Clock clock,
            ControlPlaneProperties properties) {
        return new InvitationService(store, objectMapper, clock, properties.invitations().expiry());
    }
}
