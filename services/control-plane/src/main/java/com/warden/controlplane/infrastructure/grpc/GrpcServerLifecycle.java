package com.warden.controlplane.infrastructure.grpc;

import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.grpc.ServerInterceptor;
import io.grpc.ServerInterceptors;
import io.grpc.ServerServiceDefinition;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Runs the gRPC server for the lifetime of the application context.
 *
 * <p>Interceptors are given outermost first and applied to every service.
 */
public class GrpcServerLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(GrpcServerLifecycle.class);

    private static final long SHUTDOWN_GRACE_SECONDS = 10;

    private final int port;
    private final boolean autoStartup;
    private final List<ServerServiceDefinition> services;
    private volatile Server server;

    public GrpcServerLifecycle(
            int port,
            boolean autoStartup,
            List<ServerServiceDefinition> services,
            List<ServerInterceptor> interceptors) {
        this.port = port;
        this.autoStartup = autoStartup;
        this.services = intercept(services, interceptors);
    }

    /** Wraps each service so that {@code interceptors.get(0)} sees calls first. */
    public static List<ServerServiceDefinition> intercept(
            List<ServerServiceDefinition> services, List<ServerInterceptor> interceptors) {
        return services.stream()
                .map(service -> ServerInterceptors.interceptForward(service, interceptors))
                .toList();
    }

    @Override
    public void start() {
        ServerBuilder<?> builder = ServerBuilder.forPort(port);
        services.forEach(builder::addService);
        try {
            server = builder.build().start();
        } catch (IOException e) {
            throw new UncheckedIOException("cannot start gRPC server on port " + port, e);
        }
        log.info("gRPC server listening on port {} with {} services", server.getPort(),
                services.size());
    }

    @Override
    public void stop() {
        Server running = server;
        if (running == null) {
            return;
        }
        running.shutdown();
        try {
            if (!running.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                log.warn("gRPC server did not stop within {} s, forcing", SHUTDOWN_GRACE_SECONDS);
                running.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running.shutdownNow();
        }
        server = null;
        log.info("gRPC server stopped");
    }

    @Override
    public boolean isRunning() {
        return server != null;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }
}
