package com.warden.controlplane;

import com.warden.controlplane.config.ControlPlaneProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Warden control plane.
 *
 * <p>Serves the rule type, profile, project, provider, user and health APIs over gRPC. Every call
 * passes through the interceptor pipeline configured in {@link
 * com.warden.controlplane.config.GrpcServerConfig}: correlation, logging, error mapping,
 * authentication, project context resolution and authorization.
 */
@SpringBootApplication
@EnableConfigurationProperties(ControlPlaneProperties.class)
public class ControlPlaneApplication {

    private static final Logger log = LoggerFactory.getLogger(ControlPlaneApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(ControlPlaneApplication.class, args);
        log.info("Warden control plane started");
    }
}
