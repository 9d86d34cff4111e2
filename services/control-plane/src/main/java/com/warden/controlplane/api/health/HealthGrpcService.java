package com.warden.controlplane.api.health;

import com.warden.controlplane.api.health.HealthMessages.CheckHealthRequest;
import com.warden.controlplane.api.health.HealthMessages.CheckHealthResponse;
import com.warden.controlplane.infrastructure.grpc.GrpcMethod;
import com.warden.controlplane.infrastructure.grpc.GrpcService;
import com.warden.observability.HealthCheckRegistry;
import com.warden.observability.HealthResult;
import com.warden.security.RpcPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Anonymous health check for load balancers and orchestrators. */
@Component
@GrpcService("warden.v1.HealthService")
public class HealthGrpcService {

    private static final Logger log = LoggerFactory.getLogger(HealthGrpcService.class);

    private final HealthCheckRegistry registry;

    public HealthGrpcService(HealthCheckRegistry registry) {
        this.registry = registry;
    }

    @GrpcMethod("CheckHealth")
    @RpcPolicy(anonymous = true, noLog = true)
    public CheckHealthResponse checkHealth(CheckHealthRequest request) {
        HealthResult result = registry.checkAll();
        if (!result.isServing()) {
            log.warn("Not serving, failing components: {}", result.failing());
        }
        return CheckHealthResponse.of(result);
    }
}
