package com.warden.controlplane.api.provider;

import com.warden.controlplane.api.provider.ProviderMessages.GetProviderRequest;
import com.warden.controlplane.api.provider.ProviderMessages.GetProviderResponse;
import com.warden.controlplane.api.provider.ProviderMessages.ListProvidersRequest;
import com.warden.controlplane.api.provider.ProviderMessages.ListProvidersResponse;
import com.warden.controlplane.api.provider.ProviderMessages.ProviderRecord;
import com.warden.controlplane.domain.provider.ProviderService;
import com.warden.controlplane.infrastructure.grpc.CallContext;
import com.warden.controlplane.infrastructure.grpc.GrpcMethod;
import com.warden.controlplane.infrastructure.grpc.GrpcService;
import com.warden.security.RpcPolicy;
import com.warden.security.TargetResource;
import org.springframework.stereotype.Component;

@Component
@GrpcService("warden.v1.ProviderService")
public class ProviderGrpcService {

    private final ProviderService providers;

    public ProviderGrpcService(ProviderService providers) {
        this.providers = providers;
    }

    @GrpcMethod("ListProviders")
    @RpcPolicy(targetResource = TargetResource.PROJECT)
    public ListProvidersResponse listProviders(ListProvidersRequest request) {
        return new ListProvidersResponse(
                providers.list(CallContext.entityContext()).stream()
                        .map(ProviderRecord::of)
                        .toList());
    }

    @GrpcMethod("GetProvider")
    @RpcPolicy(targetResource = TargetResource.PROJECT)
    public GetProviderResponse getProvider(GetProviderRequest request) {
        return new GetProviderResponse(
                ProviderRecord.of(providers.get(CallContext.entityContext(), request.name())));
    }
}
