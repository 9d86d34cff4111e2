package com.warden.controlplane.api.ruletype;

import com.warden.controlplane.api.Empty;
import com.warden.controlplane.api.ruletype.RuleTypeMessages.CreateRuleTypeRequest;
import com.warden.controlplane.api.ruletype.RuleTypeMessages.DeleteRuleTypeRequest;
import com.warden.controlplane.api.ruletype.RuleTypeMessages.GetRuleTypeByIdRequest;
import com.warden.controlplane.api.ruletype.RuleTypeMessages.GetRuleTypeByNameRequest;
import com.warden.controlplane.api.ruletype.RuleTypeMessages.ListRuleTypesRequest;
import com.warden.controlplane.api.ruletype.RuleTypeMessages.ListRuleTypesResponse;
import com.warden.controlplane.api.ruletype.RuleTypeMessages.RuleTypeResponse;
import com.warden.controlplane.api.ruletype.RuleTypeMessages.UpdateRuleTypeRequest;
import com.warden.controlplane.domain.ruletype.RuleTypeService;
import com.warden.controlplane.infrastructure.grpc.CallContext;
import com.warden.controlplane.infrastructure.grpc.GrpcMethod;
import com.warden.controlplane.infrastructure.grpc.GrpcService;
import com.warden.security.RpcPolicy;
import com.warden.security.TargetResource;
import org.springframework.stereotype.Component;

@Component
@GrpcService("warden.v1.RuleTypeService")
public class RuleTypeGrpcService {

    private final RuleTypeService ruleTypes;

    public RuleTypeGrpcService(RuleTypeService ruleTypes) {
        this.ruleTypes = ruleTypes;
    }

    @GrpcMethod("CreateRuleType")
    @RpcPolicy(targetResource = TargetResource.PROJECT)
    public RuleTypeResponse createRuleType(CreateRuleTypeRequest request) {
        return new RuleTypeResponse(
                ruleTypes.create(CallContext.entityContext(), request.ruleType()));
    }

    @GrpcMethod("UpdateRuleType")
    @RpcPolicy(targetResource = TargetResource.PROJECT)
    public RuleTypeResponse updateRuleType(UpdateRuleTypeRequest request) {
        return new RuleTypeResponse(
                ruleTypes.update(CallContext.entityContext(), request.ruleType()));
    }

    @GrpcMethod("DeleteRuleType")
    @RpcPolicy(targetResource = TargetResource.PROJECT)
    public Empty deleteRuleType(DeleteRuleTypeRequest request) {
        ruleTypes.deleteById(CallContext.entityContext(), request.id());
        return Empty.INSTANCE;
    }

    @GrpcMethod("ListRuleTypes")
    @RpcPolicy(targetResource = TargetResource.PROJECT)
    public ListRuleTypesResponse listRuleTypes(ListRuleTypesRequest request) {
        return new ListRuleTypesResponse(ruleTypes.list(CallContext.entityContext()));
    }

    @GrpcMethod("GetRuleTypeByName")
    @RpcPolicy(targetResource = TargetResource.PROJECT)
    public RuleTypeResponse getRuleTypeByName(GetRuleTypeByNameRequest request) {
        return new RuleTypeResponse(
                ruleTypes.getByName(CallContext.entityContext(), request.name()));
    }

    @GrpcMethod("GetRuleTypeById")
    @RpcPolicy(targetResource = TargetResource.PROJECT)
    public RuleTypeResponse getRuleTypeById(GetRuleTypeByIdRequest request) {
        return new RuleTypeResponse(
                ruleTypes.getById(CallContext.entityContext(), request.id()));
    }
}
