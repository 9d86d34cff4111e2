package com.warden.controlplane.api.permissions;

import com.warden.controlplane.api.permissions.PermissionsMessages.AssignRoleRequest;
import com.warden.controlplane.api.permissions.PermissionsMessages.AssignRoleResponse;
import com.warden.controlplane.api.permissions.PermissionsMessages.ListRoleAssignmentsRequest;
import com.warden.controlplane.api.permissions.PermissionsMessages.ListRoleAssignmentsResponse;
import com.warden.controlplane.api.permissions.PermissionsMessages.ListRolesRequest;
import com.warden.controlplane.api.permissions.PermissionsMessages.ListRolesResponse;
import com.warden.controlplane.api.permissions.PermissionsMessages.RemoveRoleRequest;
import com.warden.controlplane.api.permissions.PermissionsMessages.RemoveRoleResponse;
import com.warden.controlplane.api.permissions.PermissionsMessages.RoleAssignmentMessage;
import com.warden.controlplane.api.permissions.PermissionsMessages.RoleInfo;
import com.warden.controlplane.domain.user.RoleService;
import com.warden.controlplane.infrastructure.grpc.CallContext;
import com.warden.controlplane.infrastructure.grpc.GrpcMethod;
import com.warden.controlplane.infrastructure.grpc.GrpcService;
import com.warden.database.model.RoleAssignment;
import com.warden.security.RpcPolicy;
import com.warden.security.TargetResource;
import org.springframework.stereotype.Component;

/** Role grants on the context project. Changing grants requires an administrator. */
@Component
@GrpcService("warden.v1.PermissionsService")
public class PermissionsGrpcService {

    private static final RoleAssignmentMessage NO_ASSIGNMENT =
            new RoleAssignmentMessage(null, null, null);

    private final RoleService roles;

    public PermissionsGrpcService(RoleService roles) {
        this.roles = roles;
    }

    @GrpcMethod("ListRoles")
    @RpcPolicy(targetResource = TargetResource.PROJECT)
    public ListRolesResponse listRoles(ListRolesRequest request) {
        return new ListRolesResponse(
                roles.listRoles().stream()
                        .map(
                                role ->
                                        new RoleInfo(
                                                role.value(),
                                                role.displayName(),
                                                role.description()))
                        .toList());
    }

    @GrpcMethod("ListRoleAssignments")
    @RpcPolicy(targetResource = TargetResource.PROJECT)
    public ListRoleAssignmentsResponse listRoleAssignments(ListRoleAssignmentsRequest request) {
        return new ListRoleAssignmentsResponse(
                roles.listAssignments(CallContext.entityContext()).stream()
                        .map(PermissionsGrpcService::toMessage)
                        .toList());
    }

    @GrpcMethod("AssignRole")
    @RpcPolicy(targetResource = TargetResource.PROJECT, ownerOnly = true)
    public AssignRoleResponse assignRole(AssignRoleRequest request) {
        RoleAssignmentMessage wanted = orEmpty(request.roleAssignment());
        return new AssignRoleResponse(
                toMessage(
                        roles.assign(
                                CallContext.entityContext(), wanted.subject(), wanted.role())));
    }

    @GrpcMethod("RemoveRole")
    @RpcPolicy(targetResource = TargetResource.PROJECT, ownerOnly = true)
    public RemoveRoleResponse removeRole(RemoveRoleRequest request) {
        RoleAssignmentMessage wanted = orEmpty(request.roleAssignment());
        return new RemoveRoleResponse(
                toMessage(
                        roles.remove(
                                CallContext.entityContext(), wanted.subject(), wanted.role())));
    }

    private static RoleAssignmentMessage orEmpty(RoleAssignmentMessage message) {
        return message == null ? NO_ASSIGNMENT : message;
    }

    private static RoleAssignmentMessage toMessage(RoleAssignment assignment) {
        return new RoleAssignmentMessage(
                assignment.role(), assignment.subject(), assignment.projectId().toString());
    }
}
