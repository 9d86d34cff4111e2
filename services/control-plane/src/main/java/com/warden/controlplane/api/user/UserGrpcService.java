package com.warden.controlplane.api.user;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.controlplane.api.Empty;
import com.warden.controlplane.api.ProjectSummary;
import com.warden.controlplane.api.user.UserMessages.CreateInvitationRequest;
import com.warden.controlplane.api.user.UserMessages.CreateInvitationResponse;
import com.warden.controlplane.api.user.UserMessages.CreateUserRequest;
import com.warden.controlplane.api.user.UserMessages.CreateUserResponse;
import com.warden.controlplane.api.user.UserMessages.DeleteUserRequest;
import com.warden.controlplane.api.user.UserMessages.GetUserRequest;
import com.warden.controlplane.api.user.UserMessages.GetUserResponse;
import com.warden.controlplane.api.user.UserMessages.ProjectRole;
import com.warden.controlplane.api.user.UserMessages.ResolveInvitationRequest;
import com.warden.controlplane.api.user.UserMessages.ResolveInvitationResponse;
import com.warden.controlplane.api.user.UserMessages.UserRecord;
import com.warden.controlplane.domain.user.CreatedUser;
import com.warden.controlplane.domain.user.InvitationResolution;
import com.warden.controlplane.domain.user.InvitationService;
import com.warden.controlplane.domain.user.UserAccount;
import com.warden.controlplane.domain.user.UserService;
import com.warden.controlplane.infrastructure.grpc.CallContext;
import com.warden.controlplane.infrastructure.grpc.GrpcMethod;
import com.warden.controlplane.infrastructure.grpc.GrpcService;
import com.warden.database.model.Invitation;
import com.warden.security.RpcPolicy;
import com.warden.security.TargetResource;
import org.springframework.stereotype.Component;

@Component
@GrpcService("warden.v1.UserService")
public class UserGrpcService {

    private final UserService users;
    private final InvitationService invitations;
    private final ObjectMapper mapper;

    public UserGrpcService(UserService users, InvitationService invitations, ObjectMapper mapper) {
        this.users = users;
        this.invitations = invitations;
        this.mapper = mapper;
    }

    @GrpcMethod("CreateUser")
    @RpcPolicy(targetResource = TargetResource.USER)
    public CreateUserResponse createUser(CreateUserRequest request) {
        CreatedUser created = users.create(CallContext.claims());
        return new CreateUserResponse(
                created.userId().toString(),
                created.subject(),
                created.projectId().toString(),
                created.projectName(),
                created.createdAt());
    }

    @GrpcMethod("GetUser")
    @RpcPolicy(targetResource = TargetResource.USER)
    public GetUserResponse getUser(GetUserRequest request) {
        UserAccount account = users.get(CallContext.claims());
        return new GetUserResponse(
                new UserRecord(
                        account.user().id().toString(),
                        account.user().subject(),
                        account.user().displayName(),
                        account.user().createdAt()),
                account.projects().stream()
                        .map(project -> ProjectSummary.of(mapper, project))
                        .toList(),
                account.roles().stream()
                        .map(role -> new ProjectRole(role.projectId().toString(), role.role()))
                        .toList());
    }

    @GrpcMethod("DeleteUser")
    @RpcPolicy(targetResource = TargetResource.USER)
    public Empty deleteUser(DeleteUserRequest request) {
        users.delete(CallContext.claims());
        return Empty.INSTANCE;
    }

    @GrpcMethod("CreateInvitation")
    @RpcPolicy(targetResource = TargetResource.PROJECT, ownerOnly = true)
    public CreateInvitationResponse createInvitation(CreateInvitationRequest request) {
        Invitation invitation =
                invitations.create(
                        CallContext.entityContext(),
                        CallContext.claims(),
                        request.email(),
                        request.role());
        return new CreateInvitationResponse(
                invitation.code(),
                invitation.email(),
                invitation.role(),
                invitation.projectId().toString(),
                invitations.expiresAt(invitation));
    }

    @GrpcMethod("ResolveInvitation")
    @RpcPolicy(targetResource = TargetResource.USER)
    public ResolveInvitationResponse resolveInvitation(ResolveInvitationRequest request) {
        InvitationResolution resolution =
                invitations.resolve(CallContext.claims(), request.code(), request.accept());
        return new ResolveInvitationResponse(
                resolution.role(),
                resolution.projectId().toString(),
                resolution.projectDisplay(),
                resolution.email(),
                resolution.accepted());
    }
}
