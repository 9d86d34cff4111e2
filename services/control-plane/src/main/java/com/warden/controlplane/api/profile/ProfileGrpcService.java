package com.warden.controlplane.api.profile;

import com.warden.controlplane.api.Empty;
import com.warden.controlplane.api.profile.ProfileMessages.CreateProfileRequest;
import com.warden.controlplane.api.profile.ProfileMessages.DeleteProfileRequest;
import com.warden.controlplane.api.profile.ProfileMessages.GetProfileByIdRequest;
import com.warden.controlplane.api.profile.ProfileMessages.GetProfileByNameRequest;
import com.warden.controlplane.api.profile.ProfileMessages.GetProfileStatusByNameRequest;
import com.warden.controlplane.api.profile.ProfileMessages.GetProfileStatusByNameResponse;
import com.warden.controlplane.api.profile.ProfileMessages.GetProfileStatusByProjectRequest;
import com.warden.controlplane.api.profile.ProfileMessages.GetProfileStatusByProjectResponse;
import com.warden.controlplane.api.profile.ProfileMessages.ListProfilesRequest;
import com.warden.controlplane.api.profile.ProfileMessages.ListProfilesResponse;
import com.warden.controlplane.api.profile.ProfileMessages.ProfileResponse;
import com.warden.controlplane.api.profile.ProfileMessages.UpdateProfileRequest;
import com.warden.controlplane.domain.profile.ProfileService;
import com.warden.controlplane.domain.profile.ProfileStatusReport;
import com.warden.controlplane.infrastructure.grpc.CallContext;
import com.warden.controlplane.infrastructure.grpc.GrpcMethod;
import com.warden.controlplane.infrastructure.grpc.GrpcService;
import com.warden.security.RpcPolicy;
import com.warden.security.TargetResource;
import org.springframework.stereotype.Component;

@Component
@GrpcService("warden.v1.ProfileService")
public class ProfileGrpcService {

    private final ProfileService profiles;

    public ProfileGrpcService(ProfileService profiles) {
        this.profiles = profiles;
    }

    @GrpcMethod("CreateProfile")
    @RpcPolicy(targetResource = TargetResource.PROJECT)
    public ProfileResponse createProfile(CreateProfileRequest request) {
        return new ProfileResponse(profiles.create(CallContext.entityContext(), request.profile()));
    }

    @GrpcMethod("UpdateProfile")
    @RpcPolicy(targetResource = TargetResource.PROJECT)
    public ProfileResponse updateProfile(UpdateProfileRequest request) {
        return new ProfileResponse(profiles.update(CallContext.entityContext(), request.profile()));
    }

    @GrpcMethod("DeleteProfile")
    @RpcPolicy(targetResource = TargetResource.PROJECT)
    public Empty deleteProfile(DeleteProfileRequest request) {
        profiles.delete(CallContext.entityContext(), request.id());
        return Empty.INSTANCE;
    }

    @GrpcMethod("ListProfiles")
    @RpcPolicy(targetResource = TargetResource.PROJECT)
    public ListProfilesResponse listProfiles(ListProfilesRequest request) {
        return new ListProfilesResponse(profiles.list(CallContext.entityContext()));
    }

    @GrpcMethod("GetProfileById")
    @RpcPolicy(targetResource = TargetResource.PROJECT)
    public ProfileResponse getProfileById(GetProfileByIdRequest request) {
        return new ProfileResponse(profiles.getById(CallContext.entityContext(), request.id()));
    }

    @GrpcMethod("GetProfileByName")
    @RpcPolicy(targetResource = TargetResource.PROJECT)
    public ProfileResponse getProfileByName(GetProfileByNameRequest request) {
        return new ProfileResponse(profiles.getByName(CallContext.entityContext(), request.name()));
    }

    @GrpcMethod("GetProfileStatusByName")
    @RpcPolicy(targetResource = TargetResource.PROJECT)
    public GetProfileStatusByNameResponse getProfileStatusByName(
            GetProfileStatusByNameRequest request) {
        ProfileStatusReport report =
                profiles.statusByName(
                        CallContext.entityContext(),
                        request.name(),
                        request.evaluationSelector());
        return new GetProfileStatusByNameResponse(report.profile(), report.evaluations());
    }

    @GrpcMethod("GetProfileStatusByProject")
    @RpcPolicy(targetResource = TargetResource.PROJECT)
    public GetProfileStatusByProjectResponse getProfileStatusByProject(
            GetProfileStatusByProjectRequest request) {
        return new GetProfileStatusByProjectResponse(
                profiles.statusByProject(CallContext.entityContext()));
    }
}
