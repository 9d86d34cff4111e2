package com.warden.controlplane.api.project;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.controlplane.api.ProjectSummary;
import com.warden.controlplane.api.project.ProjectMessages.CreateProjectRequest;
import com.warden.controlplane.api.project.ProjectMessages.CreateProjectResponse;
import com.warden.controlplane.api.project.ProjectMessages.DeleteProjectRequest;
import com.warden.controlplane.api.project.ProjectMessages.DeleteProjectResponse;
import com.warden.controlplane.api.project.ProjectMessages.ListChildProjectsRequest;
import com.warden.controlplane.api.project.ProjectMessages.ListProjectsRequest;
import com.warden.controlplane.api.project.ProjectMessages.ListProjectsResponse;
import com.warden.controlplane.domain.EntityContext;
import com.warden.controlplane.domain.project.ProjectService;
import com.warden.controlplane.infrastructure.grpc.CallContext;
import com.warden.controlplane.infrastructure.grpc.GrpcMethod;
import com.warden.controlplane.infrastructure.grpc.GrpcService;
import com.warden.database.model.Project;
import com.warden.security.RpcPolicy;
import com.warden.security.TargetResource;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
@GrpcService("warden.v1.ProjectService")
public class ProjectGrpcService {

    private final ProjectService projects;
    private final ObjectMapper mapper;

    public ProjectGrpcService(ProjectService projects, ObjectMapper mapper) {
        this.projects = projects;
        this.mapper = mapper;
    }

    @GrpcMethod("CreateProject")
    @RpcPolicy(targetResource = TargetResource.PROJECT, ownerOnly = true)
    public CreateProjectResponse createProject(CreateProjectRequest request) {
        Project child =
                projects.createChild(
                        CallContext.entityContext(), CallContext.permissions(), request.name());
        return new CreateProjectResponse(ProjectSummary.of(mapper, child));
    }

    @GrpcMethod("ListProjects")
    @RpcPolicy(targetResource = TargetResource.USER)
    public ListProjectsResponse listProjects(ListProjectsRequest request) {
        return summaries(projects.listForCaller(CallContext.permissions()));
    }

    @GrpcMethod("ListChildProjects")
    @RpcPolicy(targetResource = TargetResource.PROJECT)
    public ListProjectsResponse listChildProjects(ListChildProjectsRequest request) {
        return summaries(projects.listChildren(CallContext.entityContext()));
    }

    @GrpcMethod("DeleteProject")
    @RpcPolicy(targetResource = TargetResource.PROJECT, ownerOnly = true)
    public DeleteProjectResponse deleteProject(DeleteProjectRequest request) {
        EntityContext context = CallContext.entityContext();
        projects.delete(context);
        return new DeleteProjectResponse(context.projectId().toString());
    }

    private ListProjectsResponse summaries(List<Project> found) {
        return new ListProjectsResponse(
                found.stream().map(project -> ProjectSummary.of(mapper, project)).toList());
    }
}
