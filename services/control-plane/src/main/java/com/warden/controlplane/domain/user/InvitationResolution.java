package com.warden.controlplane.domain.user;

import java.util.UUID;

/**
 * Outcome of accepting or declining an invitation.
 *
 * @param projectDisplay display name of the project, for the client to show
 */
public record InvitationResolution(
        String role, UUID projectId, String projectDisplay, String email, boolean accepted) {}
