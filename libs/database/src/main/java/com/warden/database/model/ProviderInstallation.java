package com.warden.database.model;

import java.util.UUID;

/**
 * A forge app installation. Pending until claimed, at which point it is bound to a project and
 * provider.
 *
 * @param enrollingUserId forge-side id of the user who installed the app
 */
public record ProviderInstallation(
        long appInstallationId,
        long organizationId,
        String enrollingUserId,
        UUID projectId,
        UUID providerId) {

    public boolean isPending() {
        return projectId == null;
    }
}
