package com.warden.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ProjectAccessEnforcer")
class ProjectAccessEnforcerTest {

    private static final UUID ORG = UUID.fromString("00000000-0000-0000-0000-000000000001");
    private static final UUID PROJECT = UUID.fromString("00000000-0000-0000-0000-0000000000aa");
    private static final UUID OTHER = UUID.fromString("00000000-0000-0000-0000-0000000000bb");

    private static UserPermissions holding(Role role) {
        return new UserPermissions(UUID.randomUUID(), Set.of(PROJECT),
                List.of(new RoleBinding(role, role.isAdmin(), ORG, PROJECT)), ORG, false);
    }

    @Test
    @DisplayName("allows a member of the project")
    void member() {
        assertThatCode(() -> ProjectAccessEnforcer.enforce(holding(Role.VIEWER), PROJECT, false))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("denies a project the caller does not hold")
    void foreignProject() {
        assertThatThrownBy(() -> ProjectAccessEnforcer.enforce(holding(Role.ADMIN), OTHER, false))
                .isInstanceOf(ProjectAccessDeniedException.class)
                .hasMessage("user is not authorized to access this project");
    }

    @Test
    @DisplayName("owner-only requires an admin binding on the project")
    void ownerOnly() {
        assertThatThrownBy(() -> ProjectAccessEnforcer.enforce(holding(Role.EDITOR), PROJECT, true))
                .isInstanceOf(ProjectAccessDeniedException.class)
                .hasMessage("user is not an administrator on this project");
        assertThatCode(() -> ProjectAccessEnforcer.enforce(holding(Role.ADMIN), PROJECT, true))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("admin on another project does not satisfy owner-only")
    void adminElsewhere() {
        var permissions = new UserPermissions(UUID.randomUUID(), Set.of(PROJECT, OTHER),
                List.of(new RoleBinding(Role.ADMIN, true, ORG, OTHER),
                        new RoleBinding(Role.VIEWER, false, ORG, PROJECT)), ORG, false);

        assertThatThrownBy(() -> ProjectAccessEnforcer.enforce(permissions, PROJECT, true))
                .isInstanceOf(ProjectAccessDeniedException.class);
    }

    @Test
    @DisplayName("superadmin bypasses membership and owner checks")
    void superadmin() {
        assertThatCode(() -> ProjectAccessEnforcer.enforce(UserPermissions.empty(true), OTHER, true))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("empty permissions are denied")
    void empty() {
        assertThatThrownBy(() -> ProjectAccessEnforcer.enforce(UserPermissions.empty(false), PROJECT, false))
                .isInstanceOf(ProjectAccessDeniedException.class);
    }
}
