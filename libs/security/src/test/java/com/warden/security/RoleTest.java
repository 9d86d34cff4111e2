package com.warden.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Role")
class RoleTest {

    @Test
    @DisplayName("only admin is an administrator")
    void adminFlag() {
        assertThat(Role.ADMIN.isAdmin()).isTrue();
        assertThat(Role.EDITOR.isAdmin()).isFalse();
        assertThat(Role.VIEWER.isAdmin()).isFalse();
    }

    @Test
    @DisplayName("admin implies editor and viewer, editor implies viewer")
    void hierarchy() {
        assertThat(Role.ADMIN.implies(Role.EDITOR)).isTrue();
        assertThat(Role.ADMIN.implies(Role.VIEWER)).isTrue();
        assertThat(Role.EDITOR.implies(Role.VIEWER)).isTrue();
        assertThat(Role.EDITOR.implies(Role.ADMIN)).isFalse();
        assertThat(Role.VIEWER.implies(Role.EDITOR)).isFalse();
    }

    @Test
    @DisplayName("fromString matches canonical values only")
    void fromString() {
        assertThat(Role.fromString("admin")).contains(Role.ADMIN);
        assertThat(Role.fromString("viewer")).contains(Role.VIEWER);
        assertThat(Role.fromString("ADMIN")).isEmpty();
        assertThat(Role.fromString(null)).isEmpty();
    }
}
