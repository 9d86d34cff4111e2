package com.warden.security;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Roles a user can hold on a project.
 * <p>
 * ADMIN implies EDITOR and VIEWER; EDITOR implies VIEWER. Only ADMIN counts as
 * an administrator for owner-only operations.
 */
public enum Role {

    ADMIN("admin", "Admin",
            "The Admin role allows the user to perform all actions on the project and sub-projects."),
    EDITOR("editor", "Editor",
            "The Editor role allows for more write and read actions on the project and sub-projects"
                    + " except for project administration."),
    VIEWER("viewer", "Viewer",
            "The Viewer role allows for read actions on the project and sub-projects.");

    private final String value;
    private final String displayName;
    private final String description;

    Role(String value, String displayName, String description) {
        this.value = value;
        this.displayName = displayName;
        this.description = description;
    }

    /** The canonical string stored in role bindings and invitations (e.g., "admin"). */
    public String value() {
        return value;
    }

    public String displayName() {
        return displayName;
    }

    /** What a holder of the role may do, as shown to users. */
    public String description() {
        return description;
    }

    /** Whether holding this role makes the user an administrator of the project. */
    public boolean isAdmin() {
        return this == ADMIN;
    }

    /**
     * Returns the set of roles that this role implies.
     */
    public Set<Role> impliedRoles() {
        return switch (this) {
            case ADMIN -> EnumSet.of(EDITOR, VIEWER);
            case EDITOR -> EnumSet.of(VIEWER);
            default -> EnumSet.noneOf(Role.class);
        };
    }

    /**
     * Checks whether this role implies the given role
     * (either directly or through the hierarchy).
     */
    public boolean implies(Role other) {
        return this == other || impliedRoles().contains(other);
    }

    /**
     * Looks up a Role by its canonical string value (e.g., "editor").
     *
     * @param value the string to match
     * @return the matching Role, or empty if not found
     */
    public static Optional<Role> fromString(String value) {
        for (Role role : values()) {
            if (role.value.equals(value)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
