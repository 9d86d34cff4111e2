package com.warden.security;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * Validated claims carried by a caller's access token.
 *
 * @param subject           identity-provider subject, the stable user key
 * @param preferredUsername display name chosen by the user (nullable)
 * @param forgeId           user id on the hosted forge, from the {@code gh_id} claim (nullable)
 * @param realmRoles        roles from {@code realm_access.roles}
 * @param issuer            token issuer
 * @param expiresAt         expiry instant (nullable for tokens without {@code exp})
 */
public record TokenClaims(
        String subject,
        String preferredUsername,
        String forgeId,
        Set<String> realmRoles,
        String issuer,
        Instant expiresAt
) {

    /** Realm role that grants unrestricted access to every project. */
    public static final String SUPERADMIN_ROLE = "superadmin";

    public TokenClaims {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject must not be null or blank");
        }
        realmRoles = realmRoles == null ? Set.of() : Set.copyOf(realmRoles);
    }

    /** Whether the realm roles include {@value #SUPERADMIN_ROLE}. */
    public boolean isSuperadmin() {
        return realmRoles.contains(SUPERADMIN_ROLE);
    }

    /** Preferred username when set, otherwise empty. */
    public Optional<String> preferredUsernameIfSet() {
        return preferredUsername == null || preferredUsername.isBlank()
                ? Optional.empty()
                : Optional.of(preferredUsername);
    }

    /** Forge-side user id when set, otherwise empty. */
    public Optional<String> forgeIdIfSet() {
        return forgeId == null || forgeId.isBlank() ? Optional.empty() : Optional.of(forgeId);
    }
}
