package com.warden.controlplane.domain;

import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/** Strict parsing of identifiers received from callers. */
public final class Uuids {

    // UUID.fromString alone accepts short groups such as "1-2-3-4-5"
    private static final Pattern CANONICAL =
            Pattern.compile("^\\p{XDigit}{8}(-\\p{XDigit}{4}){3}-\\p{XDigit}{12}$");

    private Uuids() {
        // utility class
    }

    /** Parses the canonical 36-character form; empty for anything else, including null. */
    public static Optional<UUID> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.strip();
        if (!CANONICAL.matcher(trimmed).matches()) {
            return Optional.empty();
        }
        return Optional.of(UUID.fromString(trimmed));
    }
}
