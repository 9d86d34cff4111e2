package com.warden.controlplane.domain;

import java.util.Optional;
import java.util.regex.Pattern;

/** Validation of user-chosen names for rule types, profiles and projects. */
public final class Names {

    private static final Pattern DNS_STYLE =
            Pattern.compile("^[a-zA-Z0-9](?:[-_a-zA-Z0-9]{0,61}[a-zA-Z0-9])?$");

    static final String BAD_DNS_STYLE_NAME =
            "name may only contain letters, numbers, hyphens and underscores, and is limited to a"
                    + " maximum of 63 characters";

    private Names() {
        // utility class
    }

    /** Checks a plain DNS-style name; returns the problem, or empty when the name is valid. */
    public static Optional<String> checkDnsStyle(String name) {
        if (name == null || !DNS_STYLE.matcher(name).matches()) {
            return Optional.of(BAD_DNS_STYLE_NAME);
        }
        return Optional.empty();
    }

    /** Checks a name of the form {@code [namespace/]name}, each part DNS-style. */
    public static Optional<String> checkNamespaced(String name) {
        String[] parts = name.split("/", -1);
        if (parts.length > 2) {
            return Optional.of("cannot have more than one slash in name");
        }
        for (String part : parts) {
            Optional<String> problem = checkDnsStyle(part);
            if (problem.isPresent()) {
                return problem;
            }
        }
        return Optional.empty();
    }
}
