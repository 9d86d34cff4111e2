package com.warden.security;

import java.util.Locale;
import java.util.Optional;

/**
 * Extracts bearer tokens from {@code authorization} header or metadata values.
 * <p>
 * Only the {@code bearer} scheme is accepted. The scheme must be followed by
 * whitespace, so a value such as {@code "bearerabc"} is rejected rather than
 * read as the token {@code "abc"}.
 */
public final class BearerTokenExtractor {

    /** Name of the header (and gRPC metadata key) that carries the token. */
    public static final String AUTHORIZATION = "authorization";

    private static final String SCHEME = "bearer";

    private BearerTokenExtractor() {
        // utility class
    }

    /**
     * Extracts the bearer token from an authorization value.
     *
     * @param authorization the full value, for example {@code "Bearer eyJ..."} (may be null)
     * @return the token, or empty if the value is missing, uses another scheme or has no token
     */
    public static Optional<String> extract(String authorization) {
        if (authorization == null || authorization.isBlank()) {
            return Optional.empty();
        }
        String trimmed = authorization.strip();
        if (trimmed.length() <= SCHEME.length()
                || !trimmed.toLowerCase(Locale.ROOT).startsWith(SCHEME)
                || !Character.isWhitespace(trimmed.charAt(SCHEME.length()))) {
            return Optional.empty();
        }
        String token = trimmed.substring(SCHEME.length()).strip();
        if (token.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(token);
    }
}
