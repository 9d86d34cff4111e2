package com.warden.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.JwtParserBuilder;
import io.jsonwebtoken.Jwts;

import javax.crypto.SecretKey;
import java.security.PublicKey;
import java.time.Clock;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Parses and verifies signed access tokens.
 * <p>
 * An instance is bound to one set of signing material. {@link #parseAndValidate(String)}
 * has no side effects and never touches the store; to rotate keys, build a new
 * validator and swap it in.
 * <p>
 * Claims read from the token:
 * <ul>
 *   <li>{@code sub}: required subject</li>
 *   <li>{@code preferred_username}: optional display name</li>
 *   <li>{@code gh_id}: optional forge user id</li>
 *   <li>{@code realm_access.roles}: optional list of realm roles</li>
 * </ul>
 */
public final class TokenValidator {

    static final String CLAIM_PREFERRED_USERNAME = "preferred_username";
    static final String CLAIM_FORGE_ID = "gh_id";
    static final String CLAIM_REALM_ACCESS = "realm_access";
    static final String CLAIM_ROLES = "roles";

    private final JwtParser parser;
    private final String issuer;

    private TokenValidator(JwtParser parser, String issuer) {
        this.parser = parser;
        this.issuer = issuer;
    }

    /**
     * Creates a validator for HMAC-signed tokens.
     *
     * @param key      shared secret
     * @param issuer   expected {@code iss} value
     * @param audience expected {@code aud} value, or null to skip the audience check
     * @param clock    clock used for expiry checks
     */
    public static TokenValidator withSecretKey(SecretKey key, String issuer, String audience, Clock clock) {
        Objects.requireNonNull(key, "key must not be null");
        var builder = Jwts.parser().verifyWith(key);
        return build(builder, issuer, audience, clock);
    }

    /**
     * Creates a validator for tokens signed with an asymmetric key (RS256, ES256...).
     */
    public static TokenValidator withPublicKey(PublicKey key, String issuer, String audience, Clock clock) {
        Objects.requireNonNull(key, "key must not be null");
        var builder = Jwts.parser().verifyWith(key);
        return build(builder, issuer, audience, clock);
    }

    private static TokenValidator build(JwtParserBuilder builder, String issuer,
                                        String audience, Clock clock) {
        if (issuer == null || issuer.isBlank()) {
            throw new IllegalArgumentException("issuer must not be null or blank");
        }
        Objects.requireNonNull(clock, "clock must not be null");
        builder.requireIssuer(issuer).clock(() -> Date.from(clock.instant()));
        if (audience != null && !audience.isBlank()) {
            builder.requireAudience(audience);
        }
        return new TokenValidator(builder.build(), issuer);
    }

    /**
     * Verifies the token and returns its claims.
     *
     * @param token compact JWS string
     * @return the validated claims
     * @throws TokenValidationException if the token is not trustworthy
     */
    public TokenClaims parseAndValidate(String token) {
        if (token == null || token.isBlank()) {
            throw new TokenValidationException("token must not be blank");
        }
        Claims claims;
        String preferredUsername;
        try {
            claims = parser.parseSignedClaims(token).getPayload();
            preferredUsername = claims.get(CLAIM_PREFERRED_USERNAME, String.class);
        } catch (ExpiredJwtException e) {
            throw new TokenValidationException("token expired", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new TokenValidationException("invalid token: " + e.getMessage(), e);
        }

        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            throw new TokenValidationException("token has no subject");
        }
        return new TokenClaims(
                subject,
                preferredUsername,
                stringClaim(claims.get(CLAIM_FORGE_ID)),
                realmRoles(claims.get(CLAIM_REALM_ACCESS)),
                claims.getIssuer(),
                claims.getExpiration() != null ? claims.getExpiration().toInstant() : null
        );
    }

    /** The issuer this validator accepts. */
    public String issuer() {
        return issuer;
    }

    // gh_id is numeric on some identity providers and a string on others
    private static String stringClaim(Object value) {
        return value == null ? null : value.toString();
    }

    private static Set<String> realmRoles(Object realmAccess) {
        if (!(realmAccess instanceof Map<?, ?> access)) {
            return Set.of();
        }
        Object roles = access.get(CLAIM_ROLES);
        if (!(roles instanceof Collection<?> values)) {
            return Set.of();
        }
        Set<String> result = new LinkedHashSet<>();
        for (Object role : values) {
            if (role != null) {
                result.add(role.toString());
            }
        }
        return result;
    }
}
