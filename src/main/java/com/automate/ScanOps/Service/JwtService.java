package com.automate.ScanOps.Service;

import com.automate.ScanOps.Models.AuthenticatedUser;
import io.jsonwebtoken.*;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * Turns access tokens minted by the identity provider into an {@link AuthenticatedUser}.
 * This service never issues tokens.
 */
@Service
public class JwtService {

    private final JwtParser parser;

    public JwtService(@Value("${jwt.secret}") String secret,
                      @Value("${jwt.issuer:}") String issuer) {
        JwtParserBuilder builder = Jwts.parserBuilder()
                .setSigningKey(hmacKey(secret))
                .setAllowedClockSkewSeconds(60);
        if (!issuer.isBlank()) {
            builder.requireIssuer(issuer);
        }
        this.parser = builder.build();
    }

    private static Key hmacKey(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("JWT secret must not be null or empty");
        }
        byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < 32) {
            throw new IllegalArgumentException("JWT secret must be at least 256 bits (32 bytes)");
        }
        return Keys.hmacShaKeyFor(bytes);
    }

    /**
     * @return the caller named by an access token
     * @throws JwtException if the token is invalid, expired, not an access token or has no user_id
     */
    public AuthenticatedUser authenticate(String token) {
        if (token == null || token.isBlank()) {
            throw new JwtException("Token must not be empty");
        }
        Claims claims;
        try {
            claims = parser.parseClaimsJws(token).getBody();
        } catch (ExpiredJwtException e) {
            throw new JwtException("Token has expired", e);
        } catch (IncorrectClaimException | MissingClaimException e) {
            throw new JwtException("Token issuer mismatch", e);
        } catch (UnsupportedJwtException | MalformedJwtException e) {
            throw new JwtException("Invalid JWT token", e);
        }

        String tokenType = claims.get("token_type", String.class);
        if (tokenType != null && !"access".equalsIgnoreCase(tokenType)) {
            throw new JwtException("Not an access token: " + tokenType);
        }
        String userId = claims.get("user_id", String.class);
        if (userId == null) {
            throw new JwtException("Token has no user_id claim");
        }
        try {
            return new AuthenticatedUser(UUID.fromString(userId), claims.get("email", String.class),
                    readRoles(claims.get("roles")));
        } catch (IllegalArgumentException e) {
            throw new JwtException("Malformed user_id claim", e);
        }
    }

    // roles claim may be a list or a single value, with or without the ROLE_ prefix
    static List<String> readRoles(Object rolesClaim) {
        if (rolesClaim instanceof List<?> roleList) {
            return roleList.stream()
                    .filter(Objects::nonNull)
                    .map(r -> stripPrefix(r.toString()))
                    .toList();
        }
        if (rolesClaim != null) {
            return List.of(stripPrefix(rolesClaim.toString()));
        }
        return List.of();
    }

    private static String stripPrefix(String role) {
        String upper = role.trim().toUpperCase(Locale.ROOT);
        return upper.startsWith("ROLE_") ? upper.substring(5) : upper;
    }
}
