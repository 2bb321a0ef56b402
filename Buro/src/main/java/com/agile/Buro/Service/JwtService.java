package com.agile.Buro.Service;

import com.agile.Buro.entity.UserRole;
import io.jsonwebtoken.*;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SignatureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Instant;
import java.util.*;

@Slf4j
@Service
public class JwtService {

    public static final String CLAIM_USER_ID = "user_id";
    public static final String CLAIM_EMAIL = "email";
    public static final String CLAIM_FULL_NAME = "full_name";
    public static final String CLAIM_ROLES = "roles";
    public static final String CLAIM_TOKEN_TYPE = "token_type";

    private final Key key;
    private final JwtParser parser;

    private final long accessMs;
    private final long refreshMs;

    public JwtService(
            @Value("${jwt.secret}") String secret,
            @Value("${jwt.access-ms}") long accessMs,
            @Value("${jwt.refresh-ms}") long refreshMs
    ) {
        this.key = buildKey(secret);
        this.parser = Jwts.parserBuilder()
                .setSigningKey(this.key)
                .setAllowedClockSkewSeconds(60)
                .build();
        this.accessMs = accessMs;
        this.refreshMs = refreshMs;
    }

    private Key buildKey(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("JWT secret must be configured (jwt.secret)");
        }
        byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < 32) {
            throw new IllegalArgumentException("JWT secret must be at least 256 bits (32 bytes)");
        }
        return Keys.hmacShaKeyFor(bytes);
    }

    public long getRefreshMs() {
        return refreshMs;
    }

    /* ============ Access Token ============ */

    public String generateAccessToken(UUID userId, String email, String fullName, UserRole role) {
        if (userId == null) {
            throw new IllegalArgumentException("User id must not be null");
        }
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("Email must not be null or empty");
        }
        if (role == null) {
            throw new IllegalArgumentException("Role must not be null");
        }

        Map<String, Object> claims = new HashMap<>();
        claims.put(CLAIM_USER_ID, userId.toString());
        claims.put(CLAIM_EMAIL, email);
        claims.put(CLAIM_FULL_NAME, fullName);
        // no ROLE_ prefix, the filter adds it
        claims.put(CLAIM_ROLES, List.of(role.name()));

        return Jwts.builder()
                .setClaims(claims)
                .setSubject(userId.toString())
                .claim(CLAIM_TOKEN_TYPE, "access")
                .setIssuedAt(new Date())
                .setExpiration(new Date(Instant.now().toEpochMilli() + accessMs))
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    /* ============ Refresh Token ============ */

    public String generateRefreshToken(UUID userId, UUID jti) {
        if (userId == null) {
            throw new IllegalArgumentException("User id must not be null");
        }
        if (jti == null) {
            throw new IllegalArgumentException("JTI must not be null");
        }
        return Jwts.builder()
                .setSubject(userId.toString())
                .setId(jti.toString())
                .claim(CLAIM_TOKEN_TYPE, "refresh")
                .setIssuedAt(new Date())
                .setExpiration(new Date(Instant.now().toEpochMilli() + refreshMs))
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    /* ============ Validation / Parsing ============ */

    public Claims parseAllClaims(String token) {
        if (token == null || token.isBlank()) {
            throw new JwtException("Token must not be null or empty");
        }
        try {
            return parser.parseClaimsJws(token).getBody();
        } catch (ExpiredJwtException e) {
            throw new JwtException("Token has expired", e);
        } catch (UnsupportedJwtException e) {
            throw new JwtException("Unsupported JWT token", e);
        } catch (MalformedJwtException e) {
            throw new JwtException("Invalid JWT token", e);
        } catch (SignatureException e) {
            throw new JwtException("Invalid JWT signature", e);
        } catch (IllegalArgumentException e) {
            throw new JwtException("JWT claims string is empty", e);
        }
    }

    public boolean isAccessToken(Claims claims) {
        return "access".equals(claims.get(CLAIM_TOKEN_TYPE, String.class));
    }

    public boolean isRefreshToken(String token) {
        if (token == null || token.isBlank()) {
            return false;
        }
        try {
            return "refresh".equals(parseAllClaims(token).get(CLAIM_TOKEN_TYPE, String.class));
        } catch (JwtException e) {
            log.debug("Rejected refresh token: {}", e.getMessage());
            return false;
        }
    }

    public UUID getUserId(Claims claims) {
        String raw = claims.get(CLAIM_USER_ID, String.class);
        return UUID.fromString(raw != null ? raw : claims.getSubject());
    }

    /** Subject of a correctly signed token, also when it has already expired. */
    public String getSubjectEvenIfExpired(String token) {
        if (token == null || token.isBlank()) {
            throw new JwtException("Token must not be null or empty");
        }
        try {
            return parser.parseClaimsJws(token).getBody().getSubject();
        } catch (ExpiredJwtException e) {
            return e.getClaims().getSubject();
        }
    }
}
