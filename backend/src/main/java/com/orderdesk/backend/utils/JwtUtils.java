package com.orderdesk.backend.utils;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SecurityException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;

/**
 * Issues and verifies the access/refresh token pair. Both carry the user id
 * as subject and the email as a claim; they are signed with different secrets
 * so a refresh token is never accepted as an access token.
 */
@Slf4j
@Component
public class JwtUtils {

    private static final String EMAIL_CLAIM = "email";

    @Value("${app.jwt.accessSecret}")
    private String accessSecret;

    @Value("${app.jwt.accessExpirationMs:3600000}")
    private long accessExpirationMs;

    @Value("${app.jwt.refreshSecret}")
    private String refreshSecret;

    @Value("${app.jwt.refreshExpirationMs:604800000}")
    private long refreshExpirationMs;

    public JwtUtils() {
    }

    public JwtUtils(String accessSecret, long accessExpirationMs, String refreshSecret, long refreshExpirationMs) {
        this.accessSecret = accessSecret;
        this.accessExpirationMs = accessExpirationMs;
        this.refreshSecret = refreshSecret;
        this.refreshExpirationMs = refreshExpirationMs;
    }

    private SecretKey key(String secret) {
        return Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    public long getAccessExpirationMs() {
        return accessExpirationMs;
    }

    public String generateAccessToken(String userId, String email) {
        return generate(userId, email, accessSecret, accessExpirationMs);
    }

    public String generateRefreshToken(String userId, String email) {
        return generate(userId, email, refreshSecret, refreshExpirationMs);
    }

    private String generate(String userId, String email, String secret, long lifetimeMs) {
        Date now = new Date();
        return Jwts.builder()
                .subject(userId)
                .claim(EMAIL_CLAIM, email)
                .issuedAt(now)
                .expiration(new Date(now.getTime() + lifetimeMs))
                .signWith(key(secret))
                .compact();
    }

    public String getUserIdFromAccessToken(String token) {
        return parse(token, accessSecret).getSubject();
    }

    public String getUserIdFromRefreshToken(String token) {
        return parse(token, refreshSecret).getSubject();
    }

    private Claims parse(String token, String secret) {
        return Jwts.parser()
                .verifyWith(key(secret))
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }

    public boolean validateAccessToken(String token) {
        return validate(token, accessSecret);
    }

    public boolean validateRefreshToken(String token) {
        return validate(token, refreshSecret);
    }

    private boolean validate(String token, String secret) {
        try {
            parse(token, secret);
            return true;
        } catch (SecurityException | MalformedJwtException e) {
            log.warn("Invalid JWT signature: {}", e.getMessage());
        } catch (ExpiredJwtException e) {
            log.warn("JWT token is expired: {}", e.getMessage());
        } catch (UnsupportedJwtException e) {
            log.warn("JWT token is unsupported: {}", e.getMessage());
        } catch (IllegalArgumentException e) {
            log.warn("JWT claims string is empty: {}", e.getMessage());
        } catch (JwtException e) {
            log.warn("JWT token rejected: {}", e.getMessage());
        }
        return false;
    }
}
