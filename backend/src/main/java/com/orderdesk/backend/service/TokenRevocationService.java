package com.orderdesk.backend.service;

import com.orderdesk.backend.cache.CacheStore;
import com.orderdesk.backend.exception.OperationFailedException;
import com.orderdesk.backend.utils.JwtUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Ledger of access tokens that were logged out before they expired. The raw
 * token is the key; the entry lives exactly as long as an access token can.
 */
@Slf4j
@Service
public class TokenRevocationService {

    static final String REVOKED = "revoked";

    @Autowired
    private CacheStore cacheStore;

    @Autowired
    private JwtUtils jwtUtils;

    public void revoke(String token) {
        try {
            cacheStore.set(token, REVOKED, Duration.ofMillis(jwtUtils.getAccessExpirationMs()));
        } catch (DataAccessException e) {
            log.error("Failed to record revoked token: {}", e.getMessage());
            throw new OperationFailedException("Logout could not be completed.", e);
        }
    }

    /**
     * A ledger that cannot be read counts as revoked.
     */
    public boolean isRevoked(String token) {
        try {
            return cacheStore.get(token).isPresent();
        } catch (DataAccessException e) {
            log.error("Revocation lookup failed, rejecting token: {}", e.getMessage());
            return true;
        }
    }

    public Optional<Duration> remainingLifetime(String token) {
        return cacheStore.ttl(token);
    }
}
