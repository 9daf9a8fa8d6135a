package com.orderdesk.backend.service;

import com.orderdesk.backend.cache.CacheStore;
import com.orderdesk.backend.exception.DuplicateResourceException;
import com.orderdesk.backend.exception.OperationFailedException;
import com.orderdesk.backend.exception.ResourceNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.List;

/**
 * Six-digit codes for email verification and password reset, kept in the
 * cache store with an expiry so they survive restarts and vanish on their own.
 */
@Slf4j
@Service
public class OneTimeCodeService {

    public enum Purpose {
        VERIFY("verify"),
        RESET("reset");

        private final String keySegment;

        Purpose(String keySegment) {
            this.keySegment = keySegment;
        }
    }

    private final SecureRandom random = new SecureRandom();
    private final CacheStore cacheStore;
    private final Duration ttl;

    public OneTimeCodeService(CacheStore cacheStore,
                              @Value("${app.otp.ttl-minutes:10}") long ttlMinutes) {
        this.cacheStore = cacheStore;
        this.ttl = Duration.ofMinutes(ttlMinutes);
    }

    static String key(Purpose purpose, String email) {
        return "otp:" + purpose.keySegment + ":" + email;
    }

    public Duration getTtl() {
        return ttl;
    }

    /**
     * Issues a fresh code, replacing any earlier one for the same email and purpose.
     */
    public String issue(Purpose purpose, String email) {
        String code = String.format("%06d", random.nextInt(1_000_000));
        try {
            cacheStore.set(key(purpose, email), code, ttl);
        } catch (DataAccessException e) {
            log.error("Failed to store {} code for {}: {}", purpose, email, e.getMessage());
            throw new OperationFailedException("Could not issue a verification code. Please try again.", e);
        }
        return code;
    }

    /**
     * Checks and consumes a code.
     *
     * @throws ResourceNotFoundException  when no code is pending (never issued or expired)
     * @throws DuplicateResourceException when the code does not match
     */
    public void verify(Purpose purpose, String email, String code) {
        String key = key(purpose, email);
        String expected;
        try {
            expected = cacheStore.get(key)
                    .orElseThrow(() -> new ResourceNotFoundException("No pending code for " + email + ". Request a new one."));
        } catch (DataAccessException e) {
            throw new OperationFailedException("Could not verify the code. Please try again.", e);
        }

        if (!expected.equals(code)) {
            log.warn("Wrong {} code submitted for {}", purpose, email);
            throw new DuplicateResourceException("The code does not match.");
        }

        try {
            cacheStore.delete(List.of(key));
        } catch (DataAccessException e) {
            log.error("Failed to delete used code {}: {}", key, e.getMessage());
        }
    }
}
