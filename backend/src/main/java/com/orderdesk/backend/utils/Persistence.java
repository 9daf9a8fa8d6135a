package com.orderdesk.backend.utils;

import com.orderdesk.backend.exception.DuplicateResourceException;
import com.orderdesk.backend.exception.OperationFailedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;

import java.util.function.Supplier;

/**
 * Service-boundary translation of driver failures. Domain exceptions thrown
 * inside the call pass through unchanged.
 */
@Slf4j
public final class Persistence {

    private Persistence() {
    }

    public static <T> T call(String failureMessage, Supplier<T> action) {
        try {
            return action.get();
        } catch (DuplicateKeyException e) {
            log.warn("Duplicate key: {}", e.getMessage());
            throw new DuplicateResourceException("A record with the same unique value already exists.");
        } catch (DataAccessException e) {
            log.error("{}: {}", failureMessage, e.getMessage(), e);
            throw new OperationFailedException(failureMessage, e);
        }
    }

    public static void run(String failureMessage, Runnable action) {
        call(failureMessage, () -> {
            action.run();
            return null;
        });
    }
}
