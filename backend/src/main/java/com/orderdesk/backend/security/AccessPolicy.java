package com.orderdesk.backend.security;

import com.orderdesk.backend.exception.ForbiddenAccessException;
import com.orderdesk.backend.exception.UnauthorizedException;
import com.orderdesk.backend.model.Role;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collection;
import java.util.Objects;

/**
 * Role, ownership and self checks shared by the entity services.
 * <p>
 * Services call {@link #requireRole} first, then load the target, then run
 * the ownership or self check. A record that does not exist is reported as
 * not found before any ownership decision is made.
 */
@Slf4j
@Component
public class AccessPolicy {

    private final boolean requireVerifiedEmail;

    public AccessPolicy(@Value("${app.auth.require-verified-email:true}") boolean requireVerifiedEmail) {
        this.requireVerifiedEmail = requireVerifiedEmail;
    }

    public void requireRole(AuthUser actor, Role... allowed) {
        if (actor == null) {
            throw new UnauthorizedException("Authentication is required.");
        }
        if (requireVerifiedEmail && !actor.isEmailVerified()) {
            log.warn("Rejected unverified user {}", actor.getId());
            throw new UnauthorizedException("Please verify your email address first.");
        }
        if (actor.getRole() == null || !Arrays.asList(allowed).contains(actor.getRole())) {
            log.warn("Role {} of user {} is not allowed here", actor.getRole(), actor.getId());
            throw new ForbiddenAccessException("Access Denied: your role cannot perform this action.");
        }
    }

    public boolean isAdmin(AuthUser actor) {
        return actor != null && actor.getRole() == Role.ADMIN;
    }

    // Managers see every order but only the customers their own orders reach.
    public boolean canManageAllOrders(AuthUser actor) {
        return actor != null && (actor.getRole() == Role.ADMIN || actor.getRole() == Role.MANAGER);
    }

    public void requireOrderAccess(AuthUser actor, String orderId, String ownerId) {
        if (canManageAllOrders(actor) || Objects.equals(ownerId, actor.getId())) {
            return;
        }
        log.warn("User {} tried to access order {}", actor.getId(), orderId);
        throw new ForbiddenAccessException("Access Denied: this order belongs to another user.");
    }

    /**
     * Customer links are moved only by the owner of the order, or by an admin.
     */
    public void requireOrderOwnership(AuthUser actor, String orderId, String ownerId) {
        if (isAdmin(actor) || Objects.equals(ownerId, actor.getId())) {
            return;
        }
        log.warn("User {} tried to move order {} of another user", actor.getId(), orderId);
        throw new ForbiddenAccessException("Access Denied: you can only link your own orders.");
    }

    /**
     * @param ownerIds owners of the orders currently linked to the customer
     */
    public void requireCustomerAccess(AuthUser actor, String customerId, Collection<String> ownerIds) {
        if (isAdmin(actor) || ownerIds.contains(actor.getId())) {
            return;
        }
        log.warn("User {} tried to access customer {}", actor.getId(), customerId);
        throw new ForbiddenAccessException("Access Denied: this customer is not linked to your orders.");
    }

    public void requireSelfOrAdmin(AuthUser actor, String targetUserId) {
        if (isAdmin(actor) || Objects.equals(actor.getId(), targetUserId)) {
            return;
        }
        log.warn("User {} tried to act on user {}", actor.getId(), targetUserId);
        throw new ForbiddenAccessException("Access Denied: you can only manage your own account.");
    }
}
