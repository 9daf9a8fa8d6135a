package com.orderdesk.backend.service;

import com.orderdesk.backend.cache.CacheRegion;
import com.orderdesk.backend.cache.QueryCache;
import com.orderdesk.backend.dto.auth.ChangePasswordRequest;
import com.orderdesk.backend.dto.auth.JwtResponse;
import com.orderdesk.backend.dto.auth.LoginRequest;
import com.orderdesk.backend.dto.auth.RegisterRequest;
import com.orderdesk.backend.dto.auth.ResetPasswordRequest;
import com.orderdesk.backend.dto.user.UserDTO;
import com.orderdesk.backend.exception.DuplicateResourceException;
import com.orderdesk.backend.exception.ForbiddenAccessException;
import com.orderdesk.backend.exception.ResourceNotFoundException;
import com.orderdesk.backend.exception.UnauthorizedException;
import com.orderdesk.backend.mapper.UserMapper;
import com.orderdesk.backend.model.Role;
import com.orderdesk.backend.model.User;
import com.orderdesk.backend.repository.UserRepository;
import com.orderdesk.backend.security.AuthUser;
import com.orderdesk.backend.service.OneTimeCodeService.Purpose;
import com.orderdesk.backend.utils.JwtUtils;
import com.orderdesk.backend.utils.ListQueries;
import com.orderdesk.backend.utils.Persistence;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.security.authentication.AuthenticationManager;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * Sign-up, token issuance and the account flows that sit outside the
 * role-gated entity services.
 */
@Slf4j
@Service
public class AuthService {

    @Autowired
    private AuthenticationManager authenticationManager;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private PasswordEncoder passwordEncoder;

    @Autowired
    private JwtUtils jwtUtils;

    @Autowired
    private TokenRevocationService tokenRevocationService;

    @Autowired
    private OneTimeCodeService oneTimeCodeService;

    @Autowired
    private EmailService emailService;

    @Autowired
    private UserMapper userMapper;

    @Autowired
    private QueryCache queryCache;

    @Value("${app.auth.logout-delay-ms:1500}")
    private long logoutDelayMs;

    /**
     * Self sign-up. The role is always FREELANCER; other roles are granted by an admin.
     */
    public UserDTO register(RegisterRequest request) {
        boolean taken = Persistence.call("Failed to register user",
                () -> userRepository.findByEmail(request.getEmail()).isPresent());
        if (taken) {
            throw new DuplicateResourceException("Email is already in use: " + request.getEmail());
        }

        LocalDateTime now = LocalDateTime.now();
        User user = User.builder()
                .firstName(request.getFirstName())
                .lastName(request.getLastName())
                .email(request.getEmail())
                .password(passwordEncoder.encode(request.getPassword()))
                .country(request.getCountry())
                .isEmailVerified(false)
                .role(Role.FREELANCER)
                .createdAt(now)
                .updatedAt(now)
                .build();

        User saved = Persistence.call("Failed to register user", () -> userRepository.create(user));
        log.info("User {} registered", saved.getId());

        queryCache.invalidate(CacheRegion.USERS);
        return userMapper.toDto(saved);
    }

    public JwtResponse login(LoginRequest request) {
        // Throws BadCredentialsException on a wrong email or password
        Authentication authentication = authenticationManager.authenticate(
                new UsernamePasswordAuthenticationToken(request.getEmail(), request.getPassword()));

        AuthUser principal = (AuthUser) authentication.getPrincipal();
        User user = Persistence.call("Failed to log in", () -> userRepository.findUnique(principal.getId()))
                .orElseThrow(() -> new BadCredentialsException("User no longer exists."));

        log.info("User {} logged in", user.getId());
        return issueTokens(user);
    }

    public JwtResponse refresh(String refreshToken) {
        if (!jwtUtils.validateRefreshToken(refreshToken)) {
            throw new UnauthorizedException("Invalid or expired refresh token.");
        }
        String userId = jwtUtils.getUserIdFromRefreshToken(refreshToken);
        User user = Persistence.call("Failed to refresh token", () -> userRepository.findUnique(userId))
                .orElseThrow(() -> new UnauthorizedException("Invalid or expired refresh token."));
        return issueTokens(user);
    }

    /**
     * Revokes the presented access token, then waits a fixed delay before returning.
     */
    public void logout(AuthUser actor, String accessToken) {
        if (accessToken == null) {
            throw new UnauthorizedException("Authentication is required.");
        }
        tokenRevocationService.revoke(accessToken);
        log.info("User {} logged out", actor.getId());

        if (logoutDelayMs > 0) {
            try {
                Thread.sleep(logoutDelayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Logout delay interrupted for user {}", actor.getId());
            }
        }
    }

    public void sendVerificationCode(AuthUser actor, String email) {
        requireOwnEmail(actor, email);
        String code = oneTimeCodeService.issue(Purpose.VERIFY, email);
        emailService.sendVerificationCode(email, code);
        log.info("Verification code sent to {}", email);
    }

    public UserDTO verifyEmail(AuthUser actor, String email, String code) {
        requireOwnEmail(actor, email);
        oneTimeCodeService.verify(Purpose.VERIFY, email, code);

        User updated = Persistence.call("Failed to verify email", () -> userRepository.update(
                ListQueries.byId(actor.getId()),
                new Update().set("isEmailVerified", true).set("updatedAt", LocalDateTime.now())))
                .orElseThrow(() -> new ResourceNotFoundException("User not found with id: " + actor.getId()));
        log.info("Email verified for {}", email);

        queryCache.invalidate(CacheRegion.USERS);
        return userMapper.toDto(updated);
    }

    public void sendPasswordResetCode(String email) {
        boolean known = Persistence.call("Failed to send reset code",
                () -> userRepository.findByEmail(email).isPresent());
        if (!known) {
            log.warn("Password reset requested for unknown email {}", email);
            throw new ResourceNotFoundException("User not found with email: " + email);
        }
        String code = oneTimeCodeService.issue(Purpose.RESET, email);
        emailService.sendPasswordResetCode(email, code);
        log.info("Password reset code sent to {}", email);
    }

    public void resetPassword(ResetPasswordRequest request) {
        User user = Persistence.call("Failed to reset password",
                () -> userRepository.findByEmail(request.getEmail()))
                .orElseThrow(() -> new ResourceNotFoundException("User not found with email: " + request.getEmail()));
        oneTimeCodeService.verify(Purpose.RESET, request.getEmail(), request.getOtp());

        storePassword(user.getId(), request.getNewPassword());
        log.info("Password reset for user {}", user.getId());
    }

    public void changePassword(AuthUser actor, ChangePasswordRequest request) {
        User user = Persistence.call("Failed to change password", () -> userRepository.findUnique(actor.getId()))
                .orElseThrow(() -> new ResourceNotFoundException("User not found with id: " + actor.getId()));

        if (!passwordEncoder.matches(request.getOldPassword(), user.getPassword())) {
            log.warn("Old password incorrect for user {}", actor.getId());
            throw new UnauthorizedException("Current password is incorrect.");
        }

        storePassword(user.getId(), request.getNewPassword());
        log.info("Password changed for user {}", user.getId());
    }

    private void storePassword(String userId, String rawPassword) {
        Persistence.call("Failed to update password", () -> userRepository.update(
                ListQueries.byId(userId),
                new Update().set("password", passwordEncoder.encode(rawPassword)).set("updatedAt", LocalDateTime.now())));
    }

    private JwtResponse issueTokens(User user) {
        return new JwtResponse(
                jwtUtils.generateAccessToken(user.getId(), user.getEmail()),
                jwtUtils.generateRefreshToken(user.getId(), user.getEmail()),
                userMapper.toDto(user));
    }

    private void requireOwnEmail(AuthUser actor, String email) {
        if (!actor.getEmail().equals(email)) {
            log.warn("User {} tried to verify foreign email {}", actor.getId(), email);
            throw new ForbiddenAccessException("You can only verify your own email address.");
        }
    }
}
