package com.orderdesk.backend.service;

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
import com.orderdesk.backend.security.AuthUser;
import com.orderdesk.backend.support.InMemoryCacheStore;
import com.orderdesk.backend.support.InMemoryRepositories;
import com.orderdesk.backend.support.TestFixtures;
import com.orderdesk.backend.utils.JwtUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.security.authentication.AuthenticationManager;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.util.ReflectionTestUtils;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AuthServiceTest {

    private InMemoryRepositories.Users users;
    private InMemoryCacheStore cacheStore;
    private PasswordEncoder passwordEncoder;
    private JwtUtils jwtUtils;
    private TokenRevocationService tokenRevocationService;
    private EmailService emailService;
    private AuthenticationManager authenticationManager;
    private AuthService authService;

    @BeforeEach
    void setUp() {
        users = new InMemoryRepositories.Users();
        cacheStore = new InMemoryCacheStore();
        passwordEncoder = new BCryptPasswordEncoder(4);
        jwtUtils = new JwtUtils("test-access-secret-0123456789abcdef0123", 60_000,
                "test-refresh-secret-0123456789abcdef012", 120_000);
        tokenRevocationService = new TokenRevocationService();
        ReflectionTestUtils.setField(tokenRevocationService, "cacheStore", cacheStore);
        ReflectionTestUtils.setField(tokenRevocationService, "jwtUtils", jwtUtils);
        emailService = mock(EmailService.class);
        authenticationManager = mock(AuthenticationManager.class);
        QueryCache queryCache = new QueryCache(cacheStore, TestFixtures.objectMapper(), 300, 1800);

        authService = new AuthService();
        ReflectionTestUtils.setField(authService, "authenticationManager", authenticationManager);
        ReflectionTestUtils.setField(authService, "userRepository", users);
        ReflectionTestUtils.setField(authService, "passwordEncoder", passwordEncoder);
        ReflectionTestUtils.setField(authService, "jwtUtils", jwtUtils);
        ReflectionTestUtils.setField(authService, "tokenRevocationService", tokenRevocationService);
        ReflectionTestUtils.setField(authService, "oneTimeCodeService", new OneTimeCodeService(cacheStore, 10));
        ReflectionTestUtils.setField(authService, "emailService", emailService);
        ReflectionTestUtils.setField(authService, "userMapper", new UserMapper());
        ReflectionTestUtils.setField(authService, "queryCache", queryCache);
        ReflectionTestUtils.setField(authService, "logoutDelayMs", 0L);
    }

    private UserDTO register(String email) {
        return authService.register(new RegisterRequest("Ada", "Lovelace", email, "s3cret-password", "UK"));
    }

    private AuthUser principal(UserDTO user) {
        return AuthUser.from(users.findUnique(user.getId()).orElseThrow());
    }

    private String sentCode(boolean reset, String email) {
        ArgumentCaptor<String> code = ArgumentCaptor.forClass(String.class);
        if (reset) {
            verify(emailService).sendPasswordResetCode(eq(email), code.capture());
        } else {
            verify(emailService).sendVerificationCode(eq(email), code.capture());
        }
        return code.getValue();
    }

    @Test
    void registrationCreatesAnUnverifiedFreelancer() {
        UserDTO user = register("ada@example.com");

        assertThat(user.getRole()).isEqualTo(Role.FREELANCER);
        assertThat(user.getIsEmailVerified()).isFalse();
        assertThatThrownBy(() -> register("ada@example.com")).isInstanceOf(DuplicateResourceException.class);
    }

    @Test
    void loginIssuesTokensForTheAuthenticatedUser() {
        UserDTO user = register("ada@example.com");
        AuthUser principal = principal(user);
        when(authenticationManager.authenticate(any()))
                .thenReturn(new UsernamePasswordAuthenticationToken(principal, null, principal.getAuthorities()));

        JwtResponse response = authService.login(new LoginRequest("ada@example.com", "s3cret-password"));

        assertThat(jwtUtils.getUserIdFromAccessToken(response.getAccessToken())).isEqualTo(user.getId());
        assertThat(jwtUtils.validateRefreshToken(response.getRefreshToken())).isTrue();
        assertThat(response.getUser().getEmail()).isEqualTo("ada@example.com");
    }

    @Test
    void refreshNeedsARefreshToken() {
        UserDTO user = register("ada@example.com");
        String access = jwtUtils.generateAccessToken(user.getId(), user.getEmail());
        String refresh = jwtUtils.generateRefreshToken(user.getId(), user.getEmail());

        assertThat(authService.refresh(refresh).getUser().getId()).isEqualTo(user.getId());
        assertThatThrownBy(() -> authService.refresh(access)).isInstanceOf(UnauthorizedException.class);
    }

    @Test
    void logoutRevokesTheToken() {
        UserDTO user = register("ada@example.com");
        String access = jwtUtils.generateAccessToken(user.getId(), user.getEmail());

        authService.logout(principal(user), access);

        assertThat(tokenRevocationService.isRevoked(access)).isTrue();
    }

    @Test
    void emailVerificationFlow() {
        UserDTO user = register("ada@example.com");
        AuthUser principal = principal(user);

        authService.sendVerificationCode(principal, "ada@example.com");
        UserDTO verified = authService.verifyEmail(principal, "ada@example.com", sentCode(false, "ada@example.com"));

        assertThat(verified.getIsEmailVerified()).isTrue();
        assertThat(users.findUnique(user.getId()).orElseThrow().getIsEmailVerified()).isTrue();
    }

    @Test
    void cannotVerifySomeoneElsesEmail() {
        AuthUser principal = principal(register("ada@example.com"));

        assertThatThrownBy(() -> authService.sendVerificationCode(principal, "grace@example.com"))
                .isInstanceOf(ForbiddenAccessException.class);
    }

    @Test
    void passwordResetFlow() {
        UserDTO user = register("ada@example.com");

        authService.sendPasswordResetCode("ada@example.com");
        authService.resetPassword(new ResetPasswordRequest("ada@example.com",
                sentCode(true, "ada@example.com"), "brand-new-password"));

        User stored = users.findUnique(user.getId()).orElseThrow();
        assertThat(passwordEncoder.matches("brand-new-password", stored.getPassword())).isTrue();
        assertThatThrownBy(() -> authService.sendPasswordResetCode("ghost@example.com"))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void changePasswordChecksTheOldOne() {
        UserDTO user = register("ada@example.com");
        AuthUser principal = principal(user);

        assertThatThrownBy(() -> authService.changePassword(principal,
                new ChangePasswordRequest("wrong-password", "brand-new-password")))
                .isInstanceOf(UnauthorizedException.class);

        authService.changePassword(principal, new ChangePasswordRequest("s3cret-password", "brand-new-password"));
        assertThat(passwordEncoder.matches("brand-new-password",
                users.findUnique(user.getId()).orElseThrow().getPassword())).isTrue();
    }
}
