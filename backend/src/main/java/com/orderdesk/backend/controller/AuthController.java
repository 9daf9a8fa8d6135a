package com.orderdesk.backend.controller;

import com.orderdesk.backend.dto.MessageResponse;
import com.orderdesk.backend.dto.auth.ChangePasswordRequest;
import com.orderdesk.backend.dto.auth.EmailRequest;
import com.orderdesk.backend.dto.auth.JwtResponse;
import com.orderdesk.backend.dto.auth.LoginRequest;
import com.orderdesk.backend.dto.auth.RefreshTokenRequest;
import com.orderdesk.backend.dto.auth.RegisterRequest;
import com.orderdesk.backend.dto.auth.ResetPasswordRequest;
import com.orderdesk.backend.dto.auth.VerifyOtpRequest;
import com.orderdesk.backend.dto.user.UserDTO;
import com.orderdesk.backend.filter.JwtAuthTokenFilter;
import com.orderdesk.backend.security.AuthUser;
import com.orderdesk.backend.service.AuthService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@CrossOrigin(origins = "*", maxAge = 3600)
@RestController
@RequestMapping("/api/auth")
public class AuthController {

    @Autowired
    AuthService authService;

    @PostMapping("/register")
    public ResponseEntity<UserDTO> registerUser(@Valid @RequestBody RegisterRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(authService.register(request));
    }

    @PostMapping("/login")
    public ResponseEntity<JwtResponse> authenticateUser(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }

    @PostMapping("/refresh")
    public ResponseEntity<JwtResponse> refresh(@Valid @RequestBody RefreshTokenRequest request) {
        return ResponseEntity.ok(authService.refresh(request.getRefreshToken()));
    }

    @PostMapping("/logout")
    public ResponseEntity<MessageResponse> logout(@AuthenticationPrincipal AuthUser currentUser,
                                                  HttpServletRequest request) {
        authService.logout(currentUser, JwtAuthTokenFilter.parseJwt(request));
        return ResponseEntity.ok(new MessageResponse("You have been logged out."));
    }

    // --- Email verification ---

    @PostMapping("/email/send-code")
    public ResponseEntity<MessageResponse> sendVerificationCode(@AuthenticationPrincipal AuthUser currentUser,
                                                                @Valid @RequestBody EmailRequest request) {
        authService.sendVerificationCode(currentUser, request.getEmail());
        return ResponseEntity.ok(new MessageResponse("Verification code sent."));
    }

    @PostMapping("/email/verify")
    public ResponseEntity<UserDTO> verifyEmail(@AuthenticationPrincipal AuthUser currentUser,
                                               @Valid @RequestBody VerifyOtpRequest request) {
        return ResponseEntity.ok(authService.verifyEmail(currentUser, request.getEmail(), request.getOtp()));
    }

    // --- Password ---

    @PostMapping("/password/forgot")
    public ResponseEntity<MessageResponse> forgotPassword(@Valid @RequestBody EmailRequest request) {
        authService.sendPasswordResetCode(request.getEmail());
        return ResponseEntity.ok(new MessageResponse("Code was sent to your email."));
    }

    @PostMapping("/password/reset")
    public ResponseEntity<MessageResponse> resetPassword(@Valid @RequestBody ResetPasswordRequest request) {
        authService.resetPassword(request);
        return ResponseEntity.ok(new MessageResponse("Password has been reset."));
    }

    @PostMapping("/password/change")
    public ResponseEntity<MessageResponse> changePassword(@AuthenticationPrincipal AuthUser currentUser,
                                                          @Valid @RequestBody ChangePasswordRequest request) {
        authService.changePassword(currentUser, request);
        return ResponseEntity.ok(new MessageResponse("Password changed."));
    }
}
