package com.orderdesk.backend.controller;

import com.orderdesk.backend.dto.user.CreateUserRequest;
import com.orderdesk.backend.dto.user.UpdateUserRequest;
import com.orderdesk.backend.dto.user.UserDTO;
import com.orderdesk.backend.dto.user.UserQuery;
import com.orderdesk.backend.pagination.PaginatedResult;
import com.orderdesk.backend.security.AuthUser;
import com.orderdesk.backend.service.UserService;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/users")
public class UserController {

    @Autowired
    private UserService userService;

    /**
     * Profile of the user the access token belongs to.
     */
    @GetMapping("/me")
    public ResponseEntity<UserDTO> getCurrentUserProfile(@AuthenticationPrincipal AuthUser currentUser) {
        return ResponseEntity.ok(userService.getCurrentUser(currentUser));
    }

    // Admin only
    @GetMapping
    public ResponseEntity<PaginatedResult<UserDTO>> getAllUsers(@AuthenticationPrincipal AuthUser currentUser,
                                                                @Valid @ModelAttribute UserQuery query) {
        return ResponseEntity.ok(userService.getUsers(currentUser, query));
    }

    @GetMapping("/{id}")
    public ResponseEntity<UserDTO> getUserById(@AuthenticationPrincipal AuthUser currentUser,
                                               @PathVariable String id) {
        return ResponseEntity.ok(userService.getUser(currentUser, id));
    }

    // Admin only
    @PostMapping
    public ResponseEntity<UserDTO> createUser(@AuthenticationPrincipal AuthUser currentUser,
                                              @Valid @RequestBody CreateUserRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(userService.createUser(currentUser, request));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<UserDTO> updateUser(@AuthenticationPrincipal AuthUser currentUser,
                                              @PathVariable String id,
                                              @Valid @RequestBody UpdateUserRequest request) {
        return ResponseEntity.ok(userService.updateUser(currentUser, id, request));
    }

    // Admin only
    @DeleteMapping("/{id}")
    public ResponseEntity<UserDTO> deleteUser(@AuthenticationPrincipal AuthUser currentUser,
                                              @PathVariable String id) {
        return ResponseEntity.ok(userService.deleteUser(currentUser, id));
    }
}
