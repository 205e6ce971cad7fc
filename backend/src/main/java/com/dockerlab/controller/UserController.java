package com.dockerlab.controller;

import com.dockerlab.dto.request.CreateUserRequest;
import com.dockerlab.dto.request.UpdateUserRequest;
import com.dockerlab.dto.response.DeletedUserResponse;
import com.dockerlab.dto.response.UserListResponse;
import com.dockerlab.dto.response.UserResponse;
import com.dockerlab.model.User;
import com.dockerlab.model.UserPatch;
import com.dockerlab.service.UserService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;

// ========== User Controller ==========
@RestController
@RequestMapping("/users")
@RequiredArgsConstructor
@Tag(name = "Users", description = "User management")
public class UserController {

    private final UserService userService;

    @GetMapping
    @Operation(summary = "Get all users, newest first")
    public ResponseEntity<UserListResponse> getAllUsers() {
        return ResponseEntity.ok(UserListResponse.of(userService.getAllUsers()));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get user by ID")
    public ResponseEntity<UserResponse> getUserById(@PathVariable long id) {
        return ResponseEntity.ok(UserResponse.of(userService.getUserById(id)));
    }

    @PostMapping
    @Operation(summary = "Create user")
    public ResponseEntity<UserResponse> createUser(@Valid @RequestBody CreateUserRequest request) {
        User created = userService.createUser(request.getName(), request.getEmail());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(UserResponse.of("User created successfully", created));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update user (partial: only supplied fields change)")
    public ResponseEntity<UserResponse> updateUser(
            @PathVariable long id,
            @Valid @RequestBody UpdateUserRequest request) {
        User updated = userService.updateUser(id, UserPatch.of(request.getName(), request.getEmail()));
        return ResponseEntity.ok(UserResponse.of("User updated successfully", updated));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete user")
    public ResponseEntity<DeletedUserResponse> deleteUser(@PathVariable long id) {
        User deleted = userService.deleteUser(id);
        return ResponseEntity.ok(new DeletedUserResponse(true, "User deleted successfully", deleted));
    }
}
