package com.resumecontrol.controller;

import com.resumecontrol.model.dto.UserRegisterRequest;
import com.resumecontrol.model.dto.UserRegisterResponse;
import com.resumecontrol.model.dto.UserResponse;
import com.resumecontrol.model.dto.UserUpdateRequest;
import com.resumecontrol.security.OwnershipGuard;
import com.resumecontrol.service.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/**
 * Controller for user registration and the caller's own profile.
 */
@RestController
@RequestMapping("/v1/users")
@RequiredArgsConstructor
public class UserController {

    private final OwnershipGuard ownershipGuard;
    private final UserService userService;

    @PostMapping("/register")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<UserRegisterResponse> registerUser(@Valid @RequestBody UserRegisterRequest request) {
        return userService.registerUser(request);
    }

    @GetMapping("/me")
    public Mono<UserResponse> me() {
        return ownershipGuard.authorize()
                .flatMap(userService::getCurrentUser);
    }

    @PutMapping("/me")
    public Mono<UserResponse> updateMe(@Valid @RequestBody UserUpdateRequest request) {
        return ownershipGuard.authorize()
                .flatMap(ownerId -> userService.updateCurrentUser(ownerId, request));
    }
}
