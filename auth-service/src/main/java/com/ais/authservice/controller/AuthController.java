package com.ais.authservice.controller;

import com.ais.authservice.dto.AuthResponse;
import com.ais.authservice.dto.LoginRequest;
import com.ais.authservice.dto.RegisterRequest;
import com.ais.authservice.dto.VerifyPasswordRequest;
import com.ais.authservice.service.AuthService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;

    /**
     * Register a new user with email and password.
     * Answers 200 rather than 201, which is what the main backend expects.
     *
     * @param request email, password (8-128 chars) and optional name
     * @return AuthResponse with the created user
     */
    @PostMapping("/register")
    public ResponseEntity<AuthResponse> register(@Valid @RequestBody RegisterRequest request) {
        return ResponseEntity.ok(authService.register(request));
    }

    /**
     * Authenticate a user with email and password.
     * Any failure is a 401 with the same message.
     *
     * @param request email and password
     * @return AuthResponse with the authenticated user
     */
    @PostMapping("/login")
    public ResponseEntity<AuthResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }

    /**
     * Verify a password against the stored hash. Called by the main backend;
     * always 200, with {@code success=false} and a reason on failure.
     *
     * @param request email and password
     * @return AuthResponse describing the outcome
     */
    @PostMapping("/verify-password")
    public ResponseEntity<AuthResponse> verifyPassword(@Valid @RequestBody VerifyPasswordRequest request) {
        return ResponseEntity.ok(authService.verifyPassword(request));
    }
}
