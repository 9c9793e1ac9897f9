package com.ais.authservice.service;

import com.ais.authservice.dto.AuthResponse;
import com.ais.authservice.dto.LoginRequest;
import com.ais.authservice.dto.RegisterRequest;
import com.ais.authservice.dto.VerifyPasswordRequest;

public interface AuthService {

    /**
     * Creates a password account. The configured owner email is given the admin
     * role, every other email the user role.
     *
     * @param request validated email, password and optional display name
     * @return success envelope with the created user
     * @throws com.ais.common.exception.DuplicateResourceException if the email is already registered
     */
    AuthResponse register(RegisterRequest request);

    /**
     * Checks an email/password pair. Every failure raises the same exception
     * with the same message, so callers cannot tell which emails exist.
     *
     * @param request validated email and password
     * @return success envelope with the stored user, unchanged
     * @throws com.ais.authservice.exception.InvalidCredentialsException on any failure
     */
    AuthResponse login(LoginRequest request);

    /**
     * Same check as {@link #login(LoginRequest)}, for the trusted main backend.
     * Failures come back as {@code success=false} with a reason instead of an exception.
     *
     * @param request validated email and password
     * @return success or failure envelope; never throws for bad credentials
     */
    AuthResponse verifyPassword(VerifyPasswordRequest request);
}
