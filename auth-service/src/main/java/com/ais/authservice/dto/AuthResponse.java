package com.ais.authservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Common envelope of the register, login and verify-password endpoints.
 * {@code user} is only present when {@code success} is true.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuthResponse {
    private boolean success;
    private UserResponse user;
    private String message;

    public static AuthResponse success(UserResponse user, String message) {
        return AuthResponse.builder()
                .success(true)
                .user(user)
                .message(message)
                .build();
    }

    public static AuthResponse failure(String message) {
        return AuthResponse.builder()
                .success(false)
                .message(message)
                .build();
    }
}
