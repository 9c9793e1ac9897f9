package com.ais.authservice.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.Arrays;

/**
 * Roles shared with the main backend. The lowercase code is what the
 * {@code users.role} column and the JSON payloads carry.
 */
@Getter
public enum UserRole {

    USER("user"),
    ADMIN("admin"),
    SUPER_ADMIN("super_admin"),
    AIRLINE_ADMIN("airline_admin"),
    FINANCE("finance"),
    OPS("ops"),
    SUPPORT("support");

    @JsonValue
    private final String code;

    UserRole(String code) {
        this.code = code;
    }

    public static UserRole fromCode(String code) {
        return Arrays.stream(values())
                .filter(role -> role.code.equals(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown user role: " + code));
    }
}
