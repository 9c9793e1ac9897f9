package com.ais.authservice.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.Arrays;
import java.util.List;

/**
 * Process-wide settings, bound once at startup.
 */
@ConfigurationProperties(prefix = "auth")
public record AuthProperties(

    @DefaultValue("AIS Auth Service")
    String appName,

    @DefaultValue("1.0.0")
    String version,

    /**
     * Email that is granted the admin role when it registers.
     * Blank disables the rule.
     */
    @DefaultValue("")
    String ownerEmail,

    /**
     * Log2 rounds used by bcrypt.
     */
    @DefaultValue("12")
    int bcryptStrength,

    /**
     * Comma-separated list of allowed CORS origins (patterns are accepted).
     */
    @DefaultValue("")
    String corsOrigins

) {

    public boolean hasOwnerEmail() {
        return ownerEmail != null && !ownerEmail.isBlank();
    }

    public boolean isOwnerEmail(String email) {
        return hasOwnerEmail() && email != null && ownerEmail.trim().equalsIgnoreCase(email);
    }

    public List<String> corsOriginList() {
        if (corsOrigins == null || corsOrigins.isBlank()) {
            return List.of();
        }
        return Arrays.stream(corsOrigins.split(","))
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .toList();
    }
}
