package com.ais.authservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

/**
 * Row of the {@code users} table. The table is shared with the main backend,
 * so column names are kept exactly as that schema declares them. The camelCase
 * names are quoted; PostgreSQL would fold them to lowercase otherwise.
 * The table and its {@code users_email_unique} index come from {@code schema.sql}.
 */
@Entity
@Table(name = "users")
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {

    public static final String LOGIN_METHOD_PASSWORD = "password";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @ToString.Include
    private Long id;

    // External id used by other systems; never changes once written
    @Column(name = "`openId`", length = 64, nullable = false, unique = true, updatable = false)
    @ToString.Include
    private String openId;

    @Column(name = "name", columnDefinition = "text")
    private String name;

    @Column(name = "email", length = 320)
    @ToString.Include
    private String email;

    // null for accounts created through social login
    @Column(name = "`passwordHash`")
    private String passwordHash;

    @Column(name = "`loginMethod`", length = 64)
    private String loginMethod;

    @Builder.Default
    @Column(name = "role", length = 32, nullable = false)
    @ToString.Include
    private UserRole role = UserRole.USER;

    @CreationTimestamp
    @Column(name = "`createdAt`", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "`updatedAt`", nullable = false)
    private Instant updatedAt;

    @CreationTimestamp
    @Column(name = "`lastSignedIn`", nullable = false)
    private Instant lastSignedIn;

    public boolean hasPassword() {
        return passwordHash != null && !passwordHash.isEmpty();
    }
}
