package com.ais.authservice.service;

import com.ais.authservice.config.AuthProperties;
import com.ais.authservice.dto.AuthResponse;
import com.ais.authservice.dto.LoginRequest;
import com.ais.authservice.dto.RegisterRequest;
import com.ais.authservice.dto.VerifyPasswordRequest;
import com.ais.authservice.exception.InvalidCredentialsException;
import com.ais.authservice.mapper.UserMapper;
import com.ais.authservice.model.User;
import com.ais.authservice.model.UserRole;
import com.ais.authservice.repository.UserRepository;
import com.ais.common.exception.DuplicateResourceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class AuthServiceImpl implements AuthService {

    static final String OPEN_ID_PREFIX = "local_";

    static final String USER_EXISTS = "A user with this email already exists.";
    static final String INVALID_CREDENTIALS = "Invalid email or password.";
    static final String NO_PASSWORD = "User not found or no password set.";
    static final String PASSWORD_MISMATCH = "Password does not match.";

    private final UserRepository userRepository;
    private final UserMapper userMapper;
    private final PasswordEncoder passwordEncoder;
    private final AuthProperties authProperties;

    @Override
    @Transactional
    public AuthResponse register(RegisterRequest request) {
        String email = request.getEmail();
        log.info("Registering new user: email={}", email);

        if (userRepository.findFirstByEmail(email).isPresent()) {
            log.warn("Registration rejected - email already exists: {}", email);
            throw new DuplicateResourceException(USER_EXISTS);
        }

        User user = User.builder()
                .openId(generateOpenId())
                .name(request.getName())
                .email(email)
                .passwordHash(passwordEncoder.encode(request.getPassword()))
                .loginMethod(User.LOGIN_METHOD_PASSWORD)
                .role(resolveRole(email))
                .build();

        User savedUser;
        try {
            // flush now so the unique index on email is checked inside this call
            savedUser = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            log.warn("Registration rejected - email taken by a concurrent request: {}", email);
            throw new DuplicateResourceException(USER_EXISTS, e);
        }

        log.info("User registered: id={}, openId={}, role={}",
                savedUser.getId(), savedUser.getOpenId(), savedUser.getRole().getCode());
        return AuthResponse.success(userMapper.toUserResponse(savedUser), "Registration successful.");
    }

    @Override
    @Transactional(readOnly = true)
    public AuthResponse login(LoginRequest request) {
        CredentialCheck check = checkCredentials(request.getEmail(), request.getPassword());

        if (check.outcome() != Outcome.VERIFIED) {
            // the reason stays in the log; the caller always gets the same message
            log.warn("Login failed: email={}, reason={}", request.getEmail(), check.outcome());
            throw new InvalidCredentialsException(INVALID_CREDENTIALS);
        }

        log.info("Login successful: id={}, email={}", check.user().getId(), request.getEmail());
        return AuthResponse.success(userMapper.toUserResponse(check.user()), "Login successful.");
    }

    @Override
    @Transactional(readOnly = true)
    public AuthResponse verifyPassword(VerifyPasswordRequest request) {
        CredentialCheck check = checkCredentials(request.getEmail(), request.getPassword());

        log.debug("Password verification: email={}, outcome={}", request.getEmail(), check.outcome());
        return switch (check.outcome()) {
            case NO_PASSWORD -> AuthResponse.failure(NO_PASSWORD);
            case MISMATCH -> AuthResponse.failure(PASSWORD_MISMATCH);
            case VERIFIED -> AuthResponse.success(userMapper.toUserResponse(check.user()), "Password verified.");
        };
    }

    /**
     * Lookup and hash comparison shared by login and verify-password, so both
     * endpoints do the same work for the same input.
     */
    private CredentialCheck checkCredentials(String email, String password) {
        User user = userRepository.findFirstByEmail(email).orElse(null);
        if (user == null || !user.hasPassword()) {
            return new CredentialCheck(Outcome.NO_PASSWORD, null);
        }
        if (!passwordEncoder.matches(password, user.getPasswordHash())) {
            return new CredentialCheck(Outcome.MISMATCH, null);
        }
        return new CredentialCheck(Outcome.VERIFIED, user);
    }

    private UserRole resolveRole(String email) {
        if (authProperties.isOwnerEmail(email)) {
            log.info("Owner email registered, assigning admin role: {}", email);
            return UserRole.ADMIN;
        }
        return UserRole.USER;
    }

    // "local_" + the first 16 hex chars of a random UUID
    static String generateOpenId() {
        return OPEN_ID_PREFIX + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }

    private enum Outcome {
        VERIFIED,
        NO_PASSWORD,
        MISMATCH
    }

    private record CredentialCheck(Outcome outcome, User user) {
    }
}
