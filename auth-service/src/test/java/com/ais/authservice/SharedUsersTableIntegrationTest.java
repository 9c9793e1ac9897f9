package com.ais.authservice;

import com.ais.authservice.dto.LoginRequest;
import com.ais.authservice.dto.RegisterRequest;
import com.ais.authservice.dto.VerifyPasswordRequest;
import com.ais.authservice.model.User;
import com.ais.authservice.model.UserRole;
import com.ais.authservice.repository.UserRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Runs against a users table laid out the way the main backend creates it:
 * quoted camelCase column names, which PostgreSQL keeps case-sensitive.
 */
@AutoConfigureMockMvc
public class SharedUsersTableIntegrationTest extends AbstractIntegrationTest {

  private static final String MAIN_BACKEND_DDL = "CREATE TABLE users ("
      + "id BIGSERIAL PRIMARY KEY, "
      + "\"openId\" VARCHAR(64) NOT NULL UNIQUE, "
      + "name TEXT, "
      + "email VARCHAR(320), "
      + "\"passwordHash\" VARCHAR(255), "
      + "\"loginMethod\" VARCHAR(64), "
      + "role VARCHAR(32) NOT NULL DEFAULT 'user', "
      + "\"createdAt\" TIMESTAMP NOT NULL DEFAULT now(), "
      + "\"updatedAt\" TIMESTAMP NOT NULL DEFAULT now(), "
      + "\"lastSignedIn\" TIMESTAMP NOT NULL DEFAULT now(), "
      + "CONSTRAINT users_email_unique UNIQUE (email))";

  @Autowired
  private MockMvc mockMvc;

  @Autowired
  private ObjectMapper objectMapper;

  @Autowired
  private JdbcTemplate jdbcTemplate;

  @Autowired
  private PasswordEncoder passwordEncoder;

  @Autowired
  private UserRepository userRepository;

  @BeforeEach
  void createTableAsMainBackend() {
    jdbcTemplate.execute("DROP TABLE IF EXISTS users");
    jdbcTemplate.execute(MAIN_BACKEND_DDL);
  }

  @AfterEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM users");
  }

  private ResultActions postJson(String path, Object body) throws Exception {
    return mockMvc.perform(post(path)
        .contentType(MediaType.APPLICATION_JSON)
        .content(objectMapper.writeValueAsString(body)));
  }

  @Test
  void should_write_registered_user_into_camel_case_columns() throws Exception {
    postJson("/auth/register", new RegisterRequest("a@x.com", "longpassword1", "Alice"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.user.role").value("user"));

    Map<String, Object> row = jdbcTemplate.queryForMap(
        "SELECT \"openId\", \"passwordHash\", \"loginMethod\", role, \"createdAt\", \"lastSignedIn\""
            + " FROM users WHERE email = ?", "a@x.com");

    assertTrue(((String) row.get("openId")).matches("local_[0-9a-f]{16}"));
    assertTrue(((String) row.get("passwordHash")).startsWith("$2"));
    assertEquals("password", row.get("loginMethod"));
    assertEquals("user", row.get("role"));
    assertNotNull(row.get("createdAt"));
    assertNotNull(row.get("lastSignedIn"));

    postJson("/auth/login", new LoginRequest("a@x.com", "longpassword1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.user.email").value("a@x.com"));
  }

  @Test
  void should_authenticate_row_inserted_by_main_backend() throws Exception {
    jdbcTemplate.update(
        "INSERT INTO users (\"openId\", email, \"passwordHash\", \"loginMethod\", role) VALUES (?, ?, ?, ?, ?)",
        "local_00112233aabbccdd", "ops@x.com", passwordEncoder.encode("longpassword1"), "password", "finance");

    User loaded = userRepository.findFirstByEmail("ops@x.com").orElseThrow();
    assertEquals("local_00112233aabbccdd", loaded.getOpenId());
    assertEquals(UserRole.FINANCE, loaded.getRole());
    assertNotNull(loaded.getCreatedAt());

    postJson("/auth/login", new LoginRequest("ops@x.com", "longpassword1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.user.openId").value("local_00112233aabbccdd"))
        .andExpect(jsonPath("$.user.role").value("finance"));

    postJson("/auth/verify-password", new VerifyPasswordRequest("ops@x.com", "wrong-password"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(false))
        .andExpect(jsonPath("$.message").value("Password does not match."));
  }

  @Test
  void should_report_conflict_from_existing_row() throws Exception {
    jdbcTemplate.update(
        "INSERT INTO users (\"openId\", email, \"loginMethod\") VALUES (?, ?, ?)",
        "google-oauth-subject-2", "taken@x.com", "google");

    postJson("/auth/register", new RegisterRequest("taken@x.com", "longpassword1", null))
        .andExpect(status().isConflict());

    assertEquals(1, jdbcTemplate.queryForObject("SELECT count(*) FROM users", Integer.class));
  }
}
