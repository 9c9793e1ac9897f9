package com.ais.authservice.mapper;

import com.ais.authservice.dto.UserResponse;
import com.ais.authservice.model.User;
import com.ais.authservice.model.UserRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("UserMapper Unit Tests")
class UserMapperTest {

  private UserMapper mapper;

  @BeforeEach
  void setUp() {
    mapper = Mappers.getMapper(UserMapper.class);
  }

  @Test
  @DisplayName("should map identity, profile and role code")
  void shouldMapPublicFields() {
    // Arrange
    User user = User.builder()
        .id(5L)
        .openId("local_00ff00ff00ff00ff")
        .name("Ops Lead")
        .email("ops@x.com")
        .passwordHash("$2a$04$abcdefghijklmnopqrstuv")
        .loginMethod("password")
        .role(UserRole.AIRLINE_ADMIN)
        .build();

    // Act
    UserResponse response = mapper.toUserResponse(user);

    // Assert
    assertThat(response.getId()).isEqualTo(5L);
    assertThat(response.getOpenId()).isEqualTo("local_00ff00ff00ff00ff");
    assertThat(response.getName()).isEqualTo("Ops Lead");
    assertThat(response.getEmail()).isEqualTo("ops@x.com");
    assertThat(response.getRole()).isEqualTo("airline_admin");
  }

  @Test
  @DisplayName("should leave optional profile fields null")
  void shouldHandleNullOptionalFields() {
    // Arrange: an account created by social login, no name or email
    User user = User.builder()
        .id(6L)
        .openId("oauth-subject-123")
        .build();

    // Act
    UserResponse response = mapper.toUserResponse(user);

    // Assert
    assertThat(response.getName()).isNull();
    assertThat(response.getEmail()).isNull();
    assertThat(response.getRole()).isEqualTo("user");
  }
}
