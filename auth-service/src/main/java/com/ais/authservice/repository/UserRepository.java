package com.ais.authservice.repository;

import com.ais.authservice.model.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    // Rows written by the other backend before the unique index existed may repeat an email
    Optional<User> findFirstByEmail(String email);
}
