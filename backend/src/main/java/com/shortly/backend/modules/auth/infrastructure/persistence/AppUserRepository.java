package com.shortly.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.shortly.backend.modules.auth.domain.AppUser;

import org.springframework.data.jpa.repository.JpaRepository;

public interface AppUserRepository extends JpaRepository<AppUser, UUID> {

    Optional<AppUser> findByEmail(String email);
}
