package com.shortly.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.shortly.backend.modules.auth.domain.EmailVerificationToken;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface EmailVerificationTokenRepository extends JpaRepository<EmailVerificationToken, UUID> {

    @Query("""
            select evt
              from EmailVerificationToken evt
              join fetch evt.user u
             where u.email = :email
               and evt.token = :token
               and evt.expiresAt > :now
            """)
    Optional<EmailVerificationToken> findUsable(@Param("email") String email,
                                                @Param("token") String token,
                                                @Param("now") OffsetDateTime now);

    @Modifying
    @Query("delete from EmailVerificationToken evt where evt.user.id = :userId")
    int deleteByUserId(@Param("userId") UUID userId);

    @Modifying
    @Query("delete from EmailVerificationToken evt where evt.expiresAt <= :now")
    int deleteExpired(@Param("now") OffsetDateTime now);
}
