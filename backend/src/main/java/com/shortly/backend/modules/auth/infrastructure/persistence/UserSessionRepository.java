package com.shortly.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.shortly.backend.modules.auth.domain.UserSession;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserSessionRepository extends JpaRepository<UserSession, UUID> {

    Optional<UserSession> findByIdAndValidTrue(UUID id);

    @Modifying
    @Query("""
            update UserSession us
               set us.valid = false,
                   us.updatedAt = :revokedAt
             where us.id = :sessionId
               and us.valid = true
            """)
    int revoke(@Param("sessionId") UUID sessionId, @Param("revokedAt") OffsetDateTime revokedAt);

    @Modifying
    @Query("""
            update UserSession us
               set us.valid = false,
                   us.updatedAt = :revokedAt
             where us.userId = :userId
               and us.valid = true
            """)
    int revokeAllForUser(@Param("userId") UUID userId, @Param("revokedAt") OffsetDateTime revokedAt);
}
