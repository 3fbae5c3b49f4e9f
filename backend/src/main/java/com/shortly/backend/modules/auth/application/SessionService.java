package com.shortly.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.shortly.backend.modules.auth.domain.AppUser;
import com.shortly.backend.modules.auth.domain.UserSession;
import com.shortly.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.shortly.backend.modules.auth.infrastructure.persistence.UserSessionRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Server-side session rows. {@link #findValidById(UUID)} is the accessor for anything that
 * authorizes a request; {@link #findAnyById(UUID)} also returns revoked rows and exists for
 * administrative reads only.
 */
@Service
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private final UserSessionRepository userSessionRepository;
    private final AppUserRepository appUserRepository;
    private final Clock clock;

    public SessionService(UserSessionRepository userSessionRepository, AppUserRepository appUserRepository,
                          Clock clock) {
        this.userSessionRepository = userSessionRepository;
        this.appUserRepository = appUserRepository;
        this.clock = clock;
    }

    @Transactional
    public UUID create(UUID userId, SessionMetadata metadata) {
        AppUser user = appUserRepository.getReferenceById(userId);
        UserSession session = userSessionRepository.save(
                new UserSession(user, metadata.ipAddress(), metadata.userAgent()));
        log.info("Session created | sessionId={} userId={} ip={}", session.getId(), userId, metadata.ipAddress());
        return session.getId();
    }

    @Transactional(readOnly = true)
    public Optional<UserSession> findValidById(UUID sessionId) {
        return userSessionRepository.findByIdAndValidTrue(sessionId);
    }

    @Transactional(readOnly = true)
    public Optional<UserSession> findAnyById(UUID sessionId) {
        return userSessionRepository.findById(sessionId);
    }

    /**
     * Marks the session invalid. Revoking an unknown or already revoked session is a no-op.
     */
    @Transactional
    public void revoke(UUID sessionId) {
        int updated = userSessionRepository.revoke(sessionId, OffsetDateTime.now(clock));
        if (updated > 0) {
            log.info("Session revoked | sessionId={}", sessionId);
        }
    }

    @Transactional
    public int revokeAllForUser(UUID userId) {
        int updated = userSessionRepository.revokeAllForUser(userId, OffsetDateTime.now(clock));
        log.info("Revoked {} sessions | userId={}", updated, userId);
        return updated;
    }
}
