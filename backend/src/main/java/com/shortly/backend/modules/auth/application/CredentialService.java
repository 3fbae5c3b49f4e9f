package com.shortly.backend.modules.auth.application;

import java.util.Optional;
import java.util.UUID;

import com.shortly.backend.modules.auth.domain.AppUser;
import com.shortly.backend.modules.auth.infrastructure.persistence.AppUserRepository;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * User rows and password checks. E-mail uniqueness is enforced by the database constraint;
 * a losing concurrent insert surfaces as {@link DuplicateEmailException}.
 */
@Service
public class CredentialService {

    private final AppUserRepository appUserRepository;
    private final PasswordEncoder passwordEncoder;

    public CredentialService(AppUserRepository appUserRepository, PasswordEncoder passwordEncoder) {
        this.appUserRepository = appUserRepository;
        this.passwordEncoder = passwordEncoder;
    }

    @Transactional(readOnly = true)
    public Optional<AppUser> findByEmail(String email) {
        return appUserRepository.findByEmail(email);
    }

    @Transactional(readOnly = true)
    public Optional<AppUser> findById(UUID userId) {
        return appUserRepository.findById(userId);
    }

    @Transactional
    public AppUser create(NewUser newUser) {
        AppUser user = new AppUser();
        user.setName(newUser.name());
        user.setEmail(newUser.email());
        user.setPasswordHash(passwordEncoder.encode(newUser.rawPassword()));
        return insert(user);
    }

    /**
     * Creates an account vouched for by an identity provider: no password, e-mail already verified.
     */
    @Transactional
    public AppUser createExternal(String name, String email, String avatarUrl, boolean emailVerified) {
        AppUser user = new AppUser();
        user.setName(name);
        user.setEmail(email);
        user.setAvatarUrl(avatarUrl);
        if (emailVerified) {
            user.markEmailVerified();
        }
        return insert(user);
    }

    public boolean passwordMatches(AppUser user, String rawPassword) {
        if (!user.hasPassword() || rawPassword == null) {
            return false;
        }
        return passwordEncoder.matches(rawPassword, user.getPasswordHash());
    }

    private AppUser insert(AppUser user) {
        try {
            return appUserRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            throw new DuplicateEmailException(user.getEmail(), ex);
        }
    }
}
