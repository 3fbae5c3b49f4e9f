package com.shortly.backend.modules.link.application;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.List;
import java.util.UUID;

import com.shortly.backend.modules.auth.domain.AppUser;
import com.shortly.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.shortly.backend.modules.link.domain.ShortLink;
import com.shortly.backend.modules.link.infrastructure.persistence.ShortLinkRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
public class ShortLinkService {

    private static final Logger log = LoggerFactory.getLogger(ShortLinkService.class);

    private static final int GENERATED_CODE_BYTES = 4;

    private final ShortLinkRepository shortLinkRepository;
    private final AppUserRepository appUserRepository;
    private final SecureRandom secureRandom = new SecureRandom();

    public ShortLinkService(ShortLinkRepository shortLinkRepository, AppUserRepository appUserRepository) {
        this.shortLinkRepository = shortLinkRepository;
        this.appUserRepository = appUserRepository;
    }

    @Transactional(readOnly = true)
    public List<ShortLink> listForOwner(UUID ownerId) {
        return shortLinkRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId);
    }

    @Transactional(readOnly = true)
    public long countForOwner(UUID ownerId) {
        return shortLinkRepository.countByOwnerId(ownerId);
    }

    /**
     * Stores a link under the requested code, or a random 8-hex-digit code when none is given.
     */
    @Transactional
    public ShortLink create(UUID ownerId, String url, String requestedCode) {
        String shortCode = StringUtils.hasText(requestedCode) ? requestedCode.trim() : generateCode();
        if (shortLinkRepository.existsByShortCode(shortCode)) {
            throw new ShortLinkExistsException();
        }
        AppUser owner = appUserRepository.getReferenceById(ownerId);
        ShortLink link;
        try {
            link = shortLinkRepository.saveAndFlush(new ShortLink(owner, shortCode, url.trim()));
        } catch (DataIntegrityViolationException ex) {
            throw new ShortLinkExistsException();
        }
        log.info("Short link created | userId={} shortCode={}", ownerId, shortCode);
        return link;
    }

    /**
     * Links of other users are reported as missing.
     */
    @Transactional(readOnly = true)
    public ShortLink findOwned(UUID ownerId, UUID linkId) {
        return shortLinkRepository.findByIdAndOwnerId(linkId, ownerId)
                .orElseThrow(ShortLinkNotFoundException::new);
    }

    /**
     * Points an owned link at a new URL and optionally a new code. A blank code keeps the current one.
     */
    @Transactional
    public ShortLink update(UUID ownerId, UUID linkId, String url, String requestedCode) {
        ShortLink link = findOwned(ownerId, linkId);
        String shortCode = StringUtils.hasText(requestedCode) ? requestedCode.trim() : link.getShortCode();
        if (!shortCode.equals(link.getShortCode()) && shortLinkRepository.existsByShortCode(shortCode)) {
            throw new ShortLinkExistsException();
        }
        link.retarget(shortCode, url.trim());
        try {
            shortLinkRepository.saveAndFlush(link);
        } catch (DataIntegrityViolationException ex) {
            throw new ShortLinkExistsException();
        }
        log.info("Short link updated | userId={} linkId={} shortCode={}", ownerId, linkId, shortCode);
        return link;
    }

    @Transactional
    public void delete(UUID ownerId, UUID linkId) {
        if (shortLinkRepository.deleteOwned(linkId, ownerId) == 0) {
            throw new ShortLinkNotFoundException();
        }
        log.info("Short link deleted | userId={} linkId={}", ownerId, linkId);
    }

    @Transactional(readOnly = true)
    public String resolve(String shortCode) {
        return shortLinkRepository.findByShortCode(shortCode)
                .map(ShortLink::getUrl)
                .orElseThrow(ShortLinkNotFoundException::new);
    }

    private String generateCode() {
        byte[] bytes = new byte[GENERATED_CODE_BYTES];
        secureRandom.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
