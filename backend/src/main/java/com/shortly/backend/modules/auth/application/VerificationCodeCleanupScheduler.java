package com.shortly.backend.modules.auth.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class VerificationCodeCleanupScheduler {

    private static final Logger log = LoggerFactory.getLogger(VerificationCodeCleanupScheduler.class);

    private final EmailVerificationService emailVerificationService;

    public VerificationCodeCleanupScheduler(EmailVerificationService emailVerificationService) {
        this.emailVerificationService = emailVerificationService;
    }

    @Scheduled(fixedDelayString = "${app.verification.cleanup-interval:PT1H}")
    public void purgeExpiredCodes() {
        int purged = emailVerificationService.purgeExpiredCodes();
        if (purged > 0) {
            log.info("Purged {} expired verification codes", purged);
        }
    }
}
