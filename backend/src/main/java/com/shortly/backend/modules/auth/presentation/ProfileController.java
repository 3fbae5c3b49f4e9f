package com.shortly.backend.modules.auth.presentation;

import java.util.Optional;

import com.shortly.backend.global.error.ProblemException;
import com.shortly.backend.global.security.AuthenticatedUser;
import com.shortly.backend.global.security.SecurityUtils;
import com.shortly.backend.global.web.FlashRedirects;
import com.shortly.backend.modules.auth.application.CredentialService;
import com.shortly.backend.modules.auth.domain.AppUser;
import com.shortly.backend.modules.auth.presentation.dto.MeResponse;
import com.shortly.backend.modules.auth.presentation.dto.UserProfileResponse;
import com.shortly.backend.modules.link.application.ShortLinkService;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ProfileController {

    private final CredentialService credentialService;
    private final ShortLinkService shortLinkService;

    public ProfileController(CredentialService credentialService, ShortLinkService shortLinkService) {
        this.credentialService = credentialService;
        this.shortLinkService = shortLinkService;
    }

    @GetMapping("/me")
    public ResponseEntity<MeResponse> me() {
        AuthenticatedUser user = SecurityUtils.currentUser()
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "UNAUTHENTICATED",
                        "Authentication required"));
        return ResponseEntity.ok(MeResponse.from(user));
    }

    @GetMapping("/profile")
    public ResponseEntity<?> profile(HttpServletRequest request) {
        Optional<AppUser> user = SecurityUtils.currentUser()
                .flatMap(current -> credentialService.findById(current.userId()));
        if (user.isEmpty()) {
            return FlashRedirects.redirect("/login");
        }
        AppUser profile = user.get();
        return ResponseEntity.ok(new UserProfileResponse(
                profile.getId(),
                profile.getName(),
                profile.getEmail(),
                profile.isEmailVerified(),
                profile.getAvatarUrl(),
                profile.getCreatedAt(),
                shortLinkService.countForOwner(profile.getId()),
                FlashRedirects.messages(request, FlashRedirects.SUCCESS)));
    }
}
