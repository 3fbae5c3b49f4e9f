package com.shortly.backend.modules.link.presentation;

import java.net.URI;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.shortly.backend.global.error.FormValidationException;
import com.shortly.backend.global.error.ProblemException;
import com.shortly.backend.global.security.AuthenticatedUser;
import com.shortly.backend.global.security.SecurityUtils;
import com.shortly.backend.global.web.FlashRedirects;
import com.shortly.backend.modules.auth.presentation.dto.MeResponse;
import com.shortly.backend.modules.link.application.ShortLinkNotFoundException;
import com.shortly.backend.modules.link.application.ShortLinkService;
import com.shortly.backend.modules.link.presentation.dto.EditLinkPageResponse;
import com.shortly.backend.modules.link.presentation.dto.HomePageResponse;
import com.shortly.backend.modules.link.presentation.dto.ShortLinkForm;
import com.shortly.backend.modules.link.presentation.dto.ShortLinkResponse;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindingResult;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ShortLinkController {

    private final ShortLinkService shortLinkService;

    public ShortLinkController(ShortLinkService shortLinkService) {
        this.shortLinkService = shortLinkService;
    }

    @GetMapping("/")
    public ResponseEntity<HomePageResponse> home(HttpServletRequest request) {
        Optional<AuthenticatedUser> current = SecurityUtils.currentUser();
        List<ShortLinkResponse> links = current
                .map(user -> shortLinkService.listForOwner(user.userId()).stream()
                        .map(ShortLinkResponse::from)
                        .toList())
                .orElse(List.of());
        return ResponseEntity.ok(new HomePageResponse(
                current.map(MeResponse::from).orElse(null),
                links,
                FlashRedirects.messages(request, FlashRedirects.ERRORS),
                FlashRedirects.messages(request, FlashRedirects.SUCCESS)));
    }

    @PostMapping("/links")
    public ResponseEntity<Void> create(
            @Valid @ModelAttribute ShortLinkForm form,
            BindingResult bindingResult,
            HttpServletRequest request,
            HttpServletResponse response
    ) {
        Optional<AuthenticatedUser> current = SecurityUtils.currentUser();
        if (current.isEmpty()) {
            return FlashRedirects.redirect("/login");
        }
        try {
            FormValidationException.throwIfInvalid(bindingResult, ShortLinkForm.FIELD_ORDER);
            shortLinkService.create(current.get().userId(), form.url(), form.shortCode());
            return FlashRedirects.redirect("/");
        } catch (ProblemException ex) {
            return FlashRedirects.redirectWithError(request, response, "/", ex.getDetailMessage());
        }
    }

    @GetMapping("/links/{id}/edit")
    public ResponseEntity<?> editPage(@PathVariable("id") UUID linkId, HttpServletRequest request) {
        Optional<AuthenticatedUser> current = SecurityUtils.currentUser();
        if (current.isEmpty()) {
            return FlashRedirects.redirect("/login");
        }
        ShortLinkResponse link = ShortLinkResponse.from(shortLinkService.findOwned(current.get().userId(), linkId));
        return ResponseEntity.ok(new EditLinkPageResponse(
                link,
                FlashRedirects.messages(request, FlashRedirects.ERRORS)));
    }

    @PostMapping("/links/{id}")
    public ResponseEntity<Void> update(
            @PathVariable("id") UUID linkId,
            @Valid @ModelAttribute ShortLinkForm form,
            BindingResult bindingResult,
            HttpServletRequest request,
            HttpServletResponse response
    ) {
        Optional<AuthenticatedUser> current = SecurityUtils.currentUser();
        if (current.isEmpty()) {
            return FlashRedirects.redirect("/login");
        }
        String editPage = "/links/" + linkId + "/edit";
        try {
            FormValidationException.throwIfInvalid(bindingResult, ShortLinkForm.FIELD_ORDER);
            shortLinkService.update(current.get().userId(), linkId, form.url(), form.shortCode());
            return FlashRedirects.redirect("/");
        } catch (ShortLinkNotFoundException ex) {
            throw ex;
        } catch (ProblemException ex) {
            return FlashRedirects.redirectWithError(request, response, editPage, ex.getDetailMessage());
        }
    }

    @PostMapping("/links/{id}/delete")
    public ResponseEntity<Void> delete(@PathVariable("id") UUID linkId) {
        Optional<AuthenticatedUser> current = SecurityUtils.currentUser();
        if (current.isEmpty()) {
            return FlashRedirects.redirect("/login");
        }
        shortLinkService.delete(current.get().userId(), linkId);
        return FlashRedirects.redirect("/");
    }

    @GetMapping("/{shortCode:[A-Za-z0-9_-]{3,16}}")
    public ResponseEntity<Void> follow(@PathVariable("shortCode") String shortCode) {
        String url = shortLinkService.resolve(shortCode);
        return ResponseEntity.status(HttpStatus.FOUND).location(URI.create(url)).build();
    }
}
