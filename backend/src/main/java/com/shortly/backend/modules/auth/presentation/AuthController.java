package com.shortly.backend.modules.auth.presentation;

import com.shortly.backend.global.error.FormValidationException;
import com.shortly.backend.global.error.ProblemException;
import com.shortly.backend.global.security.AuthCookieWriter;
import com.shortly.backend.global.security.SecurityUtils;
import com.shortly.backend.global.web.FlashRedirects;
import com.shortly.backend.modules.auth.application.AuthService;
import com.shortly.backend.modules.auth.application.IssuedLogin;
import com.shortly.backend.modules.auth.application.SessionMetadata;
import com.shortly.backend.modules.auth.presentation.dto.AuthPageResponse;
import com.shortly.backend.modules.auth.presentation.dto.LoginForm;
import com.shortly.backend.modules.auth.presentation.dto.RegisterForm;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindingResult;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuthController {

    static final String REGISTERED_MESSAGE =
            "Verification link sent to your email. Please check your inbox for the 8-digit code.";

    private final AuthService authService;
    private final AuthCookieWriter cookieWriter;

    public AuthController(AuthService authService, AuthCookieWriter cookieWriter) {
        this.authService = authService;
        this.cookieWriter = cookieWriter;
    }

    @GetMapping("/register")
    public ResponseEntity<?> registerPage(HttpServletRequest request) {
        if (SecurityUtils.currentUser().isPresent()) {
            return FlashRedirects.redirect("/");
        }
        return ResponseEntity.ok(page("register", request));
    }

    @PostMapping("/register")
    public ResponseEntity<Void> register(
            @Valid @ModelAttribute RegisterForm form,
            BindingResult bindingResult,
            HttpServletRequest request,
            HttpServletResponse response
    ) {
        if (SecurityUtils.currentUser().isPresent()) {
            return FlashRedirects.redirect("/");
        }
        try {
            FormValidationException.throwIfInvalid(bindingResult, RegisterForm.FIELD_ORDER);
            IssuedLogin login = authService.register(form, SessionMetadata.from(request));
            cookieWriter.writeTokens(response, login.tokens());
            return FlashRedirects.redirectWithSuccess(request, response, "/", REGISTERED_MESSAGE);
        } catch (ProblemException ex) {
            return FlashRedirects.redirectWithError(request, response, "/register", ex.getDetailMessage());
        }
    }

    @GetMapping("/login")
    public ResponseEntity<?> loginPage(HttpServletRequest request) {
        if (SecurityUtils.currentUser().isPresent()) {
            return FlashRedirects.redirect("/");
        }
        return ResponseEntity.ok(page("login", request));
    }

    @PostMapping("/login")
    public ResponseEntity<Void> login(
            @Valid @ModelAttribute LoginForm form,
            BindingResult bindingResult,
            HttpServletRequest request,
            HttpServletResponse response
    ) {
        if (SecurityUtils.currentUser().isPresent()) {
            return FlashRedirects.redirect("/");
        }
        try {
            FormValidationException.throwIfInvalid(bindingResult, LoginForm.FIELD_ORDER);
            IssuedLogin login = authService.login(form, SessionMetadata.from(request));
            cookieWriter.writeTokens(response, login.tokens());
            return FlashRedirects.redirect("/");
        } catch (ProblemException ex) {
            return FlashRedirects.redirectWithError(request, response, "/login", ex.getDetailMessage());
        }
    }

    @RequestMapping(value = "/logout", method = {RequestMethod.GET, RequestMethod.POST})
    public ResponseEntity<Void> logout(HttpServletResponse response) {
        return SecurityUtils.currentUser()
                .map(user -> {
                    authService.logout(user);
                    cookieWriter.clearTokens(response);
                    return FlashRedirects.redirect("/login");
                })
                .orElseGet(() -> FlashRedirects.redirect("/login"));
    }

    @PostMapping("/logout/all")
    public ResponseEntity<Void> logoutEverywhere(HttpServletResponse response) {
        return SecurityUtils.currentUser()
                .map(user -> {
                    authService.logoutEverywhere(user);
                    cookieWriter.clearTokens(response);
                    return FlashRedirects.redirect("/login");
                })
                .orElseGet(() -> FlashRedirects.redirect("/login"));
    }

    private AuthPageResponse page(String name, HttpServletRequest request) {
        return new AuthPageResponse(
                name,
                FlashRedirects.messages(request, FlashRedirects.ERRORS),
                FlashRedirects.messages(request, FlashRedirects.SUCCESS));
    }
}
