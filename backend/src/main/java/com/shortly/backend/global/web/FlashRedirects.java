package com.shortly.backend.global.web;

import java.net.URI;
import java.util.List;
import java.util.Map;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.servlet.FlashMap;
import org.springframework.web.servlet.support.RequestContextUtils;

/**
 * 302 responses for form submissions, optionally carrying a one-shot message to the next page.
 */
public final class FlashRedirects {

    public static final String ERRORS = "errors";
    public static final String SUCCESS = "success";

    private FlashRedirects() {
    }

    public static ResponseEntity<Void> redirect(String location) {
        return ResponseEntity.status(HttpStatus.FOUND).location(URI.create(location)).build();
    }

    public static ResponseEntity<Void> redirectWithError(HttpServletRequest request, HttpServletResponse response,
                                                         String location, String message) {
        return redirectWithFlash(request, response, location, ERRORS, message);
    }

    public static ResponseEntity<Void> redirectWithSuccess(HttpServletRequest request, HttpServletResponse response,
                                                           String location, String message) {
        return redirectWithFlash(request, response, location, SUCCESS, message);
    }

    /**
     * Messages flashed under {@code key} by the previous request, empty when there are none.
     */
    public static List<String> messages(HttpServletRequest request, String key) {
        Map<String, ?> input = RequestContextUtils.getInputFlashMap(request);
        if (input == null || !(input.get(key) instanceof String message)) {
            return List.of();
        }
        return List.of(message);
    }

    private static ResponseEntity<Void> redirectWithFlash(HttpServletRequest request, HttpServletResponse response,
                                                          String location, String key, String message) {
        FlashMap flashMap = RequestContextUtils.getOutputFlashMap(request);
        flashMap.put(key, message);
        RequestContextUtils.saveOutputFlashMap(location, request, response);
        return redirect(location);
    }
}
