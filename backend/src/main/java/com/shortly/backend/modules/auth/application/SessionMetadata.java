package com.shortly.backend.modules.auth.application;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;

/**
 * Device information recorded on a session row. Both values are optional and opaque.
 */
public record SessionMetadata(String ipAddress, String userAgent) {

    private static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";
    private static final int IP_MAX_LENGTH = 255;

    public static SessionMetadata from(HttpServletRequest request) {
        return new SessionMetadata(resolveClientIp(request), request.getHeader(HttpHeaders.USER_AGENT));
    }

    private static String resolveClientIp(HttpServletRequest request) {
        String ip = firstForwardedHop(request.getHeader(FORWARDED_FOR_HEADER));
        if (ip == null) {
            ip = request.getRemoteAddr();
        }
        if (ip != null && ip.length() > IP_MAX_LENGTH) {
            return ip.substring(0, IP_MAX_LENGTH);
        }
        return ip;
    }

    private static String firstForwardedHop(String forwarded) {
        if (!StringUtils.hasText(forwarded)) {
            return null;
        }
        for (String hop : forwarded.split(",")) {
            if (StringUtils.hasText(hop)) {
                return hop.trim();
            }
        }
        return null;
    }
}
