package com.investorportal.backend.global.web;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;

/**
 * User agent and client address of the calling device, recorded on sessions and audit entries.
 *
 * <p>The address is the servlet remote address. Proxy headers are applied by the container only
 * when {@code server.forward-headers-strategy} is enabled, and then only for trusted proxies.</p>
 */
public record ClientMetadata(String userAgent, String ipAddress) {

    private static final int USER_AGENT_MAX_LENGTH = 512;

    public static final ClientMetadata NONE = new ClientMetadata(null, null);

    public static ClientMetadata from(HttpServletRequest request) {
        return new ClientMetadata(
                truncate(request.getHeader(HttpHeaders.USER_AGENT)),
                request.getRemoteAddr()
        );
    }

    private static String truncate(String userAgent) {
        if (!StringUtils.hasText(userAgent)) {
            return null;
        }
        String trimmed = userAgent.trim();
        return trimmed.length() > USER_AGENT_MAX_LENGTH ? trimmed.substring(0, USER_AGENT_MAX_LENGTH) : trimmed;
    }
}
