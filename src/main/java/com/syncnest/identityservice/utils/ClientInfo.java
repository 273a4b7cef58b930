package com.syncnest.identityservice.utils;

import jakarta.servlet.http.HttpServletRequest;

import java.util.Locale;

/**
 * Request-derived client details used for rate-limit keys and refresh-token device labels.
 * Proxy headers are resolved by the container ({@code server.forward-headers-strategy}),
 * so {@link HttpServletRequest#getRemoteAddr()} already reflects the real client.
 */
public final class ClientInfo {

    private ClientInfo() {}

    public static String clientIp(HttpServletRequest request) {
        String ip = request.getRemoteAddr();
        return (ip == null || ip.isBlank()) ? "unknown" : ip;
    }

    /** Explicit device id if given, otherwise a coarse label from the User-Agent. */
    public static String deviceLabel(HttpServletRequest request, String explicitDeviceId) {
        if (explicitDeviceId != null && !explicitDeviceId.isBlank()) {
            return explicitDeviceId.trim();
        }
        String userAgent = request.getHeader("User-Agent");
        if (userAgent == null) {
            return "unknown";
        }
        String ua = userAgent.toLowerCase(Locale.ROOT);
        if (ua.contains("mobile")) {
            return "mobile";
        } else if (ua.contains("windows") || ua.contains("macintosh") || ua.contains("linux")) {
            return "desktop";
        }
        return "unknown";
    }
}
