package com.syncnest.identityservice.utils;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.util.StringUtils;

/**
 * Request-id lookup shared by the success envelope and the problem writer.
 * Order: response header, request header, then the attribute set by {@link RequestIdFilter}.
 */
public final class RequestIds {

    public static final String HEADER = "X-Request-Id";
    public static final String ATTRIBUTE = "SYNCNEST_REQUEST_ID";

    private RequestIds() {}

    public static String resolve(HttpServletRequest req, HttpServletResponse resp) {
        String id = resp != null ? resp.getHeader(HEADER) : null;
        if (!StringUtils.hasText(id)) {
            id = req.getHeader(HEADER);
        }
        if (!StringUtils.hasText(id)) {
            Object attr = req.getAttribute(ATTRIBUTE);
            if (attr instanceof String s && StringUtils.hasText(s)) {
                id = s;
            }
        }
        return id;
    }
}
