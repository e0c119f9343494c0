package io.github.casevault.api;

import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Cookie;
import jakarta.ws.rs.core.HttpHeaders;
import java.util.Map;

/**
 * Extracts the opaque session credential from a request. A bearer token wins over the session
 * cookie when both are sent.
 */
public final class Credentials {

    public static final String SESSION_COOKIE = "session";

    private static final String BEARER_PREFIX = "Bearer ";

    private Credentials() {}

    public static String fromHeaders(HttpHeaders headers) {
        if (headers == null) {
            return null;
        }
        return extract(headers.getHeaderString(HttpHeaders.AUTHORIZATION), headers.getCookies());
    }

    public static String fromRequest(ContainerRequestContext requestContext) {
        return extract(
                requestContext.getHeaderString(HttpHeaders.AUTHORIZATION),
                requestContext.getCookies());
    }

    static String extract(String authorization, Map<String, Cookie> cookies) {
        if (authorization != null
                && authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            String token = authorization.substring(BEARER_PREFIX.length()).trim();
            if (!token.isEmpty()) {
                return token;
            }
        }
        Cookie cookie = cookies == null ? null : cookies.get(SESSION_COOKIE);
        if (cookie != null && cookie.getValue() != null && !cookie.getValue().isBlank()) {
            return cookie.getValue().trim();
        }
        return null;
    }
}
