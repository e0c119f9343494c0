package io.github.casevault.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import jakarta.ws.rs.core.Cookie;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CredentialsTest {

    private static Map<String, Cookie> sessionCookie(String value) {
        return Map.of(
                Credentials.SESSION_COOKIE,
                new Cookie.Builder(Credentials.SESSION_COOKIE).value(value).build());
    }

    @Test
    void bearer_token_is_extracted() {
        assertEquals("abc", Credentials.extract("Bearer abc", Map.of()));
        assertEquals("abc", Credentials.extract("bearer  abc ", null));
    }

    @Test
    void bearer_token_wins_over_cookie() {
        assertEquals("header", Credentials.extract("Bearer header", sessionCookie("cookie")));
    }

    @Test
    void session_cookie_is_used_without_header() {
        assertEquals("cookie", Credentials.extract(null, sessionCookie("cookie")));
        assertEquals("cookie", Credentials.extract("Basic dXNlcjpwdw==", sessionCookie("cookie")));
    }

    @Test
    void missing_or_blank_credentials_are_null() {
        assertNull(Credentials.extract(null, Map.of()));
        assertNull(Credentials.extract("Bearer   ", null));
        assertNull(Credentials.extract(null, sessionCookie(" ")));
    }
}
