package com.agile.Buro.util;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.web.util.WebUtils;

import java.time.Duration;

/**
 * The refresh token travels only as the HttpOnly cookie {@value #COOKIE_NAME},
 * scoped to the auth endpoints.
 */
public class CookieUtil {

    public static final String COOKIE_NAME = "rt";
    private static final String COOKIE_PATH = "/api/auth";

    private final long refreshMs;
    private final boolean secure;
    private final String sameSite;

    public CookieUtil(long refreshMs, boolean secure, String sameSite) {
        this.refreshMs = refreshMs;
        this.secure = secure;
        this.sameSite = sameSite;
    }

    public String getRtCookie(HttpServletRequest req) {
        Cookie ck = WebUtils.getCookie(req, COOKIE_NAME);
        if (ck == null || ck.getValue() == null) return null;
        String v = ck.getValue().trim();
        return v.isEmpty() ? null : v;
    }

    public void setRtCookie(HttpServletResponse res, String refreshToken) {
        res.addHeader(HttpHeaders.SET_COOKIE, build(refreshToken, Duration.ofMillis(refreshMs)).toString());
    }

    public void clearRtCookie(HttpServletResponse res) {
        res.addHeader(HttpHeaders.SET_COOKIE, build("", Duration.ZERO).toString());
    }

    private ResponseCookie build(String value, Duration maxAge) {
        return ResponseCookie.from(COOKIE_NAME, value)
                .httpOnly(true)
                .secure(secure)
                .path(COOKIE_PATH)
                .maxAge(maxAge)
                .sameSite(sameSite)
                .build();
    }
}
