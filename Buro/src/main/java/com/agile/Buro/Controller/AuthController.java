package com.agile.Buro.Controller;

import com.agile.Buro.Config.BuroProperties;
import com.agile.Buro.Models.UserModel;
import com.agile.Buro.Response.LoginResponse;
import com.agile.Buro.Service.AuthService;
import com.agile.Buro.Service.CurrentUserService;
import com.agile.Buro.Service.JwtService;
import com.agile.Buro.dto.request.LoginRequest;
import com.agile.Buro.dto.request.RegisterRequest;
import com.agile.Buro.exception.UnauthenticatedException;
import com.agile.Buro.util.CookieUtil;
import com.agile.Buro.util.Mappers;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/auth")
public class AuthController {

    private final AuthService authService;
    private final CurrentUserService currentUser;
    private final CookieUtil cookieUtil;

    public AuthController(AuthService authService,
                          CurrentUserService currentUser,
                          JwtService jwtService,
                          BuroProperties properties) {
        this.authService = authService;
        this.currentUser = currentUser;
        this.cookieUtil = new CookieUtil(jwtService.getRefreshMs(),
                properties.getCookie().isSecure(),
                properties.getCookie().getSameSite());
    }

    /* ===================== LOGIN ===================== */
    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@RequestBody @Valid LoginRequest req,
                                               HttpServletResponse res) {
        var r = authService.login(req);
        cookieUtil.setRtCookie(res, r.refreshToken());
        return ResponseEntity.ok(new LoginResponse(r.accessToken(), r.user()));
    }

    /* ===================== REGISTER ===================== */
    @PostMapping("/register")
    public ResponseEntity<LoginResponse> register(@RequestBody @Valid RegisterRequest req,
                                                  HttpServletResponse res) {
        var r = authService.register(req);
        cookieUtil.setRtCookie(res, r.refreshToken());
        return ResponseEntity.status(HttpStatus.CREATED).body(new LoginResponse(r.accessToken(), r.user()));
    }

    /* ===================== REFRESH ===================== */
    @PostMapping("/refresh")
    public ResponseEntity<LoginResponse> refresh(HttpServletRequest req, HttpServletResponse res) {
        String rt = cookieUtil.getRtCookie(req);
        if (rt == null) throw new UnauthenticatedException("Missing refresh token");

        var r = authService.refresh(rt);
        cookieUtil.setRtCookie(res, r.refreshToken());
        return ResponseEntity.ok(new LoginResponse(r.accessToken(), r.user()));
    }

    /* ===================== LOGOUT ===================== */
    @PostMapping("/logout")
    public ResponseEntity<Map<String, String>> logout(HttpServletRequest req, HttpServletResponse res) {
        authService.logoutCurrent(cookieUtil.getRtCookie(req));
        cookieUtil.clearRtCookie(res);
        return ResponseEntity.ok(Map.of("message", "Logged out"));
    }

    @PostMapping("/logout-all")
    public ResponseEntity<Map<String, String>> logoutAll(HttpServletRequest req, HttpServletResponse res) {
        authService.logoutAllDevices(cookieUtil.getRtCookie(req));
        cookieUtil.clearRtCookie(res);
        return ResponseEntity.ok(Map.of("message", "Logged out from all devices"));
    }

    @GetMapping("/me")
    public ResponseEntity<UserModel> me(Authentication authentication) {
        return ResponseEntity.ok(Mappers.toUserModel(currentUser.require(authentication)));
    }
}
