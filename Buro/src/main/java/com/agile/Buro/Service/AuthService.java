package com.agile.Buro.Service;

import com.agile.Buro.Models.UserModel;
import com.agile.Buro.dto.request.LoginRequest;
import com.agile.Buro.dto.request.RegisterRequest;
import com.agile.Buro.entity.UserRole;
import com.agile.Buro.entity.UsersEntity;
import com.agile.Buro.exception.DuplicateFieldsException;
import com.agile.Buro.exception.ForbiddenOperationException;
import com.agile.Buro.exception.InvalidInputException;
import com.agile.Buro.exception.UnauthenticatedException;
import com.agile.Buro.repository.UsersRepository;
import com.agile.Buro.util.Mappers;
import io.jsonwebtoken.JwtException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

@Slf4j
@Service
public class AuthService {

    private final PasswordEncoder encoder;
    private final UsersRepository usersRepository;
    private final JwtService jwtService;
    private final RefreshTokenService refreshTokenService;
    private final NotificationDispatcher notifications;
    private final Clock clock;

    static final Pattern EMAIL_PATTERN = Pattern.compile(
            "^[a-zA-Z0-9_+&*-]+(?:\\.[a-zA-Z0-9_+&*-]+)*@(?:[a-zA-Z0-9-]+\\.)+[a-zA-Z]{2,7}$"
    );
    static final int MIN_PASSWORD_LENGTH = 6;
    static final int MAX_LOGIN_ATTEMPTS = 5;
    static final int LOCKOUT_DURATION_MINUTES = 30;

    private final Map<String, Integer> loginAttempts = new ConcurrentHashMap<>();
    private final Map<String, LocalDateTime> lockoutTime = new ConcurrentHashMap<>();

    public AuthService(
            PasswordEncoder encoder,
            UsersRepository usersRepository,
            JwtService jwtService,
            RefreshTokenService refreshTokenService,
            NotificationDispatcher notifications,
            Clock clock
    ) {
        this.encoder = encoder;
        this.usersRepository = usersRepository;
        this.jwtService = jwtService;
        this.refreshTokenService = refreshTokenService;
        this.notifications = notifications;
        this.clock = clock;
    }

    // ========== VALIDATION METHODS ==========

    static String normalizeEmail(String email) {
        if (email == null || email.trim().isEmpty()) {
            throw new InvalidInputException("Email is required");
        }
        String e = email.trim().toLowerCase(Locale.ROOT);
        if (!EMAIL_PATTERN.matcher(e).matches()) {
            throw new InvalidInputException("Invalid email format");
        }
        return e;
    }

    static void validatePassword(String password) {
        if (password == null || password.isEmpty()) {
            throw new InvalidInputException("Password is required");
        }
        if (password.length() < MIN_PASSWORD_LENGTH) {
            throw new InvalidInputException("Password must be at least " + MIN_PASSWORD_LENGTH + " characters");
        }
    }

    // ========== REGISTRATION ==========

    public record TokensResult(String accessToken, String refreshToken, UserModel user) {}

    @Transactional
    public TokensResult register(RegisterRequest req) {
        String email = normalizeEmail(req.email());
        validatePassword(req.password());
        if (req.fullName() == null || req.fullName().trim().isEmpty()) {
            throw new InvalidInputException("Full name is required");
        }
        if (usersRepository.existsByEmail(email)) {
            throw new DuplicateFieldsException(List.of("email"));
        }

        UsersEntity user = new UsersEntity();
        user.setEmail(email);
        user.setFullName(req.fullName().trim());
        user.setPassword(encoder.encode(req.password()));
        user.setRole(UserRole.DEVELOPER);
        user.setActive(true);

        UsersEntity saved = usersRepository.saveAndFlush(user);
        log.info("User registered: {}", saved.getEmail());

        notifications.dispatch(NotificationMessages.welcome(saved));
        return issueTokens(saved);
    }

    // ========== AUTHENTICATION ==========

    private boolean isAccountLocked(String email) {
        LocalDateTime lockTime = lockoutTime.get(email);
        if (lockTime == null) return false;

        if (LocalDateTime.now(clock).isAfter(lockTime.plusMinutes(LOCKOUT_DURATION_MINUTES))) {
            lockoutTime.remove(email);
            loginAttempts.remove(email);
            return false;
        }
        return true;
    }

    private void recordFailedLogin(String email) {
        int attempts = loginAttempts.merge(email, 1, Integer::sum);
        if (attempts >= MAX_LOGIN_ATTEMPTS) {
            lockoutTime.put(email, LocalDateTime.now(clock));
            log.warn("Account locked due to too many failed attempts: {}", email);
        } else {
            log.warn("Failed login attempt {} for {}", attempts, email);
        }
    }

    private void resetLoginAttempts(String email) {
        loginAttempts.remove(email);
        lockoutTime.remove(email);
    }

    @Transactional
    public TokensResult login(LoginRequest req) {
        String email = normalizeEmail(req.email());

        if (isAccountLocked(email)) {
            throw new ResponseStatusException(HttpStatus.TOO_MANY_REQUESTS,
                    "Account temporarily locked due to too many failed login attempts. Try again in " +
                            LOCKOUT_DURATION_MINUTES + " minutes.");
        }

        UsersEntity user = usersRepository.findByEmail(email).orElse(null);
        if (user == null || user.getPassword() == null || req.password() == null
                || !encoder.matches(req.password(), user.getPassword())) {
            recordFailedLogin(email);
            throw new UnauthenticatedException("Invalid email or password");
        }
        if (!user.isActive()) {
            throw new ForbiddenOperationException("Account is deactivated");
        }

        resetLoginAttempts(email);
        log.info("User logged in: {}", user.getEmail());
        return issueTokens(user);
    }

    @Transactional
    public TokensResult refresh(String refreshToken) {
        if (refreshToken == null || refreshToken.isBlank()) {
            throw new UnauthenticatedException("No refresh token provided");
        }
        if (!jwtService.isRefreshToken(refreshToken)) {
            throw new UnauthenticatedException("Invalid token type");
        }
        if (!refreshTokenService.existsValid(refreshToken)) {
            throw new UnauthenticatedException("Refresh token expired or revoked");
        }

        UUID userId = UUID.fromString(jwtService.parseAllClaims(refreshToken).getSubject());
        UsersEntity user = usersRepository.findById(userId)
                .filter(UsersEntity::isActive)
                .orElseThrow(() -> new UnauthenticatedException("User not found or inactive"));

        String newRefresh = jwtService.generateRefreshToken(user.getUserId(), UUID.randomUUID());
        refreshTokenService.rotate(user, refreshToken, newRefresh);

        log.debug("Tokens refreshed for user: {}", user.getEmail());
        return new TokensResult(accessTokenFor(user), newRefresh, Mappers.toUserModel(user));
    }

    @Transactional
    public void logoutCurrent(String refreshToken) {
        if (refreshToken == null || refreshToken.isBlank()) {
            return;
        }
        refreshTokenService.revoke(refreshToken);
        log.info("Refresh token revoked (current device)");
    }

    @Transactional
    public void logoutAllDevices(String refreshToken) {
        if (refreshToken == null || refreshToken.isBlank()) {
            return;
        }
        UUID userId;
        try {
            userId = UUID.fromString(jwtService.getSubjectEvenIfExpired(refreshToken));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Ignoring unreadable refresh token on logout-all: {}", e.getMessage());
            return;
        }
        usersRepository.findById(userId).ifPresent(user -> {
            long revoked = refreshTokenService.revokeAll(user);
            log.info("User logged out (all devices): {} ({} tokens)", user.getEmail(), revoked);
        });
    }

    // ========== HELPER METHODS ==========

    private TokensResult issueTokens(UsersEntity user) {
        String refresh = jwtService.generateRefreshToken(user.getUserId(), UUID.randomUUID());
        refreshTokenService.create(user, refresh);
        return new TokensResult(accessTokenFor(user), refresh, Mappers.toUserModel(user));
    }

    private String accessTokenFor(UsersEntity user) {
        return jwtService.generateAccessToken(user.getUserId(), user.getEmail(), user.getFullName(), user.getRole());
    }
}
