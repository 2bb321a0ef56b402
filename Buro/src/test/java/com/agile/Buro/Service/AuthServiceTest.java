package com.agile.Buro.Service;

import com.agile.Buro.TestFixtures;
import com.agile.Buro.dto.NotificationRequest;
import com.agile.Buro.dto.request.LoginRequest;
import com.agile.Buro.dto.request.RegisterRequest;
import com.agile.Buro.entity.NotiType;
import com.agile.Buro.entity.UserRole;
import com.agile.Buro.entity.UsersEntity;
import com.agile.Buro.exception.DuplicateFieldsException;
import com.agile.Buro.exception.ForbiddenOperationException;
import com.agile.Buro.exception.InvalidInputException;
import com.agile.Buro.exception.UnauthenticatedException;
import com.agile.Buro.repository.UsersRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

    @Mock private PasswordEncoder encoder;
    @Mock private UsersRepository usersRepository;
    @Mock private JwtService jwtService;
    @Mock private RefreshTokenService refreshTokenService;
    @Mock private NotificationDispatcher notifications;

    private AuthService authService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-10T12:00:00Z"), ZoneOffset.UTC);
        authService = new AuthService(encoder, usersRepository, jwtService, refreshTokenService, notifications, clock);
    }

    // ========== REGISTER ==========

    @Test
    void register_createsDeveloperWithLowercasedEmail() {
        when(usersRepository.existsByEmail("dev@buro.test")).thenReturn(false);
        when(encoder.encode("secret1")).thenReturn("hash");
        when(usersRepository.saveAndFlush(any(UsersEntity.class))).thenAnswer(inv -> {
            UsersEntity u = inv.getArgument(0);
            u.setUserId(UUID.randomUUID());
            return u;
        });
        when(jwtService.generateRefreshToken(any(), any())).thenReturn("refresh");
        when(jwtService.generateAccessToken(any(), anyString(), anyString(), any())).thenReturn("access");

        AuthService.TokensResult result = authService.register(new RegisterRequest("  Dev@Buro.TEST ", " Dev One ", "secret1"));

        assertThat(result.accessToken()).isEqualTo("access");
        assertThat(result.user().getEmail()).isEqualTo("dev@buro.test");
        assertThat(result.user().getRole()).isEqualTo(UserRole.DEVELOPER);
        verify(refreshTokenService).create(any(UsersEntity.class), eq("refresh"));

        ArgumentCaptor<NotificationRequest> sent = ArgumentCaptor.forClass(NotificationRequest.class);
        verify(notifications).dispatch(sent.capture());
        assertThat(sent.getValue().type()).isEqualTo(NotiType.WELCOME);
    }

    @Test
    void register_duplicateEmail_isConflict() {
        when(usersRepository.existsByEmail("dev@buro.test")).thenReturn(true);

        assertThatThrownBy(() -> authService.register(new RegisterRequest("dev@buro.test", "Dev", "secret1")))
                .isInstanceOf(DuplicateFieldsException.class);
        verify(usersRepository, never()).saveAndFlush(any());
    }

    @Test
    void register_shortPassword_isInvalid() {
        assertThatThrownBy(() -> authService.register(new RegisterRequest("dev@buro.test", "Dev", "12345")))
                .isInstanceOf(InvalidInputException.class);
    }

    // ========== LOGIN ==========

    @Test
    void login_wrongPassword_isUnauthenticated() {
        UsersEntity user = withPassword(TestFixtures.user(UserRole.DEVELOPER));
        when(usersRepository.findByEmail(user.getEmail())).thenReturn(Optional.of(user));
        when(encoder.matches("wrong", "hash")).thenReturn(false);

        assertThatThrownBy(() -> authService.login(new LoginRequest(user.getEmail(), "wrong")))
                .isInstanceOf(UnauthenticatedException.class);
    }

    @Test
    void login_locksAfterFiveFailures() {
        UsersEntity user = withPassword(TestFixtures.user(UserRole.DEVELOPER));
        when(usersRepository.findByEmail(user.getEmail())).thenReturn(Optional.of(user));
        when(encoder.matches("wrong", "hash")).thenReturn(false);

        for (int i = 0; i < AuthService.MAX_LOGIN_ATTEMPTS; i++) {
            assertThatThrownBy(() -> authService.login(new LoginRequest(user.getEmail(), "wrong")))
                    .isInstanceOf(UnauthenticatedException.class);
        }

        assertThatThrownBy(() -> authService.login(new LoginRequest(user.getEmail(), "right")))
                .isInstanceOfSatisfying(ResponseStatusException.class,
                        e -> assertThat(e.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS));
        verify(encoder, never()).matches(eq("right"), anyString());
    }

    @Test
    void login_deactivatedAccount_isForbidden() {
        UsersEntity user = withPassword(TestFixtures.user(UserRole.DEVELOPER));
        user.setActive(false);
        when(usersRepository.findByEmail(user.getEmail())).thenReturn(Optional.of(user));
        when(encoder.matches("secret1", "hash")).thenReturn(true);

        assertThatThrownBy(() -> authService.login(new LoginRequest(user.getEmail(), "secret1")))
                .isInstanceOf(ForbiddenOperationException.class);
        verifyNoInteractions(refreshTokenService);
    }

    // ========== REFRESH / LOGOUT ==========

    @Test
    void refresh_withAccessToken_isRejected() {
        when(jwtService.isRefreshToken("access")).thenReturn(false);

        assertThatThrownBy(() -> authService.refresh("access"))
                .isInstanceOf(UnauthenticatedException.class)
                .hasMessageContaining("token type");
    }

    @Test
    void refresh_revokedToken_isRejected() {
        when(jwtService.isRefreshToken("rt")).thenReturn(true);
        when(refreshTokenService.existsValid("rt")).thenReturn(false);

        assertThatThrownBy(() -> authService.refresh("rt"))
                .isInstanceOf(UnauthenticatedException.class);
        verify(refreshTokenService, never()).rotate(any(), any(), any());
    }

    @Test
    void logoutAll_unreadableToken_isIgnored() {
        when(jwtService.getSubjectEvenIfExpired("garbage")).thenThrow(new IllegalArgumentException("bad"));

        authService.logoutAllDevices("garbage");

        verifyNoInteractions(usersRepository, refreshTokenService);
    }

    private static UsersEntity withPassword(UsersEntity user) {
        user.setPassword("hash");
        return user;
    }
}
