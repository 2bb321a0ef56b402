package com.agile.Buro.Service;

import com.agile.Buro.entity.RefreshToken;
import com.agile.Buro.entity.UsersEntity;
import com.agile.Buro.repository.RefreshTokenRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;

/**
 * Server-side record of issued refresh tokens. A refresh JWT is only honoured while its
 * row exists, which is what makes logout and rotation effective.
 */
@Service
public class RefreshTokenService {

    private final RefreshTokenRepository repo;
    private final JwtService jwtService;
    private final Clock clock;

    public RefreshTokenService(RefreshTokenRepository repo, JwtService jwtService, Clock clock) {
        this.repo = repo;
        this.jwtService = jwtService;
        this.clock = clock;
    }

    /** Stores a freshly issued refresh JWT, expiring when the token itself does. */
    @Transactional
    public RefreshToken create(UsersEntity user, String refreshJwt) {
        if (user == null || refreshJwt == null || refreshJwt.isBlank()) {
            throw new IllegalArgumentException("User and refresh token must not be null");
        }
        Date exp = jwtService.parseAllClaims(refreshJwt).getExpiration();
        if (exp == null) {
            throw new IllegalArgumentException("Refresh token must have expiration date");
        }
        return repo.save(new RefreshToken(refreshJwt, exp.toInstant(), user));
    }

    @Transactional(readOnly = true)
    public Optional<RefreshToken> findValid(String token) {
        return repo.findByToken(token).filter(rt -> !isExpired(rt));
    }

    public boolean existsValid(String token) {
        return findValid(token).isPresent();
    }

    private boolean isExpired(RefreshToken rt) {
        return rt.getExpiryDate() == null || rt.getExpiryDate().isBefore(Instant.now(clock));
    }

    /** Replaces {@code oldToken} with {@code newToken} in one transaction. */
    @Transactional
    public RefreshToken rotate(UsersEntity user, String oldToken, String newToken) {
        if (oldToken == null || oldToken.isBlank()) {
            throw new IllegalArgumentException("Old token must not be null");
        }
        repo.deleteByToken(oldToken);
        return create(user, newToken);
    }

    @Transactional
    public void revoke(String token) {
        if (token == null || token.isBlank()) return;
        repo.deleteByToken(token);
    }

    @Transactional
    public long revokeAll(UsersEntity user) {
        if (user == null) return 0;
        return repo.deleteByUser(user);
    }

    @Transactional
    public long purgeExpired() {
        return repo.deleteByExpiryDateBefore(Instant.now(clock));
    }
}
