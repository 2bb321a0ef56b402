package com.agile.Buro.repository;

import com.agile.Buro.entity.RefreshToken;
import com.agile.Buro.entity.UsersEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface RefreshTokenRepository extends JpaRepository<RefreshToken, UUID> {
    Optional<RefreshToken> findByToken(String token);
    long deleteByUser(UsersEntity user);
    void deleteByToken(String token);
    long deleteByExpiryDateBefore(Instant now);
}
