package com.agile.Buro.repository;

import com.agile.Buro.entity.NotiEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface NotiRepository extends JpaRepository<NotiEntity, UUID> {

    List<NotiEntity> findByRecipient_UserIdOrderByCreatedAtDesc(UUID userId);

    List<NotiEntity> findByRecipient_UserIdAndReadFalseOrderByCreatedAtDesc(UUID userId);

    Optional<NotiEntity> findByNotiIdAndRecipient_UserId(UUID notiId, UUID userId);

    @Modifying
    @Query("update NotiEntity n set n.read = true where n.recipient.userId = :userId and n.read = false")
    int markAllRead(@Param("userId") UUID userId);

    @Modifying
    @Query("delete from NotiEntity n where n.recipient.userId = :userId")
    int deleteByRecipientId(@Param("userId") UUID userId);
}
