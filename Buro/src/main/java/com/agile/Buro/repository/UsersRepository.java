package com.agile.Buro.repository;

import com.agile.Buro.entity.UserRole;
import com.agile.Buro.entity.UsersEntity;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface UsersRepository extends JpaRepository<UsersEntity, UUID> {

    // emails are stored lower-case, callers pass the normalized value
    Optional<UsersEntity> findByEmail(String email);

    boolean existsByEmail(String email);

    boolean existsByRole(UserRole role);

    Page<UsersEntity> findByFullNameContainingIgnoreCaseOrEmailContainingIgnoreCase(String fullName,
                                                                                     String email,
                                                                                     Pageable pageable);

    List<UsersEntity> findByActiveTrueOrderByFullNameAsc();
}
