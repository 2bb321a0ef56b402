package com.agile.Buro.jobs;

import com.agile.Buro.Config.BuroProperties;
import com.agile.Buro.entity.UserRole;
import com.agile.Buro.entity.UsersEntity;
import com.agile.Buro.repository.UsersRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;

/**
 * Creates the first admin from {@code buro.bootstrap.*} when no admin exists yet.
 */
@Slf4j
@Component
public class AdminBootstrapRunner implements ApplicationRunner {

    private final UsersRepository usersRepository;
    private final PasswordEncoder encoder;
    private final BuroProperties properties;

    public AdminBootstrapRunner(UsersRepository usersRepository, PasswordEncoder encoder, BuroProperties properties) {
        this.usersRepository = usersRepository;
        this.encoder = encoder;
        this.properties = properties;
    }

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        BuroProperties.Bootstrap cfg = properties.getBootstrap();
        if (cfg.getAdminEmail() == null || cfg.getAdminEmail().isBlank()) {
            return;
        }
        if (usersRepository.existsByRole(UserRole.ADMIN)) {
            log.debug("Admin already present, bootstrap skipped");
            return;
        }
        if (cfg.getAdminPassword() == null || cfg.getAdminPassword().length() < 6) {
            throw new IllegalStateException("buro.bootstrap.admin-password must be at least 6 characters");
        }

        String email = cfg.getAdminEmail().trim().toLowerCase(Locale.ROOT);
        UsersEntity admin = usersRepository.findByEmail(email).orElseGet(UsersEntity::new);
        admin.setEmail(email);
        admin.setFullName(cfg.getAdminName());
        admin.setPassword(encoder.encode(cfg.getAdminPassword()));
        admin.setRole(UserRole.ADMIN);
        admin.setActive(true);
        usersRepository.save(admin);
        log.info("Bootstrap admin {} created", email);
    }
}
