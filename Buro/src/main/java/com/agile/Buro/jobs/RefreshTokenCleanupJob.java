package com.agile.Buro.jobs;

import com.agile.Buro.Service.RefreshTokenService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Deletes refresh tokens past their expiry: once when the application is ready, then on
 * {@code buro.cleanup.cron} in {@code buro.cleanup.zone}.
 */
@Slf4j
@Component
public class RefreshTokenCleanupJob {

    private final RefreshTokenService refreshTokenService;

    public RefreshTokenCleanupJob(RefreshTokenService refreshTokenService) {
        this.refreshTokenService = refreshTokenService;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void purgeOnStartup() {
        purge("startup");
    }

    @Scheduled(cron = "${buro.cleanup.cron:0 0 2 * * *}", zone = "${buro.cleanup.zone:UTC}")
    public void purgeScheduled() {
        purge("schedule");
    }

    private void purge(String trigger) {
        long deleted = refreshTokenService.purgeExpired();
        if (deleted > 0) {
            log.info("Purged {} expired refresh tokens ({})", deleted, trigger);
        } else {
            log.debug("No expired refresh tokens to purge ({})", trigger);
        }
    }
}
