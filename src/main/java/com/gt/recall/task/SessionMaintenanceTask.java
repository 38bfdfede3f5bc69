package com.gt.recall.task;

import com.gt.recall.reviewSession.ReviewSessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class SessionMaintenanceTask {

    private static final Logger log = LoggerFactory.getLogger(SessionMaintenanceTask.class);

    private final ReviewSessionService reviewSessionService;
    private final int sessionIdleMinutes;

    public SessionMaintenanceTask(ReviewSessionService reviewSessionService,
                                  @Value("${recall.maintenance.sessionIdleMinutes:120}") int sessionIdleMinutes) {
        this.reviewSessionService = reviewSessionService;

        this.sessionIdleMinutes = sessionIdleMinutes;
    }

    @Scheduled(cron = "${recall.maintenance.cron:0 */15 * * * *}")
    public void evictIdleSessions() {
        int evictedCnt = reviewSessionService.evictIdleSessions(Duration.ofMinutes(sessionIdleMinutes));

        log.info("Evicted idle review sessions. {} sessions removed.", evictedCnt);
    }
}
