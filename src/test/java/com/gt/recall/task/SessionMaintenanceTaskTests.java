package com.gt.recall.task;

import com.gt.recall.reviewSession.ReviewSessionService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.time.Duration;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(SpringExtension.class)
public class SessionMaintenanceTaskTests {

    @Mock private ReviewSessionService reviewSessionService;

    @Test
    public void testEvictIdleSessions() {
        SessionMaintenanceTask sessionMaintenanceTask = new SessionMaintenanceTask(reviewSessionService, 45);
        when(reviewSessionService.evictIdleSessions(Duration.ofMinutes(45))).thenReturn(2);

        sessionMaintenanceTask.evictIdleSessions();

        verify(reviewSessionService).evictIdleSessions(Duration.ofMinutes(45));
    }
}
