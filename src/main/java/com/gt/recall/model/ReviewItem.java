package com.gt.recall.model;

import java.time.Duration;
import java.time.Instant;

public record ReviewItem(String id,
                         String ownerId,
                         String title,
                         String content,
                         double easeFactor,
                         int intervalDays,
                         int repetitions,
                         Instant nextReviewAt,
                         Instant createdAt,
                         Instant updatedAt) {

    public static final double INITIAL_EASE_FACTOR = 2.5;
    public static final int INITIAL_INTERVAL_DAYS = 1;

    public static ReviewItem newItem(String id, String ownerId, String title, String content, Instant now) {
        return new ReviewItem(id, ownerId, title, content, INITIAL_EASE_FACTOR, INITIAL_INTERVAL_DAYS, 0, now, now, now);
    }

    public boolean isDue(Instant asOf) {
        return !nextReviewAt.isAfter(asOf);
    }

    // nextReviewAt is always derived from the grading instant, never supplied by a caller
    public ReviewItem withSchedule(Sm2Schedule schedule, Instant gradedAt) {
        return new ReviewItem(id, ownerId, title, content,
                schedule.easeFactor(),
                schedule.intervalDays(),
                schedule.repetitions(),
                gradedAt.plus(Duration.ofDays(schedule.intervalDays())),
                createdAt,
                gradedAt);
    }
}
