package com.gt.recall.util;

import com.gt.recall.model.ReviewItem;

import java.time.Instant;

public class TestUtils {

    public static final Instant TEST_NOW = Instant.parse("2025-03-10T09:00:00Z");
    public static final String TEST_OWNER_ID = "testOwner";

    public static ReviewItem buildReviewItem(String id, Instant nextReviewAt) {
        return buildReviewItem(id, TEST_OWNER_ID, nextReviewAt, 2.5, 1, 0);
    }

    public static ReviewItem buildReviewItem(String id, String ownerId, Instant nextReviewAt, double easeFactor, int intervalDays, int repetitions) {
        return new ReviewItem(id, ownerId, "Title " + id, "Content " + id, easeFactor, intervalDays, repetitions,
                nextReviewAt, Instant.EPOCH, Instant.EPOCH);
    }
}
