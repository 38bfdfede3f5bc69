package com.gt.recall.reviewSession;

import com.gt.recall.exception.StoreUnavailableException;
import com.gt.recall.model.ReviewItem;
import com.gt.recall.util.InMemoryReviewItemDao;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.gt.recall.util.TestUtils.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

public class DueQueueTests {

    private static final ReviewItem OVERDUE_ITEM = buildReviewItem("c-item", TEST_NOW.minus(Duration.ofDays(3)));
    private static final ReviewItem DUE_ITEM = buildReviewItem("a-item", TEST_NOW.minus(Duration.ofHours(1)));
    private static final ReviewItem DUE_NOW_ITEM = buildReviewItem("b-item", TEST_NOW);
    private static final ReviewItem FUTURE_ITEM = buildReviewItem("d-item", TEST_NOW.plusSeconds(1));
    private static final ReviewItem OTHER_OWNER_ITEM = buildReviewItem("e-item", "otherOwner", TEST_NOW.minus(Duration.ofDays(5)), 2.5, 1, 0);

    private InMemoryReviewItemDao reviewItemDao;
    private DueQueue dueQueue;

    @BeforeEach
    public void setup() {
        reviewItemDao = new InMemoryReviewItemDao();
        reviewItemDao.put(OVERDUE_ITEM, DUE_ITEM, DUE_NOW_ITEM, FUTURE_ITEM, OTHER_OWNER_ITEM);

        dueQueue = new DueQueue(reviewItemDao, 999);
    }

    @Test
    public void testLoad_EarliestDueFirst() {
        List<ReviewItem> loaded = dueQueue.load(TEST_OWNER_ID, TEST_NOW);

        assertThat(loaded).extracting(ReviewItem::id).containsExactly("c-item", "a-item", "b-item");
        assertEquals(OVERDUE_ITEM, dueQueue.current().orElseThrow());
        assertEquals(3, dueQueue.size());
    }

    @Test
    public void testLoad_EqualDueTimesOrderedById() {
        reviewItemDao = new InMemoryReviewItemDao();
        reviewItemDao.put(
                buildReviewItem("item-2", TEST_NOW.minusSeconds(60)),
                buildReviewItem("item-3", TEST_NOW.minusSeconds(60)),
                buildReviewItem("item-1", TEST_NOW.minusSeconds(60)));
        dueQueue = new DueQueue(reviewItemDao, 999);

        for (int attempt = 0; attempt < 3; attempt++) {
            assertThat(dueQueue.load(TEST_OWNER_ID, TEST_NOW))
                    .extracting(ReviewItem::id)
                    .containsExactly("item-1", "item-2", "item-3");
        }
    }

    @Test
    public void testLoad_BoundedToMaxSize() {
        dueQueue = new DueQueue(reviewItemDao, 2);

        assertThat(dueQueue.load(TEST_OWNER_ID, TEST_NOW)).extracting(ReviewItem::id).containsExactly("c-item", "a-item");
        assertEquals(2, dueQueue.size());
    }

    @Test
    public void testLoad_NothingDue() {
        assertTrue(dueQueue.load(TEST_OWNER_ID, TEST_NOW.minus(Duration.ofDays(30))).isEmpty());
        assertTrue(dueQueue.current().isEmpty());
        assertTrue(dueQueue.isEmpty());
    }

    @Test
    public void testLoad_IsSnapshot() {
        dueQueue.load(TEST_OWNER_ID, TEST_NOW);

        reviewItemDao.put(buildReviewItem("0-new-item", TEST_NOW.minus(Duration.ofDays(10))));

        assertEquals(OVERDUE_ITEM, dueQueue.current().orElseThrow());
        assertFalse(dueQueue.contains("0-new-item"));

        dueQueue.load(TEST_OWNER_ID, TEST_NOW);
        assertEquals("0-new-item", dueQueue.current().orElseThrow().id());
    }

    @Test
    public void testLoad_StoreFailureKeepsQueue() {
        dueQueue.load(TEST_OWNER_ID, TEST_NOW);
        reviewItemDao.setAvailable(false);

        assertThrows(StoreUnavailableException.class, () -> dueQueue.load(TEST_OWNER_ID, TEST_NOW.plus(Duration.ofDays(1))));

        assertEquals(3, dueQueue.size());
        assertEquals(OVERDUE_ITEM, dueQueue.current().orElseThrow());
    }

    @Test
    public void testRemove() {
        dueQueue.load(TEST_OWNER_ID, TEST_NOW);

        assertTrue(dueQueue.remove(OVERDUE_ITEM.id()));
        assertEquals(DUE_ITEM, dueQueue.current().orElseThrow());
        assertEquals(2, dueQueue.size());

        assertFalse(dueQueue.remove(OVERDUE_ITEM.id()));
        assertEquals(2, dueQueue.size());
    }

    @Test
    public void testRemove_NonHeadItem() {
        dueQueue.load(TEST_OWNER_ID, TEST_NOW);

        assertTrue(dueQueue.remove(DUE_NOW_ITEM.id()));
        assertEquals(OVERDUE_ITEM, dueQueue.current().orElseThrow());
        assertFalse(dueQueue.contains(DUE_NOW_ITEM.id()));
    }

    @Test
    public void testRemove_BeforeLoad() {
        assertFalse(dueQueue.remove(OVERDUE_ITEM.id()));
        assertTrue(dueQueue.current().isEmpty());
    }

    @Test
    public void testRemove_DoesNotTouchStore() {
        dueQueue.load(TEST_OWNER_ID, TEST_NOW);
        dueQueue.remove(OVERDUE_ITEM.id());

        assertTrue(reviewItemDao.getById(OVERDUE_ITEM.id()).isPresent());
        assertTrue(reviewItemDao.getSavedItems().isEmpty());
    }
}
