package com.gt.recall.reviewSession;

import com.gt.recall.exception.NoCurrentItemException;
import com.gt.recall.exception.StaleItemException;
import com.gt.recall.model.ReviewItem;
import com.gt.recall.model.ReviewSessionStatus;
import com.gt.recall.model.SessionState;
import com.gt.recall.model.Sm2Schedule;
import com.gt.recall.reviewItem.ReviewItemDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Drives one owner's review session: Idle, Presenting the head of the {@link DueQueue}, and Grading while the
 * new schedule is written to the store. A graded item leaves the session whatever the outcome. A failed write
 * leaves the item at the head so the same grade can be submitted again.
 */
public class ReviewSession {

    private static final Logger log = LoggerFactory.getLogger(ReviewSession.class);

    private final String ownerId;
    private final DueQueue dueQueue;
    private final Sm2Calculator sm2Calculator;
    private final ReviewItemDao reviewItemDao;
    private final Clock clock;

    private SessionState state = SessionState.Idle;
    private Instant lastActivity;

    public ReviewSession(String ownerId, DueQueue dueQueue, Sm2Calculator sm2Calculator, ReviewItemDao reviewItemDao, Clock clock) {
        this.ownerId = ownerId;
        this.dueQueue = dueQueue;
        this.sm2Calculator = sm2Calculator;
        this.reviewItemDao = reviewItemDao;
        this.clock = clock;
        this.lastActivity = clock.instant();
    }

    public synchronized ReviewSessionStatus load() {
        Instant now = clock.instant();
        lastActivity = now;

        dueQueue.load(ownerId, now);
        state = dueQueue.isEmpty() ? SessionState.Idle : SessionState.Presenting;

        log.info("Review session for {} loaded with {} due items", ownerId, dueQueue.size());
        return status();
    }

    public synchronized Optional<ReviewItem> currentItem() {
        return state == SessionState.Idle ? Optional.empty() : dueQueue.current();
    }

    public synchronized ReviewItem grade(String itemId, int quality) {
        sm2Calculator.validateQuality(quality);
        lastActivity = clock.instant();

        Optional<ReviewItem> current = currentItem();
        if (current.isEmpty()) {
            log.warn("Grade {} submitted for item {} by {} with no current item", quality, itemId, ownerId);
            throw new NoCurrentItemException(itemId, quality);
        }

        ReviewItem currentItem = current.get();
        if (!currentItem.id().equals(itemId)) {
            log.warn("Stale grade {} submitted for item {} by {}. Current item is {}", quality, itemId, ownerId, currentItem.id());
            throw new StaleItemException(itemId, currentItem.id(), quality);
        }

        state = SessionState.Grading;

        Instant gradedAt = clock.instant();
        Sm2Schedule schedule = sm2Calculator.computeNext(quality, currentItem.repetitions(), currentItem.easeFactor(), currentItem.intervalDays());
        ReviewItem gradedItem = currentItem.withSchedule(schedule, gradedAt);

        try {
            reviewItemDao.save(gradedItem);
        } catch (RuntimeException ex) {
            state = SessionState.Presenting;
            log.error("Failed to save grade {} for item {}. Item remains current.", quality, itemId, ex);
            throw ex;
        }

        dueQueue.remove(itemId);
        state = dueQueue.isEmpty() ? SessionState.Idle : SessionState.Presenting;

        log.info("Item {} graded {} by {}. Next review in {} days, {} items remaining",
                itemId, quality, ownerId, schedule.intervalDays(), dueQueue.size());

        return gradedItem;
    }

    // Drops an item deleted from the store. Advances the session if it was the current item.
    public synchronized boolean discard(String itemId) {
        boolean removed = dueQueue.remove(itemId);
        if (removed) {
            state = dueQueue.isEmpty() ? SessionState.Idle : SessionState.Presenting;
        }

        return removed;
    }

    public synchronized ReviewSessionStatus status() {
        return new ReviewSessionStatus(state, currentItem().orElse(null), dueQueue.size());
    }

    public synchronized SessionState getState() {
        return state;
    }

    public synchronized Instant getLastActivity() {
        return lastActivity;
    }

    public String getOwnerId() {
        return ownerId;
    }
}
