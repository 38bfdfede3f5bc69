package com.gt.recall.reviewSession;

import com.gt.recall.model.ReviewItem;
import com.gt.recall.reviewItem.ReviewItemDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Snapshot of one owner's due review items, earliest due first. Items that become due after {@link #load}
 * are not picked up until the next load, and a removed item never comes back within the same snapshot.
 * Not thread safe; the owning {@link ReviewSession} serializes access.
 */
public class DueQueue {

    private static final Logger log = LoggerFactory.getLogger(DueQueue.class);

    static final Comparator<ReviewItem> DUE_ORDER = Comparator
            .comparing(ReviewItem::nextReviewAt)
            .thenComparing(ReviewItem::id);

    private final ReviewItemDao reviewItemDao;
    private final int maxSize;

    private List<ReviewItem> items = new ArrayList<>();

    public DueQueue(ReviewItemDao reviewItemDao, int maxSize) {
        this.reviewItemDao = reviewItemDao;
        this.maxSize = maxSize;
    }

    // Replaces the snapshot only once the store read has succeeded
    public List<ReviewItem> load(String ownerId, Instant asOf) {
        List<ReviewItem> dueItems = reviewItemDao.findDue(ownerId, asOf)
                .stream()
                .filter(reviewItem -> ownerId.equals(reviewItem.ownerId()) && reviewItem.isDue(asOf))
                .sorted(DUE_ORDER)
                .limit(maxSize)
                .toList();

        items = new ArrayList<>(dueItems);
        log.debug("Loaded {} due review items for {} as of {}", items.size(), ownerId, asOf);

        return List.copyOf(items);
    }

    public Optional<ReviewItem> current() {
        return items.isEmpty() ? Optional.empty() : Optional.of(items.get(0));
    }

    public boolean remove(String id) {
        boolean removed = items.removeIf(reviewItem -> reviewItem.id().equals(id));
        if (removed) {
            log.debug("Removed review item {} from queue, {} remaining", id, items.size());
        }

        return removed;
    }

    public boolean contains(String id) {
        return items.stream().anyMatch(reviewItem -> reviewItem.id().equals(id));
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }
}
