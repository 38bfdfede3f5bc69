package com.gt.recall.reviewItem;

import com.gt.recall.exception.InvalidReviewItemException;
import com.gt.recall.exception.ReviewItemNotFoundException;
import com.gt.recall.exception.UserAccessException;
import com.gt.recall.model.ReviewItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Component
public class ReviewItemService {

    private static final Logger log = LoggerFactory.getLogger(ReviewItemService.class);

    private final ReviewItemDao reviewItemDao;
    private final Clock clock;

    @Autowired
    public ReviewItemService(ReviewItemDao reviewItemDao, Clock clock) {
        this.reviewItemDao = reviewItemDao;
        this.clock = clock;
    }

    public ReviewItem createItem(String ownerId, String title, String content) {
        if (title == null || title.isBlank()) {
            throw new InvalidReviewItemException("Review item title is required");
        }

        Instant now = clock.instant();
        ReviewItem reviewItem = ReviewItem.newItem(
                UUID.randomUUID().toString(),
                ownerId,
                title.trim(),
                content == null || content.isBlank() ? null : content,
                now);

        reviewItemDao.save(reviewItem);
        log.info("Created review item {} for {}", reviewItem.id(), ownerId);

        return reviewItem;
    }

    public ReviewItem getItem(String ownerId, String itemId) {
        ReviewItem reviewItem = reviewItemDao.getById(itemId).orElseThrow(() -> new ReviewItemNotFoundException(itemId));
        verifyUserAccessAllowed(reviewItem, ownerId);

        return reviewItem;
    }

    public List<ReviewItem> listItems(String ownerId) {
        return reviewItemDao.findByOwner(ownerId);
    }

    public int dueCount(String ownerId) {
        return reviewItemDao.countDue(ownerId, clock.instant());
    }

    public boolean deleteItem(String ownerId, String itemId) {
        getItem(ownerId, itemId);

        int rowsDeleted = reviewItemDao.deleteById(itemId);
        log.info("Deleted review item {} for {}", itemId, ownerId);

        return rowsDeleted > 0;
    }

    private void verifyUserAccessAllowed(ReviewItem reviewItem, String ownerId) {
        if (!reviewItem.ownerId().equals(ownerId)) {
            String errMsg = "User " + ownerId + " does not have access to review item " + reviewItem.id();

            log.error(errMsg);
            throw new UserAccessException(errMsg);
        }
    }
}
