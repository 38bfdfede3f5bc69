package com.gt.recall.delete;

import com.gt.recall.reviewItem.ReviewItemService;
import com.gt.recall.reviewSession.ReviewSessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

// Removes a review item from the store and from the owner's live session, keeping the item and session
// services independent of each other
@Component
public class DeletionService {

    private static final Logger log = LoggerFactory.getLogger(DeletionService.class);

    private final ReviewItemService reviewItemService;
    private final ReviewSessionService reviewSessionService;

    @Autowired
    public DeletionService(ReviewItemService reviewItemService, ReviewSessionService reviewSessionService) {
        this.reviewItemService = reviewItemService;
        this.reviewSessionService = reviewSessionService;
    }

    public void deleteReviewItem(String ownerId, String itemId) {
        reviewItemService.getItem(ownerId, itemId);

        // Discard first. It waits on any grade in flight for the item, and no later grade can write it back.
        if (reviewSessionService.discardItem(ownerId, itemId)) {
            log.info("Review item {} removed from the active session of {}", itemId, ownerId);
        }

        reviewItemService.deleteItem(ownerId, itemId);
    }
}
