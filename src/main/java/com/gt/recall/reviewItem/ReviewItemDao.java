package com.gt.recall.reviewItem;

import com.gt.recall.model.ReviewItem;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

// Durable record-per-id store of review items. Implementations throw StoreUnavailableException on any failure
// and must apply save atomically for a single id.
public interface ReviewItemDao {

    List<ReviewItem> findDue(String ownerId, Instant asOf);

    int countDue(String ownerId, Instant asOf);

    List<ReviewItem> findByOwner(String ownerId);

    Optional<ReviewItem> getById(String id);

    int save(ReviewItem reviewItem);

    int deleteById(String id);
}
