package com.gt.recall.reviewSession;

import com.gt.recall.exception.NoCurrentItemException;
import com.gt.recall.model.GradeResult;
import com.gt.recall.model.RecallGrade;
import com.gt.recall.model.ReviewItem;
import com.gt.recall.model.ReviewSessionStatus;
import com.gt.recall.reviewItem.ReviewItemDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

// Holds the live review session of each owner. Starting a session replaces the previous one for that owner.
@Component
public class ReviewSessionService {

    private static final Logger log = LoggerFactory.getLogger(ReviewSessionService.class);

    static final int MAX_QUEUE_SIZE = 999;

    private final ReviewItemDao reviewItemDao;
    private final Sm2Calculator sm2Calculator;
    private final Clock clock;
    private final int maxQueueSize;

    private final Map<String, ReviewSession> sessionsByOwner = new ConcurrentHashMap<>();

    @Autowired
    public ReviewSessionService(ReviewItemDao reviewItemDao,
                                Sm2Calculator sm2Calculator,
                                Clock clock,
                                @Value("${recall.review.maxQueueSize:999}") int maxQueueSize) {
        this.reviewItemDao = reviewItemDao;
        this.sm2Calculator = sm2Calculator;
        this.clock = clock;

        if (maxQueueSize <= 0 || maxQueueSize > MAX_QUEUE_SIZE) {
            log.warn("Configured max queue size {} is out of range. Using {}.", maxQueueSize, MAX_QUEUE_SIZE);
            maxQueueSize = MAX_QUEUE_SIZE;
        }
        this.maxQueueSize = maxQueueSize;
    }

    public ReviewSessionStatus startSession(String ownerId) {
        ReviewSession reviewSession = new ReviewSession(ownerId, new DueQueue(reviewItemDao, maxQueueSize), sm2Calculator, reviewItemDao, clock);

        // a failed load throws before the previous session is replaced
        ReviewSessionStatus status = reviewSession.load();
        sessionsByOwner.put(ownerId, reviewSession);

        return status;
    }

    public Optional<ReviewItem> currentItem(String ownerId) {
        ReviewSession reviewSession = sessionsByOwner.get(ownerId);

        return reviewSession == null ? Optional.empty() : reviewSession.currentItem();
    }

    public ReviewSessionStatus sessionStatus(String ownerId) {
        ReviewSession reviewSession = sessionsByOwner.get(ownerId);

        return reviewSession == null ? ReviewSessionStatus.NO_SESSION : reviewSession.status();
    }

    public GradeResult submitGrade(String ownerId, String itemId, int quality) {
        sm2Calculator.validateQuality(quality);

        ReviewSession reviewSession = sessionsByOwner.get(ownerId);
        if (reviewSession == null) {
            log.warn("Grade {} submitted for item {} by {} without an active session", quality, itemId, ownerId);
            throw new NoCurrentItemException(itemId, quality);
        }

        ReviewItem gradedItem = reviewSession.grade(itemId, quality);

        return new GradeResult(gradedItem, RecallGrade.isRecalled(quality), reviewSession.status());
    }

    public boolean discardItem(String ownerId, String itemId) {
        ReviewSession reviewSession = sessionsByOwner.get(ownerId);

        return reviewSession != null && reviewSession.discard(itemId);
    }

    public int evictIdleSessions(Duration idleTimeout) {
        Instant cutoff = clock.instant().minus(idleTimeout);

        int evictedCnt = 0;
        for (Map.Entry<String, ReviewSession> sessionEntry : sessionsByOwner.entrySet()) {
            if (sessionEntry.getValue().getLastActivity().isBefore(cutoff)
                    && sessionsByOwner.remove(sessionEntry.getKey(), sessionEntry.getValue())) {
                evictedCnt++;
            }
        }

        return evictedCnt;
    }

    int activeSessionCount() {
        return sessionsByOwner.size();
    }
}
