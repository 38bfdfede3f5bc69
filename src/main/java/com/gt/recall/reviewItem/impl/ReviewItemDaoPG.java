package com.gt.recall.reviewItem.impl;

import com.gt.recall.exception.StoreUnavailableException;
import com.gt.recall.model.ReviewItem;
import com.gt.recall.reviewItem.ReviewItemDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class ReviewItemDaoPG implements ReviewItemDao {

    private static final Logger log = LoggerFactory.getLogger(ReviewItemDaoPG.class);

    private static final String REVIEW_ITEM_COLUMNS =
            "id, owner_id, title, content, ease_factor, interval_days, repetitions, next_review_at, created_at, updated_at ";

    private static final String FIND_DUE_SQL =
            "SELECT " + REVIEW_ITEM_COLUMNS +
            "FROM review_item " +
            "WHERE owner_id = :ownerId AND next_review_at <= :asOf " +
            "ORDER BY next_review_at, id";

    private static final String COUNT_DUE_SQL =
            "SELECT COUNT(*) FROM review_item WHERE owner_id = :ownerId AND next_review_at <= :asOf";

    private static final String FIND_BY_OWNER_SQL =
            "SELECT " + REVIEW_ITEM_COLUMNS +
            "FROM review_item " +
            "WHERE owner_id = :ownerId " +
            "ORDER BY next_review_at, id";

    private static final String GET_BY_ID_SQL =
            "SELECT " + REVIEW_ITEM_COLUMNS +
            "FROM review_item " +
            "WHERE id = :id";

    private static final String SAVE_SQL =
            "INSERT INTO review_item " +
                    "(id, owner_id, title, content, ease_factor, interval_days, repetitions, next_review_at, created_at, updated_at) " +
                    "VALUES (:id, :ownerId, :title, :content, :easeFactor, :intervalDays, :repetitions, :nextReviewAt, :createdAt, :updatedAt) " +
            "ON CONFLICT (id) DO UPDATE " +
                    "SET owner_id = :ownerId, title = :title, content = :content, ease_factor = :easeFactor, interval_days = :intervalDays, " +
                    "repetitions = :repetitions, next_review_at = :nextReviewAt, created_at = :createdAt, updated_at = :updatedAt";

    private static final String DELETE_BY_ID_SQL =
            "DELETE FROM review_item WHERE id = :id";

    private final NamedParameterJdbcTemplate template;

    public ReviewItemDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public List<ReviewItem> findDue(String ownerId, Instant asOf) {
        try {
            return template.query(FIND_DUE_SQL, Map.of(
                            "ownerId", ownerId,
                            "asOf", Timestamp.from(asOf)),
                    ReviewItemDaoPG::getReviewItemFromResultSet);
        } catch (DataAccessException ex) {
            throw storeUnavailable("findDue", "Failed to load due review items for owner " + ownerId, ex);
        }
    }

    @Override
    public int countDue(String ownerId, Instant asOf) {
        try {
            Integer count = template.queryForObject(COUNT_DUE_SQL, Map.of(
                            "ownerId", ownerId,
                            "asOf", Timestamp.from(asOf)),
                    Integer.class);
            return count == null ? 0 : count;
        } catch (DataAccessException ex) {
            throw storeUnavailable("countDue", "Failed to count due review items for owner " + ownerId, ex);
        }
    }

    @Override
    public List<ReviewItem> findByOwner(String ownerId) {
        try {
            return template.query(FIND_BY_OWNER_SQL, Map.of("ownerId", ownerId), ReviewItemDaoPG::getReviewItemFromResultSet);
        } catch (DataAccessException ex) {
            throw storeUnavailable("findByOwner", "Failed to load review items for owner " + ownerId, ex);
        }
    }

    @Override
    public Optional<ReviewItem> getById(String id) {
        try {
            return template.query(GET_BY_ID_SQL, Map.of("id", id), ReviewItemDaoPG::getReviewItemFromResultSet)
                    .stream()
                    .findFirst();
        } catch (DataAccessException ex) {
            throw storeUnavailable("getById", "Failed to load review item " + id, ex);
        }
    }

    @Override
    public int save(ReviewItem reviewItem) {
        // content is nullable, so Map.of cannot be used here
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", reviewItem.id())
                .addValue("ownerId", reviewItem.ownerId())
                .addValue("title", reviewItem.title())
                .addValue("content", reviewItem.content())
                .addValue("easeFactor", reviewItem.easeFactor())
                .addValue("intervalDays", reviewItem.intervalDays())
                .addValue("repetitions", reviewItem.repetitions())
                .addValue("nextReviewAt", Timestamp.from(reviewItem.nextReviewAt()))
                .addValue("createdAt", Timestamp.from(reviewItem.createdAt()))
                .addValue("updatedAt", Timestamp.from(reviewItem.updatedAt()));

        try {
            return template.update(SAVE_SQL, params);
        } catch (DataAccessException ex) {
            throw storeUnavailable("save", "Failed to save review item " + reviewItem.id(), ex);
        }
    }

    @Override
    public int deleteById(String id) {
        try {
            return template.update(DELETE_BY_ID_SQL, Map.of("id", id));
        } catch (DataAccessException ex) {
            throw storeUnavailable("deleteById", "Failed to delete review item " + id, ex);
        }
    }

    private static StoreUnavailableException storeUnavailable(String operation, String errMsg, DataAccessException ex) {
        log.error(errMsg, ex);
        return new StoreUnavailableException(operation, errMsg, ex);
    }

    private static ReviewItem getReviewItemFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        return new ReviewItem(
                rs.getString("id"),
                rs.getString("owner_id"),
                rs.getString("title"),
                rs.getString("content"),
                rs.getDouble("ease_factor"),
                rs.getInt("interval_days"),
                rs.getInt("repetitions"),
                toInstant(rs.getTimestamp("next_review_at")),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("updated_at")));
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
