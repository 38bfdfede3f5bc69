package com.gt.recall.reviewItem.impl;

import com.gt.recall.exception.StoreUnavailableException;
import com.gt.recall.model.ReviewItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.sql.Timestamp;
import java.util.List;
import java.util.Map;

import static com.gt.recall.util.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(SpringExtension.class)
public class ReviewItemDaoPGTests {

    @Mock private NamedParameterJdbcTemplate template;

    private ReviewItemDaoPG reviewItemDao;

    @BeforeEach
    public void setup() {
        reviewItemDao = new ReviewItemDaoPG(template);
    }

    @Test
    public void testSave_NullContent() {
        ReviewItem reviewItem = ReviewItem.newItem("item-1", TEST_OWNER_ID, "Title", null, TEST_NOW);
        when(template.update(anyString(), any(SqlParameterSource.class))).thenReturn(1);

        assertEquals(1, reviewItemDao.save(reviewItem));

        ArgumentCaptor<SqlParameterSource> paramsCaptor = ArgumentCaptor.forClass(SqlParameterSource.class);
        verify(template).update(anyString(), paramsCaptor.capture());

        MapSqlParameterSource params = (MapSqlParameterSource) paramsCaptor.getValue();
        assertNull(params.getValue("content"));
        assertEquals("item-1", params.getValue("id"));
        assertEquals(2.5, params.getValue("easeFactor"));
        assertEquals(Timestamp.from(TEST_NOW), params.getValue("nextReviewAt"));
    }

    @Test
    public void testSave_StoreFailure() {
        ReviewItem reviewItem = buildReviewItem("item-1", TEST_NOW);
        when(template.update(anyString(), any(SqlParameterSource.class))).thenThrow(new DataAccessResourceFailureException("connection refused"));

        StoreUnavailableException ex = assertThrows(StoreUnavailableException.class, () -> reviewItemDao.save(reviewItem));

        assertEquals("save", ex.getOperation());
        assertTrue(ex.getMessage().contains("item-1"));
        assertInstanceOf(DataAccessResourceFailureException.class, ex.getCause());
    }

    @Test
    public void testFindDue_StoreFailure() {
        when(template.query(anyString(), anyMap(), ArgumentMatchers.<RowMapper<ReviewItem>>any())).thenThrow(new DataAccessResourceFailureException("connection refused"));

        StoreUnavailableException ex = assertThrows(StoreUnavailableException.class, () -> reviewItemDao.findDue(TEST_OWNER_ID, TEST_NOW));

        assertEquals("findDue", ex.getOperation());
    }

    @Test
    public void testGetById_NotFound() {
        when(template.query(anyString(), anyMap(), ArgumentMatchers.<RowMapper<ReviewItem>>any())).thenReturn(List.of());

        assertTrue(reviewItemDao.getById("missing").isEmpty());
    }

    @Test
    public void testCountDue() {
        when(template.queryForObject(anyString(), eq(Map.of("ownerId", TEST_OWNER_ID, "asOf", Timestamp.from(TEST_NOW))), eq(Integer.class))).thenReturn(4);

        assertEquals(4, reviewItemDao.countDue(TEST_OWNER_ID, TEST_NOW));
    }
}
