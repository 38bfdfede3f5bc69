package com.gt.recall.reviewSession;

import com.gt.recall.exception.InvalidGradeException;
import com.gt.recall.model.RecallGrade;
import com.gt.recall.model.Sm2Schedule;
import org.springframework.stereotype.Component;

/**
 * SM-2 interval calculation. Maps a recall quality and the item's prior scheduling state to its next
 * ease factor, interval and repetition count. Stateless and free of side effects.
 */
@Component
public class Sm2Calculator {

    public static final double MIN_EASE_FACTOR = 1.3;

    static final int FIRST_SUCCESS_INTERVAL_DAYS = 1;
    static final int SECOND_SUCCESS_INTERVAL_DAYS = 6;
    static final int FAILURE_INTERVAL_DAYS = 1;

    /**
     * @param quality           recall quality, 0 (complete blackout) to 5 (perfect recall)
     * @param priorRepetitions  consecutive successful reviews before this one
     * @param priorEaseFactor   ease factor before this review
     * @param priorIntervalDays interval used to schedule this review
     * @throws InvalidGradeException if quality is outside [0, 5]
     */
    public Sm2Schedule computeNext(int quality, int priorRepetitions, double priorEaseFactor, int priorIntervalDays) {
        validateQuality(quality);

        double easeFactor = computeEaseFactor(quality, priorEaseFactor);

        if (!RecallGrade.isRecalled(quality)) {
            return new Sm2Schedule(easeFactor, FAILURE_INTERVAL_DAYS, 0);
        }

        int intervalDays;
        if (priorRepetitions <= 0) {
            intervalDays = FIRST_SUCCESS_INTERVAL_DAYS;
        } else if (priorRepetitions == 1) {
            intervalDays = SECOND_SUCCESS_INTERVAL_DAYS;
        } else {
            // Saturates rather than wrapping for very long intervals
            intervalDays = (int) Math.min(Math.round(priorIntervalDays * easeFactor), Integer.MAX_VALUE);
        }

        return new Sm2Schedule(easeFactor, Math.max(1, intervalDays), priorRepetitions + 1);
    }

    public void validateQuality(int quality) {
        if (!RecallGrade.isValidQuality(quality)) {
            throw new InvalidGradeException(quality);
        }
    }

    private static double computeEaseFactor(int quality, double priorEaseFactor) {
        int qualityDeficit = RecallGrade.MAX_QUALITY - quality;
        double easeFactor = priorEaseFactor + (0.1 - qualityDeficit * (0.08 + qualityDeficit * 0.02));

        // Floor only. There is no upper bound on the ease factor.
        return Math.max(MIN_EASE_FACTOR, easeFactor);
    }
}
