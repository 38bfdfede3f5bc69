package com.gt.recall.model;

// The four grades offered to the user. Any quality in [0, 5] is accepted by the calculator.
public enum RecallGrade {
    Forgot(1),
    Hard(3),
    Good(4),
    Easy(5);

    public static final int MIN_QUALITY = 0;
    public static final int MAX_QUALITY = 5;
    public static final int PASSING_QUALITY = 3;

    private final int quality;

    RecallGrade(int quality) {
        this.quality = quality;
    }

    public int getQuality() {
        return quality;
    }

    public static boolean isValidQuality(int quality) {
        return quality >= MIN_QUALITY && quality <= MAX_QUALITY;
    }

    public static boolean isRecalled(int quality) {
        return quality >= PASSING_QUALITY;
    }
}
