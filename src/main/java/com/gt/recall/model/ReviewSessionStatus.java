package com.gt.recall.model;

public record ReviewSessionStatus(SessionState state, ReviewItem currentItem, int remaining) {
    public static final ReviewSessionStatus NO_SESSION = new ReviewSessionStatus(SessionState.Idle, null, 0);
}
