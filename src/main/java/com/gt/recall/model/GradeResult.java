package com.gt.recall.model;

public record GradeResult(ReviewItem gradedItem, boolean recalled, ReviewSessionStatus sessionStatus) { }
