package com.gt.recall.model;

public record Sm2Schedule(double easeFactor, int intervalDays, int repetitions) { }
