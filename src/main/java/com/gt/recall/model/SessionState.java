package com.gt.recall.model;

public enum SessionState {
    Idle,
    Presenting,
    Grading
}
