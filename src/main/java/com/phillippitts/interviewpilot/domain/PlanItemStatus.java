package com.phillippitts.interviewpilot.domain;

public enum PlanItemStatus {
    PENDING,
    ACTIVE,
    ANSWERED,
    SKIPPED
}
