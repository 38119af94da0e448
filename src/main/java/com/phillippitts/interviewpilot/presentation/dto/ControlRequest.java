package com.phillippitts.interviewpilot.presentation.dto;

/** Optional body of pause and abort requests. */
public record ControlRequest(String note) {
}
