package com.phillippitts.interviewpilot.presentation.dto;

import jakarta.validation.constraints.NotNull;

/** Typed answer used when audio is unavailable. An empty text counts as no answer. */
public record AnswerRequest(@NotNull String text) {
}
