package com.phillippitts.interviewpilot.service.session.event;

import com.phillippitts.interviewpilot.domain.SessionSummary;

/**
 * Emitted exactly once per session when it reaches {@code COMPLETED} or {@code ABORTED}.
 *
 * @param summary terminal summary of the session
 */
public record SessionTerminatedEvent(SessionSummary summary) {}
