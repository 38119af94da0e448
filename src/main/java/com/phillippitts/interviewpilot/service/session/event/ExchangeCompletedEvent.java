package com.phillippitts.interviewpilot.service.session.event;

import com.phillippitts.interviewpilot.domain.Exchange;

/**
 * Emitted after every exchange appended to a session's history, for the persistence/analytics
 * subsystem.
 *
 * @param sessionId session the exchange belongs to
 * @param exchange  the completed exchange
 */
public record ExchangeCompletedEvent(String sessionId, Exchange exchange) {}
