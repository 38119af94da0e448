package com.phillippitts.interviewpilot.service.speech.watchdog;

import java.time.Instant;
import java.util.Map;

/**
 * Published when a speech engine call fails or times out.
 *
 * <p>PII note: Do not include transcript or prompt text in context. Restrict to technical diagnostics.
 */
public record EngineFailureEvent(
        String engine,
        Instant at,
        String message,
        Throwable cause,
        Map<String, String> context
) {
    public EngineFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
