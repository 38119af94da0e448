package com.phillippitts.interviewpilot.service.events;

import com.phillippitts.interviewpilot.domain.Exchange;
import com.phillippitts.interviewpilot.domain.SessionSummary;
import com.phillippitts.interviewpilot.service.session.event.BudgetExhaustedEvent;
import com.phillippitts.interviewpilot.service.session.event.ExchangeCompletedEvent;
import com.phillippitts.interviewpilot.service.session.event.SessionTerminatedEvent;
import com.phillippitts.interviewpilot.service.speech.watchdog.EngineFailureEvent;
import com.phillippitts.interviewpilot.service.speech.watchdog.EngineRecoveredEvent;
import com.phillippitts.interviewpilot.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Logs the exchange stream, terminal summaries and degraded conditions. Privacy-safe: transcript
 * text never reaches INFO. Warnings are throttled per key to avoid log spam.
 */
@Component
class SessionEventsListener {
    private static final Logger LOG = LogManager.getLogger(SessionEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);
    private static final int PREVIEW_CHARS = 60;

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();

    @EventListener
    void onExchangeCompleted(ExchangeCompletedEvent e) {
        Exchange x = e.exchange();
        LOG.info("Exchange completed: session={}, item={}, round={}, decision={}, reason={}, elapsed={}, answered={}",
                e.sessionId(), x.itemId(), x.round(), x.decision().kind(), x.decision().reason(),
                x.elapsed(), x.hasAnswer());
        if (LOG.isDebugEnabled()) {
            LOG.debug("Exchange answer preview: session={}, item={}, chars={}, preview='{}'", e.sessionId(),
                    x.itemId(), x.transcript().length(), LogSanitizer.preview(x.transcript(), PREVIEW_CHARS));
        }
    }

    @EventListener
    void onBudgetExhausted(BudgetExhaustedEvent e) {
        if (shouldLog("budget-" + e.sessionId())) {
            LOG.warn("Budget exhausted: session={}, skipped={}, remaining={}. Lower item minimums or extend "
                    + "interview.deadline.", e.sessionId(), e.skippedItemIds(), e.remaining());
        }
    }

    @EventListener
    void onEngineFailure(EngineFailureEvent e) {
        if (shouldLog("engine-" + e.engine() + '-' + e.context().getOrDefault("operation", ""))) {
            LOG.warn("Speech engine failure: engine={}, message={}. Sessions continue with fallbacks.",
                    e.engine(), e.message());
        }
    }

    @EventListener
    void onEngineRecovered(EngineRecoveredEvent e) {
        LOG.info("Speech engine recovered: engine={}", e.engine());
    }

    @EventListener
    void onSessionTerminated(SessionTerminatedEvent e) {
        SessionSummary s = e.summary();
        LOG.info("Session summary: session={}, phase={}, exchanges={}, followUps={}, warnings={}, "
                        + "interruptions={}, elapsed={}, abort={}",
                s.sessionId(), s.phase(), s.history().size(), s.followUpCounts(), s.warnings().size(),
                s.interruptions().size(), s.elapsed(), s.abortReason() == null ? "none" : s.abortReason().cause());
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
