package com.phillippitts.interviewpilot.service.speech.watchdog;

import com.phillippitts.interviewpilot.config.properties.WatchdogProperties;
import com.phillippitts.interviewpilot.service.clock.InterviewClock;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Event-driven circuit breaker for remote speech engines.
 *
 * Detection model:
 * - The speech adapter publishes {@link EngineFailureEvent} when a call fails or times out.
 * - The watchdog counts failures per engine in a sliding time window.
 * - On exceeding the budget the engine is marked DISABLED; calls fail fast until the cooldown ends,
 *   after which the engine is DEGRADED and one more failure disables it again.
 * - A successful call returns the engine to HEALTHY.
 *
 * A disabled engine lets the session take its fallback path (text-only delivery, no-answer turn)
 * immediately instead of waiting out a timeout on every call.
 */
public class EngineWatchdog {

    private static final Logger LOG = LogManager.getLogger(EngineWatchdog.class);

    public enum EngineState { HEALTHY, DEGRADED, DISABLED }

    private final WatchdogProperties props;
    private final ApplicationEventPublisher publisher;
    private final InterviewClock clock;

    private final ConcurrentMap<String, Deque<Instant>> failureWindow = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, EngineState> state = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Instant> disabledUntil = new ConcurrentHashMap<>();

    public EngineWatchdog(Collection<String> engineNames,
                          WatchdogProperties props,
                          ApplicationEventPublisher publisher,
                          InterviewClock clock) {
        this.props = Objects.requireNonNull(props, "props");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
        for (String name : engineNames) {
            state.put(name, EngineState.HEALTHY);
            failureWindow.put(name, new ArrayDeque<>());
        }
        LOG.info("Watchdog initialized for engines={}", state.keySet());
    }

    /** Visible for tests */
    EngineState getState(String engine) {
        return state.get(engine);
    }

    public Set<String> engines() {
        return state.keySet();
    }

    /**
     * Checks if an engine may be called.
     *
     * <p>A disabled engine whose cooldown has passed moves to DEGRADED and is allowed again.
     *
     * @param engine engine name to check
     * @return true if calls are allowed, false while disabled
     */
    public boolean isEngineEnabled(String engine) {
        EngineState s = state.get(engine);
        if (s == null) {
            return true;
        }
        if (s != EngineState.DISABLED) {
            return true;
        }
        Instant until = disabledUntil.get(engine);
        if (until != null && clock.now().isBefore(until)) {
            return false;
        }
        if (state.replace(engine, EngineState.DISABLED, EngineState.DEGRADED)) {
            disabledUntil.remove(engine);
            LOG.info("Engine {} cooldown elapsed; allowing calls again", engine);
        }
        return true;
    }

    @EventListener
    public void onFailure(EngineFailureEvent event) {
        String engine = event.engine();
        Deque<Instant> window = failureWindow.get(engine);
        if (window == null) {
            LOG.warn("EngineFailureEvent for unknown engine: {}", engine);
            return;
        }

        LOG.debug("Engine failure: engine={}, msg={}", engine, event.message());
        if (state.get(engine) == EngineState.DISABLED) {
            return;
        }

        boolean disable;
        synchronized (window) {
            window.addLast(clock.now());
            pruneOld(window);
            disable = window.size() >= props.getMaxFailuresPerWindow();
        }
        if (disable) {
            disableEngine(engine, window.size());
        } else {
            state.put(engine, EngineState.DEGRADED);
        }
    }

    /**
     * Records a successful call. Returns the engine to HEALTHY if it was degraded.
     */
    public void recordSuccess(String engine) {
        EngineState previous = state.get(engine);
        if (previous == null || previous == EngineState.HEALTHY) {
            return;
        }
        if (state.replace(engine, previous, EngineState.HEALTHY)) {
            Deque<Instant> window = failureWindow.get(engine);
            synchronized (window) {
                window.clear();
            }
            disabledUntil.remove(engine);
            publisher.publishEvent(new EngineRecoveredEvent(engine, clock.now()));
            LOG.info("Engine recovered: {}", engine);
        }
    }

    @Scheduled(fixedRate = 60_000)
    void logHealthSummary() {
        Map<String, EngineState> sorted = new TreeMap<>(state);
        StringBuilder sb = new StringBuilder("Watchdog states: ");
        sorted.forEach((name, st) -> sb.append(name).append('=').append(st).append(' '));
        LOG.info(sb.toString().trim());
    }

    private void disableEngine(String engine, int failures) {
        state.put(engine, EngineState.DISABLED);
        Instant until = clock.now().plus(Duration.ofMinutes(props.getCooldownMinutes()));
        disabledUntil.put(engine, until);
        LOG.error("Engine {} disabled after {} failures within {}m; cooldown until {}",
                engine, failures, props.getWindowMinutes(), until);
    }

    private void pruneOld(Deque<Instant> window) {
        Instant cutoff = clock.now().minus(Duration.ofMinutes(props.getWindowMinutes()));
        while (!window.isEmpty() && window.peekFirst().isBefore(cutoff)) {
            window.removeFirst();
        }
    }
}
