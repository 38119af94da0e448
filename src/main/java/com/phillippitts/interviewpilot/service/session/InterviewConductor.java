package com.phillippitts.interviewpilot.service.session;

import com.phillippitts.interviewpilot.domain.AbortReason;
import com.phillippitts.interviewpilot.domain.BudgetState;
import com.phillippitts.interviewpilot.domain.Decision;
import com.phillippitts.interviewpilot.domain.Exchange;
import com.phillippitts.interviewpilot.domain.PlanItemView;
import com.phillippitts.interviewpilot.domain.QuestionSpec;
import com.phillippitts.interviewpilot.domain.SessionPhase;
import com.phillippitts.interviewpilot.domain.SessionSummary;
import com.phillippitts.interviewpilot.domain.TranscriptionResult;
import com.phillippitts.interviewpilot.domain.TransitionLogEntry;
import com.phillippitts.interviewpilot.exception.IllegalSessionStateException;
import com.phillippitts.interviewpilot.service.async.CancellationScope;
import com.phillippitts.interviewpilot.service.async.TimedCalls;
import com.phillippitts.interviewpilot.service.clock.InterviewClock;
import com.phillippitts.interviewpilot.service.clock.TimerHandle;
import com.phillippitts.interviewpilot.service.decision.DecisionRequest;
import com.phillippitts.interviewpilot.service.decision.FollowUpDecisionEngine;
import com.phillippitts.interviewpilot.service.metrics.InterviewMetricsPublisher;
import com.phillippitts.interviewpilot.service.session.event.BudgetExhaustedEvent;
import com.phillippitts.interviewpilot.service.session.event.ExchangeCompletedEvent;
import com.phillippitts.interviewpilot.service.session.event.SessionTerminatedEvent;
import com.phillippitts.interviewpilot.service.speech.DeliveryOutcome;
import com.phillippitts.interviewpilot.service.speech.EndOfTurnCause;
import com.phillippitts.interviewpilot.service.speech.ListeningWindow;
import com.phillippitts.interviewpilot.service.speech.SpeechIoAdapter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Drives one session through its phases by calling the speech adapter and the decision engine and
 * feeding their results back into the {@link SessionStateMachine}.
 *
 * <p><b>Threading:</b> every step runs on a per-session serial executor, so one session never
 * handles two steps at once while sessions run in parallel on the shared pool. Async results are
 * posted back as continuations stamped with the state machine's {@link SessionStateMachine#version()};
 * a continuation whose version no longer matches (deadline, abort, typed answer) is dropped.
 *
 * <p><b>Cancellation:</b> all outstanding calls register with the session's {@link CancellationScope}.
 * Closing cancels them before the closing statement; termination closes the scope.
 *
 * <p><b>Tie-break:</b> when the item cap and the global deadline fire together, the item cap is
 * ignored and the deadline forces closing.
 */
public class InterviewConductor implements SessionListener {

    private static final Logger LOG = LogManager.getLogger(InterviewConductor.class);

    public static final String MDC_SESSION_ID = "sessionId";

    static final String EVENT_GREETING = "greeting";
    static final String EVENT_QUESTION = "question";
    static final String EVENT_FOLLOW_UP = "follow_up";
    static final String EVENT_CLOSING = "closing";
    static final String EVENT_PHASE = "phase";
    static final String EVENT_SUMMARY = "summary";

    private final SessionStateMachine stateMachine;
    private final SpeechIoAdapter speech;
    private final FollowUpDecisionEngine decisions;
    private final InterviewClock clock;
    private final Executor serial;
    private final ConductorSettings settings;
    private final ApplicationEventPublisher publisher;
    private final InterviewMetricsPublisher metrics;
    private final Consumer<SessionSummary> onTerminated;
    private final CancellationScope scope;

    private volatile CandidateChannel channel = CandidateChannel.NONE;
    private volatile ListeningWindow window;
    private volatile TimerHandle deadlineTimer = TimerHandle.NONE;

    // touched only from the serial executor
    private TimerHandle itemTimer = TimerHandle.NONE;
    private long dispatchedVersion = -1;
    private boolean finished;

    /**
     * @param serial       executor that runs this session's steps one at a time
     * @param onTerminated called once with the terminal summary (e.g. to archive the session)
     */
    public InterviewConductor(SessionStateMachine stateMachine,
                              SpeechIoAdapter speech,
                              FollowUpDecisionEngine decisions,
                              InterviewClock clock,
                              Executor serial,
                              ConductorSettings settings,
                              ApplicationEventPublisher publisher,
                              InterviewMetricsPublisher metrics,
                              Consumer<SessionSummary> onTerminated) {
        this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine must not be null");
        this.speech = Objects.requireNonNull(speech, "speech must not be null");
        this.decisions = Objects.requireNonNull(decisions, "decisions must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.serial = Objects.requireNonNull(serial, "serial must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.metrics = metrics == null ? InterviewMetricsPublisher.NOOP : metrics;
        this.onTerminated = onTerminated == null ? summary -> { } : onTerminated;
        this.scope = new CancellationScope(stateMachine.getSessionId());
        stateMachine.addListener(this);
    }

    public String getSessionId() {
        return stateMachine.getSessionId();
    }

    public SessionStateMachine stateMachine() {
        return stateMachine;
    }

    /**
     * Starts the session and schedules the global deadline timer.
     *
     * @param plan         validated or raw plan items
     * @param deadlineFrom interview length measured from now
     * @throws com.phillippitts.interviewpilot.exception.InvalidPlanException if the plan is rejected
     * @throws IllegalSessionStateException if the session was already started
     */
    public void start(List<QuestionSpec> plan, Duration deadlineFrom) {
        Instant deadline = clock.now().plus(deadlineFrom);
        stateMachine.start(plan, deadline);
        onStarted(deadline);
    }

    /**
     * Starts the session with the plan staged on its state machine, including any edits made since.
     *
     * @throws com.phillippitts.interviewpilot.exception.InvalidPlanException if the staged plan is empty
     * @throws IllegalSessionStateException if the session was already started
     */
    public void start(Duration deadlineFrom) {
        Instant deadline = clock.now().plus(deadlineFrom);
        stateMachine.start(deadline);
        onStarted(deadline);
    }

    private void onStarted(Instant deadline) {
        metrics.sessionStarted();
        LOG.info("Session {} started: items={}, deadline={}", getSessionId(),
                stateMachine.status().items().size(), deadline);
        deadlineTimer = clock.scheduleAt(deadline, () -> post(this::handleDeadline));
        post(this::step);
    }

    public void attach(CandidateChannel candidateChannel) {
        this.channel = candidateChannel == null ? CandidateChannel.NONE : candidateChannel;
    }

    /** Detaches {@code candidateChannel} if it is the current one. */
    public boolean detach(CandidateChannel candidateChannel) {
        if (channel == candidateChannel) {
            channel = CandidateChannel.NONE;
            return true;
        }
        return false;
    }

    /** Feeds candidate audio into the open listening window; dropped when none is open. */
    public void acceptAudio(byte[] chunk) {
        ListeningWindow current = window;
        if (current != null) {
            current.accept(chunk);
        }
    }

    /** Explicit end of turn from the candidate. */
    public void endTurn() {
        requireListening("end_turn");
        post(() -> {
            ListeningWindow current = window;
            if (current != null) {
                current.endTurn(EndOfTurnCause.EXPLICIT);
            }
        });
    }

    /** Typed answer that replaces the audio of the current turn. */
    public void submitAnswer(String text) {
        requireListening("answer");
        long version = stateMachine.version();
        post(() -> {
            if (stateMachine.version() != version) {
                LOG.debug("Typed answer arrived after the turn ended; ignoring");
                return;
            }
            ListeningWindow current = window;
            window = null;
            itemTimer.cancel();
            stateMachine.onTranscript(text);
            if (current != null) {
                current.cancel();
            }
            step();
        });
    }

    public void pause(String note) {
        stateMachine.pause(note);
        LOG.info("Session {} paused", getSessionId());
    }

    public void resume() {
        stateMachine.resume();
        LOG.info("Session {} resumed", getSessionId());
        post(this::step);
    }

    /**
     * Aborts the session, cancelling every outstanding call.
     *
     * @return {@code false} if the session had already terminated
     */
    public boolean abort(AbortReason reason) {
        boolean aborted = stateMachine.abort(reason);
        if (aborted) {
            int cancelled = scope.cancelAll();
            LOG.info("Session {} aborted: cause={}, cancelledCalls={}", getSessionId(), reason.cause(), cancelled);
        }
        post(this::step);
        return aborted;
    }

    // -- session loop --

    private void handleDeadline() {
        if (stateMachine.onDeadline()) {
            LOG.info("Session {} reached its deadline; closing", getSessionId());
        }
        step();
    }

    private void step() {
        SessionPhase phase = stateMachine.phase();
        long version = stateMachine.version();
        if (phase.isTerminal()) {
            finish();
            return;
        }
        if (phase == SessionPhase.CREATED || version == dispatchedVersion) {
            return;
        }
        if (stateMachine.isPaused() && holdsWhilePaused(phase)) {
            LOG.debug("Session {} paused; holding {}", getSessionId(), phase);
            return;
        }
        dispatchedVersion = version;
        switch (phase) {
            case GREETING -> greet(version);
            case DELIVERING -> deliver(version, EVENT_QUESTION);
            case FOLLOWING_UP -> deliver(version, EVENT_FOLLOW_UP);
            case LISTENING -> listen(version);
            case DECIDING -> decide(version);
            case ADVANCING -> {
                stateMachine.advance();
                step();
            }
            case CLOSING -> close(version);
            default -> LOG.debug("Nothing to dispatch in {}", phase);
        }
    }

    private static boolean holdsWhilePaused(SessionPhase phase) {
        return phase == SessionPhase.GREETING || phase == SessionPhase.DELIVERING
                || phase == SessionPhase.FOLLOWING_UP;
    }

    private void greet(long version) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("text", settings.greeting());
        sendEvent(EVENT_GREETING, data);
        speech.speak(settings.greeting(), this::sendAudio, settings.synthesisTimeout(), scope)
                .thenAccept(outcome -> resumeIf(version, () -> {
                    stateMachine.advance();
                    step();
                }));
    }

    private void deliver(long version, String eventType) {
        PlanItemView item = stateMachine.activeItem()
                .orElseThrow(() -> new IllegalSessionStateException("No active item", SessionPhase.DELIVERING));
        String text = stateMachine.roundQuestion();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("itemId", item.id());
        data.put("text", text);
        data.put("type", item.type().name().toLowerCase(Locale.ROOT));
        data.put("round", stateMachine.round());
        data.put("targetSeconds", item.target().toSeconds());
        sendEvent(eventType, data);
        speech.speak(text, this::sendAudio, settings.synthesisTimeout(), scope)
                .thenAccept(outcome -> resumeIf(version, () -> {
                    if (outcome == DeliveryOutcome.TEXT_ONLY) {
                        LOG.info("Item {} delivered as text only", item.id());
                    }
                    stateMachine.onPromptDelivered();
                    step();
                }));
    }

    private void listen(long version) {
        PlanItemView item = stateMachine.activeItem()
                .orElseThrow(() -> new IllegalSessionStateException("No active item", SessionPhase.LISTENING));
        ListeningWindow turn = new ListeningWindow(item.id() + "#" + stateMachine.round(),
                settings.silenceDuration(), settings.silenceThreshold(), settings.maxTurn());
        window = turn;
        itemTimer.cancel();
        itemTimer = clock.schedule(stateMachine.activeItemRemaining(), () -> post(() -> onItemLimit(version, turn)));
        speech.transcribe(turn, settings.transcriptionTimeout(), scope)
                .whenComplete((result, error) -> resumeIf(version, () -> onTurnTranscribed(turn, result, error)));
    }

    private void onItemLimit(long version, ListeningWindow turn) {
        if (stateMachine.version() != version) {
            return;
        }
        Instant deadline = stateMachine.deadline();
        if (deadline != null && !clock.now().isBefore(deadline)) {
            return;
        }
        LOG.info("Item time cap reached in session {}; cutting off turn {}", getSessionId(), turn.label());
        turn.endTurn(EndOfTurnCause.ITEM_LIMIT);
    }

    private void onTurnTranscribed(ListeningWindow turn, TranscriptionResult result, Throwable error) {
        itemTimer.cancel();
        if (window == turn) {
            window = null;
        }
        String text;
        if (error == null) {
            text = result.text();
        } else {
            Throwable cause = TimedCalls.unwrap(error);
            if (cause instanceof CancellationException) {
                return;
            }
            LOG.info("Transcription failed in session {} ({}); continuing with no answer",
                    getSessionId(), cause.getClass().getSimpleName());
            text = TranscriptionResult.NO_ANSWER;
        }
        stateMachine.onTranscript(text);
        step();
    }

    private void decide(long version) {
        DecisionRequest request = stateMachine.decisionRequest();
        decisions.decide(request, scope).whenComplete((decision, error) -> resumeIf(version, () -> {
            Decision effective = decision;
            if (error != null) {
                Throwable cause = TimedCalls.unwrap(error);
                if (cause instanceof CancellationException) {
                    return;
                }
                LOG.warn("Decision engine failed in session {}: {}", getSessionId(), cause.toString());
                effective = Decision.advance("decision-error");
            }
            stateMachine.applyDecision(effective);
            step();
        }));
    }

    private void close(long version) {
        int cancelled = scope.cancelAll();
        itemTimer.cancel();
        cancelWindow();
        LOG.debug("Session {} closing; cancelled {} outstanding calls", getSessionId(), cancelled);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("text", settings.closing());
        sendEvent(EVENT_CLOSING, data);
        speech.speak(settings.closing(), this::sendAudio, settings.closingGrace(), scope)
                .thenAccept(outcome -> resumeIf(version, () -> {
                    stateMachine.advance();
                    step();
                }));
    }

    private void finish() {
        if (finished) {
            return;
        }
        finished = true;
        deadlineTimer.cancel();
        itemTimer.cancel();
        cancelWindow();
        scope.close();

        SessionSummary summary = stateMachine.summary();
        sendEvent(EVENT_SUMMARY, summaryPayload(summary));
        metrics.sessionTerminated(summary.phase().name(), summary.deadlineReached());
        LOG.info("Session {} terminated: phase={}, exchanges={}, elapsed={}, deadlineReached={}",
                summary.sessionId(), summary.phase(), summary.history().size(), summary.elapsed(),
                summary.deadlineReached());
        publisher.publishEvent(new SessionTerminatedEvent(summary));
        onTerminated.accept(summary);
    }

    private void cancelWindow() {
        ListeningWindow current = window;
        window = null;
        if (current != null) {
            current.cancel();
        }
    }

    // -- state machine callbacks --

    @Override
    public void onTransition(TransitionLogEntry entry) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("phase", entry.to().name());
        data.put("itemId", entry.itemId());
        sendEvent(EVENT_PHASE, data);
    }

    @Override
    public void onExchange(Exchange exchange) {
        metrics.decision(exchange.decision().kind().name());
        publisher.publishEvent(new ExchangeCompletedEvent(getSessionId(), exchange));
    }

    @Override
    public void onBudgetExhausted(List<String> skippedItemIds, BudgetState budget) {
        metrics.itemsSkipped(skippedItemIds.size());
        publisher.publishEvent(new BudgetExhaustedEvent(getSessionId(), skippedItemIds, budget.remaining(),
                budget.computedAt()));
    }

    // -- plumbing --

    private void resumeIf(long version, Runnable continuation) {
        post(() -> {
            if (stateMachine.version() != version) {
                LOG.debug("Dropping stale continuation in session {}", getSessionId());
                return;
            }
            continuation.run();
        });
    }

    private void post(Runnable task) {
        String sessionId = getSessionId();
        serial.execute(() -> {
            ThreadContext.put(MDC_SESSION_ID, sessionId);
            try {
                task.run();
            } finally {
                ThreadContext.remove(MDC_SESSION_ID);
            }
        });
    }

    private void requireListening(String signal) {
        SessionPhase phase = stateMachine.phase();
        if (phase != SessionPhase.LISTENING) {
            throw new IllegalSessionStateException(signal + " is only valid while listening", phase);
        }
    }

    private void sendEvent(String type, Map<String, Object> data) {
        channel.sendEvent(type, data);
    }

    private void sendAudio(byte[] chunk) {
        channel.sendAudio(chunk);
    }

    private static Map<String, Object> summaryPayload(SessionSummary summary) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("sessionId", summary.sessionId());
        data.put("phase", summary.phase().name());
        data.put("exchanges", summary.history().size());
        data.put("elapsedSeconds", summary.elapsed().toSeconds());
        data.put("deadlineReached", summary.deadlineReached());
        data.put("budgetExhausted", summary.budgetExhausted());
        data.put("followUps", summary.followUpCounts());
        data.put("abortReason", summary.abortReason() == null ? null : summary.abortReason().cause().name());
        return data;
    }
}
