package com.phillippitts.interviewpilot.service.session;

import com.phillippitts.interviewpilot.domain.AbortReason;
import com.phillippitts.interviewpilot.domain.BudgetState;
import com.phillippitts.interviewpilot.domain.Decision;
import com.phillippitts.interviewpilot.domain.Exchange;
import com.phillippitts.interviewpilot.domain.FailureKind;
import com.phillippitts.interviewpilot.domain.Interruption;
import com.phillippitts.interviewpilot.domain.PlanItemView;
import com.phillippitts.interviewpilot.domain.QuestionSpec;
import com.phillippitts.interviewpilot.domain.SessionPhase;
import com.phillippitts.interviewpilot.domain.SessionStatus;
import com.phillippitts.interviewpilot.domain.SessionSummary;
import com.phillippitts.interviewpilot.domain.SessionWarning;
import com.phillippitts.interviewpilot.domain.TranscriptionResult;
import com.phillippitts.interviewpilot.domain.TransitionLogEntry;
import com.phillippitts.interviewpilot.exception.IllegalSessionStateException;
import com.phillippitts.interviewpilot.service.budget.AllocationResult;
import com.phillippitts.interviewpilot.service.budget.TimeBudgetAllocator;
import com.phillippitts.interviewpilot.service.clock.InterviewClock;
import com.phillippitts.interviewpilot.service.decision.DecisionRequest;
import com.phillippitts.interviewpilot.service.plan.PlanValidator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Canonical state of one interview session and the only writer of it.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * CREATED → GREETING                     (start)
 * GREETING | ADVANCING → DELIVERING      (advance, next pending item)
 * GREETING | ADVANCING → CLOSING         (advance, plan exhausted)
 * DELIVERING | FOLLOWING_UP → LISTENING  (onPromptDelivered)
 * LISTENING → DECIDING                   (onTranscript)
 * DECIDING → FOLLOWING_UP | ADVANCING    (applyDecision)
 * any bound phase → DELIVERING | CLOSING (advance, forced)
 * any non-terminal → CLOSING             (onDeadline)
 * CLOSING → COMPLETED                    (advance)
 * any non-terminal → ABORTED             (abort)
 * </pre>
 *
 * <p>Leaving {@code LISTENING} or {@code DECIDING} appends exactly one {@link Exchange}, except an
 * abort before an answer was captured. The {@link TimeBudgetAllocator} runs at start and after every
 * exchange; its skips are recorded as a {@code BUDGET_EXHAUSTED} warning.
 *
 * <p><b>Thread Safety:</b> every public method is guarded by a {@link ReentrantLock}, so two
 * transitions never interleave. Listeners are notified after the lock is released, one notification
 * at a time and in the order the changes were recorded, whichever thread made them.
 */
public final class SessionStateMachine {

    private static final Logger LOG = LogManager.getLogger(SessionStateMachine.class);

    private final Lock lock = new ReentrantLock();
    private final ReentrantLock dispatchLock = new ReentrantLock();
    private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();
    private final Deque<Consumer<SessionListener>> outbox = new ArrayDeque<>();

    private final String sessionId;
    private final String candidateRef;
    private final String jobRef;
    private final InterviewClock clock;
    private final TimeBudgetAllocator allocator;
    private final int maxFollowUpDepth;

    private final List<Exchange> history = new ArrayList<>();
    private final List<TransitionLogEntry> log = new ArrayList<>();
    private final List<SessionWarning> warnings = new ArrayList<>();
    private final List<Interruption> interruptions = new ArrayList<>();

    private SessionPhase phase = SessionPhase.CREATED;
    private QuestionPlan plan = new QuestionPlan(List.of());
    private BudgetState budget;
    private Instant startedAt;
    private Instant deadline;
    private Instant endedAt;
    private AbortReason abortReason;
    private boolean deadlineReached;
    private long version;
    private long sequence;

    private int round;
    private String roundQuestion;
    private Instant roundStartedAt;
    private String transcript;

    /**
     * @param sessionId        session identifier
     * @param candidateRef     candidate reference
     * @param jobRef           job reference
     * @param clock            time source
     * @param allocator        budget allocator
     * @param maxFollowUpDepth follow-ups allowed per item; extra follow-up decisions become advances
     */
    public SessionStateMachine(String sessionId, String candidateRef, String jobRef, InterviewClock clock,
                               TimeBudgetAllocator allocator, int maxFollowUpDepth) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId must not be null");
        this.candidateRef = candidateRef;
        this.jobRef = jobRef;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.allocator = Objects.requireNonNull(allocator, "allocator must not be null");
        if (maxFollowUpDepth < 0) {
            throw new IllegalArgumentException("maxFollowUpDepth must not be negative");
        }
        this.maxFollowUpDepth = maxFollowUpDepth;
    }

    public void addListener(SessionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public String getSessionId() {
        return sessionId;
    }

    /**
     * Loads the plan of a created session so that it can be inspected and edited before start.
     *
     * @throws com.phillippitts.interviewpilot.exception.InvalidPlanException if the plan is empty or malformed
     * @throws IllegalSessionStateException if the session was already started
     */
    public void stage(List<QuestionSpec> specs) {
        mutate(() -> {
            requirePhase(SessionPhase.CREATED, "stage");
            PlanValidator.validate(specs);
            this.plan = new QuestionPlan(specs);
            return null;
        });
    }

    /**
     * Replaces the staged plan with {@code specs} and starts. See {@link #start(Instant)}.
     */
    public BudgetState start(List<QuestionSpec> specs, Instant deadline) {
        Objects.requireNonNull(deadline, "deadline must not be null");
        return mutate(() -> {
            requirePhase(SessionPhase.CREATED, "start");
            PlanValidator.validate(specs);
            this.plan = new QuestionPlan(specs);
            return begin(deadline);
        });
    }

    /**
     * Validates the staged plan and moves {@code CREATED → GREETING}. Scheduling the deadline timer is
     * the caller's job.
     *
     * @throws com.phillippitts.interviewpilot.exception.InvalidPlanException if the plan is empty or malformed
     * @throws IllegalSessionStateException if the session was already started
     */
    public BudgetState start(Instant deadline) {
        Objects.requireNonNull(deadline, "deadline must not be null");
        return mutate(() -> {
            requirePhase(SessionPhase.CREATED, "start");
            PlanValidator.validate(plan.specs());
            return begin(deadline);
        });
    }

    /**
     * Closes the active item (answered if it has an exchange, otherwise skipped) and activates the
     * next pending item, or moves to {@code CLOSING}. From {@code CLOSING} completes the session.
     *
     * @return {@code false} if nothing changed (not started or already terminal)
     */
    public boolean advance() {
        return mutate(() -> {
            switch (phase) {
                case CREATED, COMPLETED, ABORTED -> {
                    return false;
                }
                case CLOSING -> {
                    finish();
                    transition(SessionPhase.COMPLETED, "closing delivered");
                    return true;
                }
                case LISTENING, DECIDING -> recordRound(Decision.forceAdvance("advanced"));
                default -> {
                    // GREETING, DELIVERING, FOLLOWING_UP, ADVANCING carry no open answer
                }
            }
            pullNext(phase == SessionPhase.GREETING ? "greeting done" : "advance");
            return true;
        });
    }

    /** {@code DELIVERING | FOLLOWING_UP → LISTENING}. */
    public boolean onPromptDelivered() {
        return mutate(() -> {
            if (phase != SessionPhase.DELIVERING && phase != SessionPhase.FOLLOWING_UP) {
                return false;
            }
            transition(SessionPhase.LISTENING, "prompt delivered");
            return true;
        });
    }

    /**
     * Records the answer of the current round and moves {@code LISTENING → DECIDING}.
     *
     * @param text transcript, or {@link TranscriptionResult#NO_ANSWER}
     * @return the request to hand to the decision engine
     * @throws IllegalSessionStateException if the session is not listening
     */
    public DecisionRequest onTranscript(String text) {
        return mutate(() -> {
            requirePhase(SessionPhase.LISTENING, "onTranscript");
            transcript = text == null ? TranscriptionResult.NO_ANSWER : text.trim();
            transition(SessionPhase.DECIDING, TranscriptionResult.isNoAnswer(transcript) ? "no answer" : "answer captured");
            return buildDecisionRequest();
        });
    }

    /** Rebuilds the decision request for the round being decided. */
    public DecisionRequest decisionRequest() {
        return read(() -> {
            requirePhase(SessionPhase.DECIDING, "decisionRequest");
            return buildDecisionRequest();
        });
    }

    /**
     * Appends the round's exchange and acts on the decision. A follow-up beyond the configured depth
     * is recorded as {@code Advance("depth-exhausted")}.
     *
     * @return the exchange appended to history
     * @throws IllegalSessionStateException if the session is not deciding
     */
    public Exchange applyDecision(Decision decision) {
        Objects.requireNonNull(decision, "decision must not be null");
        return mutate(() -> {
            requirePhase(SessionPhase.DECIDING, "applyDecision");
            PlanItem item = requireActive();
            Decision effective = decision;
            if (decision.kind() == Decision.Kind.FOLLOW_UP && item.followUpsIssued() >= maxFollowUpDepth) {
                effective = Decision.advance("depth-exhausted");
            }
            Exchange exchange = recordRound(effective);
            switch (effective.kind()) {
                case FOLLOW_UP -> {
                    item.recordFollowUp();
                    beginRound(round + 1, ((Decision.FollowUp) effective).text());
                    transition(SessionPhase.FOLLOWING_UP, "follow-up " + item.followUpsIssued());
                    reallocate(reserveFor(item));
                }
                case ADVANCE, FORCE_ADVANCE -> {
                    transition(SessionPhase.ADVANCING, effective.kind() + " " + effective.reason());
                    reallocate(Duration.ZERO);
                }
            }
            return exchange;
        });
    }

    /**
     * Forces {@code CLOSING}. Pending items are skipped and an open round is closed with
     * {@code ForceAdvance("deadline")}. Later calls have no effect.
     *
     * @return {@code true} only for the call that forced closing
     */
    public boolean onDeadline() {
        return mutate(() -> {
            if (phase.isTerminal() || phase == SessionPhase.CLOSING) {
                return false;
            }
            if (phase == SessionPhase.LISTENING || phase == SessionPhase.DECIDING) {
                recordRound(Decision.forceAdvance("deadline"));
            }
            plan.active().ifPresent(PlanItem::close);
            List<PlanItem> pending = plan.pending();
            pending.forEach(PlanItem::skip);
            deadlineReached = true;
            warn(FailureKind.DEADLINE_EXCEEDED, "deadline reached, " + pending.size() + " pending items skipped");
            transition(SessionPhase.CLOSING, "deadline");
            return true;
        });
    }

    /**
     * Terminates the session. An answer already captured is kept as a {@code ForceAdvance} exchange.
     *
     * @return {@code false} if the session was already terminal
     */
    public boolean abort(AbortReason reason) {
        Objects.requireNonNull(reason, "reason must not be null");
        return mutate(() -> {
            if (phase.isTerminal()) {
                return false;
            }
            if (phase == SessionPhase.DECIDING) {
                recordRound(Decision.forceAdvance("aborted"));
            }
            plan.active().ifPresent(PlanItem::close);
            abortReason = reason;
            finish();
            transition(SessionPhase.ABORTED, reason.cause() + (reason.detail().isEmpty() ? "" : ": " + reason.detail()));
            return true;
        });
    }

    /**
     * Starts an interruption. The deadline keeps running.
     *
     * @throws IllegalSessionStateException if not started, terminal, or already paused
     */
    public void pause(String note) {
        mutate(() -> {
            if (phase == SessionPhase.CREATED || phase.isTerminal()) {
                throw new IllegalSessionStateException("Cannot pause session " + sessionId, phase);
            }
            if (isPausedLocked()) {
                throw new IllegalSessionStateException("Session " + sessionId + " is already paused", phase);
            }
            interruptions.add(new Interruption(clock.now(), null, note));
            note("paused");
            return null;
        });
    }

    /**
     * Ends the current interruption.
     *
     * @throws IllegalSessionStateException if the session is not paused
     */
    public void resume() {
        mutate(() -> {
            if (!isPausedLocked()) {
                throw new IllegalSessionStateException("Session " + sessionId + " is not paused", phase);
            }
            closeInterruption(clock.now());
            note("resumed");
            return null;
        });
    }

    /** Appends an item to the plan. Once started, the budget is rebalanced. */
    public void appendItem(QuestionSpec spec) {
        Objects.requireNonNull(spec, "spec must not be null");
        mutate(() -> {
            requireEditable("appendItem");
            PlanValidator.validate(List.of(spec));
            plan.append(spec);
            rebalance();
            return null;
        });
    }

    /** Removes a pending item. The active item cannot be removed. */
    public void removeItem(String itemId) {
        mutate(() -> {
            requireEditable("removeItem");
            plan.remove(itemId, phase);
            rebalance();
            return null;
        });
    }

    /** Moves a pending item to {@code index} in plan order. */
    public void moveItem(String itemId, int index) {
        mutate(() -> {
            requireEditable("moveItem");
            plan.move(itemId, index, phase);
            return null;
        });
    }

    public SessionPhase phase() {
        return read(() -> phase);
    }

    /** Number of phase transitions so far; changes whenever the phase changes. */
    public long version() {
        return read(() -> version);
    }

    public boolean isPaused() {
        return read(this::isPausedLocked);
    }

    public Instant deadline() {
        return read(() -> deadline);
    }

    public Optional<PlanItemView> activeItem() {
        return read(() -> plan.active().map(PlanItem::view));
    }

    /** Time left before the active item reaches its maximum, or zero when no item is active. */
    public Duration activeItemRemaining() {
        return read(() -> plan.active()
                .map(item -> item.spec().max().minus(item.elapsed(clock.now())))
                .filter(left -> !left.isNegative())
                .orElse(Duration.ZERO));
    }

    /** Text delivered (or to be delivered) in the current round. */
    public String roundQuestion() {
        return read(() -> roundQuestion);
    }

    public int round() {
        return read(() -> round);
    }

    public BudgetState budget() {
        return read(() -> budget);
    }

    public SessionStatus status() {
        return read(() -> {
            Duration remaining = null;
            if (deadline != null) {
                remaining = Duration.between(clock.now(), deadline);
                remaining = remaining.isNegative() ? Duration.ZERO : remaining;
            }
            return new SessionStatus(sessionId, candidateRef, jobRef, phase, isPausedLocked(), startedAt, deadline,
                    remaining, plan.active().map(PlanItem::id).orElse(null), plan.views(), history.size());
        });
    }

    public SessionSummary summary() {
        return read(() -> new SessionSummary(sessionId, candidateRef, jobRef, phase, startedAt, deadline, endedAt,
                history, log, plan.views(), warnings, interruptions, abortReason, deadlineReached));
    }

    // -- internals, called with the lock held --

    private BudgetState begin(Instant at) {
        this.startedAt = clock.now();
        this.deadline = at;
        transition(SessionPhase.GREETING, "started with " + plan.pendingViews().size() + " items");
        reallocate(Duration.ZERO);
        return budget;
    }

    private void pullNext(String note) {
        plan.active().ifPresent(PlanItem::close);
        Optional<PlanItem> next = plan.nextPending();
        if (next.isEmpty()) {
            transition(SessionPhase.CLOSING, "plan exhausted");
            return;
        }
        PlanItem item = next.get();
        item.activate(clock.now());
        // the floor now covers only items after this one; this item keeps its own minimum in reserve
        reallocate(reserveFor(item));
        beginRound(0, item.spec().text());
        transition(SessionPhase.DELIVERING, note);
    }

    private void beginRound(int number, String question) {
        round = number;
        roundQuestion = question;
        roundStartedAt = clock.now();
        transcript = null;
    }

    private Exchange recordRound(Decision decision) {
        PlanItem item = requireActive();
        Instant now = clock.now();
        Duration elapsed = roundStartedAt == null ? Duration.ZERO : Duration.between(roundStartedAt, now);
        String answer = phase == SessionPhase.DECIDING && transcript != null ? transcript : TranscriptionResult.NO_ANSWER;
        Exchange exchange = new Exchange(item.id(), round, roundQuestion, answer, decision,
                elapsed.isNegative() ? Duration.ZERO : elapsed, now);
        history.add(exchange);
        item.recordExchange();
        transcript = null;
        outbox.add(l -> l.onExchange(exchange));
        return exchange;
    }

    private void reallocate(Duration activeReserve) {
        AllocationResult result = allocator.allocate(plan.pendingViews(), activeReserve, clock.now(), deadline);
        for (String id : result.skipped()) {
            plan.find(id).ifPresent(PlanItem::skip);
        }
        result.budget().targets().forEach((id, target) -> plan.find(id).ifPresent(i -> i.retarget(target)));
        budget = result.budget();
        if (result.budgetExhausted()) {
            List<String> skipped = result.skipped();
            BudgetState snapshot = budget;
            LOG.debug("Budget exhausted for session {}: skipped {} (remaining={})", sessionId, skipped,
                    snapshot.remaining());
            warn(FailureKind.BUDGET_EXHAUSTED, "skipped " + skipped);
            outbox.add(l -> l.onBudgetExhausted(skipped, snapshot));
        }
    }

    private Duration reserveFor(PlanItem item) {
        Duration owed = item.spec().min().minus(item.elapsed(clock.now()));
        return owed.isNegative() ? Duration.ZERO : owed;
    }

    private void rebalance() {
        if (phase != SessionPhase.CREATED) {
            reallocate(currentReserve());
        }
    }

    private Duration currentReserve() {
        if (phase == SessionPhase.ADVANCING || !phase.isItemBound()) {
            return Duration.ZERO;
        }
        return plan.active().map(this::reserveFor).orElse(Duration.ZERO);
    }

    private DecisionRequest buildDecisionRequest() {
        PlanItem item = requireActive();
        Instant now = clock.now();
        return new DecisionRequest(item.id(), item.spec().text(), roundQuestion, transcript, item.spec().rubric(),
                item.spec().type(), item.elapsed(now), item.spec().max(), item.followUpsIssued(), budget, now);
    }

    private void transition(SessionPhase to, String note) {
        SessionPhase from = phase;
        phase = to;
        version++;
        TransitionLogEntry entry = appendLog(from, to, note);
        LOG.debug("Session {} {} -> {} ({})", sessionId, from, to, note);
        outbox.add(l -> l.onTransition(entry));
    }

    private void warn(FailureKind kind, String detail) {
        warnings.add(new SessionWarning(kind, clock.now(), detail));
        appendLog(phase, phase, kind + ": " + detail);
    }

    private void note(String text) {
        appendLog(phase, phase, text);
    }

    private TransitionLogEntry appendLog(SessionPhase from, SessionPhase to, String note) {
        TransitionLogEntry entry = new TransitionLogEntry(++sequence, clock.now(), from, to,
                plan.active().map(PlanItem::id).orElse(null), note);
        log.add(entry);
        return entry;
    }

    private void finish() {
        endedAt = clock.now();
        closeInterruption(endedAt);
    }

    private boolean isPausedLocked() {
        return !interruptions.isEmpty() && interruptions.get(interruptions.size() - 1).resumedAt() == null;
    }

    private void closeInterruption(Instant at) {
        if (isPausedLocked()) {
            int last = interruptions.size() - 1;
            interruptions.set(last, interruptions.get(last).resume(at));
        }
    }

    private PlanItem requireActive() {
        return plan.active().orElseThrow(
                () -> new IllegalSessionStateException("No active plan item in session " + sessionId, phase));
    }

    private void requirePhase(SessionPhase expected, String operation) {
        if (phase != expected) {
            throw new IllegalSessionStateException(operation + " requires " + expected, phase);
        }
    }

    private void requireEditable(String operation) {
        if (phase == SessionPhase.CLOSING || phase.isTerminal()) {
            throw new IllegalSessionStateException(operation + " is not allowed", phase);
        }
    }

    private <T> T read(Supplier<T> reader) {
        lock.lock();
        try {
            return reader.get();
        } finally {
            lock.unlock();
        }
    }

    private <T> T mutate(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
            drainOutbox();
        }
    }

    /**
     * Delivers queued notifications in FIFO order. Only one thread drains at a time; a thread that
     * finds another one draining leaves its notifications to it. A listener that mutates this state
     * machine does not drain re-entrantly, so every listener sees notifications in the same order.
     */
    private void drainOutbox() {
        if (dispatchLock.isHeldByCurrentThread()) {
            return;
        }
        while (hasPendingNotifications()) {
            if (!dispatchLock.tryLock()) {
                return;
            }
            try {
                Consumer<SessionListener> notification;
                while ((notification = pollNotification()) != null) {
                    dispatch(notification);
                }
            } finally {
                dispatchLock.unlock();
            }
        }
    }

    private boolean hasPendingNotifications() {
        return read(() -> !outbox.isEmpty());
    }

    private Consumer<SessionListener> pollNotification() {
        return read(outbox::pollFirst);
    }

    private void dispatch(Consumer<SessionListener> notification) {
        for (SessionListener listener : listeners) {
            try {
                notification.accept(listener);
            } catch (RuntimeException e) {
                LOG.warn("Session listener failed for {}: {}", sessionId, e.toString());
            }
        }
    }
}
