package com.phillippitts.interviewpilot.service.session;

import com.phillippitts.interviewpilot.domain.AbortReason;
import com.phillippitts.interviewpilot.domain.PlanItemView;
import com.phillippitts.interviewpilot.domain.QuestionSpec;
import com.phillippitts.interviewpilot.domain.SessionPhase;
import com.phillippitts.interviewpilot.domain.SessionStatus;
import com.phillippitts.interviewpilot.domain.SessionSummary;
import com.phillippitts.interviewpilot.exception.InvalidPlanException;
import com.phillippitts.interviewpilot.exception.SessionNotFoundException;
import com.phillippitts.interviewpilot.service.async.SerialExecutor;
import com.phillippitts.interviewpilot.service.plan.PlanDefaults;
import com.phillippitts.interviewpilot.service.plan.PlanValidator;
import com.phillippitts.interviewpilot.service.plan.QuestionDraft;
import com.phillippitts.interviewpilot.service.plan.QuestionPlanSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Entry point for REST and WebSocket surfaces: creates sessions, routes control signals to their
 * conductors and answers status queries from live sessions or the archive.
 *
 * <p>A session is started explicitly or when its candidate channel attaches. Closing the channel of
 * a running session aborts it with {@link AbortReason.Cause#CHANNEL_CLOSED}.
 */
public class InterviewSessionService {

    private static final Logger LOG = LogManager.getLogger(InterviewSessionService.class);

    private final SessionRegistry registry;
    private final SessionDependencies deps;
    private final QuestionPlanSource planSource;
    private final PlanDefaults planDefaults;
    private final ConductorSettings settings;
    private final Duration defaultLength;
    private final int maxFollowUpDepth;

    /**
     * @param planSource nullable; without it sessions need an inline plan
     */
    public InterviewSessionService(SessionRegistry registry,
                                   SessionDependencies deps,
                                   QuestionPlanSource planSource,
                                   PlanDefaults planDefaults,
                                   ConductorSettings settings,
                                   Duration defaultLength,
                                   int maxFollowUpDepth) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.deps = Objects.requireNonNull(deps, "deps must not be null");
        this.planSource = planSource;
        this.planDefaults = Objects.requireNonNull(planDefaults, "planDefaults must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.defaultLength = Objects.requireNonNull(defaultLength, "defaultLength must not be null");
        this.maxFollowUpDepth = maxFollowUpDepth;
    }

    /**
     * Creates and registers a session. The plan is validated and staged now so that a bad plan is
     * reported to the creator rather than at start, and so that it can be edited before start.
     *
     * @throws InvalidPlanException if the plan is empty or malformed
     */
    public SessionStatus create(CreateSessionCommand command) {
        List<QuestionDraft> drafts = command.plan();
        if (drafts == null) {
            if (planSource == null) {
                throw new InvalidPlanException("No plan given and no plan source configured");
            }
            drafts = planSource.fetchPlan(command.candidateRef(), command.jobRef());
        }
        List<QuestionSpec> plan = planDefaults.apply(drafts);
        PlanValidator.validate(plan);

        Duration length = command.length() != null ? command.length() : defaultLength;
        if (length.isZero() || length.isNegative()) {
            throw new InvalidPlanException("Interview length must be positive: " + length);
        }

        String sessionId = UUID.randomUUID().toString();
        SessionStateMachine stateMachine = new SessionStateMachine(sessionId, command.candidateRef(),
                command.jobRef(), deps.getClock(), deps.getAllocator(), maxFollowUpDepth);
        InterviewConductor conductor = new InterviewConductor(stateMachine, deps.getSpeech(), deps.getDecisions(),
                deps.getClock(), new SerialExecutor(deps.getSessionExecutor()), settings, deps.getPublisher(),
                deps.getMetrics(), registry::archive);
        stateMachine.stage(plan);
        registry.register(new LiveSession(conductor, length));
        LOG.info("Session {} created: items={}, length={}", sessionId, plan.size(), length);
        return stateMachine.status();
    }

    /** Starts a created session. */
    public SessionStatus start(String sessionId) {
        LiveSession session = registry.require(sessionId);
        session.conductor().start(session.length());
        return session.conductor().stateMachine().status();
    }

    public SessionStatus status(String sessionId) {
        return registry.find(sessionId)
                .map(s -> s.conductor().stateMachine().status())
                .orElseGet(() -> registry.findArchived(sessionId)
                        .map(InterviewSessionService::archivedStatus)
                        .orElseThrow(() -> new SessionNotFoundException(sessionId)));
    }

    public List<SessionStatus> list() {
        return registry.live().stream()
                .map(s -> s.conductor().stateMachine().status())
                .sorted(Comparator.comparing(SessionStatus::sessionId))
                .toList();
    }

    public SessionSummary summary(String sessionId) {
        return registry.find(sessionId)
                .map(s -> s.conductor().stateMachine().summary())
                .orElseGet(() -> registry.findArchived(sessionId)
                        .orElseThrow(() -> new SessionNotFoundException(sessionId)));
    }

    public boolean abort(String sessionId, String detail) {
        return conductor(sessionId).abort(AbortReason.external(detail));
    }

    public void pause(String sessionId, String note) {
        conductor(sessionId).pause(note);
    }

    public void resume(String sessionId) {
        conductor(sessionId).resume();
    }

    public void endTurn(String sessionId) {
        conductor(sessionId).endTurn();
    }

    public void answer(String sessionId, String text) {
        conductor(sessionId).submitAnswer(text);
    }

    public void acceptAudio(String sessionId, byte[] chunk) {
        registry.find(sessionId).ifPresent(s -> s.conductor().acceptAudio(chunk));
    }

    /** Appends an item to a session's plan, before or after start. */
    public SessionStatus appendItem(String sessionId, QuestionDraft draft) {
        SessionStateMachine stateMachine = conductor(sessionId).stateMachine();
        Set<String> taken = stateMachine.status().items().stream().map(PlanItemView::id).collect(Collectors.toSet());
        int position = taken.size() + 1;
        while (taken.contains("q" + position)) {
            position++;
        }
        stateMachine.appendItem(planDefaults.apply(draft, position));
        return stateMachine.status();
    }

    /** Removes a pending item from a session's plan. */
    public SessionStatus removeItem(String sessionId, String itemId) {
        SessionStateMachine stateMachine = conductor(sessionId).stateMachine();
        stateMachine.removeItem(itemId);
        return stateMachine.status();
    }

    /** Moves a pending item to {@code index} in plan order. */
    public SessionStatus moveItem(String sessionId, String itemId, int index) {
        SessionStateMachine stateMachine = conductor(sessionId).stateMachine();
        stateMachine.moveItem(itemId, index);
        return stateMachine.status();
    }

    /**
     * Attaches the candidate channel and starts the session if it has not started yet.
     */
    public void attach(String sessionId, CandidateChannel channel) {
        LiveSession session = registry.require(sessionId);
        InterviewConductor conductor = session.conductor();
        conductor.attach(channel);
        if (conductor.stateMachine().phase() == SessionPhase.CREATED) {
            conductor.start(session.length());
        }
    }

    /**
     * Detaches the candidate channel. A session that loses its current channel before finishing is aborted.
     */
    public void detach(String sessionId, CandidateChannel channel, String detail) {
        registry.find(sessionId).ifPresent(session -> {
            InterviewConductor conductor = session.conductor();
            if (conductor.detach(channel) && conductor.stateMachine().phase() != SessionPhase.CREATED) {
                conductor.abort(new AbortReason(AbortReason.Cause.CHANNEL_CLOSED, detail));
            }
        });
    }

    /** Aborts every live session; used on application shutdown. */
    public int abortAll(AbortReason reason) {
        int aborted = 0;
        for (LiveSession session : registry.live()) {
            if (session.conductor().abort(reason)) {
                aborted++;
            }
        }
        return aborted;
    }

    /** Aborts live sessions on application shutdown. */
    public void shutdown() {
        int aborted = abortAll(new AbortReason(AbortReason.Cause.SHUTDOWN, "application shutdown"));
        if (aborted > 0) {
            LOG.info("Aborted {} live sessions on shutdown", aborted);
        }
    }

    private InterviewConductor conductor(String sessionId) {
        return registry.require(sessionId).conductor();
    }

    private static SessionStatus archivedStatus(SessionSummary summary) {
        return new SessionStatus(summary.sessionId(), summary.candidateRef(), summary.jobRef(), summary.phase(), false,
                summary.startedAt(), summary.deadline(), Duration.ZERO, null, summary.items(), summary.history().size());
    }
}
