package com.phillippitts.interviewpilot.service.speech;

import com.phillippitts.interviewpilot.domain.TranscriptionResult;
import com.phillippitts.interviewpilot.exception.SpeechException;
import com.phillippitts.interviewpilot.exception.SpeechTimeoutException;
import com.phillippitts.interviewpilot.service.async.CancellationScope;
import com.phillippitts.interviewpilot.service.async.CancellationToken;
import com.phillippitts.interviewpilot.service.async.InterruptibleTask;
import com.phillippitts.interviewpilot.service.async.TimedCalls;
import com.phillippitts.interviewpilot.service.clock.InterviewClock;
import com.phillippitts.interviewpilot.service.metrics.InterviewMetricsPublisher;
import com.phillippitts.interviewpilot.service.speech.watchdog.EngineFailureEvent;
import com.phillippitts.interviewpilot.service.speech.watchdog.EngineWatchdog;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Default {@link SpeechIoAdapter} over one transcription and one synthesis engine.
 *
 * <p><b>Failure handling:</b>
 * <ul>
 *   <li>Each failed or timed-out call publishes an {@link EngineFailureEvent} and a failure metric</li>
 *   <li>Engines disabled by the {@link EngineWatchdog} are not called; synthesis degrades to
 *       text-only and transcription fails fast with {@link SpeechException}</li>
 *   <li>Cancellations (deadline, abort) are not failures and publish nothing</li>
 * </ul>
 *
 * <p>Synthesized audio is pulled from the engine's lazy chunk stream on the io executor so that a
 * timeout can interrupt a blocked read.
 */
public class DefaultSpeechIoAdapter implements SpeechIoAdapter {

    private static final Logger LOG = LogManager.getLogger(DefaultSpeechIoAdapter.class);

    static final String OP_SYNTHESIZE = "synthesize";
    static final String OP_TRANSCRIBE = "transcribe";

    private final TranscriptionEngine transcriptionEngine;
    private final SynthesisEngine synthesisEngine;
    private final Executor ioExecutor;
    private final TimedCalls timedCalls;
    private final InterviewClock clock;
    private final ApplicationEventPublisher publisher;
    private final EngineWatchdog watchdog;
    private final InterviewMetricsPublisher metrics;

    /**
     * @param watchdog nullable; when absent every engine is considered enabled
     */
    public DefaultSpeechIoAdapter(TranscriptionEngine transcriptionEngine,
                                  SynthesisEngine synthesisEngine,
                                  Executor ioExecutor,
                                  InterviewClock clock,
                                  ApplicationEventPublisher publisher,
                                  EngineWatchdog watchdog,
                                  InterviewMetricsPublisher metrics) {
        this.transcriptionEngine = Objects.requireNonNull(transcriptionEngine, "transcriptionEngine must not be null");
        this.synthesisEngine = Objects.requireNonNull(synthesisEngine, "synthesisEngine must not be null");
        this.ioExecutor = Objects.requireNonNull(ioExecutor, "ioExecutor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.watchdog = watchdog;
        this.metrics = metrics == null ? InterviewMetricsPublisher.NOOP : metrics;
        this.timedCalls = new TimedCalls(clock);
    }

    @Override
    public CompletableFuture<DeliveryOutcome> speak(String text, AudioSink sink, Duration timeout,
                                                    CancellationScope scope) {
        Objects.requireNonNull(sink, "sink must not be null");
        String engine = synthesisEngine.getEngineName();
        if (text == null || text.isBlank()) {
            return CompletableFuture.completedFuture(DeliveryOutcome.SPOKEN);
        }
        if (!isEnabled(engine)) {
            LOG.debug("Synthesis engine {} disabled; delivering text only", engine);
            metrics.speechFailure(engine, OP_SYNTHESIZE, "disabled");
            return CompletableFuture.completedFuture(DeliveryOutcome.TEXT_ONLY);
        }

        long startNanos = System.nanoTime();
        return timedCalls.<Integer>call(
                        () -> InterruptibleTask.supply(ioExecutor, () -> stream(text, sink)),
                        timeout,
                        scope,
                        () -> new SpeechTimeoutException(OP_SYNTHESIZE, engine, timeout))
                .handle((chunks, error) -> {
                    if (error == null) {
                        metrics.speechSuccess(engine, OP_SYNTHESIZE, System.nanoTime() - startNanos);
                        markSuccess(engine);
                        return DeliveryOutcome.SPOKEN;
                    }
                    Throwable cause = TimedCalls.unwrap(error);
                    if (cause instanceof CancellationException) {
                        return DeliveryOutcome.CANCELLED;
                    }
                    reportFailure(engine, OP_SYNTHESIZE, cause);
                    return DeliveryOutcome.TEXT_ONLY;
                });
    }

    @Override
    public CompletableFuture<TranscriptionResult> transcribe(ListeningWindow window, Duration timeout,
                                                             CancellationScope scope) {
        Objects.requireNonNull(window, "window must not be null");
        CompletableFuture<TranscriptionResult> result = new CompletableFuture<>();
        CancellationToken waitToken = scope.register(() -> {
            window.cancel();
            result.cancel(false);
        });

        window.endOfTurn().whenComplete((turn, error) -> {
            waitToken.release();
            if (error != null) {
                result.completeExceptionally(TimedCalls.unwrap(error));
                return;
            }
            if (!turn.speechDetected()) {
                LOG.debug("Turn {} ended without speech (cause={})", window.label(), turn.cause());
                result.complete(TranscriptionResult.noAnswer(transcriptionEngine.getEngineName(), clock.now()));
                return;
            }
            transcribeAudio(turn.pcm(), timeout, scope).whenComplete((transcript, failure) -> {
                if (failure == null) {
                    result.complete(transcript);
                } else {
                    result.completeExceptionally(TimedCalls.unwrap(failure));
                }
            });
        });
        return result;
    }

    private CompletableFuture<TranscriptionResult> transcribeAudio(byte[] pcm, Duration timeout,
                                                                   CancellationScope scope) {
        String engine = transcriptionEngine.getEngineName();
        if (!isEnabled(engine)) {
            metrics.speechFailure(engine, OP_TRANSCRIBE, "disabled");
            return CompletableFuture.failedFuture(new SpeechException("Transcription engine disabled", engine));
        }
        long startNanos = System.nanoTime();
        CompletableFuture<TranscriptionResult> call = timedCalls.call(
                () -> transcriptionEngine.transcribe(pcm),
                timeout,
                scope,
                () -> new SpeechTimeoutException(OP_TRANSCRIBE, engine, timeout));
        call.whenComplete((transcript, error) -> {
            if (error == null) {
                metrics.speechSuccess(engine, OP_TRANSCRIBE, System.nanoTime() - startNanos);
                markSuccess(engine);
                return;
            }
            Throwable cause = TimedCalls.unwrap(error);
            if (!(cause instanceof CancellationException)) {
                reportFailure(engine, OP_TRANSCRIBE, cause);
            }
        });
        return call;
    }

    private int stream(String text, AudioSink sink) {
        int chunks = 0;
        for (byte[] chunk : synthesisEngine.synthesize(text)) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("synthesis interrupted");
            }
            sink.accept(chunk);
            chunks++;
        }
        return chunks;
    }

    private boolean isEnabled(String engine) {
        return watchdog == null || watchdog.isEngineEnabled(engine);
    }

    private void markSuccess(String engine) {
        if (watchdog != null) {
            watchdog.recordSuccess(engine);
        }
    }

    private void reportFailure(String engine, String operation, Throwable cause) {
        String reason = cause instanceof SpeechTimeoutException ? "timeout" : "error";
        LOG.warn("Speech {} failed: engine={}, reason={}, error={}", operation, engine, reason, cause.toString());
        metrics.speechFailure(engine, operation, reason);
        publisher.publishEvent(new EngineFailureEvent(engine, clock.now(), operation + " " + reason, cause,
                Map.of("operation", operation, "reason", reason)));
    }
}
