package com.phillippitts.interviewpilot.service.speech;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Collects the candidate's audio for one turn and signals the end of the turn.
 *
 * <p>The turn ends on the first of:
 * <ul>
 *   <li>trailing silence of at least the configured duration, counted only after speech was heard</li>
 *   <li>an explicit {@link #endTurn(EndOfTurnCause)} from the caller</li>
 *   <li>the buffer reaching its maximum length</li>
 * </ul>
 * Chunks arriving after the end of turn are ignored.
 *
 * <p><b>Thread Safety:</b> chunks and cutoffs may arrive from different threads; the end-of-turn
 * future is completed outside the internal lock.
 */
public final class ListeningWindow {

    private static final Logger LOG = LogManager.getLogger(ListeningWindow.class);

    private final String label;
    private final long silenceBytes;
    private final int silenceThreshold;
    private final long maxBytes;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final CompletableFuture<CapturedTurn> endOfTurn = new CompletableFuture<>();

    private boolean closed;
    private boolean speechDetected;
    private long trailingSilence;

    /**
     * @param label            identifies the turn in logs (e.g. item id and round)
     * @param silenceDuration  trailing silence that ends the turn
     * @param silenceThreshold RMS amplitude below which audio counts as silence
     * @param maxTurn          longest turn that will be buffered
     */
    public ListeningWindow(String label, Duration silenceDuration, int silenceThreshold, Duration maxTurn) {
        this.label = label;
        this.silenceBytes = Math.max(AudioFormat.REQUIRED_BLOCK_ALIGN, AudioFormat.bytesFor(silenceDuration));
        this.silenceThreshold = silenceThreshold;
        this.maxBytes = AudioFormat.bytesFor(maxTurn);
    }

    /**
     * Appends a chunk of candidate audio.
     *
     * @return {@code false} if the turn had already ended and the chunk was ignored
     */
    public boolean accept(byte[] chunk) {
        if (chunk == null || chunk.length == 0) {
            return !isClosed();
        }
        CapturedTurn finished = null;
        synchronized (this) {
            if (closed) {
                return false;
            }
            long room = maxBytes - buffer.size();
            int usable = (int) Math.min(chunk.length, Math.max(0, room));
            buffer.write(chunk, 0, usable);

            AudioSilenceDetector.ChunkAnalysis analysis = AudioSilenceDetector.analyze(chunk, silenceThreshold);
            if (analysis.voiced()) {
                speechDetected = true;
                trailingSilence = analysis.trailingSilentBytes();
            } else {
                trailingSilence += analysis.trailingSilentBytes();
            }

            if (usable < chunk.length) {
                LOG.debug("Turn {} reached max length, dropped {} bytes", label, chunk.length - usable);
                finished = close(EndOfTurnCause.MAX_LENGTH);
            } else if (speechDetected && trailingSilence >= silenceBytes) {
                finished = close(EndOfTurnCause.SILENCE);
            }
        }
        if (finished != null) {
            endOfTurn.complete(finished);
        }
        return true;
    }

    /**
     * Ends the turn now.
     *
     * @return {@code true} if this call ended the turn, {@code false} if it had already ended
     */
    public boolean endTurn(EndOfTurnCause cause) {
        CapturedTurn finished;
        synchronized (this) {
            if (closed) {
                return false;
            }
            finished = close(cause);
        }
        endOfTurn.complete(finished);
        return true;
    }

    /**
     * Drops the turn without a result; waiters see a cancellation.
     */
    public void cancel() {
        synchronized (this) {
            closed = true;
        }
        endOfTurn.cancel(false);
    }

    public CompletableFuture<CapturedTurn> endOfTurn() {
        return endOfTurn;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public synchronized int bufferedBytes() {
        return buffer.size();
    }

    public String label() {
        return label;
    }

    private CapturedTurn close(EndOfTurnCause cause) {
        closed = true;
        LOG.debug("Turn {} ended: cause={}, bytes={}, speech={}", label, cause, buffer.size(), speechDetected);
        return new CapturedTurn(buffer.toByteArray(), cause, speechDetected);
    }
}
