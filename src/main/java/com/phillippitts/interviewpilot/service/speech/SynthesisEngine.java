package com.phillippitts.interviewpilot.service.speech;

/**
 * Text-to-speech engine.
 */
public interface SynthesisEngine {

    /**
     * Returns the synthesized audio of {@code text} as a lazy chunk sequence.
     *
     * <p>Nothing is requested until iteration starts. Every call to {@code iterator()} starts a fresh
     * synthesis, so the result is restartable and never shared across calls. Iteration blocks
     * while the engine produces audio and must respond to thread interruption.
     *
     * @param text prompt to speak
     * @return PCM16LE mono 16 kHz chunks
     */
    Iterable<byte[]> synthesize(String text);

    /** Engine identifier used in logs, metrics and failure events. */
    String getEngineName();
}
