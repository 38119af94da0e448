package com.phillippitts.interviewpilot.service.speech;

/**
 * Receives synthesized audio chunks in order.
 */
@FunctionalInterface
public interface AudioSink {

    void accept(byte[] chunk);
}
