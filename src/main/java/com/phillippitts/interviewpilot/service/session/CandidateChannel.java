package com.phillippitts.interviewpilot.service.session;

import java.util.Map;

/**
 * Outbound half of the duplex candidate channel.
 *
 * <p>Implementations must not throw; delivery problems are logged by the implementation.
 */
public interface CandidateChannel {

    /** Channel used while no candidate is connected. Drops everything. */
    CandidateChannel NONE = new CandidateChannel() {
        @Override
        public void sendEvent(String type, Map<String, Object> data) {
        }

        @Override
        public void sendAudio(byte[] chunk) {
        }
    };

    /**
     * Sends a JSON envelope {@code {"type": type, "data": data}}.
     */
    void sendEvent(String type, Map<String, Object> data);

    /** Sends a chunk of synthesized PCM audio. */
    void sendAudio(byte[] chunk);
}
