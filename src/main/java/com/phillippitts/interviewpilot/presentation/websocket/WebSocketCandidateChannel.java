package com.phillippitts.interviewpilot.presentation.websocket;

import com.phillippitts.interviewpilot.service.session.CandidateChannel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Map;

/**
 * Candidate channel backed by a WebSocket. Events go out as {@code {"type":..., "data":...}} text frames
 * and synthesized audio as binary frames.
 *
 * <p>The session must be a {@link org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator}
 * since the conductor and the I/O pool both send on it.
 */
final class WebSocketCandidateChannel implements CandidateChannel {

    private static final Logger LOG = LogManager.getLogger(WebSocketCandidateChannel.class);

    private final WebSocketSession session;

    WebSocketCandidateChannel(WebSocketSession session) {
        this.session = session;
    }

    WebSocketSession session() {
        return session;
    }

    @Override
    public void sendEvent(String type, Map<String, Object> data) {
        send(new TextMessage(envelope(type, data)));
    }

    @Override
    public void sendAudio(byte[] chunk) {
        if (chunk != null && chunk.length > 0) {
            send(new BinaryMessage(chunk));
        }
    }

    static String envelope(String type, Map<String, Object> data) {
        JSONObject json = new JSONObject();
        json.put("type", type);
        json.put("data", data == null ? new JSONObject() : new JSONObject(data));
        return json.toString();
    }

    private void send(WebSocketMessage<?> message) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.sendMessage(message);
        } catch (IOException | IllegalStateException e) {
            LOG.warn("Failed to send to socket {}: {}", session.getId(), e.getMessage());
        }
    }
}
