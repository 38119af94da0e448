package com.phillippitts.interviewpilot.presentation.websocket;

import com.phillippitts.interviewpilot.exception.InterviewPilotException;
import com.phillippitts.interviewpilot.service.session.InterviewSessionService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.net.URI;
import java.nio.ByteBuffer;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Duplex candidate channel at {@code /ws/interview?sessionId=...}.
 *
 * <p>Binary frames carry PCM audio from the candidate. Text frames carry control messages
 * {@code {"type":"pause|resume|abort|end_turn|answer", "data":{...}}}. Connecting starts a created
 * session; disconnecting aborts a running one.
 */
@Component
public class InterviewWebSocketHandler extends AbstractWebSocketHandler {

    private static final Logger LOG = LogManager.getLogger(InterviewWebSocketHandler.class);

    static final int MAX_MESSAGE_BYTES = 1_048_576;
    private static final int SEND_TIME_LIMIT_MS = 10_000;

    private final InterviewSessionService sessionService;
    private final Map<String, Binding> bindings = new ConcurrentHashMap<>();

    public InterviewWebSocketHandler(InterviewSessionService sessionService) {
        this.sessionService = sessionService;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession rawSession) throws Exception {
        rawSession.setTextMessageSizeLimit(MAX_MESSAGE_BYTES);
        rawSession.setBinaryMessageSizeLimit(MAX_MESSAGE_BYTES);
        WebSocketSession session = new ConcurrentWebSocketSessionDecorator(rawSession, SEND_TIME_LIMIT_MS,
                MAX_MESSAGE_BYTES);
        String sessionId = readQuery(session.getUri(), "sessionId");
        if (isBlank(sessionId)) {
            session.close(CloseStatus.BAD_DATA.withReason("sessionId is required"));
            return;
        }

        WebSocketCandidateChannel channel = new WebSocketCandidateChannel(session);
        try {
            sessionService.attach(sessionId, channel);
            bindings.put(session.getId(), new Binding(sessionId, channel));
            LOG.info("Candidate connected: session={}, socket={}", sessionId, session.getId());
        } catch (InterviewPilotException e) {
            channel.sendEvent("error", errorPayload("ATTACH_FAILED", e.getMessage()));
            session.close(CloseStatus.POLICY_VIOLATION.withReason(toCloseReason(e.getMessage())));
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        Binding binding = bindings.get(session.getId());
        if (binding == null) {
            return;
        }
        JSONObject root;
        try {
            root = new JSONObject(message.getPayload());
        } catch (JSONException e) {
            binding.channel().sendEvent("error", errorPayload("MALFORMED", "Control message is not valid JSON"));
            return;
        }
        String type = root.optString("type", "");
        JSONObject data = root.optJSONObject("data");
        if (data == null) {
            data = root;
        }

        String sessionId = binding.sessionId();
        try {
            switch (type) {
                case "pause" -> sessionService.pause(sessionId, data.optString("note", null));
                case "resume" -> sessionService.resume(sessionId);
                case "abort" -> sessionService.abort(sessionId, data.optString("reason", "candidate abort"));
                case "end_turn" -> sessionService.endTurn(sessionId);
                case "answer" -> sessionService.answer(sessionId, data.optString("text", ""));
                default -> binding.channel().sendEvent("error",
                        errorPayload("UNSUPPORTED_EVENT", "Unsupported control type: " + type));
            }
        } catch (InterviewPilotException e) {
            LOG.debug("Control '{}' rejected for session {}: {}", type, sessionId, e.getMessage());
            binding.channel().sendEvent("error", errorPayload("REJECTED", e.getMessage()));
        }
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
        Binding binding = bindings.get(session.getId());
        if (binding == null) {
            return;
        }
        ByteBuffer payload = message.getPayload();
        byte[] chunk = new byte[payload.remaining()];
        payload.get(chunk);
        sessionService.acceptAudio(binding.sessionId(), chunk);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        LOG.warn("Transport error on socket {}: {}", session.getId(),
                exception == null ? "unknown" : exception.getMessage());
        release(session.getId(), "transport error");
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        release(session.getId(), "channel closed: " + status.getCode());
    }

    private void release(String socketId, String detail) {
        Binding binding = bindings.remove(socketId);
        if (binding != null) {
            LOG.info("Candidate disconnected: session={}, socket={}", binding.sessionId(), socketId);
            sessionService.detach(binding.sessionId(), binding.channel(), detail);
        }
    }

    static String readQuery(URI uri, String key) {
        if (uri == null || isBlank(uri.getQuery())) {
            return null;
        }
        for (String pair : uri.getQuery().split("&")) {
            String[] kv = pair.split("=", 2);
            if (kv.length == 2 && key.equals(kv[0])) {
                return kv[1];
            }
        }
        return null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static Map<String, Object> errorPayload(String code, String message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("code", code);
        payload.put("message", message == null ? "" : message);
        return payload;
    }

    private static String toCloseReason(String message) {
        String normalized = message == null ? "" : message.replace('\r', ' ').replace('\n', ' ').trim();
        return normalized.length() > 120 ? normalized.substring(0, 120) : normalized;
    }

    private record Binding(String sessionId, WebSocketCandidateChannel channel) {
    }
}
