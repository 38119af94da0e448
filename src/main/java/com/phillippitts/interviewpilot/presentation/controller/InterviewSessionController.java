package com.phillippitts.interviewpilot.presentation.controller;

import com.phillippitts.interviewpilot.domain.SessionStatus;
import com.phillippitts.interviewpilot.presentation.dto.AnswerRequest;
import com.phillippitts.interviewpilot.presentation.dto.ControlRequest;
import com.phillippitts.interviewpilot.presentation.dto.CreateSessionRequest;
import com.phillippitts.interviewpilot.presentation.dto.QuestionItemRequest;
import com.phillippitts.interviewpilot.presentation.dto.SessionSummaryResponse;
import com.phillippitts.interviewpilot.service.session.InterviewSessionService;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST surface for interview sessions. Control endpoints mirror the WebSocket control messages
 * for clients that cannot hold a socket open.
 */
@RestController
@RequestMapping("/api/sessions")
class InterviewSessionController {

    private static final Logger LOG = LogManager.getLogger(InterviewSessionController.class);

    private final InterviewSessionService sessionService;

    InterviewSessionController(InterviewSessionService sessionService) {
        this.sessionService = sessionService;
    }

    @PostMapping
    ResponseEntity<SessionStatus> create(@Valid @RequestBody CreateSessionRequest request) {
        SessionStatus status = sessionService.create(request.toCommand());
        LOG.info("Created session {} for job {}", status.sessionId(), status.jobRef());
        return ResponseEntity.status(HttpStatus.CREATED).body(status);
    }

    @GetMapping
    List<SessionStatus> list() {
        return sessionService.list();
    }

    @GetMapping("/{id}")
    SessionStatus status(@PathVariable("id") String id) {
        return sessionService.status(id);
    }

    @GetMapping("/{id}/summary")
    SessionSummaryResponse summary(@PathVariable("id") String id) {
        return SessionSummaryResponse.from(sessionService.summary(id));
    }

    @PostMapping("/{id}/start")
    SessionStatus start(@PathVariable("id") String id) {
        return sessionService.start(id);
    }

    @PostMapping("/{id}/abort")
    ResponseEntity<Map<String, Object>> abort(@PathVariable("id") String id,
                                              @RequestBody(required = false) ControlRequest request) {
        String detail = request == null || request.note() == null ? "operator abort" : request.note();
        boolean aborted = sessionService.abort(id, detail);
        return ResponseEntity.accepted().body(Map.of("sessionId", id, "aborted", aborted));
    }

    @PostMapping("/{id}/pause")
    ResponseEntity<Void> pause(@PathVariable("id") String id,
                               @RequestBody(required = false) ControlRequest request) {
        sessionService.pause(id, request == null ? null : request.note());
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/{id}/resume")
    ResponseEntity<Void> resume(@PathVariable("id") String id) {
        sessionService.resume(id);
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/{id}/end-turn")
    ResponseEntity<Void> endTurn(@PathVariable("id") String id) {
        sessionService.endTurn(id);
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/{id}/answer")
    ResponseEntity<Void> answer(@PathVariable("id") String id, @Valid @RequestBody AnswerRequest request) {
        sessionService.answer(id, request.text());
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/{id}/plan/items")
    SessionStatus appendItem(@PathVariable("id") String id, @Valid @RequestBody QuestionItemRequest request) {
        return sessionService.appendItem(id, request.toDraft());
    }

    @DeleteMapping("/{id}/plan/items/{itemId}")
    SessionStatus removeItem(@PathVariable("id") String id, @PathVariable("itemId") String itemId) {
        return sessionService.removeItem(id, itemId);
    }

    @PostMapping("/{id}/plan/items/{itemId}/move")
    SessionStatus moveItem(@PathVariable("id") String id, @PathVariable("itemId") String itemId,
                           @RequestParam("index") int index) {
        return sessionService.moveItem(id, itemId, index);
    }
}
