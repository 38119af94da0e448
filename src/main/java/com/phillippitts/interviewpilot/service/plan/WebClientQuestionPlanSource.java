package com.phillippitts.interviewpilot.service.plan;

import com.phillippitts.interviewpilot.domain.QuestionType;
import com.phillippitts.interviewpilot.exception.InterviewPilotException;
import com.phillippitts.interviewpilot.exception.InvalidPlanException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Fetches plans from the JD/CV matching subsystem over HTTP.
 *
 * <p>Request: {@code GET <path>?candidateRef=..&jobRef=..}. Response:
 * <pre>
 * {"items": [{"id": "q1", "text": "...", "type": "technical",
 *             "minSeconds": 180, "targetSeconds": 480, "maxSeconds": 720,
 *             "weight": 1.5, "rubric": ["point", ...]}]}
 * </pre>
 * Every field except {@code text} is optional.
 */
public class WebClientQuestionPlanSource implements QuestionPlanSource {

    private static final Logger LOG = LogManager.getLogger(WebClientQuestionPlanSource.class);

    private final WebClient webClient;
    private final String path;
    private final Duration timeout;

    public WebClientQuestionPlanSource(WebClient webClient, String path, Duration timeout) {
        this.webClient = Objects.requireNonNull(webClient, "webClient must not be null");
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    @Override
    public List<QuestionDraft> fetchPlan(String candidateRef, String jobRef) {
        String body;
        try {
            body = webClient.get()
                    .uri(builder -> builder.path(path)
                            .queryParam("candidateRef", candidateRef)
                            .queryParam("jobRef", jobRef)
                            .build())
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(timeout);
        } catch (WebClientException | IllegalStateException e) {
            LOG.warn("Plan source request failed: candidateRef={}, jobRef={}, error={}",
                    candidateRef, jobRef, e.toString());
            throw new InterviewPilotException("Question plan source unavailable", e);
        }
        return parse(body);
    }

    static List<QuestionDraft> parse(String body) {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        try {
            JSONArray items = new JSONObject(body).optJSONArray("items");
            List<QuestionDraft> drafts = new ArrayList<>();
            if (items == null) {
                return drafts;
            }
            for (int i = 0; i < items.length(); i++) {
                drafts.add(toDraft(items.getJSONObject(i)));
            }
            return drafts;
        } catch (JSONException e) {
            throw new InvalidPlanException("Malformed question plan: " + e.getMessage());
        }
    }

    private static QuestionDraft toDraft(JSONObject item) {
        List<String> rubric = new ArrayList<>();
        JSONArray points = item.optJSONArray("rubric");
        if (points != null) {
            for (int i = 0; i < points.length(); i++) {
                rubric.add(points.optString(i, ""));
            }
        }
        return new QuestionDraft(
                item.optString("id", null),
                item.optString("text", ""),
                parseType(item.optString("type", null)),
                seconds(item, "minSeconds"),
                seconds(item, "targetSeconds"),
                seconds(item, "maxSeconds"),
                item.has("weight") ? item.getDouble("weight") : null,
                rubric);
    }

    private static Duration seconds(JSONObject item, String key) {
        return item.has(key) ? Duration.ofSeconds(item.getLong(key)) : null;
    }

    private static QuestionType parseType(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return QuestionType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            LOG.debug("Unknown question type '{}', using default", value);
            return null;
        }
    }
}
