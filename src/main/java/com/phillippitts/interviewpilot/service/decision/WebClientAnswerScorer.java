package com.phillippitts.interviewpilot.service.decision;

import com.phillippitts.interviewpilot.exception.ScoringException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Remote scorer (LLM or rules service) reached over HTTP.
 *
 * <p>Request body: {@code {"question", "transcript", "rubric": [...], "type"}}.
 * Response body: {@code {"coverage": 0.0-1.0, "followUp": "...", "missing": [...]}} where
 * {@code followUp} and {@code missing} are optional.
 */
public class WebClientAnswerScorer implements AnswerScorer {

    private final WebClient webClient;
    private final String path;
    private final String name;

    public WebClientAnswerScorer(WebClient webClient, String path, String name) {
        this.webClient = Objects.requireNonNull(webClient, "webClient must not be null");
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    @Override
    public CompletableFuture<ScoringResult> score(ScoringRequest request) {
        JSONObject payload = new JSONObject()
                .put("question", request.question())
                .put("transcript", request.transcript())
                .put("rubric", new JSONArray(request.rubric()))
                .put("type", request.type().name().toLowerCase(Locale.ROOT));
        return webClient.post()
                .uri(path)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(payload.toString())
                .retrieve()
                .bodyToMono(String.class)
                .switchIfEmpty(Mono.error(() -> new ScoringException("Empty scoring response", false)))
                .map(WebClientAnswerScorer::parse)
                .onErrorMap(WebClientException.class, e -> new ScoringException("Scoring request failed", e))
                .toFuture();
    }

    static ScoringResult parse(String body) {
        try {
            JSONObject json = new JSONObject(body);
            if (!json.has("coverage")) {
                throw new ScoringException("Scoring response has no coverage", false);
            }
            List<String> missing = new ArrayList<>();
            JSONArray points = json.optJSONArray("missing");
            if (points != null) {
                for (int i = 0; i < points.length(); i++) {
                    missing.add(points.optString(i, ""));
                }
            }
            return new ScoringResult(json.getDouble("coverage"), json.optString("followUp", null), missing);
        } catch (JSONException e) {
            throw new ScoringException("Malformed scoring response", e);
        }
    }

    @Override
    public String getName() {
        return name;
    }
}
