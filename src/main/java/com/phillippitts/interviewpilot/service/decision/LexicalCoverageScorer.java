package com.phillippitts.interviewpilot.service.decision;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Local scorer based on word overlap between the answer and the rubric.
 *
 * <p>A rubric point counts as covered when at least {@code pointOverlap} of its content tokens
 * appear in the answer. Coverage is the share of covered points. Without a rubric the score
 * falls back to answer length: {@code min(1, tokens / substantiveTokens)}.
 */
public final class LexicalCoverageScorer implements AnswerScorer {

    public static final String NAME = "lexical";

    static final double DEFAULT_POINT_OVERLAP = 0.5;
    static final int DEFAULT_SUBSTANTIVE_TOKENS = 25;

    private final double pointOverlap;
    private final int substantiveTokens;

    public LexicalCoverageScorer() {
        this(DEFAULT_POINT_OVERLAP, DEFAULT_SUBSTANTIVE_TOKENS);
    }

    /**
     * @param pointOverlap      share of a point's tokens that must appear, in (0, 1]
     * @param substantiveTokens answer length treated as full coverage when there is no rubric
     * @throws IllegalArgumentException if an argument is out of range
     */
    public LexicalCoverageScorer(double pointOverlap, int substantiveTokens) {
        if (!(pointOverlap > 0.0) || pointOverlap > 1.0) {
            throw new IllegalArgumentException("pointOverlap in (0,1]");
        }
        if (substantiveTokens <= 0) {
            throw new IllegalArgumentException("substantiveTokens must be positive");
        }
        this.pointOverlap = pointOverlap;
        this.substantiveTokens = substantiveTokens;
    }

    @Override
    public CompletableFuture<ScoringResult> score(ScoringRequest request) {
        return CompletableFuture.completedFuture(scoreNow(request));
    }

    ScoringResult scoreNow(ScoringRequest request) {
        List<String> answerTokens = TokenizerUtil.tokenize(request.transcript());
        Set<String> answer = new HashSet<>(answerTokens);

        List<String> points = new ArrayList<>();
        for (String point : request.rubric()) {
            if (!TokenizerUtil.tokenize(point).isEmpty()) {
                points.add(point);
            }
        }
        if (points.isEmpty()) {
            double coverage = Math.min(1.0, answerTokens.size() / (double) substantiveTokens);
            return new ScoringResult(coverage, null, List.of());
        }

        List<String> missing = new ArrayList<>();
        for (String point : points) {
            if (overlap(TokenizerUtil.tokenize(point), answer) < pointOverlap) {
                missing.add(point);
            }
        }
        double coverage = (points.size() - missing.size()) / (double) points.size();
        return new ScoringResult(coverage, null, missing);
    }

    private static double overlap(List<String> pointTokens, Set<String> answer) {
        Set<String> unique = new HashSet<>(pointTokens);
        int total = unique.size();
        unique.retainAll(answer);
        return unique.size() / (double) total;
    }

    @Override
    public String getName() {
        return NAME;
    }
}
