package com.phillippitts.interviewpilot.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for interview sessions ({@code interview.*}).
 *
 * <p>Item defaults fill in any time bound or weight the question plan leaves out.
 */
@Validated
@ConfigurationProperties(prefix = "interview")
public class InterviewProperties {

    /** Global deadline measured from session start. */
    @NotNull
    private Duration deadline = Duration.ofMinutes(30);

    @Valid
    private Item item = new Item();

    @Valid
    private FollowUp followUp = new FollowUp();

    @Valid
    private Timeouts timeouts = new Timeouts();

    @Valid
    private Speech speech = new Speech();

    @Valid
    private Scoring scoring = new Scoring();

    @NotBlank
    private String greeting = "Hello, and thank you for joining. Let's begin the interview.";

    @NotBlank
    private String closing = "That's all the time we have. Thank you for your answers.";

    /** Upper bound on delivering the closing statement. */
    @NotNull
    private Duration closingGrace = Duration.ofSeconds(15);

    /** Number of terminal session summaries kept in memory. */
    @Positive
    private int archiveSize = 500;

    public Duration getDeadline() {
        return deadline;
    }

    public void setDeadline(Duration deadline) {
        this.deadline = deadline;
    }

    public Item getItem() {
        return item;
    }

    public void setItem(Item item) {
        this.item = item;
    }

    public FollowUp getFollowUp() {
        return followUp;
    }

    public void setFollowUp(FollowUp followUp) {
        this.followUp = followUp;
    }

    public Timeouts getTimeouts() {
        return timeouts;
    }

    public void setTimeouts(Timeouts timeouts) {
        this.timeouts = timeouts;
    }

    public Speech getSpeech() {
        return speech;
    }

    public void setSpeech(Speech speech) {
        this.speech = speech;
    }

    public Scoring getScoring() {
        return scoring;
    }

    public void setScoring(Scoring scoring) {
        this.scoring = scoring;
    }

    public String getGreeting() {
        return greeting;
    }

    public void setGreeting(String greeting) {
        this.greeting = greeting;
    }

    public String getClosing() {
        return closing;
    }

    public void setClosing(String closing) {
        this.closing = closing;
    }

    public Duration getClosingGrace() {
        return closingGrace;
    }

    public void setClosingGrace(Duration closingGrace) {
        this.closingGrace = closingGrace;
    }

    public int getArchiveSize() {
        return archiveSize;
    }

    public void setArchiveSize(int archiveSize) {
        this.archiveSize = archiveSize;
    }

    /**
     * Per-item defaults.
     */
    public static class Item {
        @NotNull
        private Duration min = Duration.ofMinutes(3);
        @NotNull
        private Duration target = Duration.ofMinutes(8);
        @NotNull
        private Duration max = Duration.ofMinutes(12);
        @DecimalMin(value = "0.0", inclusive = false)
        private double weight = 1.0;

        public Duration getMin() {
            return min;
        }

        public void setMin(Duration min) {
            this.min = min;
        }

        public Duration getTarget() {
            return target;
        }

        public void setTarget(Duration target) {
            this.target = target;
        }

        public Duration getMax() {
            return max;
        }

        public void setMax(Duration max) {
            this.max = max;
        }

        public double getWeight() {
            return weight;
        }

        public void setWeight(double weight) {
            this.weight = weight;
        }
    }

    /**
     * Follow-up policy.
     */
    public static class FollowUp {
        /** Coverage below this value asks for a follow-up. */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double coverageThreshold = 0.6;
        /** Maximum follow-ups per item. */
        @Min(0)
        private int maxDepth = 1;
        /** Minimum remaining item time needed for one more round. */
        @NotNull
        private Duration minCost = Duration.ofSeconds(60);

        public double getCoverageThreshold() {
            return coverageThreshold;
        }

        public void setCoverageThreshold(double coverageThreshold) {
            this.coverageThreshold = coverageThreshold;
        }

        public int getMaxDepth() {
            return maxDepth;
        }

        public void setMaxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
        }

        public Duration getMinCost() {
            return minCost;
        }

        public void setMinCost(Duration minCost) {
            this.minCost = minCost;
        }
    }

    /**
     * Per-call timeouts.
     */
    public static class Timeouts {
        @NotNull
        private Duration synthesis = Duration.ofSeconds(10);
        /** Applied to the engine call after the end of turn. */
        @NotNull
        private Duration transcription = Duration.ofSeconds(10);
        @NotNull
        private Duration scoring = Duration.ofSeconds(5);

        public Duration getSynthesis() {
            return synthesis;
        }

        public void setSynthesis(Duration synthesis) {
            this.synthesis = synthesis;
        }

        public Duration getTranscription() {
            return transcription;
        }

        public void setTranscription(Duration transcription) {
            this.transcription = transcription;
        }

        public Duration getScoring() {
            return scoring;
        }

        public void setScoring(Duration scoring) {
            this.scoring = scoring;
        }
    }

    /**
     * End-of-turn detection.
     */
    public static class Speech {
        @NotNull
        private Duration silenceDuration = Duration.ofMillis(1500);
        @Min(0)
        private int silenceThreshold = 800;
        @NotNull
        private Duration maxTurn = Duration.ofMinutes(5);

        public Duration getSilenceDuration() {
            return silenceDuration;
        }

        public void setSilenceDuration(Duration silenceDuration) {
            this.silenceDuration = silenceDuration;
        }

        public int getSilenceThreshold() {
            return silenceThreshold;
        }

        public void setSilenceThreshold(int silenceThreshold) {
            this.silenceThreshold = silenceThreshold;
        }

        public Duration getMaxTurn() {
            return maxTurn;
        }

        public void setMaxTurn(Duration maxTurn) {
            this.maxTurn = maxTurn;
        }
    }

    /**
     * Scoring provider selection.
     */
    public static class Scoring {
        public enum Provider { LEXICAL, REMOTE }

        @NotNull
        private Provider provider = Provider.LEXICAL;

        public Provider getProvider() {
            return provider;
        }

        public void setProvider(Provider provider) {
            this.provider = provider;
        }
    }
}
