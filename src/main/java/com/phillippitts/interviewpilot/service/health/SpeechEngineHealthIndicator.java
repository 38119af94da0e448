package com.phillippitts.interviewpilot.service.health;

import com.phillippitts.interviewpilot.service.session.SessionRegistry;
import com.phillippitts.interviewpilot.service.speech.SynthesisEngine;
import com.phillippitts.interviewpilot.service.speech.TranscriptionEngine;
import com.phillippitts.interviewpilot.service.speech.watchdog.EngineWatchdog;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the speech engines.
 *
 * <ul>
 *   <li>UP: transcription and synthesis both enabled</li>
 *   <li>DEGRADED: one of them disabled by the watchdog; sessions continue with fallbacks</li>
 *   <li>DOWN: both disabled</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health as {@code speechEngines}.
 */
@Component("speechEngines")
public class SpeechEngineHealthIndicator implements HealthIndicator {

    private final TranscriptionEngine transcription;
    private final SynthesisEngine synthesis;
    private final EngineWatchdog watchdog;
    private final SessionRegistry registry;

    public SpeechEngineHealthIndicator(TranscriptionEngine transcription,
                                       SynthesisEngine synthesis,
                                       EngineWatchdog watchdog,
                                       SessionRegistry registry) {
        this.transcription = transcription;
        this.synthesis = synthesis;
        this.watchdog = watchdog;
        this.registry = registry;
    }

    @Override
    public Health health() {
        String transcriptionName = transcription.getEngineName();
        String synthesisName = synthesis.getEngineName();
        boolean transcriptionEnabled = watchdog.isEngineEnabled(transcriptionName);
        boolean synthesisEnabled = watchdog.isEngineEnabled(synthesisName);

        Health.Builder builder = new Health.Builder();
        if (transcriptionEnabled && synthesisEnabled) {
            builder.up().withDetail("status", "All speech engines operational");
        } else if (transcriptionEnabled || synthesisEnabled) {
            builder.status("DEGRADED").withDetail("status", "Partial speech availability");
        } else {
            builder.down().withDetail("status", "No speech engines available");
        }
        return builder
                .withDetail("transcription", transcriptionName + ": " + describe(transcriptionEnabled))
                .withDetail("synthesis", synthesisName + ": " + describe(synthesisEnabled))
                .withDetail("liveSessions", registry.live().size())
                .build();
    }

    private static String describe(boolean enabled) {
        return enabled ? "enabled" : "disabled";
    }
}
