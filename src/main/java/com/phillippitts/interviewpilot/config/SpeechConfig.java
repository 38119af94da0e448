package com.phillippitts.interviewpilot.config;

import com.phillippitts.interviewpilot.config.properties.EngineProperties;
import com.phillippitts.interviewpilot.config.properties.WatchdogProperties;
import com.phillippitts.interviewpilot.service.clock.InterviewClock;
import com.phillippitts.interviewpilot.service.metrics.InterviewMetricsPublisher;
import com.phillippitts.interviewpilot.service.speech.DefaultSpeechIoAdapter;
import com.phillippitts.interviewpilot.service.speech.SpeechIoAdapter;
import com.phillippitts.interviewpilot.service.speech.SynthesisEngine;
import com.phillippitts.interviewpilot.service.speech.TranscriptionEngine;
import com.phillippitts.interviewpilot.service.speech.http.WebClientSynthesisEngine;
import com.phillippitts.interviewpilot.service.speech.http.WebClientTranscriptionEngine;
import com.phillippitts.interviewpilot.service.speech.watchdog.EngineWatchdog;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.concurrent.Executor;

/**
 * Wires the speech engines, their watchdog and the speech I/O adapter.
 */
@Configuration
public class SpeechConfig {

    private static final Logger LOG = LogManager.getLogger(SpeechConfig.class);

    @Bean
    public TranscriptionEngine transcriptionEngine(@Qualifier("transcriptionWebClient") WebClient webClient,
                                                   EngineProperties properties,
                                                   InterviewClock clock) {
        EngineProperties.Endpoint endpoint = properties.getTranscription();
        return new WebClientTranscriptionEngine(webClient, endpoint.getPath(), endpoint.getName(), clock);
    }

    @Bean
    public SynthesisEngine synthesisEngine(@Qualifier("synthesisWebClient") WebClient webClient,
                                           EngineProperties properties) {
        EngineProperties.Endpoint endpoint = properties.getSynthesis();
        return new WebClientSynthesisEngine(webClient, endpoint.getPath(), endpoint.getVoice(), endpoint.getName());
    }

    @Bean
    public EngineWatchdog engineWatchdog(TranscriptionEngine transcriptionEngine,
                                         SynthesisEngine synthesisEngine,
                                         WatchdogProperties properties,
                                         ApplicationEventPublisher publisher,
                                         InterviewClock clock) {
        return new EngineWatchdog(List.of(transcriptionEngine.getEngineName(), synthesisEngine.getEngineName()),
                properties, publisher, clock);
    }

    @Bean
    public SpeechIoAdapter speechIoAdapter(TranscriptionEngine transcriptionEngine,
                                           SynthesisEngine synthesisEngine,
                                           @Qualifier("ioExecutor") Executor ioExecutor,
                                           InterviewClock clock,
                                           ApplicationEventPublisher publisher,
                                           EngineWatchdog watchdog,
                                           WatchdogProperties watchdogProperties,
                                           InterviewMetricsPublisher metrics) {
        if (!watchdogProperties.isEnabled()) {
            LOG.info("Engine watchdog disabled; speech engines are always called");
        }
        return new DefaultSpeechIoAdapter(transcriptionEngine, synthesisEngine, ioExecutor, clock, publisher,
                watchdogProperties.isEnabled() ? watchdog : null, metrics);
    }
}
