package com.phillippitts.interviewpilot.config;

import com.phillippitts.interviewpilot.service.async.TimedCalls;
import com.phillippitts.interviewpilot.service.clock.InterviewClock;
import com.phillippitts.interviewpilot.service.clock.SystemInterviewClock;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;

/**
 * Wires the interview clock. Tests replace it with a manual clock.
 */
@Configuration
public class ClockConfig {

    @Bean
    public InterviewClock interviewClock(@Qualifier("taskScheduler") TaskScheduler taskScheduler) {
        return new SystemInterviewClock(taskScheduler);
    }

    @Bean
    public TimedCalls timedCalls(InterviewClock interviewClock) {
        return new TimedCalls(interviewClock);
    }
}
