package com.phillippitts.interviewpilot;

import com.phillippitts.interviewpilot.config.properties.EngineProperties;
import com.phillippitts.interviewpilot.config.properties.InterviewProperties;
import com.phillippitts.interviewpilot.config.properties.ThreadPoolProperties;
import com.phillippitts.interviewpilot.config.properties.WatchdogProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        InterviewProperties.class,
        EngineProperties.class,
        WatchdogProperties.class,
        ThreadPoolProperties.class
})
@EnableScheduling
public class InterviewPilotApplication {

    public static void main(String[] args) {
        SpringApplication.run(InterviewPilotApplication.class, args);
    }

}
