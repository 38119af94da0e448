package com.phillippitts.interviewpilot.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the speech engine watchdog.
 */
@ConfigurationProperties(prefix = "engines.watchdog")
@Validated
public class WatchdogProperties {

    /** Enable/disable watchdog globally. */
    private boolean enabled = true;

    /** Sliding window size for the failure budget, in minutes. */
    @Positive(message = "Window minutes must be positive")
    private int windowMinutes = 10;

    /** Failures tolerated per engine within the window before it is disabled. */
    @Positive(message = "Max failures per window must be positive")
    private int maxFailuresPerWindow = 3;

    /** Minutes a disabled engine stays disabled before calls are allowed again. */
    @Positive(message = "Cooldown minutes must be positive")
    private int cooldownMinutes = 5;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getWindowMinutes() {
        return windowMinutes;
    }

    public void setWindowMinutes(int windowMinutes) {
        this.windowMinutes = windowMinutes;
    }

    public int getMaxFailuresPerWindow() {
        return maxFailuresPerWindow;
    }

    public void setMaxFailuresPerWindow(int maxFailuresPerWindow) {
        this.maxFailuresPerWindow = maxFailuresPerWindow;
    }

    public int getCooldownMinutes() {
        return cooldownMinutes;
    }

    public void setCooldownMinutes(int cooldownMinutes) {
        this.cooldownMinutes = cooldownMinutes;
    }
}
