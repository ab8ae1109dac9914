package com.phillippitts.livescribe.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Model reload watchdog budget ({@code livescribe.watchdog.*}).
 *
 * <p>Within any sliding window of {@code windowMinutes}, at most {@code maxReloadsPerWindow}
 * reloads are attempted per model; beyond that the model is disabled for
 * {@code cooldownMinutes}.
 */
@ConfigurationProperties(prefix = "livescribe.watchdog")
@Validated
public class ModelWatchdogProperties {

    private boolean enabled = true;

    @Positive(message = "Window minutes must be positive")
    private int windowMinutes = 10;

    @Positive(message = "Max reloads per window must be positive")
    private int maxReloadsPerWindow = 3;

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

    public int getMaxReloadsPerWindow() {
        return maxReloadsPerWindow;
    }

    public void setMaxReloadsPerWindow(int maxReloadsPerWindow) {
        this.maxReloadsPerWindow = maxReloadsPerWindow;
    }

    public int getCooldownMinutes() {
        return cooldownMinutes;
    }

    public void setCooldownMinutes(int cooldownMinutes) {
        this.cooldownMinutes = cooldownMinutes;
    }
}
