package com.phillippitts.livescribe.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Chunk validation limits ({@code livescribe.audio.validation.*}).
 */
@ConfigurationProperties(prefix = "livescribe.audio.validation")
@Validated
public class AudioValidationProperties {

    /** Largest accepted chunk (guard against memory exhaustion). Default: 8 MB. */
    @Positive(message = "Maximum chunk size must be positive")
    private int maxChunkBytes = 8 * 1024 * 1024;

    public int getMaxChunkBytes() {
        return maxChunkBytes;
    }

    public void setMaxChunkBytes(int maxChunkBytes) {
        this.maxChunkBytes = maxChunkBytes;
    }
}
