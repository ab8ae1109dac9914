package com.phillippitts.livescribe.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Speech model endpoint and call policy ({@code livescribe.model.*}).
 */
@ConfigurationProperties(prefix = "livescribe.model")
@Validated
public class ModelClientProperties {

    /** Base URL of the Hugging Face compatible inference API. */
    @NotBlank
    private String baseUrl = "https://api-inference.huggingface.co";

    /** Bearer token; blank disables the Authorization header. */
    private String apiKey = "";

    /** Known models in static fallback order. */
    @NotEmpty
    private List<String> models = new ArrayList<>(List.of(
            "facebook/wav2vec2-large-960h-lv60-self",
            "facebook/wav2vec2-base-960h",
            "openai/whisper-base",
            "openai/whisper-small"));

    @Positive
    private int connectTimeoutMs = 5_000;

    /** Upper bound on one model call, including queueing on the model executor. */
    @Positive
    private int callTimeoutMs = 30_000;

    /** Attempts made by a blocking load before the model is declared unavailable. */
    @Positive
    private int loadMaxAttempts = 3;

    @PositiveOrZero
    private long loadRetryBackoffMs = 500;

    /** Confidence reported when the endpoint does not return one. */
    @PositiveOrZero
    @DecimalMax("1.0")
    private double defaultConfidence = 0.9;

    /** Pause before moving on after a rate limit response. */
    @PositiveOrZero
    private long rateLimitBackoffMs = 1_000;

    @Positive
    private int maxConcurrentCallsPerModel = 4;

    /** Latency above which the model pool is reported as degraded. */
    @Positive
    private long degradedLatencyMs = 5_000;

    @PositiveOrZero
    private double costPerCall = 0.001;

    /** Load every configured model at startup instead of on first use. */
    private boolean preloadOnStartup = false;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public List<String> getModels() {
        return models;
    }

    public void setModels(List<String> models) {
        this.models = models;
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public int getCallTimeoutMs() {
        return callTimeoutMs;
    }

    public void setCallTimeoutMs(int callTimeoutMs) {
        this.callTimeoutMs = callTimeoutMs;
    }

    public int getLoadMaxAttempts() {
        return loadMaxAttempts;
    }

    public void setLoadMaxAttempts(int loadMaxAttempts) {
        this.loadMaxAttempts = loadMaxAttempts;
    }

    public long getLoadRetryBackoffMs() {
        return loadRetryBackoffMs;
    }

    public void setLoadRetryBackoffMs(long loadRetryBackoffMs) {
        this.loadRetryBackoffMs = loadRetryBackoffMs;
    }

    public double getDefaultConfidence() {
        return defaultConfidence;
    }

    public void setDefaultConfidence(double defaultConfidence) {
        this.defaultConfidence = defaultConfidence;
    }

    public long getRateLimitBackoffMs() {
        return rateLimitBackoffMs;
    }

    public void setRateLimitBackoffMs(long rateLimitBackoffMs) {
        this.rateLimitBackoffMs = rateLimitBackoffMs;
    }

    public int getMaxConcurrentCallsPerModel() {
        return maxConcurrentCallsPerModel;
    }

    public void setMaxConcurrentCallsPerModel(int maxConcurrentCallsPerModel) {
        this.maxConcurrentCallsPerModel = maxConcurrentCallsPerModel;
    }

    public long getDegradedLatencyMs() {
        return degradedLatencyMs;
    }

    public void setDegradedLatencyMs(long degradedLatencyMs) {
        this.degradedLatencyMs = degradedLatencyMs;
    }

    public double getCostPerCall() {
        return costPerCall;
    }

    public void setCostPerCall(double costPerCall) {
        this.costPerCall = costPerCall;
    }

    public boolean isPreloadOnStartup() {
        return preloadOnStartup;
    }

    public void setPreloadOnStartup(boolean preloadOnStartup) {
        this.preloadOnStartup = preloadOnStartup;
    }
}
