package com.phillippitts.livescribe.service.model;

import com.phillippitts.livescribe.config.properties.ModelClientProperties;
import com.phillippitts.livescribe.domain.AudioSpec;
import com.phillippitts.livescribe.domain.TranscriptionErrorCode;
import com.phillippitts.livescribe.exception.TranscriptionExceptionBuilder;
import com.phillippitts.livescribe.service.audio.WavCodec;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link SpeechModelGateway} for the Hugging Face inference API.
 *
 * <p>{@code POST {baseUrl}/models/{model}} with the WAV payload as {@code audio/wav}; the response
 * is either {@code {"text": ...}} or a one-element array of such objects. Errors come back as
 * {@code {"error": ...}} and are classified from the HTTP status.
 */
@Component
public class HuggingFaceInferenceGateway implements SpeechModelGateway {

    private static final Logger LOG = LogManager.getLogger(HuggingFaceInferenceGateway.class);

    /** Smoke-test payload size used to confirm a model is serving. */
    static final int SMOKE_TEST_BYTES = 1024;

    private final ModelClientProperties properties;
    private final HttpClient httpClient;

    @Autowired
    public HuggingFaceInferenceGateway(ModelClientProperties properties) {
        this(properties, HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(properties.getConnectTimeoutMs()))
                .build());
    }

    HuggingFaceInferenceGateway(ModelClientProperties properties, HttpClient httpClient) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        LOG.info("Initialized inference gateway: baseUrl={}", properties.getBaseUrl());
    }

    @Override
    public ModelOutput transcribe(byte[] wavAudio, String modelName) {
        HttpRequest request = authorized(HttpRequest.newBuilder()
                .uri(URI.create(stripSlash(properties.getBaseUrl()) + "/models/" + modelName))
                .timeout(Duration.ofMillis(properties.getCallTimeoutMs()))
                .header("Content-Type", "audio/wav")
                .POST(HttpRequest.BodyPublishers.ofByteArray(wavAudio)))
                .build();
        HttpResponse<String> response = send(request, modelName);
        if (response.statusCode() != 200) {
            throw TranscriptionExceptionBuilder.create("Inference request rejected")
                    .model(modelName)
                    .code(ErrorClassifier.fromHttpStatus(response.statusCode()))
                    .metadata("status", response.statusCode())
                    .metadata("error", errorMessage(response.body()))
                    .build();
        }
        return parse(response.body(), modelName);
    }

    @Override
    public void loadModel(String modelName) {
        byte[] silence = WavCodec.wrap(new byte[SMOKE_TEST_BYTES], AudioSpec.PCM16_MONO_16K);
        transcribe(silence, modelName);
    }

    @Override
    public boolean healthCheck(String modelName) {
        HttpRequest request = authorized(HttpRequest.newBuilder()
                .uri(URI.create(stripSlash(properties.getBaseUrl()) + "/status/" + modelName))
                .timeout(Duration.ofMillis(properties.getConnectTimeoutMs()))
                .GET())
                .build();
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString()).statusCode() == 200;
        } catch (IOException e) {
            LOG.debug("Health probe for {} failed: {}", modelName, e.toString());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    static ModelOutput parse(String body, String modelName) {
        try {
            String trimmed = body == null ? "" : body.trim();
            JSONObject json;
            if (trimmed.startsWith("[")) {
                JSONArray array = new JSONArray(trimmed);
                json = array.isEmpty() ? new JSONObject() : array.getJSONObject(0);
            } else {
                json = new JSONObject(trimmed);
            }
            String text = json.has("text") ? json.optString("text", "") : json.optString("generated_text", "");
            Double confidence = json.has("score") ? json.getDouble("score") : null;
            return new ModelOutput(text, confidence);
        } catch (JSONException e) {
            throw TranscriptionExceptionBuilder.create("Unparseable inference response")
                    .model(modelName)
                    .code(TranscriptionErrorCode.UNKNOWN_ERROR)
                    .cause(e)
                    .build();
        }
    }

    private HttpResponse<String> send(HttpRequest request, String modelName) {
        long start = System.nanoTime();
        try {
            LOG.debug("Sending inference request to {}", request.uri());
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw TranscriptionExceptionBuilder.create("Inference request failed")
                    .model(modelName)
                    .code(ErrorClassifier.classify(e))
                    .cause(e)
                    .durationMs((System.nanoTime() - start) / 1_000_000L)
                    .build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw TranscriptionExceptionBuilder.create("Inference request interrupted")
                    .model(modelName)
                    .code(TranscriptionErrorCode.MODEL_TIMEOUT)
                    .cause(e)
                    .build();
        }
    }

    private HttpRequest.Builder authorized(HttpRequest.Builder builder) {
        String key = properties.getApiKey();
        if (key != null && !key.isBlank()) {
            builder.header("Authorization", "Bearer " + key);
        }
        return builder;
    }

    private static String errorMessage(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return new JSONObject(body).optString("error", body);
        } catch (JSONException e) {
            return body.length() > 200 ? body.substring(0, 200) : body;
        }
    }

    private static String stripSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
