package com.phillippitts.livescribe.service.model;

import com.phillippitts.livescribe.domain.TranscriptionErrorCode;
import com.phillippitts.livescribe.exception.InvalidAudioException;
import com.phillippitts.livescribe.exception.TranscriptionException;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Maps failures from the model boundary onto {@link TranscriptionErrorCode}s.
 */
public final class ErrorClassifier {

    private ErrorClassifier() {
    }

    public static TranscriptionErrorCode classify(Throwable error) {
        if (error instanceof TranscriptionException te) {
            return te.getErrorCode();
        }
        if (error instanceof InvalidAudioException) {
            return TranscriptionErrorCode.INVALID_AUDIO_FORMAT;
        }
        if (error instanceof HttpTimeoutException || error instanceof TimeoutException) {
            return TranscriptionErrorCode.MODEL_TIMEOUT;
        }
        if (error instanceof IOException) {
            return TranscriptionErrorCode.NETWORK_ERROR;
        }
        return fromMessage(error == null ? null : error.getMessage());
    }

    public static TranscriptionErrorCode fromHttpStatus(int status) {
        if (status == 429) {
            return TranscriptionErrorCode.RATE_LIMIT_EXCEEDED;
        }
        if (status == 408 || status == 504) {
            return TranscriptionErrorCode.MODEL_TIMEOUT;
        }
        if (status == 400 || status == 415 || status == 422) {
            return TranscriptionErrorCode.INVALID_AUDIO_FORMAT;
        }
        if (status == 401 || status == 403 || status == 404 || status == 503) {
            return TranscriptionErrorCode.MODEL_UNAVAILABLE;
        }
        if (status == 502) {
            return TranscriptionErrorCode.NETWORK_ERROR;
        }
        return TranscriptionErrorCode.UNKNOWN_ERROR;
    }

    static TranscriptionErrorCode fromMessage(String message) {
        if (message == null) {
            return TranscriptionErrorCode.UNKNOWN_ERROR;
        }
        String m = message.toLowerCase(Locale.ROOT);
        if (m.contains("rate limit") || m.contains("429")) {
            return TranscriptionErrorCode.RATE_LIMIT_EXCEEDED;
        }
        if (m.contains("timeout") || m.contains("timed out")) {
            return TranscriptionErrorCode.MODEL_TIMEOUT;
        }
        if (m.contains("network") || m.contains("connection")) {
            return TranscriptionErrorCode.NETWORK_ERROR;
        }
        if (m.contains("model") || m.contains("unavailable")) {
            return TranscriptionErrorCode.MODEL_UNAVAILABLE;
        }
        if (m.contains("audio") || m.contains("format")) {
            return TranscriptionErrorCode.INVALID_AUDIO_FORMAT;
        }
        return TranscriptionErrorCode.UNKNOWN_ERROR;
    }
}
