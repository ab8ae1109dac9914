package com.phillippitts.livescribe.service.distribution;

import com.phillippitts.livescribe.domain.FullTranscript;
import com.phillippitts.livescribe.domain.ModelMetadata;
import com.phillippitts.livescribe.domain.SessionStatus;
import com.phillippitts.livescribe.domain.Speaker;
import com.phillippitts.livescribe.domain.TranscriptSegment;
import com.phillippitts.livescribe.domain.TranscriptionError;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * JSON wire format of {@link TranscriptionMessage}.
 *
 * <pre>{"type":"segment","sessionId":"...","timestamp":"2024-...Z","data":{...}}</pre>
 *
 * <p>The {@code complete} message carries transcript totals, not the segment list; subscribers
 * already received every segment.
 */
public final class TranscriptionMessageSerializer {

    private TranscriptionMessageSerializer() {
    }

    public static String toJson(TranscriptionMessage message) {
        JSONObject root = new JSONObject();
        root.put("type", message.type().wireName());
        root.put("sessionId", message.sessionId());
        root.put("timestamp", message.timestamp().toString());
        root.put("data", payload(message));
        return root.toString();
    }

    private static JSONObject payload(TranscriptionMessage message) {
        Object payload = message.payload();
        return switch (message.type()) {
            case SEGMENT -> segment((TranscriptSegment) payload);
            case SPEAKER_UPDATE -> speaker((Speaker) payload);
            case STATUS -> new JSONObject().put("status", ((SessionStatus) payload).name());
            case ERROR -> error((TranscriptionError) payload);
            case COMPLETE -> complete((FullTranscript) payload);
        };
    }

    static JSONObject segment(TranscriptSegment s) {
        return new JSONObject()
                .put("id", s.id())
                .put("startTimestamp", s.startTimestamp())
                .put("endTimestamp", s.endTimestamp())
                .put("speakerId", s.speakerId())
                .put("text", s.text())
                .put("confidence", s.confidence())
                .put("modelUsed", s.modelUsed())
                .put("processingTimeMs", s.processingTimeMs())
                .put("audioChunkId", s.audioChunkId());
    }

    private static JSONObject speaker(Speaker s) {
        JSONObject json = new JSONObject()
                .put("id", s.id())
                .put("totalSpeakingTimeMs", s.totalSpeakingTimeMs())
                .put("segmentCount", s.segmentIds().size())
                .put("averageConfidence", s.averageConfidence());
        if (s.displayName() != null) {
            json.put("displayName", s.displayName());
        }
        return json;
    }

    private static JSONObject error(TranscriptionError e) {
        JSONObject json = new JSONObject()
                .put("code", e.code().name())
                .put("message", e.message())
                .put("retryable", e.retryable());
        if (e.modelName() != null) {
            json.put("modelName", e.modelName());
        }
        return json;
    }

    private static JSONObject complete(FullTranscript t) {
        ModelMetadata meta = t.modelMetadata();
        return new JSONObject()
                .put("transcriptId", t.id())
                .put("segmentCount", t.segments().size())
                .put("speakerCount", t.speakers().size())
                .put("durationMs", t.durationMs())
                .put("primaryModel", meta.primaryModel())
                .put("fallbackModelsUsed", new JSONArray(meta.fallbackModelsUsed()))
                .put("averageConfidence", meta.averageConfidence())
                .put("estimatedCost", meta.estimatedCost());
    }
}
