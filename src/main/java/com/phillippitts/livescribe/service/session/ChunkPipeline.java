package com.phillippitts.livescribe.service.session;

import com.phillippitts.livescribe.config.properties.DiarizationProperties;
import com.phillippitts.livescribe.config.properties.PreprocessingProperties;
import com.phillippitts.livescribe.config.properties.TranscriptionProperties;
import com.phillippitts.livescribe.service.audio.preprocess.AudioPreprocessor;
import com.phillippitts.livescribe.service.diarization.SpeakerDiarizationEngine;
import com.phillippitts.livescribe.service.metrics.QualityMetricsAggregator;
import com.phillippitts.livescribe.service.model.ModelTranscriptionClient;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Preprocess, diarize, transcribe: runs a chunk through one {@link PipelineStage} per
 * {@link StageKind}, in declaration order.
 */
@Component
class ChunkPipeline {

    private final Map<StageKind, PipelineStage> stages = new EnumMap<>(StageKind.class);

    @Autowired
    ChunkPipeline(AudioPreprocessor preprocessor,
                  PreprocessingProperties preprocessingProperties,
                  SpeakerDiarizationEngine diarizationEngine,
                  DiarizationProperties diarizationProperties,
                  ModelTranscriptionClient client,
                  QualityMetricsAggregator aggregator,
                  TranscriptionProperties transcriptionProperties,
                  Clock clock) {
        this(List.of(
                new PreprocessStage(preprocessor, preprocessingProperties),
                new DiarizationStage(diarizationEngine, diarizationProperties.toConfig()),
                new TranscriptionStage(client, aggregator, transcriptionProperties.getErrorBudget(), clock)));
    }

    ChunkPipeline(List<PipelineStage> stageList) {
        for (PipelineStage stage : stageList) {
            if (stages.put(stage.kind(), stage) != null) {
                throw new IllegalArgumentException("Duplicate stage for " + stage.kind());
            }
        }
        for (StageKind kind : StageKind.values()) {
            if (!stages.containsKey(kind)) {
                throw new IllegalArgumentException("No stage registered for " + kind);
            }
        }
    }

    /**
     * Runs every applicable stage. Failures of the transcription stage propagate; the other
     * stages absorb their own.
     */
    void run(ChunkContext context) {
        for (PipelineStage stage : stages.values()) {
            if (stage.appliesTo(context)) {
                stage.apply(context);
            }
        }
    }
}
