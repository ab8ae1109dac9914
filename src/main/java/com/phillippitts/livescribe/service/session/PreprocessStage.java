package com.phillippitts.livescribe.service.session;

import com.phillippitts.livescribe.config.properties.PreprocessingProperties;
import com.phillippitts.livescribe.service.audio.preprocess.AudioPreprocessor;
import com.phillippitts.livescribe.service.audio.preprocess.PreprocessingResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Normalizes chunk audio. The preprocessor degrades to passthrough on its own, so this stage never fails.
 */
final class PreprocessStage implements PipelineStage {

    private static final Logger LOG = LogManager.getLogger(PreprocessStage.class);

    private final AudioPreprocessor preprocessor;
    private final PreprocessingProperties properties;

    PreprocessStage(AudioPreprocessor preprocessor, PreprocessingProperties properties) {
        this.preprocessor = preprocessor;
        this.properties = properties;
    }

    @Override
    public StageKind kind() {
        return StageKind.PREPROCESS;
    }

    @Override
    public void apply(ChunkContext context) {
        PreprocessingResult result = preprocessor.preprocess(context.audio(),
                properties.toConfig(context.spec()));
        context.replaceAudio(result.processedAudio(), result.outputSpec(), result.qualityScore());
        if (!result.isPassthrough() && result.qualityScore() < properties.getMinimumQuality()) {
            LOG.debug("Low quality chunk {} (score {}): {}", context.chunk().getId(),
                    result.qualityScore(), result.quality().recommendations());
        }
    }
}
