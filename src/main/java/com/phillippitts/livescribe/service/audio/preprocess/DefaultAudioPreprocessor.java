package com.phillippitts.livescribe.service.audio.preprocess;

import com.phillippitts.livescribe.domain.AudioSpec;
import com.phillippitts.livescribe.service.audio.PcmAudio;
import com.phillippitts.livescribe.service.audio.PcmCodec;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Default {@link AudioPreprocessor}: decode, run steps in {@link EnhancementType} order, encode
 * PCM16LE mono.
 *
 * <p>Failures inside the pipeline are absorbed and logged; the chunk is then passed through
 * untouched so one bad chunk never aborts a session.
 */
@Component
public class DefaultAudioPreprocessor implements AudioPreprocessor {

    private static final Logger LOG = LogManager.getLogger(DefaultAudioPreprocessor.class);

    private final Map<EnhancementType, EnhancementStep> steps;

    public DefaultAudioPreprocessor() {
        this(List.of(new FormatConversionStep(), new VolumeNormalizationStep(),
                new NoiseReductionStep(), new EchoCancellationStep()));
    }

    DefaultAudioPreprocessor(List<EnhancementStep> stepList) {
        Objects.requireNonNull(stepList, "stepList must not be null");
        Map<EnhancementType, EnhancementStep> byType = new EnumMap<>(EnhancementType.class);
        for (EnhancementStep step : stepList) {
            byType.put(step.type(), step);
        }
        for (EnhancementType type : EnhancementType.values()) {
            if (!byType.containsKey(type)) {
                throw new IllegalArgumentException("No step registered for " + type);
            }
        }
        this.steps = byType;
    }

    @Override
    public PreprocessingResult preprocess(byte[] audio, PreprocessingConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        if (audio == null || audio.length < config.minimumBytes()) {
            LOG.debug("Audio below minimum size ({} bytes); passing through",
                    audio == null ? 0 : audio.length);
            return PreprocessingResult.passthrough(audio == null ? new byte[0] : audio, config.inputSpec());
        }
        try {
            PcmAudio current = PcmCodec.decode(audio, config.inputSpec());
            List<AudioEnhancement> applied = new ArrayList<>();
            for (Map.Entry<EnhancementType, EnhancementStep> entry : steps.entrySet()) {
                if (!config.isEnabled(entry.getKey())) {
                    continue;
                }
                EnhancementStep.Outcome outcome = entry.getValue().apply(current, config);
                if (outcome != null) {
                    current = outcome.audio();
                    applied.add(new AudioEnhancement(entry.getKey(), outcome.improvement()));
                }
            }
            AudioQualityMetrics quality = AudioQualityAnalyzer.analyze(current.samples());
            byte[] out = PcmCodec.encodePcm16Mono(current);
            AudioSpec outSpec = new AudioSpec(current.sampleRate(), 1, 16);
            LOG.debug("Preprocessed {} bytes -> {} bytes, quality={}, steps={}",
                    audio.length, out.length, String.format("%.3f", quality.overallQuality()), applied.size());
            return new PreprocessingResult(out, outSpec, quality.overallQuality(), applied, quality);
        } catch (RuntimeException e) {
            LOG.warn("Audio preprocessing failed; passing chunk through: {}", e.toString());
            return PreprocessingResult.passthrough(audio, config.inputSpec());
        }
    }

    @Override
    public AudioQualityMetrics analyzeQuality(byte[] audio, AudioSpec spec) {
        try {
            PcmAudio decoded = PcmCodec.decode(audio, spec);
            double[] samples = decoded.channelCount() > 1
                    ? FormatConversionStep.fold(decoded.channels())
                    : decoded.samples();
            return AudioQualityAnalyzer.analyze(samples);
        } catch (RuntimeException e) {
            LOG.debug("Quality analysis failed: {}", e.toString());
            return AudioQualityMetrics.UNMEASURABLE;
        }
    }
}
