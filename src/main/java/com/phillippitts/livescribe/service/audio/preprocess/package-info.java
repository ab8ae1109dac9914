/**
 * Chunk preprocessing: format conversion, volume normalization, high-pass noise reduction and
 * echo suppression, each an {@link com.phillippitts.livescribe.service.audio.preprocess.EnhancementStep}
 * keyed by {@link com.phillippitts.livescribe.service.audio.preprocess.EnhancementType}.
 */
package com.phillippitts.livescribe.service.audio.preprocess;
