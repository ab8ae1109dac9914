/**
 * Audio container and sample codecs (WAV parsing and writing, PCM decoding to normalized
 * samples) plus the preprocessing pipeline in {@code service.audio.preprocess}.
 */
package com.phillippitts.livescribe.service.audio;
