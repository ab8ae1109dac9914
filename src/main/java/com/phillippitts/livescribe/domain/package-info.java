/**
 * Domain model of a transcription session: configuration, chunks, segments, speakers and the
 * aggregated transcript.
 *
 * <p>Everything here except {@link com.phillippitts.livescribe.domain.AudioChunk} is immutable.
 */
package com.phillippitts.livescribe.domain;
