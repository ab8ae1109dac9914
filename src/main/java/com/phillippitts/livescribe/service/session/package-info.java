/**
 * Transcription session lifecycle and the per-chunk pipeline.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.livescribe.service.session.TranscriptionSessionManager} - public entry
 *       point: start, feed, pause, resume, cancel and finalize sessions</li>
 *   <li>{@link com.phillippitts.livescribe.service.session.SessionRegistry} - the single map of live
 *       sessions plus tombstones of closed ones</li>
 *   <li>{@link com.phillippitts.livescribe.service.session.ChunkPipeline} - preprocess, diarize and
 *       transcribe stages run in order for every chunk</li>
 *   <li>{@link com.phillippitts.livescribe.service.session.AudioStreamConsumer} - reads a session's
 *       input stream and cuts it into overlapping windows</li>
 *   <li>{@link com.phillippitts.livescribe.service.session.SessionEventSink} - per-session observer of
 *       lifecycle changes</li>
 * </ul>
 *
 * <p><b>Lifecycle:</b> INITIALIZING to ACTIVE, ACTIVE and PAUSED alternate, and any non-terminal
 * state may end in COMPLETED, CANCELLED or ERROR. Terminal sessions leave the registry.
 */
package com.phillippitts.livescribe.service.session;
