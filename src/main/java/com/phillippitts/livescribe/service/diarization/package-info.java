/**
 * Speaker diarization: energy voice activity detection, windowed voice embeddings, greedy
 * similarity clustering and nearest-neighbour identification against session voice profiles.
 */
package com.phillippitts.livescribe.service.diarization;
