/**
 * External speech model access: the {@link com.phillippitts.livescribe.service.model.SpeechModelGateway}
 * boundary, its Hugging Face implementation, and the
 * {@link com.phillippitts.livescribe.service.model.ModelTranscriptionClient} that adds readiness
 * tracking, bounded calls, performance ranking and one-step fallback.
 */
package com.phillippitts.livescribe.service.model;
