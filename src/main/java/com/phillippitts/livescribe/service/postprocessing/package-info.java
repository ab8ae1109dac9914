/**
 * Handoff of finalized transcripts to downstream processing.
 */
package com.phillippitts.livescribe.service.postprocessing;
