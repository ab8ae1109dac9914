/**
 * Spring application events mirroring {@link com.phillippitts.livescribe.service.session.SessionEventSink}
 * callbacks, for listeners outside the engine.
 */
package com.phillippitts.livescribe.service.session.event;
