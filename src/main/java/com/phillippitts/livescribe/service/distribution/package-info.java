/**
 * Real-time fan-out of session events to subscribers.
 *
 * <p>The hub is transport neutral; {@link com.phillippitts.livescribe.service.distribution.SubscriberChannel}
 * adapts a concrete connection such as a WebSocket session.
 */
package com.phillippitts.livescribe.service.distribution;
