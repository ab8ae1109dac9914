/**
 * WebSocket transport for the distribution hub.
 */
package com.phillippitts.livescribe.presentation.websocket;
