/**
 * Runtime exception hierarchy rooted at {@link com.phillippitts.livescribe.exception.LiveScribeException}.
 *
 * <p>Model failures carry a {@link com.phillippitts.livescribe.domain.TranscriptionErrorCode}; session
 * lifecycle violations are reported with dedicated types so callers never have to parse messages.
 */
package com.phillippitts.livescribe.exception;
