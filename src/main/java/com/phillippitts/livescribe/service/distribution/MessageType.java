package com.phillippitts.livescribe.service.distribution;

import java.util.Locale;

/**
 * Kinds of message pushed to session subscribers.
 */
public enum MessageType {
    SEGMENT,
    SPEAKER_UPDATE,
    STATUS,
    ERROR,
    COMPLETE;

    /** Lower-case name used on the wire, e.g. {@code speaker_update}. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
