package com.phillippitts.livescribe.service.model;

/**
 * Raw response of the inference boundary.
 *
 * @param text transcribed text
 * @param confidence reported confidence, null when the endpoint does not provide one
 */
public record ModelOutput(String text, Double confidence) {
}
