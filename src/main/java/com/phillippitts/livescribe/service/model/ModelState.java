package com.phillippitts.livescribe.service.model;

/**
 * Readiness of one model.
 */
public enum ModelState {
    LOADING,
    READY,
    ERROR
}
