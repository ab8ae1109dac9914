/**
 * Structural checks on chunk payloads.
 */
package com.phillippitts.livescribe.service.validation;
