/**
 * Actuator health contributions.
 */
package com.phillippitts.livescribe.service.health;
