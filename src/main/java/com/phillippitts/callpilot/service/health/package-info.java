/**
 * Actuator health reporting.
 */
package com.phillippitts.callpilot.service.health;
