/**
 * Booking consolidation: validation, deduplication per session and the bounded telemetry
 * history.
 */
package com.phillippitts.callpilot.service.consolidation;
