/**
 * Best-effort forwarding of accepted bookings to the calendar and webhook sinks.
 */
package com.phillippitts.callpilot.service.forwarding;
