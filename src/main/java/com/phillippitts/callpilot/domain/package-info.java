/**
 * Domain models for outreach campaigns and booking consolidation.
 *
 * <p>Value objects are Java records and validate themselves in their constructors. The two
 * stateful types guard their own mutation:
 * <ul>
 *   <li>{@link com.phillippitts.callpilot.domain.CallSession} - call lifecycle state machine,
 *       lock-protected</li>
 *   <li>{@link com.phillippitts.callpilot.domain.Booking} - immutable apart from two set-once
 *       sink outcome slots</li>
 * </ul>
 *
 * <p>No persistence annotations: all state lives in memory for the life of the process.
 */
package com.phillippitts.callpilot.domain;
