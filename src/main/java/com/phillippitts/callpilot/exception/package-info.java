/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions extend {@link com.phillippitts.callpilot.exception.CallPilotException} so the
 * REST boundary can map them in one place.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.callpilot.exception.InvalidProviderException} - bad ranking input
 *       (caller error, surfaced)</li>
 *   <li>{@link com.phillippitts.callpilot.exception.MalformedBookingException} - rejected
 *       confirmation (caller error, surfaced)</li>
 *   <li>{@link com.phillippitts.callpilot.exception.PlacementException} - per-session call
 *       placement failure (recorded on the session, never surfaced)</li>
 *   <li>{@link com.phillippitts.callpilot.exception.PlacementNotConfiguredException} - dispatch
 *       refused because call placement settings are missing</li>
 *   <li>{@link com.phillippitts.callpilot.exception.ProviderDirectoryException} - directory
 *       unreadable</li>
 *   <li>{@link com.phillippitts.callpilot.exception.CampaignNotFoundException} - unknown campaign
 *       id in a status query</li>
 * </ul>
 *
 * <p>Sink failures are deliberately not exceptions: they are recorded as
 * {@link com.phillippitts.callpilot.domain.SinkOutcome} values.
 */
package com.phillippitts.callpilot.exception;
