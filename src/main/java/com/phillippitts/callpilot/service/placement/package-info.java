/**
 * Outbound call placement through the voice-agent platform.
 */
package com.phillippitts.callpilot.service.placement;
