/**
 * Outreach dispatch: campaigns, call sessions, call-state notifications and the session
 * lifetime sweep.
 */
package com.phillippitts.callpilot.service.dispatch;
