/**
 * Outreach orchestration and booking consolidation services.
 */
package com.phillippitts.callpilot.service;
