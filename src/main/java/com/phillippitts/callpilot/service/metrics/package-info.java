/**
 * Micrometer instrumentation for outreach, consolidation and forwarding.
 */
package com.phillippitts.callpilot.service.metrics;
