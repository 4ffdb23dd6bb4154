/**
 * Logging support: request correlation through the Log4j2 ThreadContext.
 */
package com.phillippitts.callpilot.config.logging;
