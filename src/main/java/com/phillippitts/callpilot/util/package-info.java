/**
 * Small static helpers shared across services.
 */
package com.phillippitts.callpilot.util;
