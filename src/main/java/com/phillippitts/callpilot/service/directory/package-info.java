/**
 * Provider directory access.
 */
package com.phillippitts.callpilot.service.directory;
