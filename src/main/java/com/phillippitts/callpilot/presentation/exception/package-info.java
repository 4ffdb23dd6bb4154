/**
 * Mapping of exceptions to HTTP error responses.
 */
package com.phillippitts.callpilot.presentation.exception;
