/**
 * Request and response bodies of the HTTP API.
 */
package com.phillippitts.callpilot.presentation.dto;
