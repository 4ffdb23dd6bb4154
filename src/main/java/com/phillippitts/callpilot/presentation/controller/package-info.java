/**
 * REST controllers of the HTTP API.
 */
package com.phillippitts.callpilot.presentation.controller;
