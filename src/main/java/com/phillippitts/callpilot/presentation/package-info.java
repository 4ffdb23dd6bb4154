/**
 * HTTP presentation layer: controllers, request and response bodies, and error mapping.
 */
package com.phillippitts.callpilot.presentation;
