/**
 * Spring configuration: executors, HTTP clients and configuration properties.
 */
package com.phillippitts.callpilot.config;
