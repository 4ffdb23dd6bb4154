/**
 * Provider ranking: preference filtering and deterministic weighted scoring.
 */
package com.phillippitts.callpilot.service.ranking;
