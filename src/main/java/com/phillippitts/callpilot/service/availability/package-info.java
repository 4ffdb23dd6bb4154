/**
 * Free-slot lookup for the requester, folded into swarm call briefs.
 */
package com.phillippitts.callpilot.service.availability;
