package com.phillippitts.callpilot.service.dispatch;

import com.phillippitts.callpilot.domain.OutreachCampaign;

/**
 * Opens and tracks call sessions for a set of targets.
 *
 * <p>A placement failure affects only its own session, which ends up FAILED with a reason;
 * dispatch itself never fails because one target could not be dialed.
 */
public interface OutreachDispatcher {

    /**
     * Opens one session per target and asks the call-placing service to start every call.
     * Placements run concurrently; the method returns once each has been acknowledged, has
     * failed, or the placement timeout elapsed.
     *
     * @param request targets and agent brief inputs
     * @return the new campaign, its sessions in target order
     * @throws com.phillippitts.callpilot.exception.PlacementNotConfiguredException if the
     *         call-placing service lacks required settings
     */
    OutreachCampaign dispatch(OutreachRequest request);
}
