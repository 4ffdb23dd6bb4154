package com.phillippitts.callpilot.service.dispatch;

import com.phillippitts.callpilot.domain.CallTarget;
import com.phillippitts.callpilot.domain.OutreachCampaign;

import java.util.List;
import java.util.Objects;

/**
 * What one dispatch command should dial.
 *
 * @param mode          solo or swarm
 * @param targets       targets in rank order (exactly one in solo mode)
 * @param objective     what the agent should try to book
 * @param preferredTime time window the agent negotiates for (may be null)
 * @param freeSlots     requester's free slots the agent must stay within (empty when unknown)
 */
public record OutreachRequest(OutreachCampaign.Mode mode, List<CallTarget> targets, String objective,
                              String preferredTime, List<String> freeSlots) {

    public OutreachRequest {
        Objects.requireNonNull(mode, "mode must not be null");
        targets = List.copyOf(Objects.requireNonNull(targets, "targets must not be null"));
        freeSlots = freeSlots == null ? List.of() : List.copyOf(freeSlots);
        if (mode == OutreachCampaign.Mode.SOLO && targets.size() != 1) {
            throw new IllegalArgumentException("solo dispatch needs exactly one target, got " + targets.size());
        }
    }

    public OutreachRequest(OutreachCampaign.Mode mode, List<CallTarget> targets, String objective,
                           String preferredTime) {
        this(mode, targets, objective, preferredTime, List.of());
    }

    public static OutreachRequest solo(String phoneNumber, String objective) {
        return new OutreachRequest(OutreachCampaign.Mode.SOLO, List.of(CallTarget.solo(phoneNumber)), objective, null);
    }
}
