package com.phillippitts.callpilot.service.placement;

import com.phillippitts.callpilot.domain.CallTarget;
import com.phillippitts.callpilot.domain.Provider;
import com.phillippitts.callpilot.domain.ScoredProvider;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Builds the per-call brief handed to the voice agent.
 *
 * <p>Provider calls get a header with the provider's name, match score, distance and rank, the
 * preferred time window and the requester's free slots. Every brief ends with the session reference the agent must quote
 * when it confirms a booking, which is how confirmations find their way back to the session.
 */
public final class CallBriefing {

    static final String CONCISENESS_RULE =
            "Be extremely concise: state the purpose of the call within the first 10 seconds.";

    private CallBriefing() {
    }

    public static String build(String objective, String preferredTime, CallTarget target, String sessionId) {
        return build(objective, preferredTime, List.of(), target, sessionId);
    }

    public static String build(String objective, String preferredTime, List<String> freeSlots,
                               CallTarget target, String sessionId) {
        Objects.requireNonNull(target, "target must not be null");
        StringBuilder sb = new StringBuilder();
        ScoredProvider scored = target.provider();
        if (scored != null) {
            Provider p = scored.provider();
            sb.append("You are calling ").append(p.name()).append(". ");
            sb.append("They have a match score of ")
                    .append(String.format(Locale.ROOT, "%.2f", scored.score()));
            if (p.distanceMiles() != null) {
                sb.append(" and are ").append(String.format(Locale.ROOT, "%.1f", p.distanceMiles()))
                        .append(" miles away");
            }
            sb.append(". They are ranked #").append(scored.rank()).append(". ");
            if (preferredTime != null && !preferredTime.isBlank()) {
                sb.append("Your goal is to negotiate a ").append(preferredTime.trim()).append(" slot. ");
            }
            if (freeSlots != null && !freeSlots.isEmpty()) {
                sb.append("The user is free during these times: ").append(String.join(", ", freeSlots))
                        .append(". Only request slots that fall within these windows. ");
            }
        }
        if (objective != null && !objective.isBlank()) {
            sb.append(objective.trim());
            if (!objective.trim().endsWith(".")) {
                sb.append('.');
            }
            sb.append(' ');
        }
        sb.append(CONCISENESS_RULE);
        if (sessionId != null) {
            sb.append(" When a booking is agreed, confirm it with session reference ")
                    .append(sessionId).append('.');
        }
        return sb.toString();
    }
}
