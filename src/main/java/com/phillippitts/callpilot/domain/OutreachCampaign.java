package com.phillippitts.callpilot.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * The sessions opened by one dispatch command. A solo campaign holds exactly one session.
 *
 * @param id        campaign id
 * @param mode      solo or swarm
 * @param objective what the calls are trying to book
 * @param createdAt creation time
 * @param sessions  sessions in target order (immutable list of live session objects)
 */
public record OutreachCampaign(String id, Mode mode, String objective, Instant createdAt,
                               List<CallSession> sessions) {

    public enum Mode { SOLO, SWARM }

    public OutreachCampaign {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        sessions = List.copyOf(sessions);
    }

    public List<CallSessionHandle> handles() {
        return sessions.stream().map(CallSession::toHandle).toList();
    }
}
