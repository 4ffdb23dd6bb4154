package com.phillippitts.callpilot.service.dispatch;

import com.phillippitts.callpilot.config.properties.OutreachProperties;
import com.phillippitts.callpilot.domain.CallSession;
import com.phillippitts.callpilot.domain.OutreachCampaign;
import com.phillippitts.callpilot.domain.SessionRef;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory index of campaigns and their sessions.
 *
 * <p>Sessions can be found by the engine's session id or by the conversation id the
 * call-placing service returned for them. Campaigns are kept in arrival order; once more than
 * {@code callpilot.outreach.retained-campaigns} are held, the oldest campaigns whose sessions
 * are all terminal are dropped. Campaigns with an open session are never dropped.
 *
 * <p>Deduplication only reaches as far as retention: once a settled campaign is evicted, its
 * session and conversation ids no longer resolve, and a repeated confirmation quoting them is
 * accepted as an uncorrelated booking.
 *
 * <p>Thread-safe.
 */
@Component
public class CallSessionRegistry {

    private static final Logger LOG = LogManager.getLogger(CallSessionRegistry.class);

    private final int retainedCampaigns;

    private final Map<String, OutreachCampaign> campaigns = new LinkedHashMap<>();
    private final ConcurrentMap<String, CallSession> sessionsById = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, CallSession> sessionsByConversation = new ConcurrentHashMap<>();

    public CallSessionRegistry(OutreachProperties properties) {
        this.retainedCampaigns = properties.getRetainedCampaigns();
    }

    public void register(OutreachCampaign campaign) {
        Objects.requireNonNull(campaign, "campaign must not be null");
        synchronized (campaigns) {
            campaigns.put(campaign.id(), campaign);
            for (CallSession s : campaign.sessions()) {
                sessionsById.put(s.getId(), s);
            }
            evictSettledCampaigns();
        }
    }

    /**
     * Makes a session findable by the collaborator's conversation id. A session whose campaign
     * has already been evicted is not bound.
     *
     * @return {@code true} if the reference was bound
     */
    public boolean bindReference(SessionRef ref, CallSession session) {
        Objects.requireNonNull(ref, "ref must not be null");
        Objects.requireNonNull(session, "session must not be null");
        synchronized (campaigns) {
            if (sessionsById.get(session.getId()) != session) {
                LOG.debug("Not binding conversation {}: session {} is no longer registered",
                        ref.conversationId(), session.getId());
                return false;
            }
            sessionsByConversation.put(ref.conversationId(), session);
            return true;
        }
    }

    public Optional<OutreachCampaign> findCampaign(String campaignId) {
        if (campaignId == null) {
            return Optional.empty();
        }
        synchronized (campaigns) {
            return Optional.ofNullable(campaigns.get(campaignId));
        }
    }

    /**
     * Resolves a session reference, trying the engine session id first and the collaborator
     * conversation id second.
     */
    public Optional<CallSession> findSession(String sessionRef) {
        if (sessionRef == null || sessionRef.isBlank()) {
            return Optional.empty();
        }
        String ref = sessionRef.trim();
        CallSession byId = sessionsById.get(ref);
        if (byId != null) {
            return Optional.of(byId);
        }
        return Optional.ofNullable(sessionsByConversation.get(ref));
    }

    /**
     * Snapshot of every known session that is not yet terminal.
     */
    public List<CallSession> openSessions() {
        List<CallSession> open = new ArrayList<>();
        for (CallSession s : sessionsById.values()) {
            if (!s.getState().isTerminal()) {
                open.add(s);
            }
        }
        return open;
    }

    public int campaignCount() {
        synchronized (campaigns) {
            return campaigns.size();
        }
    }

    private void evictSettledCampaigns() {
        Iterator<OutreachCampaign> it = campaigns.values().iterator();
        while (campaigns.size() > retainedCampaigns && it.hasNext()) {
            OutreachCampaign oldest = it.next();
            boolean settled = oldest.sessions().stream().allMatch(s -> s.getState().isTerminal());
            if (!settled) {
                continue;
            }
            it.remove();
            for (CallSession s : oldest.sessions()) {
                sessionsById.remove(s.getId());
                sessionsByConversation.values().removeIf(bound -> bound == s);
            }
            LOG.debug("Evicted settled campaign {}", oldest.id());
        }
    }
}
