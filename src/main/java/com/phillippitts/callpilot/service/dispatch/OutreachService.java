package com.phillippitts.callpilot.service.dispatch;

import com.phillippitts.callpilot.config.properties.OutreachProperties;
import com.phillippitts.callpilot.domain.CallTarget;
import com.phillippitts.callpilot.domain.OutreachCampaign;
import com.phillippitts.callpilot.domain.Provider;
import com.phillippitts.callpilot.domain.ScoredProvider;
import com.phillippitts.callpilot.exception.CampaignNotFoundException;
import com.phillippitts.callpilot.service.availability.AvailabilityService;
import com.phillippitts.callpilot.service.directory.ProviderDirectory;
import com.phillippitts.callpilot.service.ranking.ProviderFilter;
import com.phillippitts.callpilot.service.ranking.ProviderRanker;
import com.phillippitts.callpilot.service.ranking.RankingPreferences;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Entry point for the outreach surfaces: ranking queries, solo and swarm dispatch, and
 * campaign status.
 *
 * <p>A swarm loads the directory, applies the requester's preferences, ranks the survivors and
 * dials the top {@code callpilot.outreach.swarm-size}. Before dialing it asks the availability
 * service for the requester's free slots, which every provider brief carries. An empty
 * shortlist still produces a campaign, with no sessions.
 */
@Service
public class OutreachService {

    private static final Logger LOG = LogManager.getLogger(OutreachService.class);

    private final ProviderDirectory directory;
    private final ProviderFilter filter;
    private final ProviderRanker ranker;
    private final OutreachDispatcher dispatcher;
    private final CallSessionRegistry registry;
    private final AvailabilityService availability;
    private final OutreachProperties properties;

    public OutreachService(ProviderDirectory directory,
                           ProviderFilter filter,
                           ProviderRanker ranker,
                           OutreachDispatcher dispatcher,
                           CallSessionRegistry registry,
                           AvailabilityService availability,
                           OutreachProperties properties) {
        this.directory = Objects.requireNonNull(directory);
        this.filter = Objects.requireNonNull(filter);
        this.ranker = Objects.requireNonNull(ranker);
        this.dispatcher = Objects.requireNonNull(dispatcher);
        this.registry = Objects.requireNonNull(registry);
        this.availability = Objects.requireNonNull(availability);
        this.properties = Objects.requireNonNull(properties);
    }

    /**
     * Ranks the current directory. Preferences are applied only when given.
     */
    public List<ScoredProvider> rankProviders(RankingPreferences preferences) {
        List<Provider> providers = directory.loadProviders();
        if (preferences != null) {
            providers = filter.apply(providers, preferences);
        }
        return ranker.rank(providers);
    }

    public OutreachCampaign startSolo(String phoneNumber, String objective) {
        return dispatcher.dispatch(OutreachRequest.solo(phoneNumber, objective));
    }

    /**
     * @param requesterPhone phone of the person the booking is for; dialed in place of
     *                       {@link Provider#USER_TEST_PHONE} entries
     * @param preferences    filter preferences, or {@code null} for the configured defaults
     * @param preferredTime  time window to negotiate, or {@code null} for the configured default
     */
    public OutreachCampaign startSwarm(String requesterPhone, String objective,
                                       RankingPreferences preferences, String preferredTime) {
        RankingPreferences effective = preferences == null ? filter.defaults() : preferences;
        List<ScoredProvider> ranked = rankProviders(effective);
        List<ScoredProvider> shortlist = ranked.subList(0, Math.min(properties.getSwarmSize(), ranked.size()));
        if (shortlist.isEmpty()) {
            LOG.warn("No providers match minRating={} maxDistance={}; swarm has no targets",
                    effective.minRating(), effective.maxDistance());
        }
        List<CallTarget> targets = shortlist.stream()
                .map(sp -> CallTarget.provider(sp, requesterPhone))
                .toList();
        String window = preferredTime == null || preferredTime.isBlank()
                ? properties.getDefaultPreferredTime() : preferredTime;
        List<String> freeSlots = targets.isEmpty() ? List.of() : availability.freeSlots(window);
        return dispatcher.dispatch(
                new OutreachRequest(OutreachCampaign.Mode.SWARM, targets, objective, window, freeSlots));
    }

    public OutreachCampaign getCampaign(String campaignId) {
        return registry.findCampaign(campaignId)
                .orElseThrow(() -> new CampaignNotFoundException(campaignId));
    }
}
