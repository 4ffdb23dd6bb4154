package com.phillippitts.callpilot.service.dispatch;

import com.phillippitts.callpilot.config.properties.OutreachProperties;
import com.phillippitts.callpilot.domain.CallSession;
import com.phillippitts.callpilot.domain.CallTarget;
import com.phillippitts.callpilot.domain.OutreachCampaign;
import com.phillippitts.callpilot.domain.SessionRef;
import com.phillippitts.callpilot.exception.PlacementException;
import com.phillippitts.callpilot.exception.PlacementNotConfiguredException;
import com.phillippitts.callpilot.service.dispatch.event.CallStateChangedEvent;
import com.phillippitts.callpilot.service.metrics.OutreachMetricsPublisher;
import com.phillippitts.callpilot.service.placement.CallBriefing;
import com.phillippitts.callpilot.service.placement.CallPlacementService;
import com.phillippitts.callpilot.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Default dispatcher: one placement task per target on the {@code dialExecutor}.
 *
 * <p><b>Thread Model:</b> every target gets its own task, so a slow or hanging placement never
 * delays its siblings. {@link #dispatch} blocks until all tasks finish or
 * {@code callpilot.outreach.placement-timeout-ms} elapses; sessions still waiting at that point
 * are marked FAILED ("placement timed out").
 *
 * <p><b>Error Handling:</b> a {@link PlacementException} or unexpected runtime error fails only
 * the affected session. So does a placement the executor rejects; no placement ever runs on the
 * dispatching thread. A call acknowledged after its session already failed is logged and its
 * conversation id is still indexed, so a later confirmation quoting it is matched.
 *
 * <p>Call-state notifications from the collaborator arrive as {@link CallStateChangedEvent}s and
 * drive DIALING → IN_PROGRESS, and the COMPLETED and FAILED endings.
 */
@Service
public class DefaultOutreachDispatcher implements OutreachDispatcher {

    private static final Logger LOG = LogManager.getLogger(DefaultOutreachDispatcher.class);

    static final String PLACEMENT_TIMED_OUT = "placement timed out";
    static final String PLACEMENT_REJECTED = "placement rejected: executor unavailable";

    private final CallPlacementService placementService;
    private final CallSessionRegistry registry;
    private final Executor executor;
    private final OutreachMetricsPublisher metrics;
    private final Clock clock;
    private final long placementTimeoutMs;

    public DefaultOutreachDispatcher(CallPlacementService placementService,
                                     CallSessionRegistry registry,
                                     @Qualifier("dialExecutor") Executor executor,
                                     OutreachMetricsPublisher metrics,
                                     Clock clock,
                                     OutreachProperties properties) {
        this.placementService = Objects.requireNonNull(placementService);
        this.registry = Objects.requireNonNull(registry);
        this.executor = Objects.requireNonNull(executor);
        this.metrics = metrics == null ? OutreachMetricsPublisher.NOOP : metrics;
        this.clock = Objects.requireNonNull(clock);
        this.placementTimeoutMs = properties.getPlacementTimeoutMs();
    }

    @Override
    public OutreachCampaign dispatch(OutreachRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        List<String> missing = placementService.missingSettings();
        if (!missing.isEmpty()) {
            throw new PlacementNotConfiguredException(missing);
        }

        String campaignId = UUID.randomUUID().toString();
        List<CallSession> sessions = new ArrayList<>(request.targets().size());
        for (CallTarget target : request.targets()) {
            sessions.add(new CallSession(UUID.randomUUID().toString(), campaignId, target, clock.instant()));
        }
        OutreachCampaign campaign = new OutreachCampaign(
                campaignId, request.mode(), request.objective(), clock.instant(), sessions);
        registry.register(campaign);
        metrics.recordDispatch(request.mode().name(), sessions.size());

        ThreadContext.put("campaignId", campaignId);
        try {
            LOG.info("Dispatching {} campaign {}: {} target(s) [{}]", request.mode(), campaignId, sessions.size(),
                    String.join(", ", sessions.stream().map(s -> s.getTarget().label()).toList()));
            awaitPlacements(sessions, startPlacements(sessions, request));
        } finally {
            ThreadContext.remove("campaignId");
        }
        return campaign;
    }

    private List<CompletableFuture<Void>> startPlacements(List<CallSession> sessions, OutreachRequest request) {
        List<CompletableFuture<Void>> futures = new ArrayList<>(sessions.size());
        for (CallSession session : sessions) {
            String brief = CallBriefing.build(request.objective(), request.preferredTime(), request.freeSlots(),
                    session.getTarget(), session.getId());
            try {
                futures.add(CompletableFuture.runAsync(() -> place(session, brief), executor));
            } catch (RejectedExecutionException e) {
                LOG.warn("Placement for session {} rejected by executor: {}", session.getId(), e.getMessage());
                session.markFailed(PLACEMENT_REJECTED, clock.instant());
                futures.add(CompletableFuture.completedFuture(null));
            }
        }
        return futures;
    }

    private void awaitPlacements(List<CallSession> sessions, List<CompletableFuture<Void>> futures) {
        try {
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                    .get(placementTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            LOG.warn("Placements did not all finish within {} ms", placementTimeoutMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException ee) {
            // place() records its own failures; nothing left to collect
            LOG.debug("Placement task completed exceptionally: {}", ee.getMessage());
        }

        for (int i = 0; i < sessions.size(); i++) {
            if (!futures.get(i).isDone()) {
                CallSession session = sessions.get(i);
                if (session.markFailed(PLACEMENT_TIMED_OUT, clock.instant())) {
                    metrics.recordPlacement("timeout", TimeUnit.MILLISECONDS.toNanos(placementTimeoutMs));
                }
            }
        }
    }

    private void place(CallSession session, String brief) {
        ThreadContext.put("sessionId", session.getId());
        long t0 = System.nanoTime();
        CallTarget target = session.getTarget();
        try {
            SessionRef ref = placementService.startCall(target, brief);
            registry.bindReference(ref, session);
            if (session.markDialing(ref, clock.instant())) {
                metrics.recordPlacement("success", System.nanoTime() - t0);
                LOG.info("Session {} dialing {} (conversationId={})",
                        session.getId(), target.label(), ref.conversationId());
            } else {
                LOG.warn("Late acknowledgement for session {} in state {} (conversationId={})",
                        session.getId(), session.getState(), ref.conversationId());
            }
        } catch (PlacementException e) {
            metrics.recordPlacement("failure", System.nanoTime() - t0);
            LOG.warn("Placement failed for session {} ({}, {}): {}", session.getId(), target.label(),
                    LogSanitizer.maskPhone(target.phoneNumber()), e.getMessage());
            session.markFailed(e.getMessage(), clock.instant());
        } catch (RuntimeException e) {
            metrics.recordPlacement("failure", System.nanoTime() - t0);
            LOG.error("Unexpected placement error for session {}", session.getId(), e);
            session.markFailed("unexpected placement error: " + e.getClass().getSimpleName(), clock.instant());
        } finally {
            ThreadContext.remove("sessionId");
        }
    }

    /**
     * Applies a collaborator call-state notification to its session. Unknown references and
     * transitions that do not apply to the current state are logged and ignored.
     */
    @EventListener
    public void onCallStateChanged(CallStateChangedEvent event) {
        CallSession session = registry.findSession(event.sessionRef()).orElse(null);
        if (session == null) {
            LOG.warn("Call-state notification for unknown session: ref={}, state={}",
                    event.sessionRef(), event.state());
            return;
        }
        boolean applied = switch (event.state()) {
            case CONNECTED -> session.markInProgress(event.at());
            case ENDED -> session.markCompleted(reasonOr(event.reason(), "call ended"), event.at());
            case FAILED -> session.markFailed(reasonOr(event.reason(), "call failed"), event.at());
        };
        if (applied) {
            LOG.info("Session {} -> {} ({})", session.getId(), session.getState(), event.state());
        } else {
            LOG.debug("Ignored {} for session {} in state {}", event.state(), session.getId(), session.getState());
        }
    }

    private static String reasonOr(String reason, String fallback) {
        return reason == null || reason.isBlank() ? fallback : reason;
    }
}
