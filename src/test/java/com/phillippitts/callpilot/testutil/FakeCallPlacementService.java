package com.phillippitts.callpilot.testutil;

import com.phillippitts.callpilot.domain.CallTarget;
import com.phillippitts.callpilot.domain.SessionRef;
import com.phillippitts.callpilot.exception.PlacementException;
import com.phillippitts.callpilot.service.placement.CallPlacementService;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scriptable call-placing service.
 *
 * <p>By default every call succeeds with conversation ids {@code conv-1}, {@code conv-2}, ...
 * in call order. Individual numbers can be made to fail or to hang until {@link #release()}.
 */
public class FakeCallPlacementService implements CallPlacementService {

    private final AtomicInteger counter = new AtomicInteger();
    private final Map<String, String> failures = new ConcurrentHashMap<>();
    private final Map<String, Boolean> hanging = new ConcurrentHashMap<>();
    private final CountDownLatch hangLatch = new CountDownLatch(1);
    private final List<String> dialed = new CopyOnWriteArrayList<>();
    private final List<String> briefs = new CopyOnWriteArrayList<>();
    private volatile List<String> missingSettings = List.of();

    public FakeCallPlacementService failFor(String phone, String reason) {
        failures.put(phone, reason);
        return this;
    }

    public FakeCallPlacementService hangFor(String phone) {
        hanging.put(phone, Boolean.TRUE);
        return this;
    }

    public FakeCallPlacementService unconfigured(String... missing) {
        this.missingSettings = List.of(missing);
        return this;
    }

    /** Lets hanging placements finish. */
    public void release() {
        hangLatch.countDown();
    }

    @Override
    public SessionRef startCall(CallTarget target, String brief) {
        dialed.add(target.phoneNumber());
        briefs.add(brief);
        if (hanging.containsKey(target.phoneNumber())) {
            try {
                hangLatch.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        String reason = failures.get(target.phoneNumber());
        if (reason != null) {
            throw new PlacementException(reason);
        }
        int n = counter.incrementAndGet();
        return new SessionRef("conv-" + n, "CA" + n);
    }

    @Override
    public List<String> missingSettings() {
        return missingSettings;
    }

    public List<String> dialed() {
        return new ArrayList<>(dialed);
    }

    public List<String> briefs() {
        return new ArrayList<>(briefs);
    }
}
