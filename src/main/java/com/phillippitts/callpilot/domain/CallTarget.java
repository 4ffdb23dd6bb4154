package com.phillippitts.callpilot.domain;

import java.util.Objects;

/**
 * Something the dispatcher can dial: either an ad-hoc number (solo mode) or a ranked provider
 * (swarm mode).
 *
 * @param phoneNumber number actually dialed; blank only when a directory entry has no phone,
 *                    which the placement step reports as a per-session failure
 * @param provider    ranked provider behind the number, or {@code null} in solo mode
 */
public record CallTarget(String phoneNumber, ScoredProvider provider) {

    public CallTarget {
        Objects.requireNonNull(phoneNumber, "phoneNumber must not be null");
    }

    public static CallTarget solo(String phoneNumber) {
        if (phoneNumber == null || phoneNumber.isBlank()) {
            throw new IllegalArgumentException("phoneNumber must not be blank");
        }
        return new CallTarget(phoneNumber.trim(), null);
    }

    /**
     * Targets a ranked provider. The {@link Provider#USER_TEST_PHONE} placeholder is replaced by
     * the requester's own number so demo directories can ring the caller.
     */
    public static CallTarget provider(ScoredProvider scored, String requesterPhone) {
        Objects.requireNonNull(scored, "scored must not be null");
        String phone = scored.provider().phone();
        if (Provider.USER_TEST_PHONE.equals(phone)) {
            phone = requesterPhone;
        }
        return new CallTarget(phone == null ? "" : phone, scored);
    }

    public boolean isSolo() {
        return provider == null;
    }

    /** Display label for logs and briefs. */
    public String label() {
        return provider == null ? "solo target" : provider.provider().name();
    }
}
