package com.phillippitts.callpilot.domain;

import java.util.Objects;

/**
 * Immutable provider entry as loaded from the provider directory.
 *
 * <p>The numeric ranking inputs are boxed on purpose: raw directory data may omit them, and the
 * ranking engine must report that as an invalid provider rather than silently defaulting.
 *
 * @param id            stable provider identifier (never null)
 * @param name          display name (never null)
 * @param phone         dialable phone number, or the {@code USER_TEST_PHONE} placeholder
 * @param distanceMiles distance from the requester in miles (may be null in raw data)
 * @param rating        review rating in [0, 5] (may be null in raw data)
 * @param availability  availability score in [0, 1] (may be null in raw data)
 * @param specialty     free-form specialty label (may be null)
 * @param coordinates   optional location
 */
public record Provider(
        String id,
        String name,
        String phone,
        Double distanceMiles,
        Double rating,
        Double availability,
        String specialty,
        Coordinates coordinates
) {

    /** Placeholder phone used by demo directories; replaced by the requester's number at dial time. */
    public static final String USER_TEST_PHONE = "USER_TEST_PHONE";

    public Provider {
        Objects.requireNonNull(id, "Provider id must not be null");
        Objects.requireNonNull(name, "Provider name must not be null");
    }

    /**
     * Optional geographic position of a provider.
     */
    public record Coordinates(double latitude, double longitude) { }
}
