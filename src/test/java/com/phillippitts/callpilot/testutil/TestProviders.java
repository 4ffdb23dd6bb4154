package com.phillippitts.callpilot.testutil;

import com.phillippitts.callpilot.domain.Provider;

/**
 * Provider fixtures.
 */
public final class TestProviders {

    private TestProviders() {
    }

    public static Provider provider(String id, double rating, double distance, double availability) {
        return new Provider(id, "Provider " + id, "+1555000" + String.format("%04d", Math.abs(id.hashCode()) % 10000),
                distance, rating, availability, "dentist", null);
    }

    public static Provider withPhone(String id, String phone, double rating, double distance, double availability) {
        return new Provider(id, "Provider " + id, phone, distance, rating, availability, "dentist", null);
    }
}
