package com.phillippitts.callpilot.service.directory;

import com.phillippitts.callpilot.domain.Provider;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the provider directory JSON format.
 *
 * <p>The document is an array of objects:
 * <pre>
 * [{"id": 1, "name": "...", "phone": "+1555...", "distance_miles": 2.1, "rating": 4.8,
 *   "availability": 0.9, "specialty": "...", "coordinates": {"lat": 40.7, "lng": -74.0}}]
 * </pre>
 * {@code distance_miles} wins over the older {@code distance} field. Numeric ranking fields that
 * are absent stay {@code null}. Ids may be numbers or strings and are kept as strings.
 *
 * <p>Thread-safe: all methods are static and stateless.
 */
final class ProviderJsonParser {

    private ProviderJsonParser() {
    }

    /**
     * @throws JSONException if the document is not an array of provider objects or an entry has
     *                       no id or name
     */
    static List<Provider> parse(String json) {
        JSONArray array = new JSONArray(json);
        List<Provider> providers = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            providers.add(parseProvider(array.getJSONObject(i), i));
        }
        return providers;
    }

    private static Provider parseProvider(JSONObject obj, int index) {
        Object rawId = obj.opt("id");
        if (rawId == null || JSONObject.NULL.equals(rawId)) {
            throw new JSONException("provider at index " + index + " has no id");
        }
        String name = obj.optString("name", null);
        if (name == null || name.isBlank()) {
            throw new JSONException("provider " + rawId + " has no name");
        }
        Double distance = optNumber(obj, "distance_miles");
        if (distance == null) {
            distance = optNumber(obj, "distance");
        }
        Double availability = optNumber(obj, "availability");
        if (availability == null) {
            availability = optNumber(obj, "availability_score");
        }
        return new Provider(
                String.valueOf(rawId),
                name,
                obj.optString("phone", null),
                distance,
                optNumber(obj, "rating"),
                availability,
                obj.optString("specialty", null),
                parseCoordinates(obj.optJSONObject("coordinates")));
    }

    private static Provider.Coordinates parseCoordinates(JSONObject c) {
        if (c == null) {
            return null;
        }
        Double lat = optNumber(c, "lat");
        if (lat == null) {
            lat = optNumber(c, "latitude");
        }
        Double lng = optNumber(c, "lng");
        if (lng == null) {
            lng = optNumber(c, "longitude");
        }
        return lat == null || lng == null ? null : new Provider.Coordinates(lat, lng);
    }

    private static Double optNumber(JSONObject obj, String key) {
        if (!obj.has(key) || obj.isNull(key)) {
            return null;
        }
        Object v = obj.get(key);
        if (v instanceof Number n) {
            return n.doubleValue();
        }
        try {
            return Double.parseDouble(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new JSONException("field '" + key + "' is not a number: " + v, e);
        }
    }
}
