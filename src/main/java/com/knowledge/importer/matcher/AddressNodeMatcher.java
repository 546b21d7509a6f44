package com.knowledge.importer.matcher;

import com.knowledge.importer.matcher.AddressNormalizer.StreetComponents;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Matches postal addresses after normalizing street, city, state and country spellings.
 */
public class AddressNodeMatcher extends AbstractNodeMatcher {

    public static final double DEFAULT_THRESHOLD = 0.75;

    /** Maximum distance, in metres, for two geocoded addresses to be the same place. */
    public static final double MAX_COORDINATE_DISTANCE_METERS = 50.0;

    private static final double EARTH_RADIUS_METERS = 6_371_000.0;

    private final List<EqualityMethod> methods = List.of(
            EqualityMethod.graded("normalized_address_match", 0.9,
                    AddressNodeMatcher::normalizedAddressMatch,
                    AddressNodeMatcher::normalizedAddressScore),
            EqualityMethod.graded("street_number_street_name_match", 0.8,
                    AddressNodeMatcher::streetNumberStreetNameMatch,
                    AddressNodeMatcher::streetScore),
            EqualityMethod.graded("city_state_zip_match", 0.4,
                    AddressNodeMatcher::cityStateZipMatch,
                    AddressNodeMatcher::cityStateZipScore),
            EqualityMethod.graded("coordinate_proximity_match", 0.7,
                    AddressNodeMatcher::coordinateProximityMatch,
                    AddressNodeMatcher::coordinateScore));

    public AddressNodeMatcher() {
        super("address", DEFAULT_THRESHOLD);
    }

    @Override
    public List<String> embeddingProperties() {
        return List.of("street", "city", "state", "country", "postalCode", "notes");
    }

    @Override
    public List<EqualityMethod> equalityMethods() {
        return methods;
    }

    @Override
    public List<String> identifyingProperties() {
        return List.of("street", "city", "state", "postalCode", "zip", "country");
    }

    @Override
    protected List<String> discriminatingProperties() {
        return List.of("postalCode");
    }

    @Override
    protected String comparable(String key, Map<String, Object> properties) {
        if ("postalCode".equals(key)) {
            return zip(properties);
        }
        return super.comparable(key, properties);
    }

    // ========== Equality methods ==========

    static boolean normalizedAddressMatch(Map<String, Object> a, Map<String, Object> b) {
        String na = normalizeAddress(a);
        String nb = normalizeAddress(b);
        if (na.isEmpty() || nb.isEmpty()) {
            return false;
        }
        return na.equals(nb) || na.contains(nb) || nb.contains(na) || similar(na, nb, 0.85);
    }

    static boolean streetNumberStreetNameMatch(Map<String, Object> a, Map<String, Object> b) {
        String sa = AddressNormalizer.normalizeStreet(text(a, "street"));
        String sb = AddressNormalizer.normalizeStreet(text(b, "street"));
        if (sa == null || sb == null) {
            return false;
        }
        if (sa.equals(sb)) {
            return true;
        }
        StreetComponents ca = AddressNormalizer.streetComponents(sa);
        StreetComponents cb = AddressNormalizer.streetComponents(sb);
        if (ca.number() == null || cb.number() == null) {
            return similar(ca.name(), cb.name(), 0.85);
        }
        return ca.number().equals(cb.number()) && similar(ca.name(), cb.name(), 0.8);
    }

    /**
     * Same city and state, or same ZIP and city. A matching ZIP tolerates small
     * spelling differences in city and state.
     */
    static boolean cityStateZipMatch(Map<String, Object> a, Map<String, Object> b) {
        String cityA = AddressNormalizer.normalizeCity(text(a, "city"));
        String cityB = AddressNormalizer.normalizeCity(text(b, "city"));
        String stateA = AddressNormalizer.normalizeState(text(a, "state"));
        String stateB = AddressNormalizer.normalizeState(text(b, "state"));
        String zipA = zip(a);
        String zipB = zip(b);

        boolean cityMatch = cityA != null && cityA.equals(cityB);
        boolean stateMatch = stateA != null && stateB != null
                && (stateA.equals(stateB) || stateA.contains(stateB) || stateB.contains(stateA));
        boolean zipMatch = zipA != null && zipA.equals(zipB);

        if (zipMatch && !cityMatch) {
            cityMatch = similar(cityA, cityB, 0.7);
        }
        if (zipMatch && cityMatch && !stateMatch) {
            stateMatch = similar(stateA, stateB, 0.7);
        }
        return (cityMatch && stateMatch) || (zipMatch && cityMatch);
    }

    static boolean coordinateProximityMatch(Map<String, Object> a, Map<String, Object> b) {
        double distance = distanceMeters(a, b);
        return distance >= 0 && distance <= MAX_COORDINATE_DISTANCE_METERS;
    }

    // ========== Scores ==========

    private static double normalizedAddressScore(Map<String, Object> a, Map<String, Object> b) {
        String na = normalizeAddress(a);
        String nb = normalizeAddress(b);
        if (na.equals(nb)) {
            return 1.0;
        }
        if (na.contains(nb) || nb.contains(na)) {
            return 0.9;
        }
        return similarity(na, nb);
    }

    private static double streetScore(Map<String, Object> a, Map<String, Object> b) {
        String sa = AddressNormalizer.normalizeStreet(text(a, "street"));
        String sb = AddressNormalizer.normalizeStreet(text(b, "street"));
        if (sa != null && sa.equals(sb)) {
            return 1.0;
        }
        StreetComponents ca = AddressNormalizer.streetComponents(sa);
        StreetComponents cb = AddressNormalizer.streetComponents(sb);
        double nameScore = similarity(ca.name(), cb.name());
        return ca.number() == null || cb.number() == null ? nameScore * 0.8 : nameScore;
    }

    private static double cityStateZipScore(Map<String, Object> a, Map<String, Object> b) {
        String zipA = zip(a);
        double zipScore = zipA != null && zipA.equals(zip(b)) ? 1.0 : 0.0;
        double cityScore = similarity(AddressNormalizer.normalizeCity(text(a, "city")),
                AddressNormalizer.normalizeCity(text(b, "city")));
        double stateScore = similarity(AddressNormalizer.normalizeState(text(a, "state")),
                AddressNormalizer.normalizeState(text(b, "state")));
        return (zipScore + cityScore + stateScore) / 3.0;
    }

    private static double coordinateScore(Map<String, Object> a, Map<String, Object> b) {
        double distance = distanceMeters(a, b);
        if (distance < 0) {
            return 0.0;
        }
        return 1.0 - (distance / (2 * MAX_COORDINATE_DISTANCE_METERS));
    }

    // ========== Normalization ==========

    /**
     * "street, city state zip5, country", lower-cased, skipping missing parts.
     */
    static String normalizeAddress(Map<String, Object> properties) {
        List<String> parts = new ArrayList<>();
        String street = AddressNormalizer.normalizeStreet(text(properties, "street"));
        if (street != null) {
            parts.add(street);
        }
        List<String> locality = new ArrayList<>();
        String city = AddressNormalizer.normalizeCity(text(properties, "city"));
        String state = AddressNormalizer.normalizeState(text(properties, "state"));
        String zip = zip(properties);
        if (city != null) {
            locality.add(city);
        }
        if (state != null) {
            locality.add(state);
        }
        if (zip != null) {
            locality.add(zip);
        }
        if (!locality.isEmpty()) {
            parts.add(String.join(" ", locality));
        }
        if (parts.isEmpty()) {
            return "";
        }
        parts.add(AddressNormalizer.normalizeCountry(text(properties, "country")));
        return String.join(", ", parts).toLowerCase(Locale.ROOT);
    }

    private static String zip(Map<String, Object> properties) {
        return AddressNormalizer.zip5(firstText(properties, "postalCode", "postal_code", "zip"));
    }

    /**
     * Haversine distance between the two coordinates, or -1 when either side lacks them.
     */
    static double distanceMeters(Map<String, Object> a, Map<String, Object> b) {
        Double latA = coordinate(a, "latitude", "lat");
        Double lonA = coordinate(a, "longitude", "lng", "lon");
        Double latB = coordinate(b, "latitude", "lat");
        Double lonB = coordinate(b, "longitude", "lng", "lon");
        if (latA == null || lonA == null || latB == null || lonB == null) {
            return -1;
        }
        double dLat = Math.toRadians(latB - latA);
        double dLon = Math.toRadians(lonB - lonA);
        double h = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(latA)) * Math.cos(Math.toRadians(latB))
                * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        return 2 * EARTH_RADIUS_METERS * Math.asin(Math.min(1.0, Math.sqrt(h)));
    }

    private static Double coordinate(Map<String, Object> properties, String... keys) {
        for (String key : keys) {
            Object value = properties.get(key);
            if (value instanceof Number n) {
                return n.doubleValue();
            }
            if (value instanceof String s && !s.isBlank()) {
                try {
                    return Double.parseDouble(s.trim());
                } catch (NumberFormatException e) {
                    return null;
                }
            }
        }
        return null;
    }
}
