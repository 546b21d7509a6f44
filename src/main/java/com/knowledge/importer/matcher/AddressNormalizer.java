package com.knowledge.importer.matcher;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonical forms for postal address parts, so that "123 North Main Street" and
 * "123 N Main St" compare equal.
 */
public final class AddressNormalizer {

    private static final Map<String, String> STREET_SUFFIXES = Map.ofEntries(
            Map.entry("street", "st"), Map.entry("st", "st"), Map.entry("str", "st"),
            Map.entry("avenue", "ave"), Map.entry("ave", "ave"), Map.entry("av", "ave"),
            Map.entry("road", "rd"), Map.entry("rd", "rd"),
            Map.entry("boulevard", "blvd"), Map.entry("blvd", "blvd"),
            Map.entry("lane", "ln"), Map.entry("ln", "ln"),
            Map.entry("drive", "dr"), Map.entry("dr", "dr"),
            Map.entry("court", "ct"), Map.entry("ct", "ct"),
            Map.entry("place", "pl"), Map.entry("pl", "pl"),
            Map.entry("terrace", "terr"), Map.entry("terr", "terr"), Map.entry("ter", "terr"),
            Map.entry("parkway", "pkwy"), Map.entry("pkwy", "pkwy"),
            Map.entry("highway", "hwy"), Map.entry("hwy", "hwy"));

    private static final Map<String, String> DIRECTIONALS = Map.of(
            "north", "n", "northeast", "ne", "northwest", "nw",
            "south", "s", "southeast", "se", "southwest", "sw",
            "east", "e", "west", "w");

    private static final Map<String, String> CITY_WORDS = Map.of(
            "saint", "st", "fort", "ft", "mount", "mt",
            "north", "n", "south", "s", "east", "e", "west", "w");

    private static final Map<String, String> CITY_ALIASES = Map.ofEntries(
            Map.entry("sf", "san francisco"), Map.entry("san fran", "san francisco"),
            Map.entry("nyc", "new york"), Map.entry("new york city", "new york"), Map.entry("ny", "new york"),
            Map.entry("la", "los angeles"),
            Map.entry("chi", "chicago"), Map.entry("chitown", "chicago"), Map.entry("chi town", "chicago"),
            Map.entry("philly", "philadelphia"),
            Map.entry("dc", "washington dc"), Map.entry("washington d c", "washington dc"),
            Map.entry("washington dc", "washington dc"));

    private static final Map<String, String> STATES = new HashMap<>();
    private static final Map<String, String> STATE_ABBREVIATIONS = new HashMap<>();
    private static final Map<String, String> COUNTRIES = new HashMap<>();

    static {
        String[][] states = {
                {"alabama", "AL"}, {"alaska", "AK"}, {"arizona", "AZ"}, {"arkansas", "AR"},
                {"california", "CA"}, {"colorado", "CO"}, {"connecticut", "CT"}, {"delaware", "DE"},
                {"florida", "FL"}, {"georgia", "GA"}, {"hawaii", "HI"}, {"idaho", "ID"},
                {"illinois", "IL"}, {"indiana", "IN"}, {"iowa", "IA"}, {"kansas", "KS"},
                {"kentucky", "KY"}, {"louisiana", "LA"}, {"maine", "ME"}, {"maryland", "MD"},
                {"massachusetts", "MA"}, {"michigan", "MI"}, {"minnesota", "MN"}, {"mississippi", "MS"},
                {"missouri", "MO"}, {"montana", "MT"}, {"nebraska", "NE"}, {"nevada", "NV"},
                {"new hampshire", "NH"}, {"new jersey", "NJ"}, {"new mexico", "NM"}, {"new york", "NY"},
                {"north carolina", "NC"}, {"north dakota", "ND"}, {"ohio", "OH"}, {"oklahoma", "OK"},
                {"oregon", "OR"}, {"pennsylvania", "PA"}, {"rhode island", "RI"}, {"south carolina", "SC"},
                {"south dakota", "SD"}, {"tennessee", "TN"}, {"texas", "TX"}, {"utah", "UT"},
                {"vermont", "VT"}, {"virginia", "VA"}, {"washington", "WA"}, {"west virginia", "WV"},
                {"wisconsin", "WI"}, {"wyoming", "WY"}, {"district of columbia", "DC"},
                {"puerto rico", "PR"}, {"guam", "GU"}, {"virgin islands", "VI"},
                {"us virgin islands", "VI"}, {"american samoa", "AS"}, {"northern mariana islands", "MP"}
        };
        for (String[] state : states) {
            STATES.put(state[0], state[1]);
        }

        String[][] abbreviations = {
                {"calif", "CA"}, {"cal", "CA"}, {"colo", "CO"}, {"conn", "CT"}, {"fla", "FL"},
                {"ill", "IL"}, {"mass", "MA"}, {"mich", "MI"}, {"minn", "MN"}, {"nebr", "NE"},
                {"neb", "NE"}, {"ore", "OR"}, {"penn", "PA"}, {"penna", "PA"}, {"tenn", "TN"},
                {"tex", "TX"}, {"virg", "VA"}, {"wash", "WA"}, {"wisc", "WI"}, {"wis", "WI"},
                {"wva", "WV"}, {"w va", "WV"}
        };
        for (String[] abbreviation : abbreviations) {
            STATE_ABBREVIATIONS.put(abbreviation[0], abbreviation[1]);
        }

        String[][] countries = {
                {"usa", "usa"}, {"us", "usa"}, {"u s", "usa"}, {"u s a", "usa"}, {"united states", "usa"},
                {"united states of america", "usa"}, {"america", "usa"},
                {"uk", "uk"}, {"u k", "uk"}, {"united kingdom", "uk"}, {"great britain", "uk"},
                {"britain", "uk"}, {"gb", "uk"}, {"england", "uk"},
                {"canada", "canada"}, {"ca", "canada"}, {"can", "canada"},
                {"australia", "australia"}, {"au", "australia"}, {"aus", "australia"},
                {"germany", "germany"}, {"de", "germany"}, {"deutschland", "germany"},
                {"france", "france"}, {"fr", "france"},
                {"spain", "spain"}, {"es", "spain"}, {"espana", "spain"}, {"españa", "spain"},
                {"italy", "italy"}, {"it", "italy"}, {"italia", "italy"},
                {"japan", "japan"}, {"jp", "japan"},
                {"china", "china"}, {"cn", "china"}, {"prc", "china"}
        };
        for (String[] country : countries) {
            COUNTRIES.put(country[0], country[1]);
        }
    }

    private static final Set<String> STATE_CODES = Set.copyOf(STATES.values());

    private static final Pattern STREET_COMPONENTS =
            Pattern.compile("^(\\d+[a-z]?(?:\\s*[-/]\\s*\\d+[a-z]?)?)\\s+(.+)$");
    private static final Pattern LEADING_DIGITS = Pattern.compile("^(\\d+)");

    private AddressNormalizer() {
    }

    /**
     * Lower-cases, drops punctuation and maps suffixes and directionals to their abbreviations.
     */
    public static String normalizeStreet(String street) {
        if (street == null || street.isBlank()) {
            return null;
        }
        String cleaned = street.toLowerCase(Locale.ROOT)
                .replaceAll("[.,]", " ")
                .replaceAll("[^\\w\\s\\-/#]", " ");
        List<String> tokens = new ArrayList<>();
        for (String token : cleaned.trim().split("\\s+")) {
            String mapped = STREET_SUFFIXES.getOrDefault(token, DIRECTIONALS.getOrDefault(token, token));
            tokens.add(mapped);
        }
        return String.join(" ", tokens).replaceAll("\\s+", " ").trim();
    }

    public static String normalizeCity(String city) {
        if (city == null || city.isBlank()) {
            return null;
        }
        String cleaned = city.toLowerCase(Locale.ROOT)
                .replaceAll("[.,]", " ")
                .replaceAll("\\s+", " ")
                .trim();
        String alias = CITY_ALIASES.get(cleaned);
        if (alias != null) {
            return alias;
        }
        List<String> tokens = new ArrayList<>(List.of(cleaned.split(" ")));
        // "austin tx" -> "austin"
        if (tokens.size() > 1) {
            String last = tokens.get(tokens.size() - 1);
            if (last.length() == 2 && STATE_CODES.contains(last.toUpperCase(Locale.ROOT))) {
                tokens.remove(tokens.size() - 1);
            }
        }
        String joined = String.join(" ", tokens);
        alias = CITY_ALIASES.get(joined);
        if (alias != null) {
            return alias;
        }
        List<String> mapped = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            mapped.add(CITY_WORDS.getOrDefault(token, token));
        }
        return String.join(" ", mapped);
    }

    /**
     * Maps full state and territory names and common abbreviations to the two-letter code.
     */
    public static String normalizeState(String state) {
        if (state == null || state.isBlank()) {
            return null;
        }
        String cleaned = state.trim().toLowerCase(Locale.ROOT)
                .replaceAll("\\.$", "")
                .replace(".", " ")
                .replaceAll("\\s+", " ")
                .trim();
        String code = STATES.get(cleaned);
        if (code != null) {
            return code;
        }
        code = STATE_ABBREVIATIONS.get(cleaned);
        if (code != null) {
            return code;
        }
        return cleaned.toUpperCase(Locale.ROOT);
    }

    /**
     * Maps country aliases to a canonical lower-case name; blank means "usa".
     */
    public static String normalizeCountry(String country) {
        if (country == null || country.isBlank()) {
            return "usa";
        }
        String cleaned = country.trim().toLowerCase(Locale.ROOT)
                .replace(".", " ")
                .replaceAll("\\s+", " ")
                .trim();
        return COUNTRIES.getOrDefault(cleaned, cleaned);
    }

    /**
     * First five digits of a postal code, or null.
     */
    public static String zip5(String postalCode) {
        if (postalCode == null) {
            return null;
        }
        String digits = postalCode.replaceAll("\\D", "");
        if (digits.isEmpty()) {
            return null;
        }
        return digits.length() > 5 ? digits.substring(0, 5) : digits;
    }

    /**
     * Splits a normalized street into house number and street name.
     * A number range such as "120-124" keeps its first number.
     */
    public static StreetComponents streetComponents(String normalizedStreet) {
        if (normalizedStreet == null) {
            return new StreetComponents(null, null);
        }
        Matcher matcher = STREET_COMPONENTS.matcher(normalizedStreet);
        if (!matcher.matches()) {
            return new StreetComponents(null, normalizedStreet);
        }
        Matcher digits = LEADING_DIGITS.matcher(matcher.group(1));
        String number = digits.find() ? digits.group(1) : matcher.group(1);
        return new StreetComponents(number, matcher.group(2).trim());
    }

    /**
     * @param number house number, null when absent
     * @param name   street name, null when absent
     */
    public record StreetComponents(String number, String name) {
    }
}
