package com.knowledge.importer.matcher;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Matches physical assets (vehicles, equipment, parts) on serial numbers and other
 * unique identifiers, falling back to brand/model and name similarity.
 */
public class AssetNodeMatcher extends AbstractNodeMatcher {

    public static final double DEFAULT_THRESHOLD = 0.8;

    static final List<String> UNIQUE_IDENTIFIER_FIELDS =
            List.of("license_plate", "vin", "part_number", "registration", "barcode", "product_code");

    private static final Set<String> NON_BRAND_WORDS = Set.of(
            "the", "and", "or", "of", "for", "with", "model", "type", "size",
            "inch", "inches", "mm", "cm", "kg", "lb", "lbs");
    private static final Pattern CAPITALIZED = Pattern.compile("^[A-Z][A-Za-z]*$");
    private static final Pattern DIGIT = Pattern.compile("\\d");

    private final List<EqualityMethod> methods = List.of(
            EqualityMethod.exact("exact_serial_number_match", 1.0,
                    AssetNodeMatcher::exactSerialNumberMatch),
            EqualityMethod.exact("exact_unique_identifier_match", 0.95,
                    AssetNodeMatcher::exactUniqueIdentifierMatch),
            EqualityMethod.graded("brand_and_model_match", 0.7,
                    AssetNodeMatcher::brandAndModelMatch,
                    AssetNodeMatcher::brandAndModelScore),
            EqualityMethod.graded("asset_name_similarity_match", 0.5,
                    AssetNodeMatcher::assetNameSimilarityMatch,
                    AssetNodeMatcher::nameScore));

    public AssetNodeMatcher() {
        super("asset", DEFAULT_THRESHOLD);
    }

    @Override
    public List<String> embeddingProperties() {
        return List.of("name", "model", "brand", "make", "serial_number", "license_plate", "description", "category");
    }

    @Override
    public List<EqualityMethod> equalityMethods() {
        return methods;
    }

    @Override
    public List<String> identifyingProperties() {
        return List.of("serial_number", "license_plate", "vin", "part_number", "barcode", "brand", "model", "name");
    }

    @Override
    protected List<String> discriminatingProperties() {
        return List.of("serial_number", "vin", "license_plate", "brand");
    }

    @Override
    protected String comparable(String key, Map<String, Object> properties) {
        if ("brand".equals(key)) {
            String brand = firstText(properties, "brand", "make", "manufacturer");
            return brand == null ? null : brand.toLowerCase(Locale.ROOT);
        }
        if ("serial_number".equals(key)) {
            return super.comparable(key, properties);
        }
        return alphanumeric(text(properties, key));
    }

    // ========== Equality methods ==========

    static boolean exactSerialNumberMatch(Map<String, Object> a, Map<String, Object> b) {
        String sa = text(a, "serial_number");
        String sb = text(b, "serial_number");
        return sa != null && sb != null && sa.equalsIgnoreCase(sb);
    }

    /**
     * Any shared identifier field equal after stripping punctuation and spacing.
     */
    static boolean exactUniqueIdentifierMatch(Map<String, Object> a, Map<String, Object> b) {
        for (String field : UNIQUE_IDENTIFIER_FIELDS) {
            String va = alphanumeric(text(a, field));
            String vb = alphanumeric(text(b, field));
            if (va != null && !va.isEmpty() && va.equals(vb)) {
                return true;
            }
        }
        return false;
    }

    static boolean brandAndModelMatch(Map<String, Object> a, Map<String, Object> b) {
        String brandA = extractBrand(a);
        String brandB = extractBrand(b);
        String modelA = extractModel(a);
        String modelB = extractModel(b);

        if (brandA != null && brandB != null && modelA != null && modelB != null
                && similar(brandA, brandB, 0.8) && similar(modelA, modelB, 0.7)) {
            return true;
        }
        if ((brandA != null || brandB != null) && modelA != null && modelB != null
                && similar(modelA, modelB, 0.7) && similar(text(a, "name"), text(b, "name"), 0.6)) {
            return true;
        }
        // one side's brand or model spelled out in the other side's name, e.g. "GMC Sierra 1500" vs model "Sierra"
        return crossReferenced(brandA, a, modelB, b) || crossReferenced(brandB, b, modelA, a);
    }

    static boolean assetNameSimilarityMatch(Map<String, Object> a, Map<String, Object> b) {
        return similar(text(a, "name"), text(b, "name"), 0.85);
    }

    // ========== Scores ==========

    private static double brandAndModelScore(Map<String, Object> a, Map<String, Object> b) {
        return (partScore(extractBrand(a), extractBrand(b), 0.3)
                + partScore(extractModel(a), extractModel(b), 0.4)) / 2.0;
    }

    private static double nameScore(Map<String, Object> a, Map<String, Object> b) {
        String na = text(a, "name");
        String nb = text(b, "name");
        if (na == null || nb == null) {
            return 0.1;
        }
        return similarity(na, nb) * 0.8;
    }

    private static double partScore(String a, String b, double floor) {
        if (a == null || b == null) {
            return floor;
        }
        if (a.equalsIgnoreCase(b)) {
            return 1.0;
        }
        return Math.max(similarity(a, b), floor);
    }

    // ========== Extraction ==========

    /**
     * Upper-cased brand: the first capitalized word of brand, make, manufacturer or name,
     * else the first word of the name when longer than two characters.
     */
    public static String extractBrand(Map<String, Object> properties) {
        for (String key : List.of("brand", "make", "manufacturer", "name")) {
            String source = text(properties, key);
            if (source == null) {
                continue;
            }
            for (String word : source.split("\\s+")) {
                if (NON_BRAND_WORDS.contains(word.toLowerCase(Locale.ROOT))) {
                    continue;
                }
                if (CAPITALIZED.matcher(word).matches()) {
                    return word.toUpperCase(Locale.ROOT);
                }
            }
        }
        String name = text(properties, "name");
        if (name != null) {
            String first = name.split("\\s+")[0];
            if (first.length() > 2) {
                return first.toUpperCase(Locale.ROOT);
            }
        }
        return null;
    }

    /**
     * The explicit model, else the first later name word that carries a digit or is
     * longer than four characters, else the second name word.
     */
    public static String extractModel(Map<String, Object> properties) {
        String model = text(properties, "model");
        if (model != null) {
            return model;
        }
        String name = text(properties, "name");
        if (name == null) {
            return null;
        }
        String[] words = name.split("\\s+");
        if (words.length < 2) {
            return null;
        }
        for (int i = 1; i < words.length; i++) {
            if (DIGIT.matcher(words[i]).find() || words[i].length() > 4) {
                return words[i];
            }
        }
        return words[1];
    }

    private static boolean crossReferenced(String brand, Map<String, Object> brandSide,
                                           String model, Map<String, Object> modelSide) {
        if (brand == null || model == null) {
            return false;
        }
        String modelSideName = lower(text(modelSide, "name"));
        String brandSideName = lower(text(brandSide, "name"));
        return (modelSideName != null && modelSideName.contains(brand.toLowerCase(Locale.ROOT)))
                || (brandSideName != null && brandSideName.contains(model.toLowerCase(Locale.ROOT)));
    }

    private static String lower(String value) {
        return value == null ? null : value.toLowerCase(Locale.ROOT);
    }

    private static String alphanumeric(String value) {
        return value == null ? null : value.replaceAll("[^A-Za-z0-9]", "").toUpperCase(Locale.ROOT);
    }
}
