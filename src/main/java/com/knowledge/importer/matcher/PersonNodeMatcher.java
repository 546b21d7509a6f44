package com.knowledge.importer.matcher;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Matches people by contact details first and by name variants second.
 */
public class PersonNodeMatcher extends AbstractNodeMatcher {

    public static final double DEFAULT_THRESHOLD = 0.85;

    private static final int MIN_PHONE_DIGITS = 8;

    private final List<EqualityMethod> methods = List.of(
            EqualityMethod.exact("exact_email_match", 1.0, PersonNodeMatcher::exactEmailMatch),
            EqualityMethod.exact("exact_phone_match", 0.95, PersonNodeMatcher::exactPhoneMatch),
            EqualityMethod.graded("full_name_email_domain_match", 0.7,
                    PersonNodeMatcher::fullNameEmailDomainMatch,
                    (a, b) -> (1.0 + similarity(fullName(a), fullName(b))) / 2.0),
            EqualityMethod.graded("full_name_similarity_match", 0.5,
                    (a, b) -> similar(fullName(a), fullName(b), 0.9),
                    (a, b) -> similarity(fullName(a), fullName(b)) * 0.8),
            EqualityMethod.graded("last_name_first_initial_match", 0.45,
                    PersonNodeMatcher::lastNameFirstInitialMatch,
                    (a, b) -> similarity(lastName(a), lastName(b)) * 0.7));

    public PersonNodeMatcher() {
        super("person", DEFAULT_THRESHOLD);
    }

    @Override
    public List<String> embeddingProperties() {
        return List.of("full_name", "first_name", "last_name", "name", "email",
                "phone", "phone_number", "title", "company_name");
    }

    @Override
    public List<EqualityMethod> equalityMethods() {
        return methods;
    }

    @Override
    public List<String> identifyingProperties() {
        return List.of("full_name", "first_name", "last_name", "name", "email",
                "phone", "phone_number", "ssn", "date_of_birth");
    }

    @Override
    protected List<String> discriminatingProperties() {
        return List.of("ssn", "date_of_birth");
    }

    @Override
    protected String comparable(String key, Map<String, Object> properties) {
        if ("ssn".equals(key)) {
            String ssn = digits(text(properties, key));
            return ssn.isEmpty() ? null : ssn;
        }
        return super.comparable(key, properties);
    }

    // ========== Equality methods ==========

    static boolean exactEmailMatch(Map<String, Object> a, Map<String, Object> b) {
        String ea = email(a);
        return ea != null && ea.equals(email(b));
    }

    static boolean exactPhoneMatch(Map<String, Object> a, Map<String, Object> b) {
        String pa = digits(firstText(a, "phone", "phone_number"));
        String pb = digits(firstText(b, "phone", "phone_number"));
        if (pa.length() < MIN_PHONE_DIGITS || pb.length() < MIN_PHONE_DIGITS) {
            return false;
        }
        // tolerate country-code prefixes on one side
        return pa.contains(pb) || pb.contains(pa);
    }

    static boolean fullNameEmailDomainMatch(Map<String, Object> a, Map<String, Object> b) {
        String da = emailDomain(a);
        return da != null && da.equals(emailDomain(b)) && similar(fullName(a), fullName(b), 0.8);
    }

    static boolean lastNameFirstInitialMatch(Map<String, Object> a, Map<String, Object> b) {
        String la = lastName(a);
        String lb = lastName(b);
        if (!similar(la, lb, 0.9)) {
            return false;
        }
        Character ia = firstInitial(a);
        Character ib = firstInitial(b);
        return ia == null || ib == null || ia.equals(ib);
    }

    // ========== Field extraction ==========

    /**
     * {@code full_name}, else {@code name}, else first and last name joined.
     */
    static String fullName(Map<String, Object> properties) {
        String full = firstText(properties, "full_name", "name");
        if (full != null) {
            return full;
        }
        String first = text(properties, "first_name");
        String last = text(properties, "last_name");
        if (first == null && last == null) {
            return null;
        }
        return ((first != null ? first : "") + " " + (last != null ? last : "")).trim();
    }

    static String lastName(Map<String, Object> properties) {
        return text(properties, "last_name");
    }

    private static Character firstInitial(Map<String, Object> properties) {
        String first = text(properties, "first_name");
        if (first == null) {
            String full = fullName(properties);
            if (full != null && full.contains(" ")) {
                first = full.substring(0, full.indexOf(' '));
            }
        }
        return first == null || first.isEmpty() ? null : Character.toLowerCase(first.charAt(0));
    }

    private static String email(Map<String, Object> properties) {
        String email = text(properties, "email");
        return email == null ? null : email.toLowerCase(Locale.ROOT);
    }

    private static String emailDomain(Map<String, Object> properties) {
        String email = email(properties);
        if (email == null || !email.contains("@")) {
            return null;
        }
        String domain = email.substring(email.indexOf('@') + 1);
        return domain.isEmpty() ? null : domain;
    }
}
