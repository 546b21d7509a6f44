package com.knowledge.importer.review;

import java.util.Locale;

/**
 * The three mutually exclusive outcomes of scoring a candidate pair.
 */
public enum MatchAction {
    AUTO_MERGE,
    AUTO_REJECT,
    HUMAN_REVIEW;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
