package com.iocguardian.indicators.match;

/**
 * How a candidate matched an indicator, ordered from no match to strongest.
 *
 * @author IOC Guardian Developers
 */
public enum MatchType {

    NONE(0.0, "no indicator matched"),
    SUBSTRING(0.4, "indicator domain appears in an unparsable URL"),
    TRUNCATED_PREFIX(0.6, "truncated process name is a prefix of an indicator"),
    SUB_DOMAIN(0.7, "sub-domain matches suspicious top-level domain"),
    FULL_DOMAIN(1.0, "domain matches suspicious domain"),
    EXACT(1.0, "exact indicator match");

    private final double confidence;
    private final String description;

    MatchType(double confidence, String description) {
        this.confidence = confidence;
        this.description = description;
    }

    public double getConfidence() {
        return confidence;
    }

    public String getDescription() {
        return description;
    }
}
