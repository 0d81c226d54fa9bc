package com.iocguardian.indicators.indicator;

import java.util.Locale;
import java.util.Optional;

/**
 * Indicator categories understood by the engine.
 *
 * <p>
 * Pattern keys must match the STIX2 object paths used in indicator
 * {@code pattern} expressions, e.g. {@code [domain-name:value = 'evil.com']}.
 * </p>
 *
 * @author IOC Guardian Developers
 */
public enum IndicatorKind {

    DOMAIN("domain-name:value", true),
    PROCESS("process:name", false),
    EMAIL("email-addr:value", true),
    FILE("file:name", false);

    private final String patternKey;
    private final boolean caseInsensitive;

    IndicatorKind(String patternKey, boolean caseInsensitive) {
        this.patternKey = patternKey;
        this.caseInsensitive = caseInsensitive;
    }

    public String getPatternKey() {
        return patternKey;
    }

    public boolean isCaseInsensitive() {
        return caseInsensitive;
    }

    /**
     * Apply the category's value normalization.
     *
     * @param value raw indicator or candidate value
     * @return the value lower-cased for case-insensitive kinds, unchanged otherwise
     */
    public String normalize(String value) {
        return caseInsensitive ? value.toLowerCase(Locale.ROOT) : value;
    }

    /**
     * Look up a kind by its STIX2 pattern key.
     *
     * @param key pattern key, e.g. {@code process:name}
     * @return the kind, or empty for keys the engine does not consume
     */
    public static Optional<IndicatorKind> fromPatternKey(String key) {
        for (IndicatorKind kind : values()) {
            if (kind.patternKey.equals(key)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
