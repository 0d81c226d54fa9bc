package com.iocguardian.indicators.indicator;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Immutable, de-duplicated indicator values grouped by {@link IndicatorKind}.
 *
 * <p>
 * Values keep their insertion order so that "first match wins" is
 * deterministic. Instances are safe to share between threads.
 * </p>
 *
 * @author IOC Guardian Developers
 */
public final class IndicatorSet {

    private static final IndicatorSet EMPTY = builder().build();

    private final Map<IndicatorKind, Set<String>> values;

    private IndicatorSet(Map<IndicatorKind, Set<String>> values) {
        this.values = values;
    }

    public static IndicatorSet empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<String> get(IndicatorKind kind) {
        return values.get(kind);
    }

    public Set<String> domains() {
        return get(IndicatorKind.DOMAIN);
    }

    public Set<String> processes() {
        return get(IndicatorKind.PROCESS);
    }

    public Set<String> emails() {
        return get(IndicatorKind.EMAIL);
    }

    public Set<String> files() {
        return get(IndicatorKind.FILE);
    }

    public int size() {
        return values.values().stream().mapToInt(Set::size).sum();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    @Override
    public String toString() {
        return String.format("IndicatorSet[domains=%d, processes=%d, emails=%d, files=%d]",
                domains().size(), processes().size(), emails().size(), files().size());
    }

    /** Accumulates values; not thread-safe. */
    public static final class Builder {

        private final Map<IndicatorKind, Set<String>> values = new EnumMap<>(IndicatorKind.class);

        private Builder() {
            for (IndicatorKind kind : IndicatorKind.values()) {
                values.put(kind, new LinkedHashSet<>());
            }
        }

        /**
         * Add a value after applying the kind's normalization.
         *
         * @return true if the value was not already present
         * @throws IllegalArgumentException if the value is null or empty
         */
        public boolean add(IndicatorKind kind, String value) {
            if (value == null || value.isEmpty()) {
                throw new IllegalArgumentException("Empty " + kind + " indicator value");
            }
            return values.get(kind).add(kind.normalize(value));
        }

        public Builder addAll(IndicatorSet other) {
            other.values.forEach((kind, set) -> values.get(kind).addAll(set));
            return this;
        }

        public IndicatorSet build() {
            Map<IndicatorKind, Set<String>> frozen = new EnumMap<>(IndicatorKind.class);
            values.forEach((kind, set) ->
                    frozen.put(kind, Collections.unmodifiableSet(new LinkedHashSet<>(set))));
            return new IndicatorSet(Collections.unmodifiableMap(frozen));
        }
    }
}
