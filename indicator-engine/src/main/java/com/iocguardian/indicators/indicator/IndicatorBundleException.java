package com.iocguardian.indicators.indicator;

import java.nio.file.Path;

/**
 * Raised when an indicator bundle cannot be turned into an {@link IndicatorSet}.
 *
 * <p>
 * Every reason is fatal for the bundle being loaded: no partial set is
 * returned.
 * </p>
 *
 * @author IOC Guardian Developers
 */
public class IndicatorBundleException extends RuntimeException {

    public enum Reason {
        /** Bundle file could not be read. */
        IO,
        /** Bundle is not valid JSON or has no {@code objects} array. */
        PARSE,
        /** An indicator pattern is not a single key/value comparison. */
        SCHEMA
    }

    private final Reason reason;
    private final Path source;

    public IndicatorBundleException(Reason reason, Path source, String message) {
        super(message);
        this.reason = reason;
        this.source = source;
    }

    public IndicatorBundleException(Reason reason, Path source, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.source = source;
    }

    public Reason getReason() {
        return reason;
    }

    public Path getSource() {
        return source;
    }
}
