package com.iocguardian.indicators.url;

/**
 * Raised when a candidate string cannot be parsed into a {@link NormalizedUrl}.
 *
 * @author IOC Guardian Developers
 */
public class InvalidUrlException extends IllegalArgumentException {

    private final String url;

    public InvalidUrlException(String url, String message) {
        super(message);
        this.url = url;
    }

    public InvalidUrlException(String url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
