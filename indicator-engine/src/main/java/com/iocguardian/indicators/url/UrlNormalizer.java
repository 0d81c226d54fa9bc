package com.iocguardian.indicators.url;

import org.apache.hc.client5.http.psl.DomainType;
import org.apache.hc.client5.http.psl.PublicSuffixMatcher;
import org.apache.hc.client5.http.psl.PublicSuffixMatcherLoader;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Parses URL strings into {@link NormalizedUrl}s.
 *
 * <p>
 * Domain splitting is public-suffix aware, so {@code a.b.example.co.uk}
 * yields the registrable domain {@code example.co.uk} rather than
 * {@code co.uk}. Only ICANN suffixes are honoured; private registry entries
 * are treated as ordinary labels.
 * </p>
 *
 * @author IOC Guardian Developers
 */
public class UrlNormalizer {

    private static final Pattern IPV4 = Pattern.compile(
            "^(?:(?:25[0-5]|2[0-4]\\d|1?\\d?\\d)\\.){3}(?:25[0-5]|2[0-4]\\d|1?\\d?\\d)$");

    private final PublicSuffixMatcher psl;
    private final ShortenerRegistry shorteners;

    public UrlNormalizer(ShortenerRegistry shorteners) {
        this(PublicSuffixMatcherLoader.getDefault(), shorteners);
    }

    public UrlNormalizer(PublicSuffixMatcher psl, ShortenerRegistry shorteners) {
        this.psl = Objects.requireNonNull(psl, "psl");
        this.shorteners = Objects.requireNonNull(shorteners, "shorteners");
    }

    /**
     * Normalize a raw URL.
     *
     * @param rawUrl URL with scheme and host; surrounding whitespace is dropped
     * @return the normalized URL, whose {@code raw} is the trimmed string
     * @throws InvalidUrlException if the string is not an absolute URL with a host
     */
    public NormalizedUrl normalize(String rawUrl) {
        if (rawUrl == null || rawUrl.isBlank()) {
            throw new InvalidUrlException(rawUrl, "Empty URL");
        }

        String url = rawUrl.trim();
        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw new InvalidUrlException(rawUrl, "Unparsable URL: " + e.getMessage(), e);
        }
        if (uri.getScheme() == null) {
            throw new InvalidUrlException(rawUrl, "URL has no scheme: " + rawUrl);
        }
        if (uri.getHost() == null) {
            throw new InvalidUrlException(rawUrl, "URL has no host: " + rawUrl);
        }

        String host = trimDots(uri.getHost().toLowerCase(Locale.ROOT));
        if (host.isEmpty()) {
            throw new InvalidUrlException(rawUrl, "URL has an empty host: " + rawUrl);
        }

        String topLevel;
        String suffix;
        if (isIpLiteral(host)) {
            topLevel = host;
            suffix = "";
        } else {
            topLevel = registrableDomain(host);
            int dot = topLevel.indexOf('.');
            suffix = dot >= 0 ? topLevel.substring(dot + 1) : topLevel;
        }

        boolean shortened = shorteners.contains(host) || shorteners.contains(topLevel);
        return new NormalizedUrl(url, host, topLevel, suffix, shortened);
    }

    /**
     * Whether the string can be normalized. Never throws.
     */
    public boolean isValid(String rawUrl) {
        try {
            normalize(rawUrl);
            return true;
        } catch (InvalidUrlException e) {
            return false;
        }
    }

    private String registrableDomain(String host) {
        String root = psl.getDomainRoot(host, DomainType.ICANN);
        if (root != null) {
            return root;
        }

        // Host is a bare suffix or its suffix is unlisted: keep the last two labels.
        int last = host.lastIndexOf('.');
        if (last <= 0) {
            return host;
        }
        int previous = host.lastIndexOf('.', last - 1);
        return previous < 0 ? host : host.substring(previous + 1);
    }

    private static boolean isIpLiteral(String host) {
        return host.startsWith("[") || IPV4.matcher(host).matches();
    }

    private static String trimDots(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '.') {
            start++;
        }
        while (end > start && s.charAt(end - 1) == '.') {
            end--;
        }
        return s.substring(start, end);
    }
}
