package com.iocguardian.indicators.url;

/**
 * Structured view of a URL used for domain matching.
 *
 * @param raw            the original URL string, without surrounding whitespace
 * @param domain         full host, lower case (e.g. {@code sub.evil.com})
 * @param topLevelDomain registrable domain, public suffix plus one label
 *                       (e.g. {@code evil.com}, {@code evil.co.uk})
 * @param publicSuffix   public suffix of the host (e.g. {@code com}), empty for IP literals
 * @param shortened      whether the host belongs to a known URL shortener
 *
 * @author IOC Guardian Developers
 */
public record NormalizedUrl(
        String raw,
        String domain,
        String topLevelDomain,
        String publicSuffix,
        boolean shortened) {

    /** True when the host has labels beyond its registrable domain. */
    public boolean isSubdomain() {
        return !domain.equals(topLevelDomain);
    }
}
