package com.iocguardian.indicators.url;

import reactor.core.publisher.Mono;

/**
 * Resolves a shortened URL to the URL it redirects to.
 *
 * @author IOC Guardian Developers
 */
@FunctionalInterface
public interface UrlResolver {

    /** Resolver that never follows anything; every URL resolves to itself. */
    UrlResolver IDENTITY = Mono::just;

    /**
     * Resolve one redirect hop.
     *
     * @param url absolute URL to resolve
     * @return the redirect target, or {@code url} itself when the server does
     *         not redirect; errors on network failure or timeout
     */
    Mono<String> unshorten(String url);
}
