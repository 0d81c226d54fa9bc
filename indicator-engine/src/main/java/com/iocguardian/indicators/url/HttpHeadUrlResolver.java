package com.iocguardian.indicators.url;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;

/**
 * {@link UrlResolver} that issues a single HTTP HEAD request and reads the
 * {@code Location} header.
 *
 * <p>
 * Redirects are never followed by the HTTP client itself: each hop is one
 * request, so the caller controls how far a chain is chased. Relative
 * locations are resolved against the request URL.
 * </p>
 *
 * @author IOC Guardian Developers
 */
public class HttpHeadUrlResolver implements UrlResolver {

    private static final Logger log = LoggerFactory.getLogger(HttpHeadUrlResolver.class);

    private final WebClient webClient;
    private final Duration timeout;
    private final Counter requests;
    private final Counter failures;

    public HttpHeadUrlResolver(WebClient.Builder webClientBuilder, Duration timeout, MeterRegistry meterRegistry) {
        this.webClient = webClientBuilder.build();
        this.timeout = timeout;
        this.requests = Counter.builder("guardian.unshorten.requests")
                .description("HEAD requests issued to URL shorteners")
                .register(meterRegistry);
        this.failures = Counter.builder("guardian.unshorten.failures")
                .description("Failed or timed out shortener requests")
                .register(meterRegistry);
    }

    @Override
    public Mono<String> unshorten(String url) {
        return Mono.defer(() -> {
                    requests.increment();
                    URI target = URI.create(url.trim());
                    return webClient.head()
                            .uri(target)
                            .exchangeToMono(response -> readLocation(target, target.toString(), response));
                })
                .timeout(timeout)
                .doOnError(e -> {
                    failures.increment();
                    log.warn("Unable to unshorten {}: {}", url, e.toString());
                });
    }

    private Mono<String> readLocation(URI target, String url, ClientResponse response) {
        if (response.statusCode().is3xxRedirection()) {
            String location = response.headers().asHttpHeaders().getFirst(HttpHeaders.LOCATION);
            if (location != null && !location.isBlank()) {
                return response.releaseBody()
                        .then(Mono.fromCallable(() -> target.resolve(location.trim()).toString()));
            }
        }
        log.debug("No redirect from {} (status {})", url, response.statusCode().value());
        return response.releaseBody().thenReturn(url);
    }
}
