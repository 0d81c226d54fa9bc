package com.iocguardian.indicators.url;

import com.iocguardian.indicators.url.ResolutionChain.Termination;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Follows chains of URL shorteners to their final destination.
 *
 * <p>
 * The chase is bounded three ways: by a hop limit, by a visited-URL check
 * that stops redirect cycles, and by an overall time budget. Whichever
 * bound trips, the chain built so far is emitted; the chase never errors.
 * </p>
 *
 * @author IOC Guardian Developers
 */
public class ShortUrlChaser {

    private static final Logger log = LoggerFactory.getLogger(ShortUrlChaser.class);

    private final UrlNormalizer normalizer;
    private final UrlResolver resolver;
    private final int defaultMaxDepth;
    private final Duration defaultBudget;

    public ShortUrlChaser(UrlNormalizer normalizer, UrlResolver resolver, int defaultMaxDepth, Duration defaultBudget) {
        if (defaultMaxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1: " + defaultMaxDepth);
        }
        this.normalizer = normalizer;
        this.resolver = resolver;
        this.defaultMaxDepth = defaultMaxDepth;
        this.defaultBudget = defaultBudget;
    }

    public int getDefaultMaxDepth() {
        return defaultMaxDepth;
    }

    public Duration getDefaultBudget() {
        return defaultBudget;
    }

    public Mono<ResolutionChain> resolve(NormalizedUrl start) {
        return resolve(start, defaultMaxDepth, defaultBudget);
    }

    public Mono<ResolutionChain> resolve(NormalizedUrl start, int maxDepth) {
        return resolve(start, maxDepth, defaultBudget);
    }

    /**
     * Chase {@code start} until it no longer points at a shortener.
     *
     * @param start    normalized starting URL
     * @param maxDepth maximum number of redirects to follow
     * @param budget   wall-clock limit for the whole chase
     * @return the chain of visited URLs; completes with the partial chain when
     *         the budget elapses
     */
    public Mono<ResolutionChain> resolve(NormalizedUrl start, int maxDepth, Duration budget) {
        AtomicReference<ResolutionChain> progress = new AtomicReference<>(ResolutionChain.start(start));

        return Mono.defer(() -> follow(progress, maxDepth))
                .timeout(budget, Mono.fromSupplier(() -> {
                    log.warn("Gave up resolving {} after {}; matching {}",
                            start.raw(), budget, progress.get().last().raw());
                    return progress.get().terminate(Termination.CANCELLED);
                }))
                .onErrorResume(e -> {
                    log.warn("Resolution of {} failed: {}", start.raw(), e.toString());
                    return Mono.just(progress.get().terminate(Termination.RESOLUTION_FAILED));
                });
    }

    private Mono<ResolutionChain> follow(AtomicReference<ResolutionChain> progress, int hopsLeft) {
        ResolutionChain chain = progress.get();
        NormalizedUrl current = chain.last();

        if (!current.shortened()) {
            return Mono.just(chain.terminate(Termination.NOT_SHORTENED));
        }
        if (hopsLeft <= 0) {
            log.warn("Stopped following {} after {} redirects", chain.original().raw(), chain.depth());
            return Mono.just(chain.terminate(Termination.DEPTH_EXHAUSTED));
        }

        return resolver.unshorten(current.raw())
                .flatMap(target -> {
                    if (target.equals(current.raw())) {
                        return Mono.just(chain.terminate(Termination.UNCHANGED));
                    }
                    if (chain.visited(target)) {
                        log.warn("Redirect cycle detected: {} points back to {}", current.raw(), target);
                        return Mono.just(chain.terminate(Termination.CYCLE));
                    }

                    NormalizedUrl next;
                    try {
                        next = normalizer.normalize(target);
                    } catch (InvalidUrlException e) {
                        log.warn("Shortener {} redirected to an invalid URL {}: {}",
                                current.raw(), target, e.getMessage());
                        return Mono.just(chain.terminate(Termination.RESOLUTION_FAILED));
                    }

                    log.debug("Resolved {} -> {}", current.raw(), target);
                    progress.set(chain.append(next));
                    return follow(progress, hopsLeft - 1);
                })
                .switchIfEmpty(Mono.fromSupplier(() -> chain.terminate(Termination.UNCHANGED)))
                .onErrorResume(e -> Mono.just(progress.get().terminate(Termination.RESOLUTION_FAILED)));
    }
}
