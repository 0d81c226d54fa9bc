package com.iocguardian.indicators.match;

import com.iocguardian.indicators.indicator.IndicatorKind;
import com.iocguardian.indicators.indicator.IndicatorSet;
import com.iocguardian.indicators.url.InvalidUrlException;
import com.iocguardian.indicators.url.NormalizedUrl;
import com.iocguardian.indicators.url.ResolutionChain;
import com.iocguardian.indicators.url.ShortUrlChaser;
import com.iocguardian.indicators.url.UrlNormalizer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Checks candidate artifacts against a loaded {@link IndicatorSet}.
 *
 * <p>
 * The matcher holds no mutable state besides thread-safe meters and may be
 * shared by any number of callers. No check ever throws: malformed input
 * produces a non-match, and network trouble while de-shortening degrades to
 * matching the last URL that was resolved.
 * </p>
 *
 * @author IOC Guardian Developers
 */
@Service
public class IndicatorMatcher {

    private static final Logger log = LoggerFactory.getLogger(IndicatorMatcher.class);

    /** Width of the process-name field on the source platform. */
    public static final int TRUNCATED_PROCESS_NAME_LENGTH = 16;

    /** Hosts under this label are compared as their parent domain. */
    private static final String WWW_PREFIX = "www.";

    private final IndicatorSet indicators;
    private final UrlNormalizer normalizer;
    private final ShortUrlChaser chaser;

    private final Map<IndicatorKind, Counter> checks = new EnumMap<>(IndicatorKind.class);
    private final Map<IndicatorKind, Counter> hits = new EnumMap<>(IndicatorKind.class);

    public IndicatorMatcher(
            IndicatorSet indicators,
            UrlNormalizer normalizer,
            ShortUrlChaser chaser,
            MeterRegistry meterRegistry) {
        this.indicators = indicators;
        this.normalizer = normalizer;
        this.chaser = chaser;

        for (IndicatorKind kind : IndicatorKind.values()) {
            String tag = kind.name().toLowerCase(Locale.ROOT);
            checks.put(kind, Counter.builder("guardian.match.checks")
                    .description("Candidates checked against indicators")
                    .tag("kind", tag)
                    .register(meterRegistry));
            hits.put(kind, Counter.builder("guardian.match.hits")
                    .description("Candidates that matched an indicator")
                    .tag("kind", tag)
                    .register(meterRegistry));
        }
    }

    public IndicatorSet getIndicators() {
        return indicators;
    }

    // ---- domains ----

    public MatchFinding checkDomain(String url) {
        return checkDomain(url, chaser.getDefaultMaxDepth(), chaser.getDefaultBudget());
    }

    public MatchFinding checkDomain(String url, int maxDepth) {
        return checkDomain(url, maxDepth, chaser.getDefaultBudget());
    }

    /**
     * Check a URL against the domain indicators, blocking while shortened
     * URLs are resolved.
     *
     * <p>
     * Blocks the calling thread, so it must not be called from a Reactor
     * non-blocking thread; reactive callers use
     * {@link #checkDomainAsync(String, int, Duration)} instead. The same holds
     * for the shorter overloads and for {@link #checkDomains(Iterable)}.
     * </p>
     *
     * @param url      candidate URL
     * @param maxDepth maximum shortener redirects to follow
     * @param deadline time allowed for de-shortening; on expiry the last
     *                 resolved URL is matched
     * @return the finding, never null
     */
    public MatchFinding checkDomain(String url, int maxDepth, Duration deadline) {
        try {
            MatchFinding finding = checkDomainAsync(url, maxDepth, deadline).block();
            return finding != null ? finding : MatchFinding.none(IndicatorKind.DOMAIN, url);
        } catch (RuntimeException e) {
            log.error("Domain check failed for {}: {}", url, e.getMessage(), e);
            return MatchFinding.none(IndicatorKind.DOMAIN, url);
        }
    }

    public Mono<MatchFinding> checkDomainAsync(String url) {
        return checkDomainAsync(url, chaser.getDefaultMaxDepth(), chaser.getDefaultBudget());
    }

    /**
     * Non-blocking variant of {@link #checkDomain(String, int, Duration)}.
     * Cancelling the subscription cancels any in-flight shortener request.
     */
    public Mono<MatchFinding> checkDomainAsync(String url, int maxDepth, Duration deadline) {
        if (url == null || url.isBlank()) {
            return Mono.just(MatchFinding.none(IndicatorKind.DOMAIN, url));
        }

        return Mono.defer(() -> {
            checks.get(IndicatorKind.DOMAIN).increment();

            NormalizedUrl normalized;
            try {
                normalized = normalizer.normalize(url);
            } catch (InvalidUrlException e) {
                log.debug("Falling back to substring match for {}: {}", url, e.getMessage());
                return Mono.just(report(matchSubstring(url)));
            }

            return chaser.resolve(normalized, maxDepth, deadline)
                    .map(chain -> report(matchResolved(url, chain)));
        });
    }

    /**
     * Check URLs in order and return the first positive finding. Remaining
     * URLs are not checked once one matches.
     */
    public MatchFinding checkDomains(Iterable<String> urls) {
        for (String url : urls) {
            MatchFinding finding = checkDomain(url);
            if (finding.matched()) {
                return finding;
            }
        }
        return MatchFinding.none(IndicatorKind.DOMAIN, null);
    }

    private MatchFinding matchSubstring(String url) {
        String haystack = url.toLowerCase(Locale.ROOT);
        for (String ioc : indicators.domains()) {
            if (haystack.contains(ioc)) {
                return MatchFinding.match(IndicatorKind.DOMAIN, MatchType.SUBSTRING, url, url, ioc,
                        String.format("Maybe found a known suspicious domain: %s", url));
            }
        }
        return MatchFinding.none(IndicatorKind.DOMAIN, url);
    }

    private MatchFinding matchResolved(String url, ResolutionChain chain) {
        NormalizedUrl target = chain.last();
        List<String> redirects = chain.wasResolved() ? chain.urls() : List.of();

        String host = target.domain();
        String bareHost = host.startsWith(WWW_PREFIX) ? host.substring(WWW_PREFIX.length()) : host;
        for (String ioc : indicators.domains()) {
            if (host.equalsIgnoreCase(ioc) || bareHost.equalsIgnoreCase(ioc)) {
                String detail = chain.wasResolved()
                        ? String.format("Found a known suspicious domain %s shortened as %s", target.raw(), url)
                        : String.format("Found a known suspicious domain: %s", target.raw());
                return MatchFinding.match(IndicatorKind.DOMAIN, MatchType.FULL_DOMAIN, url,
                        target.raw(), ioc, redirects, detail);
            }
        }

        for (String ioc : indicators.domains()) {
            if (target.topLevelDomain().equalsIgnoreCase(ioc) || host.endsWith("." + ioc)) {
                String detail = chain.wasResolved()
                        ? String.format("Found a sub-domain matching a suspicious top level %s shortened as %s",
                                target.raw(), url)
                        : String.format("Found a sub-domain matching a suspicious top level: %s", target.raw());
                return MatchFinding.match(IndicatorKind.DOMAIN, MatchType.SUB_DOMAIN, url,
                        target.raw(), ioc, redirects, detail);
            }
        }

        if (chain.wasResolved()) {
            log.debug("No domain indicator for {} (resolved to {}, {})", url, target.raw(), chain.termination());
        }
        return MatchFinding.none(IndicatorKind.DOMAIN, url);
    }

    // ---- processes ----

    /**
     * Check a process name or path. Names exactly
     * {@value #TRUNCATED_PROCESS_NAME_LENGTH} characters long are treated as
     * possibly truncated and also match indicators they prefix.
     */
    public MatchFinding checkProcess(String process) {
        if (process == null || process.isEmpty()) {
            return MatchFinding.none(IndicatorKind.PROCESS, process);
        }
        checks.get(IndicatorKind.PROCESS).increment();

        String name = basename(process);
        if (indicators.processes().contains(name)) {
            return report(MatchFinding.match(IndicatorKind.PROCESS, MatchType.EXACT, process, name, name,
                    String.format("Found a known suspicious process name \"%s\"", process)));
        }

        if (name.length() == TRUNCATED_PROCESS_NAME_LENGTH) {
            for (String ioc : indicators.processes()) {
                if (ioc.startsWith(name)) {
                    return report(MatchFinding.match(IndicatorKind.PROCESS, MatchType.TRUNCATED_PREFIX, process,
                            name, ioc,
                            String.format("Found a truncated known suspicious process name \"%s\"", process)));
                }
            }
        }

        return MatchFinding.none(IndicatorKind.PROCESS, process);
    }

    public MatchFinding checkProcesses(Iterable<String> processes) {
        for (String process : processes) {
            MatchFinding finding = checkProcess(process);
            if (finding.matched()) {
                return finding;
            }
        }
        return MatchFinding.none(IndicatorKind.PROCESS, null);
    }

    // ---- emails ----

    public MatchFinding checkEmail(String email) {
        if (email == null || email.isEmpty()) {
            return MatchFinding.none(IndicatorKind.EMAIL, email);
        }
        checks.get(IndicatorKind.EMAIL).increment();

        String normalized = IndicatorKind.EMAIL.normalize(email);
        if (indicators.emails().contains(normalized)) {
            return report(MatchFinding.match(IndicatorKind.EMAIL, MatchType.EXACT, email, email, normalized,
                    String.format("Found a known suspicious email address: \"%s\"", email)));
        }
        return MatchFinding.none(IndicatorKind.EMAIL, email);
    }

    // ---- files ----

    public MatchFinding checkFile(String filePath) {
        if (filePath == null || filePath.isEmpty()) {
            return MatchFinding.none(IndicatorKind.FILE, filePath);
        }
        checks.get(IndicatorKind.FILE).increment();

        String name = basename(filePath);
        if (indicators.files().contains(name)) {
            return report(MatchFinding.match(IndicatorKind.FILE, MatchType.EXACT, filePath, name, name,
                    String.format("Found a known suspicious file: \"%s\"", filePath)));
        }
        return MatchFinding.none(IndicatorKind.FILE, filePath);
    }

    public MatchFinding checkFiles(Iterable<String> filePaths) {
        for (String filePath : filePaths) {
            MatchFinding finding = checkFile(filePath);
            if (finding.matched()) {
                return finding;
            }
        }
        return MatchFinding.none(IndicatorKind.FILE, null);
    }

    /**
     * Dispatch a check by indicator kind.
     */
    public MatchFinding check(IndicatorKind kind, String candidate) {
        return switch (kind) {
            case DOMAIN -> checkDomain(candidate);
            case PROCESS -> checkProcess(candidate);
            case EMAIL -> checkEmail(candidate);
            case FILE -> checkFile(candidate);
        };
    }

    private MatchFinding report(MatchFinding finding) {
        if (finding.matched()) {
            hits.get(finding.kind()).increment();
            log.warn(finding.detail());
        }
        return finding;
    }

    /**
     * Final path component, accepting both separators and ignoring trailing ones.
     */
    static String basename(String path) {
        int end = path.length();
        while (end > 0 && (path.charAt(end - 1) == '/' || path.charAt(end - 1) == '\\')) {
            end--;
        }
        int start = Math.max(path.lastIndexOf('/', end - 1), path.lastIndexOf('\\', end - 1)) + 1;
        return path.substring(start, end);
    }
}
