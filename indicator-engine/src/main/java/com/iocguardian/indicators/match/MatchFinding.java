package com.iocguardian.indicators.match;

import com.iocguardian.indicators.indicator.IndicatorKind;

import java.util.List;

/**
 * Outcome of checking one candidate against the indicator set.
 *
 * @param matched       whether an indicator matched
 * @param kind          indicator category that was checked
 * @param matchType     how the match was made, {@link MatchType#NONE} if not matched
 * @param candidate     the value handed to the matcher
 * @param matchedValue  the artifact that triggered the match; for shortened
 *                      URLs this is the resolved URL
 * @param indicator     the indicator value that matched, null if not matched
 * @param redirectChain URLs visited while de-shortening, empty if no redirect was followed
 * @param detail        human-readable explanation
 *
 * @author IOC Guardian Developers
 */
public record MatchFinding(
        boolean matched,
        IndicatorKind kind,
        MatchType matchType,
        String candidate,
        String matchedValue,
        String indicator,
        List<String> redirectChain,
        String detail) {

    public MatchFinding {
        redirectChain = redirectChain == null ? List.of() : List.copyOf(redirectChain);
    }

    /** Factory for a non-match. */
    public static MatchFinding none(IndicatorKind kind, String candidate) {
        return new MatchFinding(false, kind, MatchType.NONE, candidate, null, null, List.of(),
                MatchType.NONE.getDescription());
    }

    /** Factory for a match without redirects. */
    public static MatchFinding match(IndicatorKind kind, MatchType matchType, String candidate,
            String matchedValue, String indicator, String detail) {
        return new MatchFinding(true, kind, matchType, candidate, matchedValue, indicator, List.of(), detail);
    }

    /** Factory for a match reached through a redirect chain. */
    public static MatchFinding match(IndicatorKind kind, MatchType matchType, String candidate,
            String matchedValue, String indicator, List<String> redirectChain, String detail) {
        return new MatchFinding(true, kind, matchType, candidate, matchedValue, indicator, redirectChain, detail);
    }

    public double confidence() {
        return matchType.getConfidence();
    }

    /** True when the candidate was de-shortened before matching. */
    public boolean wasRedirected() {
        return redirectChain.size() > 1;
    }
}
