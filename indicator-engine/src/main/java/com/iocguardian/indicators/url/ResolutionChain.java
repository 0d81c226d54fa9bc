package com.iocguardian.indicators.url;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The hops visited while de-shortening a URL, first hop being the original.
 *
 * @param hops        visited URLs in order, never empty
 * @param termination why the chase stopped
 *
 * @author IOC Guardian Developers
 */
public record ResolutionChain(List<NormalizedUrl> hops, Termination termination) {

    public enum Termination {
        /** Last hop is not a shortener; the normal outcome. */
        NOT_SHORTENED,
        /** Shortener answered without redirecting. */
        UNCHANGED,
        /** The hop limit was reached while the last hop was still shortened. */
        DEPTH_EXHAUSTED,
        /** A redirect pointed back at an already visited URL. */
        CYCLE,
        /** A request failed or the target was not a valid URL. */
        RESOLUTION_FAILED,
        /** The chase budget elapsed or the caller cancelled. */
        CANCELLED,
        /** Chase not finished yet. */
        IN_PROGRESS
    }

    public ResolutionChain {
        if (hops.isEmpty()) {
            throw new IllegalArgumentException("A resolution chain needs at least one hop");
        }
        hops = Collections.unmodifiableList(new ArrayList<>(hops));
    }

    public static ResolutionChain start(NormalizedUrl url) {
        return new ResolutionChain(List.of(url), Termination.IN_PROGRESS);
    }

    public NormalizedUrl original() {
        return hops.get(0);
    }

    public NormalizedUrl last() {
        return hops.get(hops.size() - 1);
    }

    /** Number of redirects followed. */
    public int depth() {
        return hops.size() - 1;
    }

    public boolean wasResolved() {
        return hops.size() > 1;
    }

    public boolean visited(String url) {
        return hops.stream().anyMatch(hop -> hop.raw().equals(url));
    }

    public List<String> urls() {
        return hops.stream().map(NormalizedUrl::raw).toList();
    }

    public ResolutionChain append(NormalizedUrl next) {
        List<NormalizedUrl> extended = new ArrayList<>(hops);
        extended.add(next);
        return new ResolutionChain(extended, Termination.IN_PROGRESS);
    }

    public ResolutionChain terminate(Termination reason) {
        return new ResolutionChain(hops, reason);
    }
}
