package com.iocguardian.indicators.module;

import java.io.IOException;
import java.util.List;

/**
 * Capability shared by all artifact extraction modules.
 *
 * <p>
 * Each call to {@link #run()} must return a freshly allocated list; modules
 * never hand out a collection shared between invocations.
 * </p>
 *
 * @author IOC Guardian Developers
 */
public interface ArtifactModule {

    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * Extract records from the module's artifact.
     *
     * @return the extracted records, in a new list owned by the caller
     * @throws IOException if the artifact cannot be read
     */
    List<ArtifactRecord> run() throws IOException;

    /** Convert a record into a timeline entry. */
    TimelineEvent serialize(ArtifactRecord record);

    /**
     * Values of a record that should be checked against indicators.
     * Modules without indicator-relevant fields return an empty list.
     */
    default List<Candidate> candidates(ArtifactRecord record) {
        return List.of();
    }
}
