package com.iocguardian.indicators.module;

import com.iocguardian.indicators.match.MatchFinding;

import java.util.List;
import java.util.Map;

/**
 * Aggregated outcome of running a set of artifact modules.
 *
 * @param recordCounts  records extracted per module
 * @param timeline      serialized records, sorted by timestamp
 * @param detections    records whose candidates matched an indicator
 * @param failedModules modules whose extraction failed
 *
 * @author IOC Guardian Developers
 */
public record ScanReport(
        Map<String, Integer> recordCounts,
        List<TimelineEvent> timeline,
        List<Detection> detections,
        List<String> failedModules) {

    /** A record that matched an indicator. */
    public record Detection(String module, ArtifactRecord record, MatchFinding finding) {
    }

    public boolean hasDetections() {
        return !detections.isEmpty();
    }
}
