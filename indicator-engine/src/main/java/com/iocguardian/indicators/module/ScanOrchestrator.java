package com.iocguardian.indicators.module;

import com.iocguardian.indicators.match.IndicatorMatcher;
import com.iocguardian.indicators.match.MatchFinding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs artifact modules and checks their candidates against indicators.
 *
 * <p>
 * Modules are isolated from each other: a module that fails to extract is
 * logged and listed in the report, and the scan carries on with the rest.
 * </p>
 *
 * @author IOC Guardian Developers
 */
@Service
public class ScanOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ScanOrchestrator.class);

    private final IndicatorMatcher matcher;

    public ScanOrchestrator(IndicatorMatcher matcher) {
        this.matcher = matcher;
    }

    public ScanReport scan(List<? extends ArtifactModule> modules) {
        Map<String, Integer> recordCounts = new LinkedHashMap<>();
        List<TimelineEvent> timeline = new ArrayList<>();
        List<ScanReport.Detection> detections = new ArrayList<>();
        List<String> failedModules = new ArrayList<>();

        for (ArtifactModule module : modules) {
            String name = module.name();
            List<ArtifactRecord> records;
            try {
                records = module.run();
            } catch (Exception e) {
                log.error("Module {} failed: {}", name, e.getMessage(), e);
                failedModules.add(name);
                continue;
            }

            recordCounts.put(name, records.size());
            log.info("Module {} extracted {} records", name, records.size());

            for (ArtifactRecord record : records) {
                timeline.add(module.serialize(record));
                for (Candidate candidate : module.candidates(record)) {
                    MatchFinding finding = matcher.check(candidate.kind(), candidate.value());
                    if (finding.matched()) {
                        detections.add(new ScanReport.Detection(name, record, finding));
                    }
                }
            }
        }

        timeline.sort(Comparator.comparing(TimelineEvent::timestamp,
                Comparator.nullsLast(Comparator.naturalOrder())));

        if (!detections.isEmpty()) {
            log.warn("Scan produced {} detections across {} modules", detections.size(), modules.size());
        }
        return new ScanReport(recordCounts, timeline, detections, failedModules);
    }
}
