package com.iocguardian.indicators.module;

import com.iocguardian.indicators.indicator.IndicatorKind;
import com.iocguardian.indicators.indicator.IndicatorSet;
import com.iocguardian.indicators.match.IndicatorMatcher;
import com.iocguardian.indicators.match.MatchType;
import com.iocguardian.indicators.url.ShortUrlChaser;
import com.iocguardian.indicators.url.ShortenerRegistry;
import com.iocguardian.indicators.url.UrlNormalizer;
import com.iocguardian.indicators.url.UrlResolver;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScanOrchestratorTest {

    private ScanOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        IndicatorSet.Builder builder = IndicatorSet.builder();
        builder.add(IndicatorKind.DOMAIN, "evil.com");
        builder.add(IndicatorKind.PROCESS, "badproc");

        UrlNormalizer normalizer = new UrlNormalizer(ShortenerRegistry.withDefaults(List.of()));
        ShortUrlChaser chaser = new ShortUrlChaser(normalizer, UrlResolver.IDENTITY, 5, Duration.ofSeconds(5));
        IndicatorMatcher matcher = new IndicatorMatcher(builder.build(), normalizer, chaser, new SimpleMeterRegistry());
        orchestrator = new ScanOrchestrator(matcher);
    }

    @Test
    void shouldCollectDetectionsAndSortedTimeline() {
        StubModule history = new StubModule("BrowserHistory", List.of(
                record(200, "url", "https://cdn.evil.com/x"),
                record(100, "url", "https://example.org/")));
        StubModule processes = new StubModule("Processes", List.of(
                record(150, "process", "/usr/bin/badproc")));

        ScanReport report = orchestrator.scan(List.of(history, processes));

        assertEquals(Map.of("BrowserHistory", 2, "Processes", 1), report.recordCounts());
        assertEquals(2, report.detections().size());
        assertEquals("BrowserHistory", report.detections().get(0).module());
        assertEquals(MatchType.SUB_DOMAIN, report.detections().get(0).finding().matchType());
        assertEquals(IndicatorKind.PROCESS, report.detections().get(1).finding().kind());
        assertEquals(List.of(100L, 150L, 200L),
                report.timeline().stream().map(e -> e.timestamp().getEpochSecond()).toList());
        assertTrue(report.failedModules().isEmpty());
        assertTrue(report.hasDetections());
    }

    @Test
    void shouldIsolateFailingModule() {
        ArtifactModule broken = new StubModule("Broken", List.of()) {
            @Override
            public List<ArtifactRecord> run() throws IOException {
                throw new IOException("database is locked");
            }
        };
        StubModule healthy = new StubModule("Healthy", List.of(record(1, "url", "https://example.org/")));

        ScanReport report = orchestrator.scan(List.of(broken, healthy));

        assertEquals(List.of("Broken"), report.failedModules());
        assertEquals(Map.of("Healthy", 1), report.recordCounts());
        assertFalse(report.hasDetections());
    }

    @Test
    void eachRunShouldReturnItsOwnList() throws IOException {
        StubModule module = new StubModule("Stub", List.of(record(1, "url", "https://example.org/")));

        List<ArtifactRecord> first = module.run();
        first.clear();

        assertEquals(1, module.run().size());
    }

    private static ArtifactRecord record(long epochSecond, String field, String value) {
        return new ArtifactRecord(Instant.ofEpochSecond(epochSecond), Map.of(field, value));
    }

    private static class StubModule implements ArtifactModule {

        private final String name;
        private final List<ArtifactRecord> records;

        StubModule(String name, List<ArtifactRecord> records) {
            this.name = name;
            this.records = records;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public List<ArtifactRecord> run() throws IOException {
            return new ArrayList<>(records);
        }

        @Override
        public TimelineEvent serialize(ArtifactRecord record) {
            return new TimelineEvent(record.timestamp(), name, "stub", record.fields().toString());
        }

        @Override
        public List<Candidate> candidates(ArtifactRecord record) {
            List<Candidate> candidates = new ArrayList<>();
            if (record.field("url") != null) {
                candidates.add(Candidate.domain(record.field("url")));
            }
            if (record.field("process") != null) {
                candidates.add(Candidate.process(record.field("process")));
            }
            return candidates;
        }
    }
}
