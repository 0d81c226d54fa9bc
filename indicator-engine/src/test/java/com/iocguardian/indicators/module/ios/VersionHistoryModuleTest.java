package com.iocguardian.indicators.module.ios;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.iocguardian.indicators.module.ArtifactRecord;
import com.iocguardian.indicators.module.TimelineEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VersionHistoryModuleTest {

    @TempDir
    Path baseFolder;

    private Path journalDir;
    private VersionHistoryModule module;

    @BeforeEach
    void setUp() throws IOException {
        journalDir = Files.createDirectories(baseFolder.resolve(VersionHistoryModule.JOURNAL_DIR));
        module = new VersionHistoryModule(baseFolder, new ObjectMapper());
    }

    @Test
    void shouldExtractVersionsSortedByTimestamp() throws IOException {
        writeJournal("Analytics-Journal-2.ips",
                "{\"timestamp\":\"2021-06-01 08:00:00.123456 +0200\",\"os_version\":\"iPhone OS 14.6 (18F72)\"}");
        writeJournal("Analytics-Journal-1.ips",
                "{\"timestamp\":\"2021-03-01 10:30:00.00 +0000\",\"os_version\":\"iPhone OS 14.4 (18D52)\"}");

        List<ArtifactRecord> records = module.run();

        assertEquals(2, records.size());
        assertEquals("iPhone OS 14.4 (18D52)", records.get(0).field("os_version"));
        assertEquals(Instant.parse("2021-03-01T10:30:00Z"), records.get(0).timestamp());
        assertEquals(Instant.parse("2021-06-01T06:00:00.123456Z"), records.get(1).timestamp());
    }

    @Test
    void shouldSerializeToTimelineEvent() throws IOException {
        writeJournal("Analytics-Journal-1.ips",
                "{\"timestamp\":\"2021-03-01 10:30:00.00 +0000\",\"os_version\":\"iPhone OS 14.4 (18D52)\"}");

        TimelineEvent event = module.serialize(module.run().get(0));

        assertEquals("VersionHistoryModule", event.module());
        assertEquals("ios_version", event.event());
        assertEquals("Recorded iOS version iPhone OS 14.4 (18D52)", event.data());
    }

    @Test
    void shouldSkipJournalsWithoutHeader() throws IOException {
        writeJournal("Analytics-Journal-1.ips", "not json");
        writeJournal("Analytics-Journal-2.ips", "{\"timestamp\":\"2021-03-01 10:30:00 +0000\"}");
        writeJournal("Analytics-Journal-3.ips", "");
        writeJournal("unrelated.log",
                "{\"timestamp\":\"2021-03-01 10:30:00 +0000\",\"os_version\":\"iPhone OS 14.4\"}");

        assertTrue(module.run().isEmpty());
    }

    @Test
    void shouldReturnEmptyWhenDirectoryIsMissing() throws IOException {
        VersionHistoryModule elsewhere = new VersionHistoryModule(baseFolder.resolve("none"), new ObjectMapper());

        assertTrue(elsewhere.run().isEmpty());
        assertTrue(elsewhere.candidates(null).isEmpty());
    }

    @Test
    void shouldParseTimestampWithoutFraction() {
        assertEquals(Instant.parse("2022-01-02T03:04:05Z"),
                VersionHistoryModule.parseTimestamp("2022-01-02 03:04:05 +0000"));
    }

    private void writeJournal(String name, String header) throws IOException {
        Files.writeString(journalDir.resolve(name), header + "\n{\"message\":{}}\n");
    }
}
