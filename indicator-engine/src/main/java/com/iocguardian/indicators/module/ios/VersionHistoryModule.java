package com.iocguardian.indicators.module.ios;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.iocguardian.indicators.module.ArtifactModule;
import com.iocguardian.indicators.module.ArtifactRecord;
import com.iocguardian.indicators.module.TimelineEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Extracts the iOS update history from analytics journal files.
 *
 * <p>
 * Each {@code Analytics-Journal-*.ips} file starts with a JSON header line
 * holding the OS version and the time the journal was written.
 * </p>
 *
 * @author IOC Guardian Developers
 */
public class VersionHistoryModule implements ArtifactModule {

    private static final Logger log = LoggerFactory.getLogger(VersionHistoryModule.class);

    static final String JOURNAL_DIR = "private/var/db/analyticsd";
    static final String JOURNAL_GLOB = "Analytics-Journal-*.ips";

    /** e.g. {@code 2021-05-03 10:23:10.00 +0200}; fraction width varies. */
    private static final DateTimeFormatter JOURNAL_TIMESTAMP = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .appendLiteral(' ')
            .appendOffset("+HHMM", "+0000")
            .toFormatter();

    private final Path baseFolder;
    private final ObjectMapper objectMapper;

    public VersionHistoryModule(Path baseFolder, ObjectMapper objectMapper) {
        this.baseFolder = baseFolder;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<ArtifactRecord> run() throws IOException {
        List<ArtifactRecord> records = new ArrayList<>();
        Path journalDir = baseFolder.resolve(JOURNAL_DIR);
        if (!Files.isDirectory(journalDir)) {
            log.info("No analytics journals under {}", journalDir);
            return records;
        }

        try (DirectoryStream<Path> journals = Files.newDirectoryStream(journalDir, JOURNAL_GLOB)) {
            for (Path journal : journals) {
                ArtifactRecord record = readHeader(journal);
                if (record != null) {
                    records.add(record);
                }
            }
        }

        records.sort(Comparator.comparing(ArtifactRecord::timestamp));
        log.info("Extracted {} iOS version records", records.size());
        return records;
    }

    @Override
    public TimelineEvent serialize(ArtifactRecord record) {
        return new TimelineEvent(record.timestamp(), name(), "ios_version",
                "Recorded iOS version " + record.field("os_version"));
    }

    private ArtifactRecord readHeader(Path journal) throws IOException {
        String header;
        try (BufferedReader reader = Files.newBufferedReader(journal, StandardCharsets.UTF_8)) {
            header = reader.readLine();
        }
        if (header == null || header.isBlank()) {
            log.warn("Skipping empty analytics journal {}", journal);
            return null;
        }

        try {
            JsonNode line = objectMapper.readTree(header.trim());
            String osVersion = line.path("os_version").asText(null);
            String timestamp = line.path("timestamp").asText(null);
            if (osVersion == null || timestamp == null) {
                log.warn("Analytics journal {} has no os_version/timestamp header", journal);
                return null;
            }
            return new ArtifactRecord(parseTimestamp(timestamp), Map.of("os_version", osVersion));
        } catch (IOException | DateTimeParseException e) {
            log.warn("Unable to parse analytics journal header in {}: {}", journal, e.getMessage());
            return null;
        }
    }

    static Instant parseTimestamp(String value) {
        return OffsetDateTime.parse(value.trim(), JOURNAL_TIMESTAMP).toInstant();
    }
}
