package com.iocguardian.indicators.indicator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.iocguardian.indicators.indicator.IndicatorBundleException.Reason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Parses STIX2 indicator bundles into an {@link IndicatorSet}.
 *
 * <p>
 * Only objects with {@code "type": "indicator"} and a {@code pattern} are
 * considered. Patterns must have the shape {@code [<key> = '<value>']};
 * keys other than the four {@link IndicatorKind} keys are ignored.
 * </p>
 *
 * @author IOC Guardian Developers
 */
@Component
public class IndicatorBundleLoader {

    private static final Logger log = LoggerFactory.getLogger(IndicatorBundleLoader.class);

    private final ObjectMapper objectMapper;

    public IndicatorBundleLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Load and merge one or more bundle files.
     *
     * @param paths bundle files, loaded in order
     * @return the merged indicator set
     * @throws IndicatorBundleException if any bundle is unreadable or malformed
     */
    public IndicatorSet load(List<Path> paths) {
        IndicatorSet.Builder builder = IndicatorSet.builder();
        for (Path path : paths) {
            parseInto(path, readBundle(path), builder);
        }

        IndicatorSet set = builder.build();
        log.info("Loaded {} indicators from {} bundle(s): {}", set.size(), paths.size(), set);
        return set;
    }

    public IndicatorSet load(Path... paths) {
        return load(List.of(paths));
    }

    private JsonNode readBundle(Path path) {
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IndicatorBundleException(Reason.IO, path,
                    "Unable to read indicator bundle " + path + ": " + e.getMessage(), e);
        }

        try {
            return objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new IndicatorBundleException(Reason.PARSE, path,
                    "Malformed JSON in indicator bundle " + path + ": " + e.getOriginalMessage(), e);
        }
    }

    private void parseInto(Path path, JsonNode root, IndicatorSet.Builder builder) {
        JsonNode objects = root == null ? null : root.get("objects");
        if (objects == null || !objects.isArray()) {
            throw new IndicatorBundleException(Reason.PARSE, path,
                    "Indicator bundle " + path + " has no 'objects' array");
        }

        int added = 0;
        int ignored = 0;
        for (JsonNode entry : objects) {
            if (!"indicator".equals(entry.path("type").asText(null))) {
                continue;
            }
            JsonNode pattern = entry.get("pattern");
            if (pattern == null || pattern.isNull()) {
                continue;
            }
            if (!pattern.isTextual()) {
                throw new IndicatorBundleException(Reason.SCHEMA, path,
                        "Indicator pattern is not a string: " + pattern);
            }

            String[] keyValue = splitPattern(path, pattern.asText());
            Optional<IndicatorKind> kind = IndicatorKind.fromPatternKey(keyValue[0]);
            if (kind.isEmpty()) {
                ignored++;
                continue;
            }
            if (keyValue[1].isEmpty()) {
                throw new IndicatorBundleException(Reason.SCHEMA, path,
                        "Indicator pattern has an empty value: " + pattern.asText());
            }
            if (builder.add(kind.get(), keyValue[1])) {
                added++;
            }
        }

        log.debug("Parsed bundle {}: {} new indicators, {} with unsupported keys", path, added, ignored);
    }

    /**
     * Split {@code [key = 'value']} into its trimmed key and unquoted value.
     */
    static String[] splitPattern(Path path, String pattern) {
        String body = strip(pattern.trim(), "[]").trim();
        String[] parts = body.split("=", -1);
        if (parts.length != 2) {
            throw new IndicatorBundleException(Reason.SCHEMA, path,
                    "Indicator pattern is not a single key/value comparison: " + pattern);
        }
        String key = parts[0].trim();
        String value = strip(parts[1].trim(), "'\"");
        return new String[] { key, value };
    }

    private static String strip(String value, String chars) {
        int start = 0;
        int end = value.length();
        while (start < end && chars.indexOf(value.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && chars.indexOf(value.charAt(end - 1)) >= 0) {
            end--;
        }
        return value.substring(start, end);
    }
}
