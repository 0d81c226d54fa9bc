package com.iocguardian.indicators.module;

import java.time.Instant;

/**
 * Serialized form of an artifact record for a scan timeline.
 *
 * @param timestamp when the event happened
 * @param module    name of the producing module
 * @param event     short event identifier, e.g. {@code ios_version}
 * @param data      human-readable description
 *
 * @author IOC Guardian Developers
 */
public record TimelineEvent(Instant timestamp, String module, String event, String data) {
}
