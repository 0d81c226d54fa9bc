package com.iocguardian.indicators.metrics;

import com.iocguardian.indicators.indicator.IndicatorKind;
import com.iocguardian.indicators.indicator.IndicatorSet;
import com.iocguardian.indicators.url.ShortenerRegistry;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Exposes indicator-engine gauges via Micrometer/Prometheus.
 *
 * <ul>
 * <li>{@code guardian.indicators.loaded{kind}} - indicators loaded per category</li>
 * <li>{@code guardian.shorteners.registered} - size of the shortener registry</li>
 * <li>{@code guardian.uptime_seconds} - engine uptime</li>
 * </ul>
 *
 * <p>
 * Match and de-shortening counters are registered by the components that
 * own them.
 * </p>
 *
 * @author IOC Guardian Developers
 */
@Component
public class IndicatorMetrics {

    private static final Logger log = LoggerFactory.getLogger(IndicatorMetrics.class);

    private final IndicatorSet indicators;
    private final ShortenerRegistry shorteners;
    private final MeterRegistry meterRegistry;

    private final long startTime = System.currentTimeMillis();

    public IndicatorMetrics(IndicatorSet indicators, ShortenerRegistry shorteners, MeterRegistry meterRegistry) {
        this.indicators = indicators;
        this.shorteners = shorteners;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void registerGauges() {
        for (IndicatorKind kind : IndicatorKind.values()) {
            Gauge.builder("guardian.indicators.loaded", indicators, set -> set.get(kind).size())
                    .description("Indicators loaded per category")
                    .tag("kind", kind.name().toLowerCase(Locale.ROOT))
                    .register(meterRegistry);
        }

        Gauge.builder("guardian.shorteners.registered", shorteners, ShortenerRegistry::size)
                .description("Known URL-shortener domains")
                .register(meterRegistry);

        Gauge.builder("guardian.uptime_seconds", this, m -> (System.currentTimeMillis() - m.startTime) / 1000.0)
                .description("Indicator engine uptime in seconds")
                .register(meterRegistry);

        log.info("Indicator metrics registered");
    }
}
