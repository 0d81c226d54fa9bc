package com.iocguardian.indicators.config;

import com.iocguardian.indicators.indicator.IndicatorBundleLoader;
import com.iocguardian.indicators.indicator.IndicatorSet;
import com.iocguardian.indicators.url.HttpHeadUrlResolver;
import com.iocguardian.indicators.url.ShortUrlChaser;
import com.iocguardian.indicators.url.ShortenerRegistry;
import com.iocguardian.indicators.url.UrlNormalizer;
import com.iocguardian.indicators.url.UrlResolver;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Wires the indicator set and the URL components from {@link IndicatorProperties}.
 *
 * @author IOC Guardian Developers
 */
@Configuration
@EnableConfigurationProperties(IndicatorProperties.class)
public class IndicatorEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(IndicatorEngineConfig.class);

    @Bean
    public IndicatorSet indicatorSet(IndicatorProperties properties, IndicatorBundleLoader loader) {
        List<Path> paths = properties.getBundlePaths().stream().map(Path::of).toList();
        if (paths.isEmpty()) {
            log.warn("No indicator bundles configured (guardian.indicators.bundle-paths); nothing will match");
            return IndicatorSet.empty();
        }
        return loader.load(paths);
    }

    @Bean
    public ShortenerRegistry shortenerRegistry(IndicatorProperties properties) {
        ShortenerRegistry registry = ShortenerRegistry.withDefaults(
                properties.getShorteners().getAdditionalDomains());
        log.info("Shortener registry holds {} domains", registry.size());
        return registry;
    }

    @Bean
    public UrlNormalizer urlNormalizer(ShortenerRegistry shortenerRegistry) {
        return new UrlNormalizer(shortenerRegistry);
    }

    @Bean
    public UrlResolver urlResolver(
            IndicatorProperties properties,
            WebClient.Builder webClientBuilder,
            MeterRegistry meterRegistry) {
        IndicatorProperties.Unshorten unshorten = properties.getUnshorten();
        if (!unshorten.isEnabled()) {
            log.info("URL de-shortening disabled; shortened URLs are matched as-is");
            return UrlResolver.IDENTITY;
        }
        return new HttpHeadUrlResolver(webClientBuilder,
                Duration.ofMillis(unshorten.getTimeoutMs()), meterRegistry);
    }

    @Bean
    public ShortUrlChaser shortUrlChaser(
            IndicatorProperties properties,
            UrlNormalizer urlNormalizer,
            UrlResolver urlResolver) {
        IndicatorProperties.Unshorten unshorten = properties.getUnshorten();
        return new ShortUrlChaser(urlNormalizer, urlResolver, unshorten.getMaxDepth(),
                Duration.ofMillis(unshorten.getChaseBudgetMs()));
    }
}
