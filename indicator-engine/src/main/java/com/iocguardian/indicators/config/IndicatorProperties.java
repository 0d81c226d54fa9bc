package com.iocguardian.indicators.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for indicator loading and URL de-shortening.
 *
 * <p>
 * Bundle paths are read once at startup. The shortener registry ships with a
 * built-in list; extra domains can be appended here without a rebuild.
 * </p>
 *
 * @author IOC Guardian Developers
 */
@Validated
@ConfigurationProperties(prefix = "guardian.indicators")
public class IndicatorProperties {

    private List<String> bundlePaths = new ArrayList<>();
    @Valid
    private Unshorten unshorten = new Unshorten();
    private Shorteners shorteners = new Shorteners();

    public List<String> getBundlePaths() {
        return bundlePaths;
    }

    public void setBundlePaths(List<String> bundlePaths) {
        this.bundlePaths = bundlePaths;
    }

    public Unshorten getUnshorten() {
        return unshorten;
    }

    public void setUnshorten(Unshorten unshorten) {
        this.unshorten = unshorten;
    }

    public Shorteners getShorteners() {
        return shorteners;
    }

    public void setShorteners(Shorteners shorteners) {
        this.shorteners = shorteners;
    }

    public static class Unshorten {
        private boolean enabled = true;
        @Min(1)
        private int maxDepth = 5;
        @Min(100)
        private int timeoutMs = 5000;
        @Min(100)
        private int chaseBudgetMs = 15000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMaxDepth() {
            return maxDepth;
        }

        public void setMaxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public int getChaseBudgetMs() {
            return chaseBudgetMs;
        }

        public void setChaseBudgetMs(int chaseBudgetMs) {
            this.chaseBudgetMs = chaseBudgetMs;
        }
    }

    public static class Shorteners {
        private List<String> additionalDomains = new ArrayList<>();

        public List<String> getAdditionalDomains() {
            return additionalDomains;
        }

        public void setAdditionalDomains(List<String> additionalDomains) {
            this.additionalDomains = additionalDomains;
        }
    }
}
