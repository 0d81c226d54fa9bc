package com.iocguardian.indicators.url;

import org.springframework.core.io.ClassPathResource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Registry of known URL-shortener domains.
 *
 * <p>
 * The built-in list lives in {@code shortener-domains.txt} on the classpath,
 * one domain per line, {@code #} starting a comment. Lookups are
 * case-insensitive.
 * </p>
 *
 * @author IOC Guardian Developers
 */
public final class ShortenerRegistry {

    static final String DEFAULT_RESOURCE = "shortener-domains.txt";

    private final Set<String> domains;

    public ShortenerRegistry(Collection<String> domains) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String domain : domains) {
            String d = normalize(domain);
            if (!d.isEmpty()) {
                normalized.add(d);
            }
        }
        this.domains = Collections.unmodifiableSet(normalized);
    }

    /**
     * Built-in shorteners plus any extra domains from configuration.
     *
     * @param additionalDomains extra shortener domains, may be empty
     */
    public static ShortenerRegistry withDefaults(Collection<String> additionalDomains) {
        Set<String> all = new LinkedHashSet<>(readDefaults());
        all.addAll(additionalDomains);
        return new ShortenerRegistry(all);
    }

    public boolean contains(String domain) {
        return domain != null && domains.contains(normalize(domain));
    }

    public Set<String> domains() {
        return domains;
    }

    public int size() {
        return domains.size();
    }

    private static String normalize(String domain) {
        return domain.trim().toLowerCase(Locale.ROOT);
    }

    private static Set<String> readDefaults() {
        ClassPathResource resource = new ClassPathResource(DEFAULT_RESOURCE);
        Set<String> defaults = new LinkedHashSet<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                int comment = line.indexOf('#');
                String entry = (comment >= 0 ? line.substring(0, comment) : line).trim();
                if (!entry.isEmpty()) {
                    defaults.add(entry);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read shortener registry " + DEFAULT_RESOURCE, e);
        }
        return defaults;
    }
}
