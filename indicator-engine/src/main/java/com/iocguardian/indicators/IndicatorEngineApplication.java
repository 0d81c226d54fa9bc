package com.iocguardian.indicators;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * IOC Guardian Indicator Engine.
 *
 * <p>
 * Spring Boot application that loads STIX2 indicator bundles at startup and
 * exposes the matching services used by artifact extraction modules to flag
 * suspicious domains, processes, email addresses and files.
 * </p>
 *
 * @author IOC Guardian Developers
 */
@SpringBootApplication
public class IndicatorEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(IndicatorEngineApplication.class, args);
    }
}
