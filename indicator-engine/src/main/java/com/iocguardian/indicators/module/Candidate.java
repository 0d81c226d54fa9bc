package com.iocguardian.indicators.module;

import com.iocguardian.indicators.indicator.IndicatorKind;

/**
 * A value extracted from an artifact that should be checked against one
 * indicator category.
 *
 * @author IOC Guardian Developers
 */
public record Candidate(IndicatorKind kind, String value) {

    public static Candidate domain(String url) {
        return new Candidate(IndicatorKind.DOMAIN, url);
    }

    public static Candidate process(String process) {
        return new Candidate(IndicatorKind.PROCESS, process);
    }

    public static Candidate email(String email) {
        return new Candidate(IndicatorKind.EMAIL, email);
    }

    public static Candidate file(String path) {
        return new Candidate(IndicatorKind.FILE, path);
    }
}
