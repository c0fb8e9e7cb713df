package com.finance.audit.service;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.regex.Pattern;

/**
 * Guesses whether crosstab column headers are calendar periods or sequential
 * labels, for the upstream step that configures the scanners.
 *
 * Patterns are matched as prefixes, so "12" and "Total" both look like period
 * headers. Short numeric headers are therefore often reported as date-like; the
 * patterns are a compatibility heuristic, not a business rule.
 */
@Component
public class PeriodHeaderClassifier {

    public enum HeaderFormat { YEAR_MONTH_DASH, YEAR_MONTH_SLASH, MONTH_NAME, SEQUENTIAL, UNKNOWN }

    public enum PeriodMode { DATE, SEQUENTIAL }

    private static final Pattern YEAR_MONTH_DASH = Pattern.compile("\\d{4}-\\d{2}");
    private static final Pattern YEAR_MONTH_SLASH = Pattern.compile("\\d{4}/\\d{2}");
    // Latin or Thai month abbreviations
    private static final Pattern MONTH_NAME = Pattern.compile("[A-Za-z\\u0E01-\\u0E2E]{3,}");
    private static final Pattern ONE_OR_TWO_DIGITS = Pattern.compile("\\d{1,2}");

    public boolean looksLikeDateHeader(String header) {
        return guessFormat(header) != HeaderFormat.UNKNOWN;
    }

    public HeaderFormat guessFormat(String header) {
        if (header == null) {
            return HeaderFormat.UNKNOWN;
        }
        if (startsWith(YEAR_MONTH_DASH, header)) return HeaderFormat.YEAR_MONTH_DASH;
        if (startsWith(YEAR_MONTH_SLASH, header)) return HeaderFormat.YEAR_MONTH_SLASH;
        if (startsWith(MONTH_NAME, header)) return HeaderFormat.MONTH_NAME;
        if (startsWith(ONE_OR_TWO_DIGITS, header)) return HeaderFormat.SEQUENTIAL;
        return HeaderFormat.UNKNOWN;
    }

    /**
     * DATE when at least one header looks like a period, otherwise SEQUENTIAL.
     */
    public PeriodMode suggestMode(Collection<String> headers) {
        for (String header : headers) {
            if (looksLikeDateHeader(header)) {
                return PeriodMode.DATE;
            }
        }
        return PeriodMode.SEQUENTIAL;
    }

    private static boolean startsWith(Pattern pattern, String text) {
        return pattern.matcher(text).lookingAt();
    }
}
