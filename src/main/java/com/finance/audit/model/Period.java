package com.finance.audit.model;

import lombok.Value;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An ordinal time bucket. Calendar months order by year and month, sequential
 * periods (1, 2, 3, ...) by their number.
 */
@Value
public class Period implements Comparable<Period> {

    public enum Kind { MONTH, SEQUENTIAL }

    private static final DateTimeFormatter MONTH_LABEL = DateTimeFormatter.ofPattern("yyyy-MM");
    private static final Pattern ISO_DATE = Pattern.compile("(\\d{4})-(\\d{1,2})-(\\d{1,2})");
    private static final Pattern YEAR_MONTH = Pattern.compile("(\\d{4})[-/](\\d{1,2})");
    private static final Pattern INTEGER = Pattern.compile("-?\\d+");

    private static final Comparator<Period> ORDER = Comparator
            .comparing(Period::getKind)
            .thenComparingLong(Period::getOrdinal)
            .thenComparing(Period::getLabel);

    Kind kind;
    long ordinal;
    String label;

    public static Period ofMonth(YearMonth month) {
        return new Period(Kind.MONTH, month.getYear() * 12L + month.getMonthValue() - 1, month.format(MONTH_LABEL));
    }

    public static Period ofMonth(int year, int month) {
        return ofMonth(YearMonth.of(year, month));
    }

    public static Period sequential(long number) {
        return new Period(Kind.SEQUENTIAL, number, Long.toString(number));
    }

    /**
     * Coerce a raw period cell into a Period.
     *
     * @throws IllegalArgumentException if the value has no period interpretation
     */
    public static Period parse(Object raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Period value is null");
        }
        if (raw instanceof Period period) {
            return period;
        }
        if (raw instanceof YearMonth yearMonth) {
            return ofMonth(yearMonth);
        }
        if (raw instanceof LocalDate date) {
            return ofMonth(YearMonth.from(date));
        }
        if (raw instanceof LocalDateTime dateTime) {
            return ofMonth(YearMonth.from(dateTime));
        }
        if (raw instanceof Number number) {
            double d = number.doubleValue();
            if (Double.isFinite(d) && d == Math.rint(d)) {
                return sequential(number.longValue());
            }
            throw new IllegalArgumentException("Period number is not integral: " + raw);
        }
        return parseText(raw.toString().trim());
    }

    private static Period parseText(String text) {
        Matcher m = ISO_DATE.matcher(text);
        if (!m.matches()) {
            m = YEAR_MONTH.matcher(text);
        }
        if (m.matches()) {
            try {
                return ofMonth(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
            } catch (DateTimeException e) {
                throw new IllegalArgumentException("Invalid month in period '" + text + "'", e);
            }
        }
        if (INTEGER.matcher(text).matches()) {
            return sequential(Long.parseLong(text));
        }
        throw new IllegalArgumentException("Unrecognised period: '" + text + "'");
    }

    @Override
    public int compareTo(Period other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return label;
    }
}
