package com.nursingjobs.pipeline.ingest.normalize;

import com.nursingjobs.pipeline.ingest.model.SalaryRange;
import com.nursingjobs.pipeline.ingest.model.SalaryType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses free-text pay into a {@link SalaryRange}. The type comes from hourly/annual keywords
 * when present, otherwise from magnitude (values of 1000 or more are annual). Results outside
 * the plausible band for their type are discarded.
 */
public final class SalaryParser {
    private static final Logger log = LoggerFactory.getLogger(SalaryParser.class);

    static final BigDecimal HOURLY_FLOOR = new BigDecimal("10");
    static final BigDecimal HOURLY_CEILING = new BigDecimal("500");
    static final BigDecimal ANNUAL_FLOOR = new BigDecimal("20000");
    static final BigDecimal ANNUAL_CEILING = new BigDecimal("1000000");

    private static final String AMOUNT = "\\$?\\s*(\\d{1,3}(?:,\\d{3})+|\\d+)(?:\\.(\\d{1,2}))?\\s*([kK])?";
    private static final Pattern RANGE = Pattern.compile(AMOUNT + "\\s*(?:-|–|—|to)\\s*" + AMOUNT);
    private static final Pattern SINGLE = Pattern.compile(AMOUNT);
    private static final Pattern HOURLY = Pattern.compile("hour|hourly|/hr\\b|\\bhr\\b|/h\\b");
    private static final Pattern ANNUAL = Pattern.compile("annual|per year|/year|/yr\\b|yearly|salary|per annum");

    private SalaryParser() {
    }

    public static SalaryRange parse(String text) {
        if (text == null || text.isBlank()) {
            return SalaryRange.empty();
        }
        String value = text.replace(' ', ' ').trim();
        BigDecimal min;
        BigDecimal max;
        Matcher range = RANGE.matcher(value);
        if (range.find()) {
            min = amount(range.group(1), range.group(2), range.group(3));
            max = amount(range.group(4), range.group(5), range.group(6));
        } else {
            Matcher single = SINGLE.matcher(value);
            if (!single.find()) {
                return SalaryRange.empty();
            }
            min = amount(single.group(1), single.group(2), single.group(3));
            max = min;
        }
        if (min.compareTo(max) > 0) {
            BigDecimal swap = min;
            min = max;
            max = swap;
        }

        SalaryType type = detectType(value.toLowerCase(Locale.ROOT), min);
        if (!isPlausible(type, min, max)) {
            log.info("Dropping implausible {} salary {}-{} parsed from '{}'", type, min, max, text);
            return SalaryRange.empty();
        }
        return new SalaryRange(min, max, type);
    }

    static boolean isPlausible(SalaryType type, BigDecimal min, BigDecimal max) {
        BigDecimal floor = type == SalaryType.HOURLY ? HOURLY_FLOOR : ANNUAL_FLOOR;
        BigDecimal ceiling = type == SalaryType.HOURLY ? HOURLY_CEILING : ANNUAL_CEILING;
        return min.compareTo(floor) >= 0 && max.compareTo(ceiling) <= 0;
    }

    private static SalaryType detectType(String lower, BigDecimal min) {
        if (HOURLY.matcher(lower).find()) {
            return SalaryType.HOURLY;
        }
        if (ANNUAL.matcher(lower).find()) {
            return SalaryType.ANNUAL;
        }
        return min.compareTo(BigDecimal.valueOf(1000)) >= 0 ? SalaryType.ANNUAL : SalaryType.HOURLY;
    }

    private static BigDecimal amount(String whole, String cents, String thousands) {
        BigDecimal value = new BigDecimal(whole.replace(",", ""));
        if (cents != null) {
            value = value.add(new BigDecimal("0." + cents));
        }
        if (thousands != null) {
            value = value.multiply(BigDecimal.valueOf(1000));
        }
        return value.setScale(2, RoundingMode.HALF_UP);
    }
}
