package dev.careeriq.util;

import java.time.LocalDate;
import java.time.Month;
import java.time.YearMonth;
import java.time.format.TextStyle;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses free-form experience durations into months.
 * <p>
 * Understands explicit spans ("2 years", "1.5 yrs", "3 years 6 months", "18 months") and
 * date ranges ("Jan 2020 - Mar 2022", "2019 – 2021", "June 2021 - Present"). Open-ended
 * ranges end at the supplied reference date.
 */
public final class DurationParser {

    private DurationParser() {}

    /** Upper bound for any single duration and for a summed career: fifty years. */
    public static final int MAX_MONTHS = 600;

    private static final Pattern YEARS_PATTERN =
            Pattern.compile("(?<![\\d.])(\\d{1,3}(?:\\.\\d{1,2})?)\\s*\\+?\\s*(?:years?|yrs?)\\b");
    private static final Pattern MONTHS_PATTERN =
            Pattern.compile("(?<![\\d.])(\\d{1,4})\\s*(?:months?|mos?)\\b");
    private static final Pattern RANGE_PATTERN = Pattern.compile(
            "(?:([a-z]{3,9})\\.?\\s+)?(\\d{4})\\s*(?:-|–|—|to|until)\\s*"
                    + "(?:(?:([a-z]{3,9})\\.?\\s+)?(\\d{4})|(present|current|now|today|ongoing))");

    /** "5+ years", "3 years of experience": requirement phrasing in free text. */
    private static final Pattern YEARS_MENTION =
            Pattern.compile("(?<![\\d.])(\\d{1,2})\\s*\\+?\\s*(?:years?|yrs?)");

    private static final Set<String> ONGOING_TOKENS = Set.of("present", "current", "now", "today", "ongoing");

    private static final Map<String, Month> MONTH_LOOKUP = buildMonthLookup();

    /**
     * Months covered by a duration string, capped at {@link #MAX_MONTHS}, or empty when
     * nothing in it can be read. Figures too long to be a real span are ignored.
     */
    public static OptionalInt parseMonths(String duration, LocalDate today) {
        if (duration == null || duration.isBlank()) {
            return OptionalInt.empty();
        }
        String text = duration.toLowerCase(Locale.ROOT);

        Matcher range = RANGE_PATTERN.matcher(text);
        if (range.find()) {
            OptionalInt months = rangeMonths(range, today);
            if (months.isPresent()) {
                return months;
            }
        }

        double total = 0;
        boolean found = false;
        Matcher years = YEARS_PATTERN.matcher(text);
        while (years.find()) {
            total += Double.parseDouble(years.group(1)) * 12;
            found = true;
        }
        Matcher months = MONTHS_PATTERN.matcher(text);
        while (months.find()) {
            total += Integer.parseInt(months.group(1));
            found = true;
        }
        return found ? OptionalInt.of((int) Math.min(Math.round(total), MAX_MONTHS)) : OptionalInt.empty();
    }

    /**
     * Largest "N years" figure mentioned anywhere in the text, used when no entry carries
     * a parseable duration ("5+ years of experience with Java").
     */
    public static OptionalInt maxYearsMentioned(String text) {
        if (text == null || text.isBlank()) {
            return OptionalInt.empty();
        }
        Matcher matcher = YEARS_MENTION.matcher(text.toLowerCase(Locale.ROOT));
        int max = -1;
        while (matcher.find()) {
            max = Math.max(max, Integer.parseInt(matcher.group(1)));
        }
        return max >= 0 ? OptionalInt.of(max) : OptionalInt.empty();
    }

    private static OptionalInt rangeMonths(Matcher range, LocalDate today) {
        Month startMonth = lookupMonth(range.group(1));
        int startYear = Integer.parseInt(range.group(2));
        YearMonth start = YearMonth.of(startYear, startMonth != null ? startMonth : Month.JANUARY);

        YearMonth end;
        boolean monthPrecision = startMonth != null;
        if (range.group(5) != null && ONGOING_TOKENS.contains(range.group(5))) {
            end = YearMonth.from(today);
            monthPrecision = true;
        } else {
            Month endMonth = lookupMonth(range.group(3));
            end = YearMonth.of(Integer.parseInt(range.group(4)), endMonth != null ? endMonth : Month.JANUARY);
            monthPrecision = monthPrecision && endMonth != null;
        }

        long months = ChronoUnit.MONTHS.between(start, end);
        if (months < 0) {
            return OptionalInt.empty();
        }
        // "Jan 2020 - Dec 2020" covers twelve months
        return OptionalInt.of((int) Math.min(monthPrecision ? months + 1 : months, MAX_MONTHS));
    }

    private static Month lookupMonth(String name) {
        return name == null ? null : MONTH_LOOKUP.get(name);
    }

    private static Map<String, Month> buildMonthLookup() {
        Map<String, Month> lookup = new HashMap<>();
        for (Month month : Month.values()) {
            lookup.put(month.getDisplayName(TextStyle.FULL, Locale.ENGLISH).toLowerCase(Locale.ROOT), month);
            lookup.put(month.getDisplayName(TextStyle.SHORT, Locale.ENGLISH).toLowerCase(Locale.ROOT), month);
        }
        lookup.put("sept", Month.SEPTEMBER);
        return Map.copyOf(lookup);
    }
}
