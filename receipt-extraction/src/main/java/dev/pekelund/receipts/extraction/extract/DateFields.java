package dev.pekelund.receipts.extraction.extract;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Date recognition over receipt lines, most specific layout first.
 */
final class DateFields {

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
        Map.entry("jan", 1), Map.entry("feb", 2), Map.entry("mar", 3), Map.entry("apr", 4),
        Map.entry("may", 5), Map.entry("jun", 6), Map.entry("jul", 7), Map.entry("aug", 8),
        Map.entry("sep", 9), Map.entry("oct", 10), Map.entry("nov", 11), Map.entry("dec", 12));

    private static final String MONTH_NAME = "(?<month>jan|feb|mar|apr|may|jun|jul|aug|sep|oct|nov|dec)[a-z]*\\.?";

    private static final List<DateLayout> LAYOUTS = List.of(
        new DateLayout(Pattern.compile("\\b(?<year>\\d{4})-(?<month>\\d{1,2})-(?<day>\\d{1,2})\\b"), 1.0,
            DateFields::numeric),
        new DateLayout(Pattern.compile("\\b" + MONTH_NAME + "\\s+(?<day>\\d{1,2})(?:st|nd|rd|th)?,?\\s+(?<year>\\d{4})\\b",
            Pattern.CASE_INSENSITIVE), 1.0, DateFields::named),
        new DateLayout(Pattern.compile("\\b(?<day>\\d{1,2})(?:st|nd|rd|th)?\\s+" + MONTH_NAME + ",?\\s+(?<year>\\d{4})\\b",
            Pattern.CASE_INSENSITIVE), 1.0, DateFields::named),
        new DateLayout(Pattern.compile("\\b(?<month>\\d{1,2})/(?<day>\\d{1,2})/(?<year>\\d{4})\\b"), 0.9,
            DateFields::monthFirst),
        new DateLayout(Pattern.compile("\\b(?<day>\\d{1,2})\\.(?<month>\\d{1,2})\\.(?<year>\\d{4})\\b"), 0.9,
            DateFields::numeric),
        new DateLayout(Pattern.compile("\\b(?<month>\\d{1,2})[/-](?<day>\\d{1,2})[/-](?<year>\\d{2})\\b"), 0.8,
            DateFields::monthFirst));

    private DateFields() {
    }

    static Optional<DateCandidate> find(List<String> lines, List<TemplateDatePattern> templatePatterns) {
        for (TemplateDatePattern templatePattern : templatePatterns) {
            for (int index = 0; index < lines.size(); index++) {
                Matcher matcher = templatePattern.pattern().matcher(lines.get(index));
                while (matcher.find()) {
                    Optional<LocalDate> date = parse(matcher.group("date"), templatePattern.formatter());
                    if (date.isPresent()) {
                        return Optional.of(new DateCandidate(date.get(), 1.0, index, true));
                    }
                }
            }
        }
        for (DateLayout layout : LAYOUTS) {
            for (int index = 0; index < lines.size(); index++) {
                Matcher matcher = layout.pattern().matcher(lines.get(index));
                while (matcher.find()) {
                    Optional<LocalDate> date = layout.parser().apply(matcher);
                    if (date.isPresent()) {
                        return Optional.of(new DateCandidate(date.get(), layout.specificity(), index, false));
                    }
                }
            }
        }
        return Optional.empty();
    }

    static boolean containsDate(String line) {
        return LAYOUTS.stream().anyMatch(layout -> layout.pattern().matcher(line).find());
    }

    private static Optional<LocalDate> parse(String value, DateTimeFormatter formatter) {
        try {
            return Optional.of(LocalDate.parse(value, formatter));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }

    private static Optional<LocalDate> numeric(Matcher matcher) {
        return of(expandYear(matcher.group("year")), Integer.parseInt(matcher.group("month")),
            Integer.parseInt(matcher.group("day")));
    }

    private static Optional<LocalDate> monthFirst(Matcher matcher) {
        int year = expandYear(matcher.group("year"));
        int month = Integer.parseInt(matcher.group("month"));
        int day = Integer.parseInt(matcher.group("day"));
        if (month > 12 && day <= 12) {
            return of(year, day, month);
        }
        return of(year, month, day);
    }

    private static Optional<LocalDate> named(Matcher matcher) {
        Integer month = MONTHS.get(matcher.group("month").substring(0, 3).toLowerCase(Locale.ROOT));
        if (month == null) {
            return Optional.empty();
        }
        return of(Integer.parseInt(matcher.group("year")), month, Integer.parseInt(matcher.group("day")));
    }

    private static int expandYear(String year) {
        int value = Integer.parseInt(year);
        if (year.length() == 2) {
            return value < 50 ? 2000 + value : 1900 + value;
        }
        return value;
    }

    private static Optional<LocalDate> of(int year, int month, int day) {
        try {
            return Optional.of(LocalDate.of(year, month, day));
        } catch (DateTimeException ex) {
            return Optional.empty();
        }
    }

    record DateCandidate(LocalDate date, double specificity, int lineIndex, boolean templateSpecific) {
    }

    private record DateLayout(Pattern pattern, double specificity, Function<Matcher, Optional<LocalDate>> parser) {
    }
}
