package com.example.cruscotto.application.extraction;

import com.example.cruscotto.domain.model.DatasetType;
import com.example.cruscotto.domain.model.ItalianMonth;
import com.example.cruscotto.domain.model.LandingRecord;
import com.example.cruscotto.domain.model.ValidationVerdict;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the "Migranti sbarcati per giorno" bar chart. The chart has no table structure; its axis
 * labels ({@code 3-set}) and bar values are recovered from the page text between the chart title
 * and the caption printed under it.
 */
@Component
public class LandingsExtractor implements DatasetExtractor<LandingRecord> {

    static final String CHART_FORMAT = "daily-chart";
    static final int MAX_DAILY_VALUE = 10_000;
    static final double ALTERNATIVE_THRESHOLD = 0.3;

    private static final Pattern TITLE =
            Pattern.compile("Migranti sbarcati per giorno al \\d{1,2} \\w+ \\d{4}\\* - mese di \\w+");
    private static final Pattern FIRST_CAPTION = Pattern.compile(
            "\\*I dati si riferiscono agli eventi di sbarco rilevati entro le ore 8:00 del giorno di riferimento");
    private static final Pattern SECOND_CAPTION = Pattern.compile(
            "Fonte: Dipartimento della Pubblica sicurezza\\. I dati sono suscettibili di successivo consolidamento\\.");
    private static final Pattern NOISE_LINE =
            Pattern.compile("Note:|Tabella|PRESENZE|NAZIONALIT|Totale", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private final List<ExtractionStrategy<LandingRecord>> strategies = List.of(
            new DayMonthPairsStrategy(),
            new AlternativePatternsStrategy()
    );

    @Override
    public DatasetType dataset() {
        return DatasetType.LANDINGS;
    }

    @Override
    public OptionalInt locatePage(ReportDocument document) {
        for (int i = 0; i < document.pageCount(); i++) {
            if (hasChartMarkers(document.pageText(i))) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    static boolean hasChartMarkers(String text) {
        return TITLE.matcher(text).find()
                && FIRST_CAPTION.matcher(text).find()
                && SECOND_CAPTION.matcher(text).find();
    }

    @Override
    public String detectFormat(ReportPage page, LocalDate referenceDate) {
        return CHART_FORMAT;
    }

    @Override
    public List<ExtractionStrategy<LandingRecord>> strategies() {
        return strategies;
    }

    @Override
    public ValidationVerdict validate(List<LandingRecord> rows, ExtractionContext context) {
        int daysInMonth = YearMonth.from(context.referenceDate()).lengthOfMonth();
        if (rows.isEmpty()) {
            return ValidationVerdict.reject("no daily values");
        }
        Set<Integer> days = new HashSet<>();
        int minDay = Integer.MAX_VALUE;
        int maxDay = Integer.MIN_VALUE;
        for (LandingRecord row : rows) {
            if (row.day() < 1 || row.day() > daysInMonth) {
                return ValidationVerdict.reject("day " + row.day() + " outside month of " + daysInMonth + " days");
            }
            if (row.landedMigrants() < 0 || row.landedMigrants() > MAX_DAILY_VALUE) {
                return ValidationVerdict.reject("implausible value " + row.landedMigrants() + " on day " + row.day());
            }
            if (!days.add(row.day())) {
                return ValidationVerdict.reject("day " + row.day() + " read twice");
            }
            minDay = Math.min(minDay, row.day());
            maxDay = Math.max(maxDay, row.day());
        }
        double required = Math.max(5, daysInMonth * 0.25);
        if (days.size() < required) {
            return ValidationVerdict.reject("only " + days.size() + " of " + daysInMonth + " days");
        }
        int span = maxDay - minDay + 1;
        if (span < days.size() * 0.8) {
            return ValidationVerdict.reject("days spread over " + span + " for " + days.size() + " values");
        }
        return ValidationVerdict.accept();
    }

    /**
     * Text between the chart title and the first caption line, without noise lines.
     *
     * @return chart text, empty when the title or caption is missing
     */
    static String chartArea(String pageText) {
        Matcher title = TITLE.matcher(pageText);
        if (!title.find()) {
            return "";
        }
        String afterTitle = pageText.substring(title.end());
        Matcher caption = FIRST_CAPTION.matcher(afterTitle);
        if (!caption.find()) {
            return "";
        }
        List<String> kept = new ArrayList<>();
        for (String line : afterTitle.substring(0, caption.start()).split("\\R")) {
            String trimmed = line.strip();
            if (!trimmed.isEmpty() && !NOISE_LINE.matcher(trimmed).find()) {
                kept.add(trimmed);
            }
        }
        return String.join("\n", kept);
    }

    private static String abbreviation(ExtractionContext context) {
        return ItalianMonth.of(context.referenceDate().getMonthValue()).abbreviation();
    }

    private static Pattern primaryPattern(String abbreviation) {
        return Pattern.compile("(\\d{1,2})-" + abbreviation + "\\s+(\\d{1,6})", Pattern.CASE_INSENSITIVE);
    }

    private static List<LandingRecord> toRecords(Map<Integer, Integer> values, ExtractionContext context) {
        List<LandingRecord> records = new ArrayList<>();
        values.forEach((day, value) -> records.add(
                new LandingRecord(day, value, context.referenceDate(), context.sourceFilename())));
        return records;
    }

    /**
     * Every {@code <day>-<abbr> <value>} pair, unfiltered, so that validation sees duplicates and
     * out-of-range values.
     */
    private static final class DayMonthPairsStrategy implements ExtractionStrategy<LandingRecord> {

        @Override
        public String name() {
            return "day-month-pairs";
        }

        @Override
        public List<LandingRecord> extract(ReportPage page, ExtractionContext context) {
            Matcher matcher = primaryPattern(abbreviation(context)).matcher(chartArea(page.text()));
            List<LandingRecord> records = new ArrayList<>();
            while (matcher.find()) {
                records.add(new LandingRecord(
                        Integer.parseInt(matcher.group(1)),
                        Integer.parseInt(matcher.group(2)),
                        context.referenceDate(),
                        context.sourceFilename()));
            }
            return records;
        }
    }

    /**
     * In-range pairs from the primary pattern, keeping the first value read for a day. Only when
     * they cover less than {@link #ALTERNATIVE_THRESHOLD} of the month are looser patterns used to
     * fill the missing days.
     */
    private static final class AlternativePatternsStrategy implements ExtractionStrategy<LandingRecord> {

        @Override
        public String name() {
            return "alternative-patterns";
        }

        @Override
        public List<LandingRecord> extract(ReportPage page, ExtractionContext context) {
            String area = chartArea(page.text());
            String abbreviation = abbreviation(context);
            int daysInMonth = YearMonth.from(context.referenceDate()).lengthOfMonth();
            Map<Integer, Integer> values = new LinkedHashMap<>();
            collect(primaryPattern(abbreviation), area, daysInMonth, values);
            if (values.size() < daysInMonth * ALTERNATIVE_THRESHOLD) {
                List<Pattern> loose = List.of(
                        Pattern.compile("(\\d{1,2})\\s+" + abbreviation + "\\s+(\\d{1,6})", Pattern.CASE_INSENSITIVE),
                        Pattern.compile("(\\d{1,2})[" + abbreviation + "]\\s*(\\d{1,6})", Pattern.CASE_INSENSITIVE),
                        Pattern.compile("(\\d{1,2})\\s+(\\d{1,6})")
                );
                for (Pattern pattern : loose) {
                    collect(pattern, area, daysInMonth, values);
                }
            }
            return toRecords(values, context);
        }

        private static void collect(Pattern pattern, String area, int daysInMonth, Map<Integer, Integer> values) {
            Matcher matcher = pattern.matcher(area);
            while (matcher.find()) {
                int day = Integer.parseInt(matcher.group(1));
                int value = Integer.parseInt(matcher.group(2));
                if (day >= 1 && day <= daysInMonth && value <= MAX_DAILY_VALUE) {
                    values.putIfAbsent(day, value);
                }
            }
        }
    }
}
