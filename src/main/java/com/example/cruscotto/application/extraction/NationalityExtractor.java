package com.example.cruscotto.application.extraction;

import com.example.cruscotto.domain.model.DatasetType;
import com.example.cruscotto.domain.model.NationalityRecord;
import com.example.cruscotto.domain.model.ValidationVerdict;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Reads the "Nazionalità dichiarate al momento dello sbarco" table: one row per declared
 * nationality with the number of migrants landed since the start of the year.
 */
@Component
public class NationalityExtractor implements DatasetExtractor<NationalityRecord> {

    static final String STANDARD_FORMAT = "nationality-table";
    static final String CANONICAL_IVORY_COAST = "Costa d'Avorio";

    private static final List<String> TITLE_INDICATORS = List.of(
            "NAZIONALITÀ DICHIARATE AL MOMENTO DELLO SBARCO",
            "NAZIONALITÀ DICHIARATA AL MOMENTO DELLO SBARCO",
            "NAZIONALITÀ DICHIARATE"
    );
    private static final Pattern TITLE_PATTERN =
            Pattern.compile("NAZIONALIT[ÀA].*DICHIARAT[AE].*SBARCO", Pattern.DOTALL);
    private static final Pattern NOISE =
            Pattern.compile("TOTALE|NAZIONALIT[ÀA]|NOTE", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern IVORY_COAST = Pattern.compile(
            "costa\\s*d(?:''|â€™|['’‘´`])\\s*avorio", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private final List<ExtractionStrategy<NationalityRecord>> strategies = List.of(
            new TableRowsStrategy(),
            new TextLinesStrategy()
    );

    @Override
    public DatasetType dataset() {
        return DatasetType.NATIONALITY;
    }

    @Override
    public OptionalInt locatePage(ReportDocument document) {
        for (int i = 0; i < document.pageCount(); i++) {
            String text = document.pageText(i).toUpperCase(Locale.ROOT);
            if (TITLE_INDICATORS.stream().anyMatch(text::contains) || TITLE_PATTERN.matcher(text).find()) {
                return OptionalInt.of(i);
            }
        }
        for (int i = 0; i < document.pageCount(); i++) {
            String text = document.pageText(i).toUpperCase(Locale.ROOT);
            if (text.contains("NAZIONALIT") && text.contains("SBARCAT")) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    @Override
    public String detectFormat(ReportPage page, LocalDate referenceDate) {
        return STANDARD_FORMAT;
    }

    @Override
    public List<ExtractionStrategy<NationalityRecord>> strategies() {
        return strategies;
    }

    @Override
    public ValidationVerdict validate(List<NationalityRecord> rows, ExtractionContext context) {
        if (rows.isEmpty()) {
            return ValidationVerdict.reject("no nationality rows");
        }
        return ValidationVerdict.accept();
    }

    /**
     * Folds every spelling of Côte d'Ivoire seen in the reports into one name; other names are
     * only trimmed.
     */
    static String normalizeNationality(String nationality) {
        String trimmed = NumericCells.squeeze(nationality);
        if (IVORY_COAST.matcher(trimmed).find()) {
            return CANONICAL_IVORY_COAST;
        }
        return trimmed;
    }

    private static Optional<NationalityRecord> toRecord(String name, String value, ExtractionContext context) {
        String nationality = NumericCells.squeeze(name);
        if (nationality.isEmpty() || NOISE.matcher(nationality).find() || !NumericCells.containsDigit(value)) {
            return Optional.empty();
        }
        int landed = NumericCells.parse(value);
        if (landed <= 0) {
            return Optional.empty();
        }
        return Optional.of(new NationalityRecord(
                normalizeNationality(nationality), landed, context.referenceDate(), context.sourceFilename()));
    }

    private static final class TableRowsStrategy implements ExtractionStrategy<NationalityRecord> {

        @Override
        public String name() {
            return "table-rows";
        }

        @Override
        public List<NationalityRecord> extract(ReportPage page, ExtractionContext context) {
            List<NationalityRecord> records = new ArrayList<>();
            for (List<String> row : page.rows()) {
                if (row.size() < 2) {
                    continue;
                }
                toRecord(row.get(0), row.get(1), context).ifPresent(records::add);
            }
            return records;
        }
    }

    private static final class TextLinesStrategy implements ExtractionStrategy<NationalityRecord> {

        @Override
        public String name() {
            return "text-lines";
        }

        @Override
        public List<NationalityRecord> extract(ReportPage page, ExtractionContext context) {
            List<NationalityRecord> records = new ArrayList<>();
            for (String line : page.lines()) {
                LabelledLine.parse(line)
                        .filter(parsed -> parsed.values().size() == 1)
                        .flatMap(parsed -> toRecord(parsed.label(), parsed.values().get(0), context))
                        .ifPresent(records::add);
            }
            return records;
        }
    }
}
