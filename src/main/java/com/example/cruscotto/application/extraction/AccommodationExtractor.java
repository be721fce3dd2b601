package com.example.cruscotto.application.extraction;

import com.example.cruscotto.config.CruscottoProperties;
import com.example.cruscotto.domain.model.AccommodationFormat;
import com.example.cruscotto.domain.model.AccommodationRecord;
import com.example.cruscotto.domain.model.DatasetType;
import com.example.cruscotto.domain.model.ValidationVerdict;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reads the "Presenze migranti in accoglienza" table: migrants in the reception system per region.
 * <p>
 * Reports before the cutover print only a regional total (and a distribution percentage); later
 * reports split the total into hotspot, reception centre and SIPROIMI/SAI columns.
 */
@Component
public class AccommodationExtractor implements DatasetExtractor<AccommodationRecord> {

    static final int MIN_REGIONS = (int) Math.ceil(RegionVocabulary.CANONICAL.size() * 0.25);

    private static final List<String> TITLE_INDICATORS = List.of(
            "PRESENZE MIGRANTI IN ACCOGLIENZA",
            "PRESENZA MIGRANTI IN ACCOGLIENZA",
            "PRESENZE IN ACCOGLIENZA",
            "PRESENZA IN ACCOGLIENZA"
    );
    private static final Pattern TITLE_PATTERN = Pattern.compile("PRESENZ[AE]\\s*(MIGRANTI)?\\s*IN\\s*ACCOGLIENZA");
    private static final List<String> PRE_CUTOVER_INDICATORS = List.of(
            "totale immigrati presenti sul territorio regione",
            "percentuale di distribuzione"
    );
    private static final List<String> NOISE = List.of(
            "presenze migranti", "presenza migranti", "totale", "aggiornamento",
            "regione", "note", "fonte", "percentuale"
    );

    private final LocalDate cutover;
    private final List<ExtractionStrategy<AccommodationRecord>> strategies = List.of(
            new TableRowsStrategy(),
            new TextLinesStrategy()
    );

    @Autowired
    public AccommodationExtractor(CruscottoProperties properties) {
        this(properties.getExtraction().getAccommodationCutover());
    }

    AccommodationExtractor(LocalDate cutover) {
        this.cutover = cutover;
    }

    @Override
    public DatasetType dataset() {
        return DatasetType.ACCOMMODATION;
    }

    @Override
    public OptionalInt locatePage(ReportDocument document) {
        for (int i = 0; i < document.pageCount(); i++) {
            String text = document.pageText(i).toUpperCase(Locale.ROOT);
            if (TITLE_INDICATORS.stream().anyMatch(text::contains)
                    || TITLE_PATTERN.matcher(text).find()
                    || (text.contains("REGIONE") && text.contains("HOT SPOT") && text.contains("ACCOGLIENZA"))
                    || (text.contains("REGIONE") && text.contains("TOTALE IMMIGRATI PRESENTI"))) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    @Override
    public String detectFormat(ReportPage page, LocalDate referenceDate) {
        String text = page.text().toLowerCase(Locale.ROOT);
        if (PRE_CUTOVER_INDICATORS.stream().anyMatch(text::contains)) {
            return AccommodationFormat.PRE_CUTOVER.tag();
        }
        if (referenceDate.isBefore(cutover)) {
            return AccommodationFormat.PRE_CUTOVER.tag();
        }
        return AccommodationFormat.POST_CUTOVER.tag();
    }

    @Override
    public List<ExtractionStrategy<AccommodationRecord>> strategies() {
        return strategies;
    }

    @Override
    public ValidationVerdict validate(List<AccommodationRecord> rows, ExtractionContext context) {
        if (rows.isEmpty()) {
            return ValidationVerdict.reject("no region rows");
        }
        Set<String> seen = new HashSet<>();
        for (AccommodationRecord row : rows) {
            if (!seen.add(row.region())) {
                return ValidationVerdict.reject("region listed twice: " + row.region());
            }
        }
        if (seen.size() < MIN_REGIONS) {
            return ValidationVerdict.reject("only " + seen.size() + " of " + RegionVocabulary.CANONICAL.size() + " regions");
        }
        return ValidationVerdict.accept();
    }

    /**
     * Builds a record from a region label and the numeric cells that follow it.
     * Missing numeric cells count as zero.
     */
    static Optional<AccommodationRecord> toRecord(String label, List<String> values, ExtractionContext context) {
        String raw = NumericCells.squeeze(label);
        String lower = raw.toLowerCase(Locale.ROOT);
        if (raw.isEmpty() || NOISE.stream().anyMatch(lower::contains)) {
            return Optional.empty();
        }
        Optional<String> region = RegionVocabulary.canonicalize(raw);
        if (region.isEmpty()) {
            return Optional.empty();
        }
        AccommodationFormat format = AccommodationFormat.fromTag(context.format());
        if (format.hasBreakdownColumns()) {
            return Optional.of(new AccommodationRecord(
                    region.get(),
                    NumericCells.parse(valueAt(values, 0)),
                    NumericCells.parse(valueAt(values, 1)),
                    NumericCells.parse(valueAt(values, 2)),
                    NumericCells.parse(valueAt(values, 3)),
                    context.referenceDate(),
                    context.sourceFilename(),
                    format));
        }
        return Optional.of(new AccommodationRecord(
                region.get(), 0, 0, 0,
                NumericCells.parse(valueAt(values, 0)),
                context.referenceDate(),
                context.sourceFilename(),
                format));
    }

    private static String valueAt(List<String> values, int index) {
        return index < values.size() ? values.get(index) : "0";
    }

    private static final class TableRowsStrategy implements ExtractionStrategy<AccommodationRecord> {

        @Override
        public String name() {
            return "table-rows";
        }

        @Override
        public List<AccommodationRecord> extract(ReportPage page, ExtractionContext context) {
            List<AccommodationRecord> records = new ArrayList<>();
            for (List<String> row : page.rows()) {
                if (row.size() < 2) {
                    continue;
                }
                toRecord(row.get(0), row.subList(1, row.size()), context).ifPresent(records::add);
            }
            return records;
        }
    }

    private static final class TextLinesStrategy implements ExtractionStrategy<AccommodationRecord> {

        @Override
        public String name() {
            return "text-lines";
        }

        @Override
        public List<AccommodationRecord> extract(ReportPage page, ExtractionContext context) {
            List<AccommodationRecord> records = new ArrayList<>();
            for (String line : page.lines()) {
                LabelledLine.parse(line)
                        .flatMap(parsed -> toRecord(parsed.label(), parsed.values(), context))
                        .ifPresent(records::add);
            }
            return records;
        }
    }
}
