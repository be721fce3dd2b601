package com.example.cruscotto.application.extraction;

import com.example.cruscotto.domain.model.NationalityRecord;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Unit tests for the nationality table reader on synthetic pages.
 */
class NationalityExtractorTest {

    private static final ExtractionContext CONTEXT = new ExtractionContext(
            "cruscotto_statistico_giornaliero_31-01-2024.pdf",
            LocalDate.of(2024, 1, 31),
            NationalityExtractor.STANDARD_FORMAT);

    private final NationalityExtractor extractor = new NationalityExtractor();

    @Test
    void locatesPageByTitle() {
        ReportDocument document = InMemoryReportDocument.ofTexts(
                "Sbarchi e accoglienza dei migranti: tutti i dati",
                "Nazionalità dichiarate al momento dello sbarco\nTunisia 1.234");

        assertThat(extractor.locatePage(document)).hasValue(1);
    }

    @Test
    void locatesPageByLooseTitleWhenWordsAreSplit() {
        ReportDocument document = InMemoryReportDocument.ofTexts(
                "Presenze migranti in accoglienza",
                "Nazionalità\ndei migranti sbarcati nel 2024");

        assertThat(extractor.locatePage(document)).hasValue(1);
    }

    @Test
    void noPageWhenTitleIsMissing() {
        assertThat(extractor.locatePage(InMemoryReportDocument.ofTexts("Migranti sbarcati per giorno"))).isEmpty();
    }

    @Test
    void tableRowsSkipHeadersTotalsAndZeroValues() {
        ReportPage page = new ReportPage(0, "", List.of(
                List.of("Nazionalità", "Migranti"),
                List.of("Tunisia", "1.234"),
                List.of("Costa d’Avorio", "987"),
                List.of("Guinea", "0"),
                List.of("Note"),
                List.of("Totale", "2.221")));

        List<NationalityRecord> records = extractor.strategies().get(0).extract(page, CONTEXT);

        assertThat(records)
                .extracting(NationalityRecord::nationality, NationalityRecord::landedMigrants)
                .containsExactly(tuple("Tunisia", 1234), tuple("Costa d'Avorio", 987));
        assertThat(records).allSatisfy(record -> {
            assertThat(record.referenceDate()).isEqualTo(LocalDate.of(2024, 1, 31));
            assertThat(record.sourceFilename()).isEqualTo("cruscotto_statistico_giornaliero_31-01-2024.pdf");
        });
    }

    @Test
    void textLinesReadOneValuePerNationality() {
        ReportPage page = new ReportPage(0, """
                NAZIONALITÀ DICHIARATE AL MOMENTO DELLO SBARCO
                Bangladesh 2.001
                Costa d''Avorio 15
                Egitto 3 4
                Totale 2.016
                """, List.of());

        List<NationalityRecord> records = extractor.strategies().get(1).extract(page, CONTEXT);

        assertThat(records)
                .extracting(NationalityRecord::nationality, NationalityRecord::landedMigrants)
                .containsExactly(tuple("Bangladesh", 2001), tuple("Costa d'Avorio", 15));
    }

    @Test
    void ivoryCoastSpellingsAreFolded() {
        assertThat(NationalityExtractor.normalizeNationality("Costa dâ€™Avorio")).isEqualTo("Costa d'Avorio");
        assertThat(NationalityExtractor.normalizeNationality("COSTA D' AVORIO")).isEqualTo("Costa d'Avorio");
        assertThat(NationalityExtractor.normalizeNationality("  Sudan   del Sud ")).isEqualTo("Sudan del Sud");
    }

    @Test
    void emptyResultIsRejected() {
        assertThat(extractor.validate(List.of(), CONTEXT).accepted()).isFalse();
        assertThat(extractor.validate(List.of(new NationalityRecord("Tunisia", 5, CONTEXT.referenceDate(),
                CONTEXT.sourceFilename())), CONTEXT).accepted()).isTrue();
    }
}
