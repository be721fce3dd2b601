package com.example.cruscotto.application.service;

import com.example.cruscotto.domain.model.ItalianMonth;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives the reference date of a report from its filename.
 * <p>
 * Publishers used several naming conventions over the years, so a fixed list of pattern families
 * is tried in order and the first one that yields a valid calendar date wins. The concatenated
 * {@code ddmmyyyy} form is only trusted for 2017 and 2018 because later filenames carry other
 * eight-digit runs. The generic {@code d_month_yyyy} family is checked last for the same reason.
 */
@Component
public class ReferenceDateExtractor {

    private static final Logger log = LoggerFactory.getLogger(ReferenceDateExtractor.class);

    private final List<Function<String, Optional<LocalDate>>> families = List.of(
            numeric(Pattern.compile("(\\d{2})-(\\d{2})-(\\d{4})")),
            spelled(Pattern.compile("(\\d{1,2})\\s+(\\w+)\\s+(\\d{4})")),
            numeric(Pattern.compile("(\\d{2})\\.(\\d{2})\\.(\\d{4})")),
            this::legacyConcatenated,
            spelled(Pattern.compile("cruscotto_statistico_giornaliero_(\\d{1,2})_(\\w+)_(\\d{4})")),
            spelled(Pattern.compile("(\\d{1,2})_(\\w+)_(\\d{4})"))
    );

    private static final Pattern CONCATENATED = Pattern.compile("(\\d{2})(\\d{2})(\\d{4})");

    /**
     * @param filename report filename, with or without extension
     * @return reference date, empty when no family recognizes the name
     */
    public Optional<LocalDate> extract(String filename) {
        if (filename == null || filename.isBlank()) {
            return Optional.empty();
        }
        for (Function<String, Optional<LocalDate>> family : families) {
            Optional<LocalDate> date = family.apply(filename);
            if (date.isPresent()) {
                return date;
            }
        }
        log.debug("No reference date recognized in '{}'", filename);
        return Optional.empty();
    }

    private Optional<LocalDate> legacyConcatenated(String filename) {
        Matcher matcher = CONCATENATED.matcher(filename);
        if (!matcher.find()) {
            return Optional.empty();
        }
        int year = Integer.parseInt(matcher.group(3));
        if (year != 2017 && year != 2018) {
            return Optional.empty();
        }
        return toDate(year, Integer.parseInt(matcher.group(2)), Integer.parseInt(matcher.group(1)));
    }

    private static Function<String, Optional<LocalDate>> numeric(Pattern pattern) {
        return filename -> {
            Matcher matcher = pattern.matcher(filename);
            if (!matcher.find()) {
                return Optional.empty();
            }
            return toDate(Integer.parseInt(matcher.group(3)),
                    Integer.parseInt(matcher.group(2)),
                    Integer.parseInt(matcher.group(1)));
        };
    }

    private static Function<String, Optional<LocalDate>> spelled(Pattern pattern) {
        return filename -> {
            Matcher matcher = pattern.matcher(filename);
            if (!matcher.find()) {
                return Optional.empty();
            }
            return ItalianMonth.fromName(matcher.group(2))
                    .flatMap(month -> toDate(Integer.parseInt(matcher.group(3)),
                            month.number(),
                            Integer.parseInt(matcher.group(1))));
        };
    }

    private static Optional<LocalDate> toDate(int year, int month, int day) {
        try {
            return Optional.of(LocalDate.of(year, month, day));
        } catch (DateTimeException ex) {
            log.debug("Discarding impossible date {}-{}-{}: {}", year, month, day, ex.getMessage());
            return Optional.empty();
        }
    }
}
