package com.example.cruscotto.application.service;

import com.example.cruscotto.config.CruscottoProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Known report locations that do not follow the generated naming scheme, keyed by period.
 * Entries come from {@code cruscotto.acquisition.overrides}; paths are relative to the site domain.
 */
@Component
public class UrlOverrideTable {

    private final Map<YearMonth, String> paths;

    @Autowired
    public UrlOverrideTable(CruscottoProperties properties) {
        this(properties.getAcquisition().getOverrides());
    }

    UrlOverrideTable(List<CruscottoProperties.UrlOverride> overrides) {
        Map<YearMonth, String> byPeriod = new TreeMap<>();
        for (CruscottoProperties.UrlOverride override : overrides) {
            YearMonth period;
            try {
                period = YearMonth.parse(override.getPeriod());
            } catch (DateTimeParseException | NullPointerException ex) {
                throw new IllegalArgumentException("Invalid override period: " + override.getPeriod(), ex);
            }
            if (override.getPath() == null || override.getPath().isBlank()) {
                throw new IllegalArgumentException("Override for " + period + " has no path");
            }
            String path = override.getPath().trim();
            try {
                URI.create(path);
                URLDecoder.decode(path, StandardCharsets.UTF_8);
            } catch (IllegalArgumentException ex) {
                throw new IllegalArgumentException("Override for " + period + " is not a valid URL path: " + path, ex);
            }
            byPeriod.put(period, path);
        }
        this.paths = Collections.unmodifiableMap(byPeriod);
    }

    public Optional<String> pathFor(YearMonth period) {
        return Optional.ofNullable(paths.get(period));
    }

    public int size() {
        return paths.size();
    }
}
