package com.example.cruscotto.application.extraction;

import java.text.Normalizer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Closed vocabulary of the 20 Italian regions and the spellings found in the reports
 * (bilingual names, French and plural forms, mis-encoded umlauts).
 */
final class RegionVocabulary {

    static final List<String> CANONICAL = List.of(
            "Abruzzo", "Basilicata", "Calabria", "Campania", "Emilia-Romagna",
            "Friuli-Venezia Giulia", "Lazio", "Liguria", "Lombardia", "Marche",
            "Molise", "Piemonte", "Puglia", "Sardegna", "Sicilia", "Toscana",
            "Trentino-Alto Adige", "Umbria", "Valle D'Aosta", "Veneto"
    );

    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Pattern SEPARATORS = Pattern.compile("[-/'’‘`´.]");

    // multi-word regions are checked on the whole name before single keywords
    private static final Map<String, String> PHRASES = new LinkedHashMap<>();
    private static final Map<String, String> WORDS = new LinkedHashMap<>();

    static {
        PHRASES.put("trentino", "Trentino-Alto Adige");
        PHRASES.put("alto adige", "Trentino-Alto Adige");
        PHRASES.put("sudtirol", "Trentino-Alto Adige");
        PHRASES.put("valle d aosta", "Valle D'Aosta");
        PHRASES.put("valle daosta", "Valle D'Aosta");
        PHRASES.put("vallee d aoste", "Valle D'Aosta");
        PHRASES.put("aosta", "Valle D'Aosta");
        PHRASES.put("friuli", "Friuli-Venezia Giulia");
        PHRASES.put("venezia giulia", "Friuli-Venezia Giulia");
        PHRASES.put("emilia", "Emilia-Romagna");
        PHRASES.put("romagna", "Emilia-Romagna");

        for (String region : CANONICAL) {
            if (!region.contains(" ") && !region.contains("-")) {
                WORDS.put(region.toLowerCase(Locale.ROOT), region);
            }
        }
        WORDS.put("puglie", "Puglia");
        WORDS.put("toscane", "Toscana");
        WORDS.put("lombardie", "Lombardia");
    }

    private RegionVocabulary() {
    }

    /**
     * @param raw region cell as printed
     * @return canonical region name, empty when the text names no region
     */
    static Optional<String> canonicalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = normalize(raw);
        for (Map.Entry<String, String> phrase : PHRASES.entrySet()) {
            if (normalized.contains(phrase.getKey())) {
                return Optional.of(phrase.getValue());
            }
        }
        for (String word : normalized.split(" ")) {
            String region = WORDS.get(word);
            if (region != null) {
                return Optional.of(region);
            }
        }
        return Optional.empty();
    }

    static String normalize(String raw) {
        String repaired = raw.replace("Ã¼", "ü").replace("Ã©", "é").replace("Ã¨", "è");
        String stripped = DIACRITICS.matcher(Normalizer.normalize(repaired, Normalizer.Form.NFD)).replaceAll("");
        String spaced = SEPARATORS.matcher(stripped.toLowerCase(Locale.ROOT)).replaceAll(" ");
        return spaced.replaceAll("\\s+", " ").trim();
    }
}
