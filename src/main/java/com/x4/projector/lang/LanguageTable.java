package com.x4.projector.lang;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Language names and abbreviations accepted on the command line, mapped to the
 * game's language files. The game numbers its language files by country
 * calling code.
 */
public final class LanguageTable {

    private static final Map<String, List<String>> ALIASES_BY_FILE = new LinkedHashMap<>();

    static {
        ALIASES_BY_FILE.put("t/0001-l007.xml", List.of("ru", "rus", "russian", "russkij", "russkiy", "русский"));
        ALIASES_BY_FILE.put("t/0001-l033.xml", List.of("fr", "fra", "fre", "french", "français"));
        ALIASES_BY_FILE.put("t/0001-l034.xml", List.of("es", "sp", "spa", "spanish", "español"));
        ALIASES_BY_FILE.put("t/0001-l039.xml", List.of("it", "ita", "italian", "italiano"));
        ALIASES_BY_FILE.put("t/0001-l044.xml", List.of("en", "eng", "english"));
        ALIASES_BY_FILE.put("t/0001-l049.xml",
                List.of("ge", "de", "ger", "deu", "german", "deutsch", "deutsche"));
        ALIASES_BY_FILE.put("t/0001-l055.xml", List.of("pt", "por", "portuguese", "português"));
        ALIASES_BY_FILE.put("t/0001-l081.xml", List.of("ja", "jpn", "japanese", "日本語", "nihongo"));
        ALIASES_BY_FILE.put("t/0001-l082.xml", List.of("ko", "kor", "korean", "한국어", "韓國語", "hangugeo"));
        ALIASES_BY_FILE.put("t/0001-l086.xml", List.of("zh", "zh-cn", "chi", "chi-cn", "zho", "zho-cn",
                "chinese", "chinese-cn", "汉语", "hànyǔ"));
        ALIASES_BY_FILE.put("t/0001-l088.xml", List.of("zh-tw", "chi-tw", "zho-tw", "chinese-tw", "漢語"));
    }

    private LanguageTable() {
        // Utility class
    }

    /**
     * Logical path of the language file for a name or abbreviation, case-insensitive.
     */
    public static Optional<String> fileFor(String language) {
        if (language == null) {
            return Optional.empty();
        }
        String wanted = language.trim().toLowerCase(Locale.ROOT);
        return ALIASES_BY_FILE.entrySet().stream()
                .filter(e -> e.getValue().contains(wanted))
                .map(Map.Entry::getKey)
                .findFirst();
    }

    public static boolean isKnown(String language) {
        return fileFor(language).isPresent();
    }
}
