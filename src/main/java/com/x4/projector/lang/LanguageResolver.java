package com.x4.projector.lang;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.x4.projector.archive.GameFileSource;

/**
 * Resolves {@code {page,text}} placeholders against the game's language files.
 *
 * A substituted text may itself contain placeholders, so substitution repeats
 * until the text stops changing. Placeholders that match no text are left in
 * place and remembered; see {@link #getUnresolved()}.
 */
public class LanguageResolver {
    private static final Logger log = LoggerFactory.getLogger(LanguageResolver.class);

    static final int MAX_PASSES = 32;

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\s*(\\d+)\\s*,\\s*(\\d+)\\s*\\}");
    // comments are unescaped parenthesised parts of a text
    private static final Pattern COMMENT = Pattern.compile("(?<!\\\\)\\(.*?(?<!\\\\)\\)");
    private static final Pattern ESCAPED = Pattern.compile("\\\\(.)");

    private final GameFileSource files;
    private final String defaultLanguage;

    private final Map<String, TextTable> tables = new ConcurrentHashMap<>();
    private final Set<String> unresolved = ConcurrentHashMap.newKeySet();

    /**
     * @throws IllegalArgumentException if the default language is not in {@link LanguageTable}
     */
    public LanguageResolver(GameFileSource files, String defaultLanguage) {
        this.files = Objects.requireNonNull(files, "files");
        if (!LanguageTable.isKnown(defaultLanguage)) {
            throw new IllegalArgumentException("Unknown language: " + defaultLanguage);
        }
        this.defaultLanguage = defaultLanguage;
    }

    public String resolve(String template) {
        return resolve(template, defaultLanguage);
    }

    /**
     * Resolves a template in the given language; the result is trimmed.
     *
     * @throws IllegalArgumentException if the language is not in {@link LanguageTable}
     * @throws UncheckedIOException if the language file cannot be read
     */
    public String resolve(String template, String language) {
        if (template == null || template.isEmpty()) {
            return template;
        }
        TextTable table = table(language);

        String previous = null;
        String current = template;
        int passes = 0;
        while (!current.equals(previous)) {
            if (passes++ == MAX_PASSES) {
                log.warn("Stopped resolving '{}' after {} passes", template, MAX_PASSES);
                break;
            }
            previous = current;
            current = substitute(current, table);
        }

        return ESCAPED.matcher(current).replaceAll("$1").trim();
    }

    /**
     * Placeholders seen so far that match no text, sorted.
     */
    public Set<String> getUnresolved() {
        return new TreeSet<>(unresolved);
    }

    /**
     * Loads the language file up front, so a missing file fails early.
     */
    public void preload(String language) throws IOException {
        try {
            table(language);
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private String substitute(String text, TextTable table) {
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String replacement = table.find(matcher.group(1), matcher.group(2))
                    .map(found -> COMMENT.matcher(found).replaceAll(""))
                    .orElseGet(() -> {
                        if (unresolved.add(matcher.group())) {
                            log.warn("Cannot resolve text {}", matcher.group());
                        }
                        return matcher.group();
                    });
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private TextTable table(String language) {
        String path = LanguageTable.fileFor(language)
                .orElseThrow(() -> new IllegalArgumentException("Unknown language: " + language));
        return tables.computeIfAbsent(path, this::load);
    }

    private TextTable load(String path) {
        try {
            TextTable table = TextTable.parse(files.read(path), path);
            log.info("Loaded {} texts from {}", table.size(), path);
            return table;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read language file " + path, e);
        }
    }
}
