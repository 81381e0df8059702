package com.x4.projector.export;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Output formats. Tabular formats write fixed columns per category; structured
 * formats write whole records including slots.
 */
public enum ExportFormat {
    CSV("csv", "csv", true),
    MARKDOWN("markdown", "md", true),
    JSON("json", "json", false),
    YAML("yaml", "yaml", false);

    private final String cliName;
    private final String fileExtension;
    private final boolean tabular;

    ExportFormat(String cliName, String fileExtension, boolean tabular) {
        this.cliName = cliName;
        this.fileExtension = fileExtension;
        this.tabular = tabular;
    }

    public String getCliName() {
        return cliName;
    }

    public String getFileExtension() {
        return fileExtension;
    }

    public boolean isTabular() {
        return tabular;
    }

    /**
     * Case-insensitive lookup by name; "md" and "yml" are accepted too.
     */
    public static Optional<ExportFormat> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String wanted = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(f -> f.cliName.equals(wanted) || f.fileExtension.equals(wanted)
                        || ("yml".equals(wanted) && f == YAML))
                .findFirst();
    }
}
