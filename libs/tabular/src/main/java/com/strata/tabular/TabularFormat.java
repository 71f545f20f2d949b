package com.strata.tabular;

import java.util.Locale;
import java.util.Optional;

/**
 * Tabular file formats accepted for ingestion, identified by file extension.
 */
public enum TabularFormat {
    CSV("csv"),
    XLS("xls"),
    XLSX("xlsx");

    private final String extension;

    TabularFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    /**
     * Resolves the format from the extension of a file name, ignoring case.
     * A name without an extension resolves to nothing.
     */
    public static Optional<TabularFormat> fromFileName(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return Optional.empty();
        }
        return fromExtension(fileName.substring(dot + 1));
    }

    public static Optional<TabularFormat> fromExtension(String extension) {
        if (extension == null) {
            return Optional.empty();
        }
        String normalized = extension.trim().toLowerCase(Locale.ROOT);
        for (TabularFormat format : values()) {
            if (format.extension.equals(normalized)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
