package com.strata.tabular;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for turning uploaded files into {@link ParsedTable}s.
 *
 * <p>The format is chosen from the declared file name. Stateless and safe to share.
 */
public class TabularParser {

    private static final Logger log = LoggerFactory.getLogger(TabularParser.class);

    /**
     * Parses {@code content} according to the extension of {@code fileName}.
     *
     * @throws TabularParseException if the extension is unsupported or the content is malformed
     */
    public ParsedTable parse(String fileName, byte[] content) {
        TabularFormat format = TabularFormat.fromFileName(fileName)
                .orElseThrow(() -> new TabularParseException("format",
                        "unsupported format for file '%s' (expected csv, xls or xlsx)".formatted(fileName)));
        return parse(format, content);
    }

    public ParsedTable parse(TabularFormat format, byte[] content) {
        Objects.requireNonNull(format, "format must not be null");
        Objects.requireNonNull(content, "content must not be null");

        TableReader reader = switch (format) {
            case CSV -> new CsvTableReader();
            case XLS, XLSX -> new SpreadsheetTableReader(format);
        };
        ParsedTable table = reader.read(content);
        log.debug("Parsed {} file: {} columns, {} rows", format, table.headers().size(), table.rowCount());
        return table;
    }
}
