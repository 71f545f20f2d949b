package com.strata.tabular;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * CSV reader built on Apache Commons CSV.
 *
 * <p>The delimiter is sniffed from the first {@value #SNIFF_WINDOW} bytes: a semicolon anywhere
 * in that window selects {@code ;}, otherwise {@code ,}. Records may have any number of fields.
 */
final class CsvTableReader implements TableReader {

    static final int SNIFF_WINDOW = 1000;

    private static final char BOM = '\uFEFF';

    @Override
    public ParsedTable read(byte[] content) {
        char delimiter = sniffDelimiter(content);
        String text = decode(content);

        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setIgnoreEmptyLines(true)
                .build();

        try (CSVParser parser = CSVParser.parse(new StringReader(text), format)) {
            Iterator<CSVRecord> records = parser.iterator();
            List<String> headers = readHeaders(records);
            List<Map<String, String>> rows = new ArrayList<>();
            long rowNumber = 0;
            while (true) {
                rowNumber++;
                CSVRecord record;
                try {
                    if (!records.hasNext()) {
                        break;
                    }
                    record = records.next();
                } catch (UncheckedIOException | IllegalStateException e) {
                    throw new TabularParseException("row " + rowNumber, "malformed CSV data", e);
                }
                rows.add(RowZipper.zip(headers, record.toList()));
            }
            return new ParsedTable(headers, rows);
        } catch (IOException e) {
            throw new TabularParseException("header", "cannot read CSV content", e);
        }
    }

    static char sniffDelimiter(byte[] content) {
        int limit = Math.min(content.length, SNIFF_WINDOW);
        for (int i = 0; i < limit; i++) {
            if (content[i] == ';') {
                return ';';
            }
        }
        return ',';
    }

    private static List<String> readHeaders(Iterator<CSVRecord> records) {
        try {
            if (!records.hasNext()) {
                return List.of();
            }
            return records.next().stream().map(String::trim).toList();
        } catch (UncheckedIOException | IllegalStateException e) {
            throw new TabularParseException("header", "malformed CSV header", e);
        }
    }

    private static String decode(byte[] content) {
        try {
            String text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content))
                    .toString();
            return !text.isEmpty() && text.charAt(0) == BOM ? text.substring(1) : text;
        } catch (CharacterCodingException e) {
            throw new TabularParseException("encoding", "CSV content is not valid UTF-8", e);
        }
    }
}
