package com.strata.tabular;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

/**
 * Excel reader built on Apache POI. Only the first sheet is read; its first row supplies the
 * headers and every cell is rendered the way Excel would display it.
 */
final class SpreadsheetTableReader implements TableReader {

    private final TabularFormat format;

    SpreadsheetTableReader(TabularFormat format) {
        if (format == TabularFormat.CSV) {
            throw new IllegalArgumentException("CSV is not a spreadsheet format");
        }
        this.format = format;
    }

    @Override
    public ParsedTable read(byte[] content) {
        try (Workbook workbook = open(content)) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new TabularParseException("sheet", "workbook has no sheets");
            }
            Sheet sheet = workbook.getSheetAt(0);
            if (sheet.getPhysicalNumberOfRows() == 0) {
                throw new TabularParseException("sheet", "first sheet is empty");
            }

            DataFormatter formatter = new DataFormatter();
            FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();

            int headerIndex = sheet.getFirstRowNum();
            List<String> headers = render(sheet.getRow(headerIndex), formatter, evaluator);

            List<Map<String, String>> rows = new ArrayList<>();
            for (int r = headerIndex + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                if (row == null) {
                    continue;
                }
                rows.add(RowZipper.zip(headers, render(row, formatter, evaluator)));
            }
            return new ParsedTable(headers, rows);
        } catch (IOException e) {
            throw new TabularParseException("workbook", "cannot close " + format.name() + " workbook", e);
        }
    }

    private Workbook open(byte[] content) {
        try {
            return switch (format) {
                case XLS -> new HSSFWorkbook(new ByteArrayInputStream(content));
                case XLSX -> new XSSFWorkbook(new ByteArrayInputStream(content));
                case CSV -> throw new IllegalStateException("unreachable");
            };
        } catch (IOException | RuntimeException e) {
            // POI signals corrupt or mismatched files with a mix of checked and unchecked types
            throw new TabularParseException("workbook", "cannot open " + format.name() + " workbook", e);
        }
    }

    private static List<String> render(Row row, DataFormatter formatter, FormulaEvaluator evaluator) {
        short lastCell = row.getLastCellNum();
        if (lastCell <= 0) {
            return List.of();
        }
        List<String> values = new ArrayList<>(lastCell);
        for (int c = 0; c < lastCell; c++) {
            Cell cell = row.getCell(c);
            values.add(cell == null ? "" : formatter.formatCellValue(cell, evaluator));
        }
        return values;
    }
}
