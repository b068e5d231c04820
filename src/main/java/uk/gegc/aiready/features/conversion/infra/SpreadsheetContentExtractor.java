package uk.gegc.aiready.features.conversion.infra;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.poi.poifs.filesystem.FileMagic;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;
import uk.gegc.aiready.features.conversion.domain.ContentExtractor;
import uk.gegc.aiready.features.conversion.domain.ExtractionException;
import uk.gegc.aiready.features.conversion.domain.OutputFilenames;
import uk.gegc.aiready.features.conversion.domain.SourceKind;
import uk.gegc.aiready.features.conversion.domain.model.SheetData;
import uk.gegc.aiready.features.conversion.domain.model.SpreadsheetContent;
import uk.gegc.aiready.features.conversion.domain.model.StructuredContent;
import uk.gegc.aiready.features.conversion.domain.model.TableData;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Spreadsheet extractor. Excel workbooks ({@code .xlsx}, {@code .xls}) are read with Apache POI,
 * {@code .csv} files with Apache Commons CSV as a single sheet named {@value #CSV_SHEET_NAME}.
 * The first non-empty row of each sheet is its header row; empty rows are skipped.
 */
@Component
@Slf4j
public class SpreadsheetContentExtractor implements ContentExtractor {

    static final String CSV_SHEET_NAME = "Sheet1";

    private static final List<String> SUPPORTED = List.of(
            ".xlsx",
            ".xls",
            ".csv",
            "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet",
            "application/vnd.ms-excel",
            "text/csv"
    );

    @Override
    public boolean supports(String filenameOrMime) {
        if (filenameOrMime == null) return false;
        String lower = filenameOrMime.toLowerCase(Locale.ROOT);
        return SUPPORTED.stream().anyMatch(suffix -> suffix.startsWith(".") ? lower.endsWith(suffix) : lower.equals(suffix));
    }

    @Override
    public StructuredContent extract(byte[] bytes, String filename) throws ExtractionException {
        boolean csv = filename != null && filename.toLowerCase(Locale.ROOT).endsWith(".csv");
        FileMagic magic = OfficeFiles.magicOf(bytes);
        if (!csv && (magic == FileMagic.OOXML || magic == FileMagic.OLE2)) {
            return extractWorkbook(bytes, filename);
        }
        if (!csv && filename != null && !OutputFilenames.extensionOf(filename).isEmpty()) {
            throw new ExtractionException("Failed to read spreadsheet: not an Excel workbook");
        }
        return extractCsv(bytes, filename);
    }

    private StructuredContent extractWorkbook(byte[] bytes, String filename) throws ExtractionException {
        DataFormatter formatter = new DataFormatter(Locale.ROOT);
        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(bytes))) {
            List<SheetData> sheets = new ArrayList<>();
            for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
                Sheet sheet = workbook.getSheetAt(i);
                List<List<String>> rows = new ArrayList<>();
                for (Row row : sheet) {
                    List<String> cells = readRow(row, formatter);
                    if (!cells.isEmpty()) {
                        rows.add(cells);
                    }
                }
                sheets.add(new SheetData(sheet.getSheetName(), TableData.fromRows(rows)));
            }
            log.debug("Extracted workbook {}: {} sheets", filename, sheets.size());
            return new SpreadsheetContent(SourceKind.EXCEL_SPREADSHEET, sheets);
        } catch (IOException | RuntimeException e) {
            throw new ExtractionException("Failed to read spreadsheet: " + e.getMessage(), e);
        }
    }

    private StructuredContent extractCsv(byte[] bytes, String filename) throws ExtractionException {
        String text = new String(bytes, StandardCharsets.UTF_8);
        if (text.startsWith("\uFEFF")) {
            text = text.substring(1);
        }
        try (CSVParser parser = CSVParser.parse(text, CSVFormat.DEFAULT)) {
            List<List<String>> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                List<String> cells = new ArrayList<>();
                for (String value : record) {
                    cells.add(value.trim());
                }
                trimTrailingBlanks(cells);
                if (!cells.isEmpty()) {
                    rows.add(cells);
                }
            }
            log.debug("Extracted CSV file {}: {} rows", filename, rows.size());
            return new SpreadsheetContent(SourceKind.CSV_SPREADSHEET,
                    List.of(new SheetData(CSV_SHEET_NAME, TableData.fromRows(rows))));
        } catch (IOException | UncheckedIOException | IllegalStateException e) {
            throw new ExtractionException("Failed to read CSV file: " + e.getMessage(), e);
        }
    }

    /**
     * Cell texts of a row up to its last non-blank cell; empty when the row holds nothing.
     */
    private List<String> readRow(Row row, DataFormatter formatter) {
        List<String> cells = new ArrayList<>();
        short lastCell = row.getLastCellNum();
        for (int c = 0; c < lastCell; c++) {
            Cell cell = row.getCell(c, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
            cells.add(cell == null ? "" : cellText(cell, formatter));
        }
        trimTrailingBlanks(cells);
        return cells;
    }

    /**
     * Formatted cell text. Formula cells use their cached result so no evaluation happens at read time.
     */
    private String cellText(Cell cell, DataFormatter formatter) {
        if (cell.getCellType() != CellType.FORMULA) {
            return formatter.formatCellValue(cell).trim();
        }
        return switch (cell.getCachedFormulaResultType()) {
            case NUMERIC -> formatter.formatRawCellContents(
                    cell.getNumericCellValue(),
                    cell.getCellStyle().getDataFormat(),
                    cell.getCellStyle().getDataFormatString()).trim();
            case STRING -> cell.getRichStringCellValue().getString().trim();
            case BOOLEAN -> cell.getBooleanCellValue() ? "TRUE" : "FALSE";
            default -> "";
        };
    }

    private static void trimTrailingBlanks(List<String> cells) {
        while (!cells.isEmpty() && cells.get(cells.size() - 1).isBlank()) {
            cells.remove(cells.size() - 1);
        }
    }
}
