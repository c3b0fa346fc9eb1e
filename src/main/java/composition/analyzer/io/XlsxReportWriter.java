package composition.analyzer.io;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.VerticalAlignment;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import composition.analyzer.analysis.AnalysisResult;
import composition.analyzer.model.AggregatedStatistic;
import composition.analyzer.model.ExtractionRecord;
import composition.analyzer.model.FileMappingEntry;
import composition.analyzer.stats.AggregatedReport;

/**
 * Writes the report as an .xlsx workbook with one sheet per table.
 * Column widths follow the longest value (plus padding, capped); file locations wrap.
 */
public final class XlsxReportWriter implements ReportWriter {

    private static final Logger LOG = LoggerFactory.getLogger(XlsxReportWriter.class);

    public static final String RAW_DATA_SHEET = "Raw Data";
    public static final String STATISTICS_SHEET = "MR Statistics";
    public static final String FILE_MAPPING_SHEET = "File Mapping";
    public static final String FUNCTIONS_SHEET = "Functions";

    static final int MAX_COLUMN_WIDTH = 120;
    static final int FILE_LOCATIONS_WIDTH = 100;
    private static final int COLUMN_PADDING = 2;
    private static final int FILE_LOCATIONS_COLUMN = 3;
    private static final int MAX_CELL_TEXT = SpreadsheetVersion.EXCEL2007.getMaxTextLength();

    @Override
    public void write(AnalysisResult result, AggregatedReport report, Path output) throws IOException {
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(report, "report");
        Objects.requireNonNull(output, "output");
        LOG.debug("Starting Excel export to {}", output);

        try (Workbook workbook = new XSSFWorkbook()) {
            final CellStyle headerStyle = headerStyle(workbook);

            writeTable(workbook, headerStyle, rawData(result.records()));
            writeTable(workbook, headerStyle, statistics(report.statistics()));
            final Sheet fileMapping = writeTable(workbook, headerStyle, fileMapping(report.fileMapping()));
            writeTable(workbook, headerStyle, functions(result.functions()));

            wrapFileLocations(workbook, fileMapping);

            final Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(output)) {
                workbook.write(out);
            }
        }
        LOG.info("Results saved to {}", output);
    }

    // --- tables ---

    private static Table rawData(List<ExtractionRecord> records) {
        final List<List<Object>> rows = new ArrayList<>(records.size());
        for (ExtractionRecord r : records) {
            rows.add(List.of(
                    r.filePath(),
                    r.compositionKindApiVersion(),
                    r.resource().kindApiVersion(),
                    r.resource().kind(),
                    r.resource().apiVersion(),
                    r.resource().category()));
        }
        return new Table(RAW_DATA_SHEET, List.of(
                "File Path",
                "Composition Kind/API Version",
                "Managed Resource (MR) Kind/API Version",
                "Kind",
                "API Version",
                "Category"), rows);
    }

    private static Table statistics(List<AggregatedStatistic> stats) {
        final List<List<Object>> rows = new ArrayList<>(stats.size());
        for (AggregatedStatistic s : stats) {
            rows.add(List.of(
                    s.kindApiVersion(),
                    s.kind(),
                    s.apiVersion(),
                    s.category(),
                    s.totalOccurrences(),
                    s.foundInNFiles(),
                    s.usedByNCompositions()));
        }
        return new Table(STATISTICS_SHEET, List.of(
                "Kind/API Version",
                "Kind",
                "API Version",
                "Category",
                "Total Occurrences",
                "Found in N Files",
                "Used by N Compositions"), rows);
    }

    private static Table fileMapping(List<FileMappingEntry> mapping) {
        final List<List<Object>> rows = new ArrayList<>(mapping.size());
        for (FileMappingEntry m : mapping) {
            rows.add(List.of(
                    m.kindApiVersion(),
                    m.totalFiles(),
                    m.totalOccurrences(),
                    m.fileLocationsText()));
        }
        return new Table(FILE_MAPPING_SHEET, List.of(
                "Kind/API Version",
                "Total Files",
                "Total Occurrences",
                "File Locations"), rows);
    }

    private static Table functions(List<String> functions) {
        final List<List<Object>> rows = new ArrayList<>(functions.size());
        for (String f : functions) {
            rows.add(List.of(f));
        }
        return new Table(FUNCTIONS_SHEET, List.of("Function Reference"), rows);
    }

    // --- sheet writing ---

    private static Sheet writeTable(Workbook workbook, CellStyle headerStyle, Table table) {
        LOG.debug("Formatting sheet: {}", table.name());
        final Sheet sheet = workbook.createSheet(table.name());
        final int[] widths = new int[table.headers().size()];

        final Row header = sheet.createRow(0);
        for (int c = 0; c < table.headers().size(); c++) {
            final String title = table.headers().get(c);
            final Cell cell = header.createCell(c);
            cell.setCellValue(title);
            cell.setCellStyle(headerStyle);
            widths[c] = title.length();
        }

        int rowIndex = 1;
        for (List<Object> values : table.rows()) {
            final Row row = sheet.createRow(rowIndex++);
            for (int c = 0; c < values.size(); c++) {
                final Object value = values.get(c);
                final Cell cell = row.createCell(c);
                if (value instanceof Number number) {
                    cell.setCellValue(number.doubleValue());
                } else {
                    cell.setCellValue(fitCell(String.valueOf(value), table.name()));
                }
                widths[c] = Math.max(widths[c], String.valueOf(value).length());
            }
        }

        for (int c = 0; c < widths.length; c++) {
            sheet.setColumnWidth(c, columnWidth(widths[c]) * 256);
        }
        return sheet;
    }

    private static void wrapFileLocations(Workbook workbook, Sheet sheet) {
        final CellStyle wrap = workbook.createCellStyle();
        wrap.setWrapText(true);
        wrap.setVerticalAlignment(VerticalAlignment.TOP);

        sheet.setColumnWidth(FILE_LOCATIONS_COLUMN, FILE_LOCATIONS_WIDTH * 256);
        sheet.setDefaultColumnStyle(FILE_LOCATIONS_COLUMN, wrap);
        for (int r = 1; r <= sheet.getLastRowNum(); r++) {
            final Row row = sheet.getRow(r);
            final Cell cell = row != null ? row.getCell(FILE_LOCATIONS_COLUMN) : null;
            if (cell != null) {
                cell.setCellStyle(wrap);
            }
        }
    }

    private static CellStyle headerStyle(Workbook workbook) {
        final Font bold = workbook.createFont();
        bold.setBold(true);
        final CellStyle style = workbook.createCellStyle();
        style.setFont(bold);
        return style;
    }

    static int columnWidth(int longestValue) {
        return Math.min(longestValue + COLUMN_PADDING, MAX_COLUMN_WIDTH);
    }

    private static String fitCell(String text, String sheetName) {
        if (text.length() <= MAX_CELL_TEXT) {
            return text;
        }
        LOG.warn("Truncating a {}-character value in sheet '{}' to the cell limit", text.length(), sheetName);
        return text.substring(0, MAX_CELL_TEXT);
    }

    private record Table(String name, List<String> headers, List<List<Object>> rows) {
    }
}
