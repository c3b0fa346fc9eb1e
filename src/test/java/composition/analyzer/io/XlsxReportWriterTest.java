package composition.analyzer.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import composition.analyzer.analysis.AnalysisResult;

import static org.assertj.core.api.Assertions.assertThat;

class XlsxReportWriterTest {

    private final XlsxReportWriter writer = new XlsxReportWriter();

    @Test
    void writesFourSheetsWithHeadersAndRows(@TempDir Path tmp) throws IOException {
        final AnalysisResult result = ReportFixtures.result();
        final Path output = tmp.resolve("out/report.xlsx");

        writer.write(result, ReportFixtures.report(result), output);

        try (InputStream in = Files.newInputStream(output); Workbook workbook = new XSSFWorkbook(in)) {
            assertThat(workbook.getNumberOfSheets()).isEqualTo(4);
            assertThat(workbook.getSheetName(0)).isEqualTo(XlsxReportWriter.RAW_DATA_SHEET);
            assertThat(workbook.getSheetName(1)).isEqualTo(XlsxReportWriter.STATISTICS_SHEET);
            assertThat(workbook.getSheetName(2)).isEqualTo(XlsxReportWriter.FILE_MAPPING_SHEET);
            assertThat(workbook.getSheetName(3)).isEqualTo(XlsxReportWriter.FUNCTIONS_SHEET);

            final Sheet raw = workbook.getSheet(XlsxReportWriter.RAW_DATA_SHEET);
            assertThat(raw.getLastRowNum()).isEqualTo(3);
            assertThat(raw.getRow(0).getCell(0).getStringCellValue()).isEqualTo("File Path");
            assertThat(raw.getRow(1).getCell(2).getStringCellValue())
                    .isEqualTo("Bucket_s3.aws.upbound.io/v1beta1");
            assertThat(raw.getRow(1).getCell(5).getStringCellValue()).isEqualTo("aws");

            final Sheet stats = workbook.getSheet(XlsxReportWriter.STATISTICS_SHEET);
            final Row top = stats.getRow(1);
            assertThat(top.getCell(1).getStringCellValue()).isEqualTo("Bucket");
            assertThat(top.getCell(4).getNumericCellValue()).isEqualTo(2.0);
            assertThat(top.getCell(5).getNumericCellValue()).isEqualTo(2.0);
            assertThat(top.getCell(6).getNumericCellValue()).isEqualTo(2.0);

            final Sheet functions = workbook.getSheet(XlsxReportWriter.FUNCTIONS_SHEET);
            assertThat(functions.getRow(1).getCell(0).getStringCellValue()).isEqualTo("function-auto-ready");
            assertThat(functions.getRow(2).getCell(0).getStringCellValue())
                    .isEqualTo("function-patch-and-transform");
        }
    }

    @Test
    void fileLocationsWrapAndColumnsAreSizedToContent(@TempDir Path tmp) throws IOException {
        final AnalysisResult result = ReportFixtures.result();
        final Path output = tmp.resolve("report.xlsx");

        writer.write(result, ReportFixtures.report(result), output);

        try (InputStream in = Files.newInputStream(output); Workbook workbook = new XSSFWorkbook(in)) {
            final Sheet mapping = workbook.getSheet(XlsxReportWriter.FILE_MAPPING_SHEET);
            final Cell locations = mapping.getRow(1).getCell(3);
            assertThat(locations.getStringCellValue())
                    .isEqualTo("manifests/a.yaml (1 occurrences)\nmanifests/b.yaml (1 occurrences)");
            assertThat(locations.getCellStyle().getWrapText()).isTrue();
            assertThat(mapping.getColumnWidth(3)).isEqualTo(XlsxReportWriter.FILE_LOCATIONS_WIDTH * 256);

            final Sheet functions = workbook.getSheet(XlsxReportWriter.FUNCTIONS_SHEET);
            assertThat(functions.getColumnWidth(0)).isEqualTo(("function-patch-and-transform".length() + 2) * 256);
        }
    }

    @Test
    void columnWidthIsCapped() {
        assertThat(XlsxReportWriter.columnWidth(10)).isEqualTo(12);
        assertThat(XlsxReportWriter.columnWidth(500)).isEqualTo(XlsxReportWriter.MAX_COLUMN_WIDTH);
    }
}
