package composition.analyzer.io;

import java.io.IOException;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import composition.analyzer.analysis.AnalysisResult;

import static org.assertj.core.api.Assertions.assertThat;

class JsonReportWriterTest {

    @Test
    void writesAllTablesAndSummary(@TempDir Path tmp) throws IOException {
        final AnalysisResult result = ReportFixtures.result();
        final Path output = tmp.resolve("report.json");

        new JsonReportWriter().write(result, ReportFixtures.report(result), output);

        final JsonNode doc = new ObjectMapper().readTree(output.toFile());
        assertThat(doc.path("schema").asText()).isEqualTo(JsonReportWriter.SCHEMA_VERSION);
        assertThat(doc.path("generatedAt").asText()).isNotBlank();
        assertThat(doc.path("summary").path("records").asInt()).isEqualTo(3);
        assertThat(doc.path("summary").path("managedResources").asInt()).isEqualTo(2);
        assertThat(doc.path("records").size()).isEqualTo(3);
        assertThat(doc.path("records").get(0).path("resource").path("kind").asText()).isEqualTo("Bucket");
        assertThat(doc.path("statistics").get(0).path("totalOccurrences").asInt()).isEqualTo(2);
        assertThat(doc.path("fileMapping").get(0).path("fileLocations").size()).isEqualTo(2);
        assertThat(doc.path("functions").get(1).asText()).isEqualTo("function-patch-and-transform");
    }

    @Test
    void writerIsChosenByExtension() {
        assertThat(ReportWriters.forPath(Path.of("out/report.json"))).isInstanceOf(JsonReportWriter.class);
        assertThat(ReportWriters.forPath(Path.of("out/REPORT.JSON"))).isInstanceOf(JsonReportWriter.class);
        assertThat(ReportWriters.forPath(Path.of("composition_extraction.xlsx"))).isInstanceOf(XlsxReportWriter.class);
    }
}
