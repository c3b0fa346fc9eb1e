package composition.analyzer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import composition.analyzer.analysis.AnalysisResult;
import composition.analyzer.stats.AggregatedReport;

import static org.assertj.core.api.Assertions.assertThat;

class MainTest {

    private static final String COMPOSITION = """
            apiVersion: apiextensions.crossplane.io/v1
            kind: Composition
            spec:
              compositeTypeRef:
                apiVersion: platform.example.org/v1alpha1
                kind: XBucket
              pipeline:
                - step: patch-and-transform
                  functionRef:
                    name: function-patch-and-transform
                  input:
                    apiVersion: pt.fn.crossplane.io/v1beta1
                    kind: Resources
                    resources:
                      - base:
                          apiVersion: s3.aws.upbound.io/v1beta1
                          kind: Bucket
            """;

    @AfterEach
    void restoreLogLevel() {
        final LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ctx.getLogger("composition.analyzer").setLevel(Level.WARN);
    }

    @Test
    void writesJsonReport(@TempDir Path tmp) throws IOException {
        final Path manifests = Files.createDirectories(tmp.resolve("manifests"));
        Files.writeString(manifests.resolve("bucket.yaml"), COMPOSITION);
        final Path output = tmp.resolve("report.json");

        final int code = Main.run(new String[] {manifests.toString(), "--output", output.toString()});

        assertThat(code).isZero();
        final JsonNode doc = new ObjectMapper().readTree(output.toFile());
        assertThat(doc.path("records").size()).isEqualTo(2);
        assertThat(doc.path("functions").get(0).asText()).isEqualTo("function-patch-and-transform");
    }

    @Test
    void writesSpreadsheetWithShortOutputFlag(@TempDir Path tmp) throws IOException {
        final Path manifests = Files.createDirectories(tmp.resolve("manifests"));
        Files.writeString(manifests.resolve("bucket.yml"), COMPOSITION);
        final Path output = tmp.resolve("reports/out.xlsx");

        final int code = Main.run(new String[] {"-o", output.toString(), manifests.toString()});

        assertThat(code).isZero();
        assertThat(output).isRegularFile();
    }

    @Test
    void verboseSwitchesAnalyzerLoggingToDebug(@TempDir Path tmp) {
        final int code = Main.run(new String[] {tmp.toString(), "-v", "--output=" + tmp.resolve("r.xlsx")});

        assertThat(code).isZero();
        final Logger logger = ((LoggerContext) LoggerFactory.getILoggerFactory()).getLogger("composition.analyzer");
        assertThat(logger.getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void zeroResultsSucceedsWithoutWritingReport(@TempDir Path tmp) throws IOException {
        Files.writeString(tmp.resolve("configmap.yaml"), "apiVersion: v1\nkind: ConfigMap\n");
        final Path output = tmp.resolve("report.xlsx");

        final int code = Main.run(new String[] {tmp.toString(), "--output", output.toString()});

        assertThat(code).isZero();
        assertThat(output).doesNotExist();
    }

    @Test
    void missingRootDirectoryExitsWithTwo(@TempDir Path tmp) {
        assertThat(Main.run(new String[] {tmp.resolve("nope").toString()})).isEqualTo(2);
    }

    @Test
    void usageErrorsExitWithTwo(@TempDir Path tmp) {
        assertThat(Main.run(new String[] {})).isEqualTo(2);
        assertThat(Main.run(new String[] {tmp.toString(), "--bogus"})).isEqualTo(2);
        assertThat(Main.run(new String[] {tmp.toString(), "-o"})).isEqualTo(2);
        assertThat(Main.run(new String[] {tmp.toString(), "second"})).isEqualTo(2);
    }

    @Test
    void summaryLineReportsFailedFiles() {
        final AnalysisResult result = new AnalysisResult(
                List.of(), List.of("function-patch-and-transform"), 5, 3, 2);
        final AggregatedReport report = new AggregatedReport(List.of(), List.of());

        assertThat(Main.summaryLine(result, report))
                .isEqualTo("Files: 5, failed files: 2, compositions: 3, managed resources: 0, functions: 1");
    }

    @Test
    void helpExitsWithZero() {
        assertThat(Main.run(new String[] {"--help"})).isZero();
    }
}
