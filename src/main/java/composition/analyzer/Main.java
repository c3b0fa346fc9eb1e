package composition.analyzer;

import java.nio.file.Path;
import java.nio.file.Paths;

import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;

import composition.analyzer.analysis.AnalysisResult;
import composition.analyzer.analysis.CompositionAnalyzer;
import composition.analyzer.io.ReportWriters;
import composition.analyzer.stats.AggregatedReport;
import composition.analyzer.stats.Aggregator;

public final class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    private static final String BASE_LOGGER = "composition.analyzer";

    public static void main(String[] args) {
        final int code = run(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args) {
        Path root = null;
        Path output = AnalyzerOptions.DEFAULT_OUTPUT;
        boolean verbose = false;

        try {
            for (int i = 0; i < args.length; i++) {
                final String arg = args[i];
                if ("--help".equals(arg) || "-h".equals(arg)) {
                    printUsage();
                    return 0;
                }
                if ("--verbose".equals(arg) || "-v".equals(arg)) {
                    verbose = true;
                    continue;
                }
                if (arg.startsWith("--output=")) {
                    output = Paths.get(arg.substring("--output=".length()));
                    continue;
                }
                if ("--output".equals(arg) || "-o".equals(arg)) {
                    if (i + 1 >= args.length) {
                        System.err.println("ERROR: " + arg + " requires a path");
                        printUsage();
                        return 2;
                    }
                    output = Paths.get(args[++i]);
                    continue;
                }
                if (arg.startsWith("-")) {
                    System.err.println("ERROR: unknown argument: " + arg);
                    printUsage();
                    return 2;
                }
                if (root == null) {
                    root = Paths.get(arg);
                    continue;
                }
                System.err.println("ERROR: unexpected argument: " + arg);
                printUsage();
                return 2;
            }

            if (root == null) {
                System.err.println("ERROR: missing root path");
                printUsage();
                return 2;
            }

            final AnalyzerOptions options = new AnalyzerOptions(root, output, verbose);
            if (options.verbose()) {
                enableVerboseLogging();
            }
            return analyze(options);
        } catch (java.io.IOException ex) {
            LOG.error("Error during extraction: {}", ex.getMessage());
            System.err.println("ERROR: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (Exception ex) {
            LOG.error("Error during extraction", ex);
            System.err.println("ERROR: extraction failed: "
                    + ex.getClass().getSimpleName() + ": " + safeMsg(ex.getMessage()));
            return 1;
        }
    }

    private static int analyze(AnalyzerOptions options) throws java.io.IOException {
        LOG.info("Starting Composition extraction...");
        System.out.println("Extracting Compositions from " + options.root() + "...");

        final AnalysisResult result = new CompositionAnalyzer(options.root()).analyze();
        if (result.failedFiles() > 0) {
            System.err.println("WARN: files skipped after errors: " + result.failedFiles()
                    + " (see composition_extraction.log)");
        }

        if (!result.hasRecords()) {
            LOG.warn("No Composition entries found");
            LOG.warn("No data extracted. Skipping report export.");
            System.out.println("No Composition entries found");
            return 0;
        }

        LOG.info("Extracted {} entries", result.records().size());
        System.out.println("Extracted " + result.records().size() + " entries");

        final AggregatedReport report = new Aggregator().aggregate(result.records());
        ReportWriters.forPath(options.output()).write(result, report, options.output());

        System.out.println("Results saved to " + options.output());
        System.out.println(summaryLine(result, report));
        return 0;
    }

    static String summaryLine(AnalysisResult result, AggregatedReport report) {
        return "Files: " + result.filesScanned()
                + ", failed files: " + result.failedFiles()
                + ", compositions: " + result.compositions()
                + ", managed resources: " + report.statistics().size()
                + ", functions: " + result.functions().size();
    }

    private static void enableVerboseLogging() {
        final ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (factory instanceof LoggerContext ctx) {
            ctx.getLogger(BASE_LOGGER).setLevel(Level.DEBUG);
        }
    }

    private static void printUsage() {
        System.out.println("Usage: composition-analyzer <rootPath> [options]");
        System.out.println("Options:");
        System.out.println("  -o, --output <path>     Report file, .xlsx or .json (default: composition_extraction.xlsx)");
        System.out.println("  -v, --verbose           Debug logging in composition_extraction.log");
        System.out.println("  -h, --help              Show this help");
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
