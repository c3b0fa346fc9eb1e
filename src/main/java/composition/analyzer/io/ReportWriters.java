package composition.analyzer.io;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

public final class ReportWriters {

    private ReportWriters() {
    }

    /**
     * {@code .json} gets the JSON writer, anything else the spreadsheet writer.
     */
    public static ReportWriter forPath(Path output) {
        Objects.requireNonNull(output, "output");
        final String name = output.getFileName() != null
                ? output.getFileName().toString().toLowerCase(Locale.ROOT)
                : "";
        return name.endsWith(".json") ? new JsonReportWriter() : new XlsxReportWriter();
    }
}
