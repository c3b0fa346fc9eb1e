package composition.analyzer.model;

import java.util.List;

/**
 * Row of the File Mapping table.
 */
public record FileMappingEntry(
        String kindApiVersion,
        int totalFiles,
        int totalOccurrences,
        List<String> fileLocations // "path (N occurrences)", highest count first
) {

    public FileMappingEntry {
        fileLocations = List.copyOf(fileLocations);
    }

    public String fileLocationsText() {
        return String.join("\n", fileLocations);
    }
}
