package composition.analyzer.model;

import java.util.Objects;

/**
 * One raw output row: a resource association tied to its file and Composition.
 */
public record ExtractionRecord(
        String filePath,
        String compositionKindApiVersion, // <compositeTypeRef.kind>_<compositeTypeRef.apiVersion>
        ResourceAssociation resource
) {

    public ExtractionRecord {
        Objects.requireNonNull(filePath, "filePath");
        Objects.requireNonNull(compositionKindApiVersion, "compositionKindApiVersion");
        Objects.requireNonNull(resource, "resource");
    }
}
