package composition.analyzer.extract;

import java.util.List;

import composition.analyzer.model.ExtractionRecord;

/**
 * What one document contributed: its records and the function names its pipeline references.
 * Both lists are empty for documents that are not Compositions.
 */
public record CompositionExtraction(List<ExtractionRecord> records, List<String> functionRefs) {

    private static final CompositionExtraction NONE = new CompositionExtraction(List.of(), List.of());

    public CompositionExtraction {
        records = List.copyOf(records);
        functionRefs = List.copyOf(functionRefs);
    }

    public static CompositionExtraction none() {
        return NONE;
    }

    public boolean matched() {
        return !records.isEmpty();
    }
}
