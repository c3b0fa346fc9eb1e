package composition.analyzer.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;

import composition.analyzer.model.CompositeTypeReference;
import composition.analyzer.model.ExtractionRecord;
import composition.analyzer.model.PipelineStep;
import composition.analyzer.model.ResourceAssociation;
import composition.analyzer.model.TemplateFragment;

/**
 * Turns one parsed document into extraction records when it is a Composition.
 * <p>
 * Associations come from two places, in this order: a scan of everything below the
 * Composition header, then the inline templates of the pipeline steps. Nothing is deduplicated;
 * a resource found by both counts twice. A Composition with no associations yields a single N/A record.
 */
public final class CompositionExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(CompositionExtractor.class);

    public static final String COMPOSITION_API_VERSION = "apiextensions.crossplane.io/v1";
    public static final String COMPOSITION_KIND = "Composition";

    private final ResourceScanner scanner;
    private final TemplateContentExtractor templateExtractor;

    public CompositionExtractor() {
        this(new ResourceScanner(), new TemplateContentExtractor());
    }

    public CompositionExtractor(ResourceScanner scanner, TemplateContentExtractor templateExtractor) {
        this.scanner = Objects.requireNonNull(scanner, "scanner");
        this.templateExtractor = Objects.requireNonNull(templateExtractor, "templateExtractor");
    }

    public static boolean isComposition(JsonNode document) {
        if (document == null) {
            return false;
        }
        return COMPOSITION_API_VERSION.equals(document.path("apiVersion").textValue())
                && COMPOSITION_KIND.equals(document.path("kind").textValue());
    }

    public CompositionExtraction extract(JsonNode document, String filePath) {
        Objects.requireNonNull(filePath, "filePath");
        LOG.debug("Extracting composition details from {}", filePath);

        if (!isComposition(document)) {
            LOG.debug("Document is not a Composition, skipping");
            return CompositionExtraction.none();
        }

        final JsonNode spec = document.path("spec");
        final CompositeTypeReference compositeRef = CompositeTypeReference.from(spec.path("compositeTypeRef"));
        final List<PipelineStep> steps = PipelineStep.listFrom(spec.path("pipeline"));

        final List<String> functionRefs = new ArrayList<>(steps.size());
        for (PipelineStep step : steps) {
            functionRefs.add(step.functionName());
        }

        final List<ResourceAssociation> associations = new ArrayList<>(scanner.scanNested(document));
        for (PipelineStep step : steps) {
            if (!step.hasInlineTemplate()) {
                continue;
            }
            for (TemplateFragment fragment : templateExtractor.extract(step.inlineTemplate())) {
                scanner.associate(fragment.apiVersion(), fragment.kind()).ifPresent(associations::add);
            }
        }

        if (associations.isEmpty()) {
            associations.add(ResourceAssociation.notAvailable());
        }

        final String compositeKey = compositeRef.key();
        final List<ExtractionRecord> records = new ArrayList<>(associations.size());
        for (ResourceAssociation association : associations) {
            records.add(new ExtractionRecord(filePath, compositeKey, association));
        }

        LOG.debug("Found {} special resources", associations.size());
        LOG.debug("Function references found: {}", functionRefs);
        return new CompositionExtraction(records, functionRefs);
    }
}
