package composition.analyzer.model;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineStepTest {

    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());

    @Test
    void readsFunctionNameAndInlineTemplate() throws Exception {
        final JsonNode pipeline = yaml.readTree("""
                - step: render
                  functionRef:
                    name: function-go-templating
                  input:
                    inline:
                      template: "apiVersion: v1"
                - step: ready
                - step: odd
                  input:
                    inline:
                      template:
                        nested: true
                """);

        final var steps = PipelineStep.listFrom(pipeline);

        assertThat(steps).containsExactly(
                new PipelineStep("function-go-templating", "apiVersion: v1"),
                new PipelineStep("N/A", null),
                new PipelineStep("N/A", null));
        assertThat(steps.get(0).hasInlineTemplate()).isTrue();
        assertThat(steps.get(1).hasInlineTemplate()).isFalse();
    }

    @Test
    void nonSequencePipelineHasNoSteps() throws Exception {
        assertThat(PipelineStep.listFrom(yaml.readTree("mode: Pipeline")))
                .isEmpty();
        assertThat(PipelineStep.listFrom(null)).isEmpty();
    }

    @Test
    void compositeTypeReferenceDefaultsMissingFields() throws Exception {
        final JsonNode ref = yaml.readTree("kind: XBucket");

        final CompositeTypeReference reference = CompositeTypeReference.from(ref);

        assertThat(reference.key()).isEqualTo("XBucket_N/A");
        assertThat(CompositeTypeReference.from(yaml.readTree("{}").path("missing")).key()).isEqualTo("N/A_N/A");
    }

    @Test
    void functionCatalogIsSortedAndUnique() {
        final FunctionCatalog catalog = new FunctionCatalog();
        catalog.addAll(java.util.List.of("function-b", "function-a", "function-b"));
        catalog.add("N/A");

        assertThat(catalog.sortedNames()).containsExactly("N/A", "function-a", "function-b");
        assertThat(catalog.size()).isEqualTo(3);
        assertThat(catalog.contains("function-a")).isTrue();
    }
}
