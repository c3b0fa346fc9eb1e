package composition.analyzer.model;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One entry of {@code spec.pipeline}.
 */
public record PipelineStep(
        String functionName,  // functionRef.name, N/A when absent
        String inlineTemplate // input.inline.template, null when absent or not text
) {

    public static PipelineStep from(JsonNode step) {
        final JsonNode template = step.path("input").path("inline").path("template");
        return new PipelineStep(
                Keys.textOrNotAvailable(step.path("functionRef").path("name")),
                template.isTextual() ? template.textValue() : null);
    }

    public static List<PipelineStep> listFrom(JsonNode pipeline) {
        if (pipeline == null || !pipeline.isArray()) {
            return List.of();
        }
        final List<PipelineStep> steps = new ArrayList<>(pipeline.size());
        for (JsonNode step : pipeline) {
            steps.add(from(step));
        }
        return steps;
    }

    public boolean hasInlineTemplate() {
        return inlineTemplate != null && !inlineTemplate.isEmpty();
    }
}
