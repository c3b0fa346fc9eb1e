package composition.analyzer.model;

/**
 * The apiVersion/kind pair recovered from a templated resource document.
 */
public record TemplateFragment(String apiVersion, String kind) {
}
