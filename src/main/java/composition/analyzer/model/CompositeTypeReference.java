package composition.analyzer.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * {@code spec.compositeTypeRef} of a Composition. Missing fields read as N/A.
 */
public record CompositeTypeReference(String kind, String apiVersion) {

    public static CompositeTypeReference from(JsonNode compositeTypeRef) {
        return new CompositeTypeReference(
                Keys.textOrNotAvailable(compositeTypeRef.path("kind")),
                Keys.textOrNotAvailable(compositeTypeRef.path("apiVersion")));
    }

    public String key() {
        return Keys.kindApiVersion(kind, apiVersion);
    }
}
