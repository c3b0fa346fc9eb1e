package composition.analyzer.model;

import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;

public final class Keys {

    public static final String NOT_AVAILABLE = "N/A";

    private Keys() {
    }

    /**
     * Composite key used across the report: {@code <kind>_<apiVersion>}.
     */
    public static String kindApiVersion(String kind, String apiVersion) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(apiVersion, "apiVersion");
        return kind + "_" + apiVersion;
    }

    /**
     * Text of a scalar node, or {@link #NOT_AVAILABLE} when the node is missing or null.
     * Containers are rendered as JSON so they still produce a stable key.
     */
    public static String textOrNotAvailable(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return NOT_AVAILABLE;
        }
        return node.isValueNode() ? node.asText() : node.toString();
    }
}
