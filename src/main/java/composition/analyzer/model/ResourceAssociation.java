package composition.analyzer.model;

import java.util.Objects;

/**
 * One managed resource reference found in a Composition.
 * Equal associations are expected; each one is an occurrence.
 */
public record ResourceAssociation(
        String kindApiVersion, // <kind>_<apiVersion>, or N/A for the placeholder
        String kind,
        String apiVersion,
        String category        // API group label, "other", or "" for the placeholder
) {

    public ResourceAssociation {
        Objects.requireNonNull(kindApiVersion, "kindApiVersion");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(apiVersion, "apiVersion");
        Objects.requireNonNull(category, "category");
    }

    public static ResourceAssociation of(String kind, String apiVersion, String category) {
        return new ResourceAssociation(Keys.kindApiVersion(kind, apiVersion), kind, apiVersion, category);
    }

    /**
     * Stands in for a Composition in which nothing matched, so it still shows up in the raw output.
     */
    public static ResourceAssociation notAvailable() {
        return new ResourceAssociation(Keys.NOT_AVAILABLE, Keys.NOT_AVAILABLE, Keys.NOT_AVAILABLE, "");
    }
}
