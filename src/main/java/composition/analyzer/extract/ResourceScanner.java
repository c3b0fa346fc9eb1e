package composition.analyzer.extract;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;

import composition.analyzer.model.Keys;
import composition.analyzer.model.ResourceAssociation;

/**
 * Walks a parsed document and collects every {@code apiVersion} in the Crossplane/Upbound domains,
 * paired with the {@code kind} of the same mapping.
 * <p>
 * Uses an explicit work stack instead of recursion. Associations come out in document order
 * (pre-order, keys in declaration order), the same order a recursive walk would give.
 */
public final class ResourceScanner {

    private static final String API_VERSION = "apiVersion";
    private static final String KIND = "kind";

    public List<ResourceAssociation> scan(JsonNode root) {
        return walk(root, true);
    }

    /**
     * Like {@link #scan(JsonNode)} but skips the apiVersion/kind of the root mapping itself,
     * e.g. the header of the Composition being scanned.
     */
    public List<ResourceAssociation> scanNested(JsonNode root) {
        return walk(root, false);
    }

    private List<ResourceAssociation> walk(JsonNode root, boolean includeRoot) {
        final List<ResourceAssociation> found = new ArrayList<>();
        if (root == null) {
            return found;
        }

        // holds JsonNode (to visit) or ResourceAssociation (to emit)
        final Deque<Object> work = new ArrayDeque<>();
        if (includeRoot) {
            work.push(root);
        } else {
            final List<Object> children = new ArrayList<>(root.size());
            root.elements().forEachRemaining(children::add);
            pushInOrder(children, work);
        }

        while (!work.isEmpty()) {
            final Object item = work.pop();
            if (item instanceof ResourceAssociation association) {
                found.add(association);
                continue;
            }
            final JsonNode node = (JsonNode) item;
            switch (node.getNodeType()) {
                case OBJECT -> expandMapping(node, work);
                case ARRAY -> expandSequence(node, work);
                default -> {
                    // scalar leaf
                }
            }
        }
        return found;
    }

    /**
     * Filter and category check for a single apiVersion/kind pair.
     */
    public Optional<ResourceAssociation> associate(String apiVersion, String kind) {
        if (!ApiCategories.isManagedApiVersion(apiVersion)) {
            return Optional.empty();
        }
        final String effectiveKind = kind != null ? kind : Keys.NOT_AVAILABLE;
        return Optional.of(ResourceAssociation.of(effectiveKind, apiVersion, ApiCategories.categoryOf(apiVersion)));
    }

    private void expandMapping(JsonNode mapping, Deque<Object> work) {
        final List<Object> pending = new ArrayList<>(mapping.size() + 1);
        final Iterator<Map.Entry<String, JsonNode>> fields = mapping.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> field = fields.next();
            final JsonNode value = field.getValue();
            if (API_VERSION.equals(field.getKey()) && value.isTextual()) {
                associate(value.textValue(), Keys.textOrNotAvailable(mapping.get(KIND))).ifPresent(pending::add);
            }
            pending.add(value);
        }
        pushInOrder(pending, work);
    }

    private void expandSequence(JsonNode sequence, Deque<Object> work) {
        final List<Object> pending = new ArrayList<>(sequence.size());
        for (JsonNode element : sequence) {
            pending.add(element);
        }
        pushInOrder(pending, work);
    }

    private static void pushInOrder(List<Object> items, Deque<Object> work) {
        for (int i = items.size() - 1; i >= 0; i--) {
            work.push(items.get(i));
        }
    }
}
