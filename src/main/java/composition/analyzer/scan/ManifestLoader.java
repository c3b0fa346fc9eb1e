package composition.analyzer.scan;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads a multi-document YAML file into trees. Empty documents are dropped.
 * <p>
 * SnakeYAML builds the documents so anchors, aliases and merge keys ({@code <<: *base}) are
 * resolved; Jackson then converts each one into a {@link JsonNode}.
 */
public final class ManifestLoader {

    private final ObjectMapper mapper;

    public ManifestLoader() {
        this(new ObjectMapper());
    }

    public ManifestLoader(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public List<JsonNode> load(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return parse(Files.readString(file, StandardCharsets.UTF_8));
    }

    public List<JsonNode> parse(String content) throws IOException {
        Objects.requireNonNull(content, "content");
        // Yaml instances are not thread-safe; one per call
        final Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        final List<JsonNode> documents = new ArrayList<>();
        try {
            for (Object raw : yaml.loadAll(content)) {
                if (raw == null) {
                    continue;
                }
                final JsonNode document = mapper.valueToTree(raw);
                if (!isEmpty(document)) {
                    documents.add(document);
                }
            }
        } catch (YAMLException ex) {
            throw new IOException("Invalid YAML: " + ex.getMessage(), ex);
        } catch (IllegalArgumentException ex) {
            // valueToTree: content Jackson cannot represent, e.g. a null mapping key
            throw new IOException("Unsupported YAML content: " + ex.getMessage(), ex);
        }
        return documents;
    }

    private static boolean isEmpty(JsonNode document) {
        if (document == null || document.isNull() || document.isMissingNode()) {
            return true;
        }
        if (document.isContainerNode()) {
            return document.isEmpty();
        }
        return document.isTextual() && document.textValue().isEmpty();
    }
}
