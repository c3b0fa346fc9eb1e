package composition.analyzer.extract;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import composition.analyzer.model.TemplateFragment;

/**
 * Splits an inline template body into candidate resource documents and parses each one.
 * <p>
 * Line scanner with two states, idle and in-document:
 * - comment lines ({@code #...}) are ignored
 * - a line holding {@code apiVersion:} opens a document when {@code kind:} or {@code metadata:}
 *   shows up in it or the two lines after it; an open document is flushed first
 * - a {@code ---} line closes the open document
 * - whatever is buffered at the end is flushed
 * Template actions are never evaluated.
 */
public final class TemplateContentExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(TemplateContentExtractor.class);

    private static final String START_MARKER = "apiVersion:";
    private static final List<String> CONFIRM_MARKERS = List.of("kind:", "metadata:");
    private static final int LOOKAHEAD_LINES = 2;
    private static final String DOCUMENT_SEPARATOR = "---";

    private final TemplatedFragmentParser fragmentParser;

    public TemplateContentExtractor() {
        this(new TemplatedFragmentParser());
    }

    public TemplateContentExtractor(TemplatedFragmentParser fragmentParser) {
        this.fragmentParser = Objects.requireNonNull(fragmentParser, "fragmentParser");
    }

    public List<TemplateFragment> extract(String template) {
        if (template == null || template.isEmpty()) {
            return List.of();
        }
        LOG.debug("Starting template content extraction");

        final String[] lines = template.split("\n", -1);
        final List<TemplateFragment> fragments = new ArrayList<>();
        final List<String> buffer = new ArrayList<>();
        boolean inDocument = false;

        for (int i = 0; i < lines.length; i++) {
            final String line = lines[i];
            final String trimmed = line.trim();
            if (trimmed.startsWith("#")) {
                continue;
            }

            if (opensDocument(lines, i)) {
                if (inDocument && !buffer.isEmpty()) {
                    flush(buffer, fragments);
                }
                buffer.clear();
                inDocument = true;
            }

            if (inDocument) {
                buffer.add(line);
            }

            if (inDocument && DOCUMENT_SEPARATOR.equals(trimmed)) {
                flush(buffer, fragments);
                buffer.clear();
                inDocument = false;
            }
        }

        if (!buffer.isEmpty()) {
            flush(buffer, fragments);
        }

        LOG.debug("Extracted {} YAML documents from template", fragments.size());
        return fragments;
    }

    private static boolean opensDocument(String[] lines, int index) {
        if (!lines[index].contains(START_MARKER)) {
            return false;
        }
        final int end = Math.min(index + 1 + LOOKAHEAD_LINES, lines.length);
        final String window = String.join("\n", Arrays.asList(lines).subList(index, end));
        for (String marker : CONFIRM_MARKERS) {
            if (window.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    private void flush(List<String> buffer, List<TemplateFragment> out) {
        fragmentParser.parse(String.join(" ", buffer)).ifPresent(out::add);
    }
}
