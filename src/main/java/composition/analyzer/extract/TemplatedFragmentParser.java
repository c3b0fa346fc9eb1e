package composition.analyzer.extract;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import composition.analyzer.model.TemplateFragment;

/**
 * Pulls apiVersion and kind out of text that looks like YAML but still carries template actions,
 * so it cannot go through a YAML parser. Values stop at whitespace or at an opening brace.
 */
public final class TemplatedFragmentParser {

    private static final Logger LOG = LoggerFactory.getLogger(TemplatedFragmentParser.class);

    private static final Pattern API_VERSION = Pattern.compile("apiVersion:\\s*([^\\s{]+)");
    private static final Pattern KIND = Pattern.compile("kind:\\s*([^\\s{]+)");

    public Optional<TemplateFragment> parse(String content) {
        if (content == null || content.isBlank()) {
            return Optional.empty();
        }
        try {
            final Matcher apiVersion = API_VERSION.matcher(content);
            final Matcher kind = KIND.matcher(content);
            if (apiVersion.find() && kind.find()) {
                return Optional.of(new TemplateFragment(apiVersion.group(1).trim(), kind.group(1).trim()));
            }
            return Optional.empty();
        } catch (RuntimeException ex) {
            LOG.debug("Failed to parse templated YAML: {} | content: {}", ex.getMessage(), safeMsg(content));
            return Optional.empty();
        }
    }

    private static String safeMsg(String msg) {
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
