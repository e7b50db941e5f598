package pmxt.apigen.scan;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.github.javaparser.ast.nodeTypes.NodeWithJavadoc;

/**
 * Recovers the descriptive part of an attached Javadoc comment.
 */
final class DocComments {

    private static final Pattern LEADING_STAR = Pattern.compile("^\\s*\\*\\s?");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private DocComments() {
    }

    static String summaryOf(NodeWithJavadoc<?> node) {
        return node.getJavadocComment()
                .map(c -> summarize(c.getContent()))
                .orElse(null);
    }

    static String summarize(String content) {
        if (content == null) {
            return null;
        }
        final List<String> lines = new ArrayList<>();
        for (String raw : content.split("\\r?\\n", -1)) {
            final String line = LEADING_STAR.matcher(raw).replaceFirst("").stripTrailing();
            if (line.stripLeading().startsWith("@")) {
                break;
            }
            lines.add(line);
        }
        final String joined = WHITESPACE.matcher(String.join(" ", lines)).replaceAll(" ").trim();
        return joined.isEmpty() ? null : joined;
    }
}
