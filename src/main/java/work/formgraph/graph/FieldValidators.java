package work.formgraph.graph;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import work.formgraph.shared.Keys;

/**
 * Per-field sanity checks surfaced as warnings by {@link GraphValidator}.
 */
public final class FieldValidators {
    private FieldValidators() {}

    public static List<String> validate(SchemaGraph graph, SchemaNode node) {
        var problems = new ArrayList<String>();
        String label = label(node);
        boolean root = SchemaGraph.ROOT_ID.equals(node.id());

        if (node.title() == null || node.title().isBlank()) {
            problems.add(label + ": title is required");
        }
        if (!root && (node.key() == null || node.key().isBlank())) {
            problems.add(label + ": key is required");
        } else if (!root && !Keys.isIdentifier(node.key())) {
            problems.add(label + ": key must start with a letter or underscore and contain only letters, digits "
                + "and underscores");
        }

        NodeDetails details = node.details();
        if (details instanceof NodeDetails.StringField text) {
            if (text.minLength() != null && text.maxLength() != null && text.minLength() > text.maxLength()) {
                problems.add(label + ": minLength must not exceed maxLength");
            }
            if (text.pattern() != null) {
                try {
                    Pattern.compile(text.pattern());
                } catch (PatternSyntaxException e) {
                    problems.add(label + ": invalid pattern (" + e.getDescription() + ")");
                }
            }
        } else if (details instanceof NodeDetails.NumberField number) {
            if (number.minimum() != null && number.maximum() != null
                    && number.minimum().doubleValue() > number.maximum().doubleValue()) {
                problems.add(label + ": minimum must not exceed maximum");
            }
        } else if (details instanceof NodeDetails.ArrayField) {
            if (graph.outgoing(node.id(), EdgeType.CHILD).size() > 1) {
                problems.add(label + ": an array holds a single item definition");
            }
        } else if (details instanceof NodeDetails.EnumField choice) {
            if (choice.values().isEmpty()) {
                problems.add(label + ": enum needs at least one value");
            } else if (new HashSet<>(choice.values()).size() != choice.values().size()) {
                problems.add(label + ": enum values must be unique");
            }
        }
        return problems;
    }

    static String label(SchemaNode node) {
        return node.key() == null || node.key().isBlank() ? node.id() : node.key() + " (" + node.id() + ")";
    }
}
