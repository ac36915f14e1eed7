package work.formgraph.graph;

import java.util.Locale;
import java.util.Optional;

/**
 * Type tag of a {@link SchemaNode}. The tag string is the name used in patches and in editor documents.
 */
public enum NodeKind {
    STRING("string"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    ENUM("enum"),
    OBJECT("object"),
    ARRAY("array"),
    ALL_OF("allOf"),
    ANY_OF("anyOf"),
    ONE_OF("oneOf"),
    IF_BLOCK("if_block"),
    DEFINITION("definition"),
    REF("ref");

    private final String tag;

    NodeKind(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public boolean isConditionalGroup() {
        return this == ALL_OF || this == ANY_OF || this == ONE_OF;
    }

    /** Kinds allowed as the source of then/else edges. */
    public boolean isBranchSource() {
        return isConditionalGroup() || this == IF_BLOCK;
    }

    /** Kinds whose child edges compile into {@code properties}. */
    public boolean isObjectLike() {
        return this == OBJECT || this == DEFINITION;
    }

    public static Optional<NodeKind> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        String trimmed = tag.trim();
        for (NodeKind kind : values()) {
            if (kind.tag.equals(trimmed) || kind.name().equals(trimmed.toUpperCase(Locale.ROOT))) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
