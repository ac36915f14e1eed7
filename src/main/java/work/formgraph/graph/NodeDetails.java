package work.formgraph.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import work.formgraph.shared.JsonValues;

/**
 * Kind-specific part of a {@link SchemaNode}. One record per node kind; the kind of a node is the kind of its details.
 *
 * <p>{@link #attributes()} exposes the variant fields under their JSON Schema keyword so that patches can address them
 * generically; {@link #withAttributes(Map)} merges such a patch back into a new record.
 */
public sealed interface NodeDetails permits NodeDetails.StringField, NodeDetails.NumberField,
        NodeDetails.BooleanField, NodeDetails.EnumField, NodeDetails.ObjectField, NodeDetails.ArrayField,
        NodeDetails.ConditionalGroup, NodeDetails.IfBlock, NodeDetails.DefinitionMarker, NodeDetails.Reference {

    NodeKind kind();

    /** Non-null variant fields keyed by keyword, in keyword order. */
    Map<String, Object> attributes();

    /**
     * Returns a copy with the given attributes merged in. A {@code null} value clears the attribute.
     *
     * @throws IllegalArgumentException when an attribute does not belong to this kind or has the wrong shape
     */
    default NodeDetails withAttributes(Map<String, Object> changes) {
        var allowed = attributeNames(kind());
        var merged = new LinkedHashMap<>(attributes());
        for (var entry : changes.entrySet()) {
            if (!allowed.contains(entry.getKey())) {
                throw new IllegalArgumentException(
                    "Attribute '" + entry.getKey() + "' does not apply to " + kind().tag() + " nodes");
            }
            if (entry.getValue() == null) {
                merged.remove(entry.getKey());
            } else {
                merged.put(entry.getKey(), entry.getValue());
            }
        }
        return of(kind(), merged);
    }

    static Set<String> attributeNames(NodeKind kind) {
        return switch (kind) {
            case STRING -> Set.of("minLength", "maxLength", "pattern", "format");
            case NUMBER -> Set.of("minimum", "maximum", "multipleOf", "exclusiveMinimum", "exclusiveMaximum");
            case ENUM -> Set.of("enum", "enumNames");
            case OBJECT -> Set.of("minProperties", "maxProperties", "additionalProperties");
            case ARRAY -> Set.of("minItems", "maxItems", "uniqueItems", "additionalItems");
            case ALL_OF, ANY_OF, ONE_OF -> Set.of("conditions");
            case IF_BLOCK -> Set.of("condition", "thenIds", "elseIds");
            case REF -> Set.of("refTarget", "resolvedNodeId");
            case BOOLEAN, DEFINITION -> Set.of();
        };
    }

    static NodeDetails defaults(NodeKind kind) {
        return of(kind, Map.of());
    }

    /**
     * Builds the details of {@code kind} from keyword attributes. Missing attributes stay unset.
     */
    static NodeDetails of(NodeKind kind, Map<String, Object> attrs) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(attrs, "attrs");
        return switch (kind) {
            case STRING -> new StringField(
                integer(attrs, "minLength"), integer(attrs, "maxLength"),
                text(attrs, "pattern"), text(attrs, "format"));
            case NUMBER -> new NumberField(
                number(attrs, "minimum"), number(attrs, "maximum"), number(attrs, "multipleOf"),
                number(attrs, "exclusiveMinimum"), number(attrs, "exclusiveMaximum"));
            case BOOLEAN -> new BooleanField();
            case ENUM -> new EnumField(choices(attrs, "enum"), strings(attrs, "enumNames"));
            case OBJECT -> new ObjectField(
                integer(attrs, "minProperties"), integer(attrs, "maxProperties"),
                flag(attrs, "additionalProperties"));
            case ARRAY -> new ArrayField(
                integer(attrs, "minItems"), integer(attrs, "maxItems"),
                flag(attrs, "uniqueItems"), flag(attrs, "additionalItems"));
            case ALL_OF -> new ConditionalGroup(Combinator.ALL_OF, conditions(attrs));
            case ANY_OF -> new ConditionalGroup(Combinator.ANY_OF, conditions(attrs));
            case ONE_OF -> new ConditionalGroup(Combinator.ONE_OF, conditions(attrs));
            case IF_BLOCK -> new IfBlock(
                typed(attrs, "condition", Predicate.class),
                strings(attrs, "thenIds"), strings(attrs, "elseIds"));
            case DEFINITION -> new DefinitionMarker();
            case REF -> new Reference(text(attrs, "refTarget"), text(attrs, "resolvedNodeId"));
        };
    }

    record StringField(Integer minLength, Integer maxLength, String pattern, String format) implements NodeDetails {
        public static StringField empty() {
            return new StringField(null, null, null, null);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.STRING;
        }

        @Override
        public Map<String, Object> attributes() {
            return ordered("minLength", minLength, "maxLength", maxLength, "pattern", pattern, "format", format);
        }
    }

    record NumberField(Number minimum, Number maximum, Number multipleOf, Number exclusiveMinimum,
                       Number exclusiveMaximum) implements NodeDetails {
        public static NumberField empty() {
            return new NumberField(null, null, null, null, null);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.NUMBER;
        }

        @Override
        public Map<String, Object> attributes() {
            return ordered("minimum", minimum, "maximum", maximum, "multipleOf", multipleOf,
                "exclusiveMinimum", exclusiveMinimum, "exclusiveMaximum", exclusiveMaximum);
        }
    }

    record BooleanField() implements NodeDetails {
        @Override
        public NodeKind kind() {
            return NodeKind.BOOLEAN;
        }

        @Override
        public Map<String, Object> attributes() {
            return Map.of();
        }
    }

    /**
     * Enumerated choice. {@code values} keep their JSON type (string, number or boolean) as given; {@code labels}
     * ({@code enumNames}) is not checked against their length.
     */
    record EnumField(List<Object> values, List<String> labels) implements NodeDetails {
        public EnumField {
            values = values == null ? List.of() : List.copyOf(JsonValues.asArray(JsonValues.freeze(values)));
            labels = labels == null ? null : List.copyOf(labels);
        }

        public static EnumField of(Object... values) {
            return new EnumField(List.of(values), null);
        }

        /** JSON Schema type shared by every value, {@code string} when they are mixed or absent. */
        public String valueType() {
            if (!values.isEmpty() && values.stream().allMatch(Number.class::isInstance)) {
                return "number";
            }
            if (!values.isEmpty() && values.stream().allMatch(Boolean.class::isInstance)) {
                return "boolean";
            }
            return "string";
        }

        @Override
        public NodeKind kind() {
            return NodeKind.ENUM;
        }

        @Override
        public Map<String, Object> attributes() {
            return ordered("enum", values, "enumNames", labels);
        }
    }

    record ObjectField(Integer minProperties, Integer maxProperties, Boolean additionalProperties)
            implements NodeDetails {
        public static ObjectField empty() {
            return new ObjectField(null, null, null);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.OBJECT;
        }

        @Override
        public Map<String, Object> attributes() {
            return ordered("minProperties", minProperties, "maxProperties", maxProperties,
                "additionalProperties", additionalProperties);
        }
    }

    record ArrayField(Integer minItems, Integer maxItems, Boolean uniqueItems, Boolean additionalItems)
            implements NodeDetails {
        public static ArrayField empty() {
            return new ArrayField(null, null, null, null);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.ARRAY;
        }

        @Override
        public Map<String, Object> attributes() {
            return ordered("minItems", minItems, "maxItems", maxItems, "uniqueItems", uniqueItems,
                "additionalItems", additionalItems);
        }
    }

    /**
     * allOf/anyOf/oneOf node holding an ordered list of conditions. Branch nodes hang off the group by then/else edges.
     */
    record ConditionalGroup(Combinator combinator, List<Condition> conditions) implements NodeDetails {
        public ConditionalGroup {
            Objects.requireNonNull(combinator, "combinator");
            conditions = conditions == null ? List.of() : List.copyOf(conditions);
        }

        public static ConditionalGroup empty(Combinator combinator) {
            return new ConditionalGroup(combinator, List.of());
        }

        public ConditionalGroup withConditions(List<Condition> updated) {
            return new ConditionalGroup(combinator, updated);
        }

        @Override
        public NodeKind kind() {
            return combinator.kind();
        }

        @Override
        public Map<String, Object> attributes() {
            return ordered("conditions", conditions);
        }
    }

    /**
     * Legacy single if/then/else block. Besides then/else edges it may list branch node ids directly.
     */
    record IfBlock(Predicate condition, List<String> thenIds, List<String> elseIds) implements NodeDetails {
        public IfBlock {
            thenIds = thenIds == null ? List.of() : List.copyOf(thenIds);
            elseIds = elseIds == null ? List.of() : List.copyOf(elseIds);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.IF_BLOCK;
        }

        @Override
        public Map<String, Object> attributes() {
            return ordered("condition", condition, "thenIds", thenIds, "elseIds", elseIds);
        }
    }

    record DefinitionMarker() implements NodeDetails {
        @Override
        public NodeKind kind() {
            return NodeKind.DEFINITION;
        }

        @Override
        public Map<String, Object> attributes() {
            return Map.of();
        }
    }

    /**
     * Reference to a named definition. {@code resolvedNodeId} caches the definition node id at creation time.
     */
    record Reference(String refTarget, String resolvedNodeId) implements NodeDetails {
        public Reference withResolvedNodeId(String nodeId) {
            return new Reference(refTarget, nodeId);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.REF;
        }

        @Override
        public Map<String, Object> attributes() {
            return ordered("refTarget", refTarget, "resolvedNodeId", resolvedNodeId);
        }
    }

    private static Map<String, Object> ordered(Object... pairs) {
        var out = new LinkedHashMap<String, Object>();
        for (int i = 0; i < pairs.length; i += 2) {
            if (pairs[i + 1] != null) {
                out.put((String) pairs[i], pairs[i + 1]);
            }
        }
        return Collections.unmodifiableMap(out);
    }

    private static Integer integer(Map<String, Object> attrs, String key) {
        Object raw = attrs.get(key);
        if (raw == null) {
            return null;
        }
        Number parsed = JsonValues.toNumber(raw)
            .orElseThrow(() -> new IllegalArgumentException("Attribute '" + key + "' must be an integer: " + raw));
        double asDouble = parsed.doubleValue();
        if (asDouble != Math.rint(asDouble) || asDouble < Integer.MIN_VALUE || asDouble > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Attribute '" + key + "' must be an integer: " + raw);
        }
        return parsed.intValue();
    }

    private static Number number(Map<String, Object> attrs, String key) {
        Object raw = attrs.get(key);
        if (raw == null) {
            return null;
        }
        return JsonValues.toNumber(raw)
            .orElseThrow(() -> new IllegalArgumentException("Attribute '" + key + "' must be a number: " + raw));
    }

    private static String text(Map<String, Object> attrs, String key) {
        Object raw = attrs.get(key);
        return raw == null ? null : String.valueOf(raw);
    }

    private static Boolean flag(Map<String, Object> attrs, String key) {
        Object raw = attrs.get(key);
        if (raw == null) {
            return null;
        }
        if (raw instanceof Boolean bool) {
            return bool;
        }
        if (raw instanceof String str && ("true".equalsIgnoreCase(str) || "false".equalsIgnoreCase(str))) {
            return Boolean.parseBoolean(str);
        }
        throw new IllegalArgumentException("Attribute '" + key + "' must be a boolean: " + raw);
    }

    private static List<String> strings(Map<String, Object> attrs, String key) {
        Object raw = attrs.get(key);
        if (raw == null) {
            return null;
        }
        if (!(raw instanceof List<?> list)) {
            throw new IllegalArgumentException("Attribute '" + key + "' must be a list: " + raw);
        }
        var out = new ArrayList<String>(list.size());
        for (Object item : list) {
            out.add(String.valueOf(item));
        }
        return out;
    }

    private static List<Object> choices(Map<String, Object> attrs, String key) {
        Object raw = attrs.get(key);
        if (raw == null) {
            return null;
        }
        if (!(raw instanceof List<?> list)) {
            throw new IllegalArgumentException("Attribute '" + key + "' must be a list: " + raw);
        }
        var out = new ArrayList<Object>(list.size());
        for (Object item : list) {
            if (item != null) {
                out.add(item);
            }
        }
        return out;
    }

    private static List<Condition> conditions(Map<String, Object> attrs) {
        Object raw = attrs.get("conditions");
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof List<?> list)) {
            throw new IllegalArgumentException("Attribute 'conditions' must be a list of conditions");
        }
        var out = new ArrayList<Condition>(list.size());
        for (Object item : list) {
            if (!(item instanceof Condition condition)) {
                throw new IllegalArgumentException("Attribute 'conditions' must be a list of conditions");
            }
            out.add(condition);
        }
        return out;
    }

    private static <T> T typed(Map<String, Object> attrs, String key, Class<T> type) {
        Object raw = attrs.get(key);
        if (raw == null) {
            return null;
        }
        if (!type.isInstance(raw)) {
            throw new IllegalArgumentException(
                "Attribute '" + key + "' must be a " + type.getSimpleName() + ": " + raw);
        }
        return type.cast(raw);
    }
}
