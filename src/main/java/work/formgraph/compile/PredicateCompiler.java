package work.formgraph.compile;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;
import work.formgraph.graph.Combinator;
import work.formgraph.graph.Operator;
import work.formgraph.graph.Predicate;
import work.formgraph.shared.JsonValues;

/**
 * Translates {@link Predicate}s into JSON Schema {@code if} clauses and back.
 *
 * <p>Every clause has the shape {@code {properties: {field: fragment}, required: [field]}}.
 */
public final class PredicateCompiler {
    private static final Logger LOG = Logger.getLogger(PredicateCompiler.class.getName());

    private PredicateCompiler() {}

    public static Map<String, Object> compile(Predicate predicate) {
        var properties = new LinkedHashMap<String, Object>();
        properties.put(predicate.field(), fragment(predicate));
        var clause = new LinkedHashMap<String, Object>();
        clause.put("properties", properties);
        clause.put("required", new ArrayList<Object>(List.of(predicate.field())));
        return clause;
    }

    /**
     * Combines several predicates into one {@code if}: a single predicate is used as is, several are wrapped in
     * {@code {<combinator>: [...]}}.
     */
    public static Map<String, Object> combine(Combinator combinator, List<Predicate> predicates) {
        if (predicates.size() == 1) {
            return compile(predicates.get(0));
        }
        var clauses = new ArrayList<Object>(predicates.size());
        for (Predicate predicate : predicates) {
            clauses.add(compile(predicate));
        }
        var combined = new LinkedHashMap<String, Object>();
        combined.put(combinator.keyword(), clauses);
        return combined;
    }

    static Map<String, Object> fragment(Predicate predicate) {
        Object value = predicate.value();
        var out = new LinkedHashMap<String, Object>();
        switch (predicate.operator()) {
            case EQUALS -> out.put("const", JsonValues.deepCopy(value));
            case NOT_EQUALS -> {
                var inner = new LinkedHashMap<String, Object>();
                inner.put("const", JsonValues.deepCopy(value));
                out.put("not", inner);
            }
            case GREATER_THAN -> numeric(out, "exclusiveMinimum", predicate);
            case LESS_THAN -> numeric(out, "exclusiveMaximum", predicate);
            case GREATER_EQUAL -> numeric(out, "minimum", predicate);
            case LESS_EQUAL -> numeric(out, "maximum", predicate);
            case CONTAINS -> pattern(out, ".*" + text(value) + ".*");
            case STARTS_WITH -> pattern(out, "^" + text(value) + ".*");
            case ENDS_WITH -> pattern(out, ".*" + text(value) + "$");
            case EMPTY -> out.put("oneOf", new ArrayList<Object>(List.of(
                object("type", "string", "maxLength", 0),
                object("type", "null"))));
            case NOT_EMPTY -> out.put("allOf", new ArrayList<Object>(List.of(
                object("type", "string"),
                object("minLength", 1))));
        }
        return out;
    }

    /**
     * Recovers the predicate from a clause produced by {@link #compile(Predicate)}.
     */
    public static Optional<Predicate> decompile(Map<String, Object> clause) {
        Map<String, Object> properties = JsonValues.objectAt(clause, "properties");
        if (properties == null || properties.size() != 1) {
            return Optional.empty();
        }
        var entry = properties.entrySet().iterator().next();
        Map<String, Object> fragment = JsonValues.asObject(entry.getValue());
        if (fragment == null) {
            return Optional.empty();
        }
        return operatorOf(fragment).map(found -> new Predicate(entry.getKey(), found.operator(), found.value()));
    }

    /**
     * Recovers predicates from an {@code if} that is either a single clause or a combinator over clauses.
     */
    public static Optional<PredicateSet> decompileCombined(Map<String, Object> ifSchema) {
        if (ifSchema == null) {
            return Optional.empty();
        }
        if (ifSchema.containsKey("properties")) {
            return decompile(ifSchema).map(predicate -> new PredicateSet(null, List.of(predicate)));
        }
        for (Combinator combinator : Combinator.values()) {
            List<Object> entries = JsonValues.arrayAt(ifSchema, combinator.keyword());
            if (entries == null || entries.isEmpty() || ifSchema.size() != 1) {
                continue;
            }
            var predicates = new ArrayList<Predicate>(entries.size());
            for (Object entry : entries) {
                Optional<Predicate> predicate = decompile(JsonValues.asObject(entry));
                if (predicate.isEmpty()) {
                    return Optional.empty();
                }
                predicates.add(predicate.get());
            }
            return Optional.of(new PredicateSet(combinator, predicates));
        }
        return Optional.empty();
    }

    /**
     * Predicates recovered from one {@code if}. {@code combinator} is null for a single bare clause.
     */
    public record PredicateSet(Combinator combinator, List<Predicate> predicates) {
        public PredicateSet {
            predicates = List.copyOf(predicates);
        }
    }

    private record Found(Operator operator, Object value) {}

    private static Optional<Found> operatorOf(Map<String, Object> fragment) {
        if (fragment.containsKey("const")) {
            return Optional.of(new Found(Operator.EQUALS, fragment.get("const")));
        }
        Map<String, Object> not = JsonValues.objectAt(fragment, "not");
        if (not != null && not.containsKey("const")) {
            return Optional.of(new Found(Operator.NOT_EQUALS, not.get("const")));
        }
        List<Object> single = JsonValues.arrayAt(fragment, "enum");
        if (single != null && single.size() == 1) {
            return Optional.of(new Found(Operator.EQUALS, single.get(0)));
        }
        if (fragment.containsKey("exclusiveMinimum")) {
            return Optional.of(new Found(Operator.GREATER_THAN, fragment.get("exclusiveMinimum")));
        }
        if (fragment.containsKey("exclusiveMaximum")) {
            return Optional.of(new Found(Operator.LESS_THAN, fragment.get("exclusiveMaximum")));
        }
        if (fragment.containsKey("minimum")) {
            return Optional.of(new Found(Operator.GREATER_EQUAL, fragment.get("minimum")));
        }
        if (fragment.containsKey("maximum")) {
            return Optional.of(new Found(Operator.LESS_EQUAL, fragment.get("maximum")));
        }
        String pattern = JsonValues.stringAt(fragment, "pattern");
        if (pattern != null) {
            if (pattern.startsWith("^") && pattern.endsWith(".*")) {
                return Optional.of(new Found(Operator.STARTS_WITH, pattern.substring(1, pattern.length() - 2)));
            }
            if (pattern.startsWith(".*") && pattern.endsWith("$") && pattern.length() >= 3) {
                return Optional.of(new Found(Operator.ENDS_WITH, pattern.substring(2, pattern.length() - 1)));
            }
            if (pattern.startsWith(".*") && pattern.endsWith(".*") && pattern.length() >= 4) {
                return Optional.of(new Found(Operator.CONTAINS, pattern.substring(2, pattern.length() - 2)));
            }
            return Optional.empty();
        }
        if (fragment.containsKey("oneOf") && isEmptyCheck(JsonValues.arrayAt(fragment, "oneOf"))) {
            return Optional.of(new Found(Operator.EMPTY, null));
        }
        if (fragment.containsKey("allOf") && isNotEmptyCheck(JsonValues.arrayAt(fragment, "allOf"))) {
            return Optional.of(new Found(Operator.NOT_EMPTY, null));
        }
        return Optional.empty();
    }

    private static boolean isEmptyCheck(List<Object> alternatives) {
        if (alternatives == null || alternatives.size() != 2) {
            return false;
        }
        Map<String, Object> first = JsonValues.asObject(alternatives.get(0));
        Map<String, Object> second = JsonValues.asObject(alternatives.get(1));
        return first != null && second != null
            && "string".equals(first.get("type")) && Integer.valueOf(0).equals(JsonValues.integerAt(first, "maxLength"))
            && "null".equals(second.get("type"));
    }

    private static boolean isNotEmptyCheck(List<Object> parts) {
        if (parts == null || parts.size() != 2) {
            return false;
        }
        Map<String, Object> first = JsonValues.asObject(parts.get(0));
        Map<String, Object> second = JsonValues.asObject(parts.get(1));
        return first != null && second != null
            && "string".equals(first.get("type")) && Integer.valueOf(1).equals(JsonValues.integerAt(second, "minLength"));
    }

    private static void numeric(Map<String, Object> out, String keyword, Predicate predicate) {
        out.put("type", "number");
        out.put(keyword, JsonValues.toNumber(predicate.value()).orElseGet(() -> {
            LOG.warning(() -> "Non-numeric value '" + predicate.value() + "' for " + predicate.operator().wireName()
                + " on field " + predicate.field() + "; using 0");
            return 0;
        }));
    }

    private static void pattern(Map<String, Object> out, String regex) {
        out.put("type", "string");
        out.put("pattern", regex);
    }

    private static String text(Object value) {
        return value == null ? "" : String.valueOf(value);
    }

    private static Map<String, Object> object(Object... pairs) {
        var out = new LinkedHashMap<String, Object>();
        for (int i = 0; i < pairs.length; i += 2) {
            out.put((String) pairs[i], pairs[i + 1]);
        }
        return out;
    }
}
