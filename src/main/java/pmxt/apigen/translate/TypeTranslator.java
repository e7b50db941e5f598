package pmxt.apigen.translate;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import pmxt.apigen.model.FieldDescriptor;
import pmxt.apigen.model.TypeExpression;

/**
 * Translates type expressions into OpenAPI schema nodes.
 * <p>
 * Pure and deterministic: the same expression and table always give an equal tree with the
 * same key order. Never throws; anything without a better rendition becomes {@code {type: object}}.
 * An empty result means the type has no value on the wire (void, null, undefined).
 */
public final class TypeTranslator {

    public static final Set<String> ASYNC_WRAPPERS = Set.of("Promise", "CompletableFuture", "CompletionStage", "Future");

    public static final Set<String> MAP_TYPES = Set.of("Record", "Map");

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private TypeTranslator() {
    }

    public static Optional<ObjectNode> translate(TypeExpression expr, NamedSchemaTable table) {
        if (expr == null) {
            return Optional.of(NODES.objectNode());
        }
        if (expr instanceof TypeExpression.Primitive p) {
            return primitive(p);
        }
        if (expr instanceof TypeExpression.ArrayOf a) {
            return Optional.of(arrayOf(a.element(), table));
        }
        if (expr instanceof TypeExpression.NamedReference ref) {
            return named(ref, table);
        }
        if (expr instanceof TypeExpression.Union u) {
            return union(u, table);
        }
        if (expr instanceof TypeExpression.Literal lit) {
            return Optional.of(literal(lit));
        }
        if (expr instanceof TypeExpression.InlineRecord rec) {
            return Optional.of(inlineRecord(rec, table));
        }
        // function types cannot cross a serialized boundary
        return Optional.of(openObject());
    }

    public static ObjectNode translateOrEmpty(TypeExpression expr, NamedSchemaTable table) {
        return translate(expr, table).orElseGet(NODES::objectNode);
    }

    private static Optional<ObjectNode> primitive(TypeExpression.Primitive p) {
        switch (p.kind()) {
            case STRING:
                return Optional.of(scalar("string"));
            case NUMBER:
                return Optional.of(scalar("number"));
            case BOOLEAN:
                return Optional.of(scalar("boolean"));
            case VOID:
            case NULL:
            case UNDEFINED:
                return Optional.empty();
            default:
                return Optional.of(openObject());
        }
    }

    private static ObjectNode arrayOf(TypeExpression element, NamedSchemaTable table) {
        final ObjectNode node = scalar("array");
        node.set("items", translateOrEmpty(element, table));
        return node;
    }

    private static Optional<ObjectNode> named(TypeExpression.NamedReference ref, NamedSchemaTable table) {
        final String name = ref.name();
        if (ASYNC_WRAPPERS.contains(name)) {
            final TypeExpression inner = ref.typeArgument(0);
            return inner == null ? Optional.empty() : translate(inner, table);
        }
        if (MAP_TYPES.contains(name)) {
            final ObjectNode node = scalar("object");
            node.set("additionalProperties", translateOrEmpty(ref.typeArgument(1), table));
            return Optional.of(node);
        }
        final Optional<String> schemaId = table.schemaIdFor(name);
        if (schemaId.isPresent()) {
            final ObjectNode node = NODES.objectNode();
            node.put("$ref", table.refFor(schemaId.get()));
            return Optional.of(node);
        }
        return Optional.of(openObject());
    }

    private static Optional<ObjectNode> union(TypeExpression.Union u, NamedSchemaTable table) {
        final List<TypeExpression> usable = new ArrayList<>(u.members().size());
        for (TypeExpression m : u.members()) {
            if (!m.isNullish()) {
                usable.add(m);
            }
        }
        if (usable.isEmpty()) {
            return Optional.empty();
        }
        if (allStringLiterals(usable)) {
            final ObjectNode node = scalar("string");
            final ArrayNode values = node.putArray("enum");
            for (TypeExpression m : usable) {
                values.add((String) ((TypeExpression.Literal) m).value());
            }
            return Optional.of(node);
        }
        if (usable.size() == 1) {
            return translate(usable.get(0), table);
        }

        final List<ObjectNode> schemas = new ArrayList<>(usable.size());
        for (TypeExpression m : usable) {
            translate(m, table).ifPresent(schemas::add);
        }
        if (schemas.isEmpty()) {
            return Optional.empty();
        }
        if (schemas.size() == 1) {
            return Optional.of(schemas.get(0));
        }
        final ObjectNode node = NODES.objectNode();
        node.putArray("oneOf").addAll(schemas);
        return Optional.of(node);
    }

    private static boolean allStringLiterals(List<TypeExpression> members) {
        for (TypeExpression m : members) {
            if (!(m instanceof TypeExpression.Literal lit) || !lit.isString()) {
                return false;
            }
        }
        return true;
    }

    private static ObjectNode literal(TypeExpression.Literal lit) {
        if (lit.value() instanceof String s) {
            final ObjectNode node = scalar("string");
            node.putArray("enum").add(s);
            return node;
        }
        if (lit.value() instanceof Boolean) {
            return scalar("boolean");
        }
        return scalar("number");
    }

    private static ObjectNode inlineRecord(TypeExpression.InlineRecord rec, NamedSchemaTable table) {
        final ObjectNode node = scalar("object");
        final ObjectNode properties = node.putObject("properties");
        final List<String> required = new ArrayList<>();
        for (FieldDescriptor f : rec.fields()) {
            final Optional<ObjectNode> schema = translate(f.type(), table);
            if (schema.isEmpty()) {
                continue;
            }
            properties.set(f.name(), schema.get());
            if (!f.optional()) {
                required.add(f.name());
            }
        }
        if (!required.isEmpty()) {
            final ArrayNode req = node.putArray("required");
            required.forEach(req::add);
        }
        return node;
    }

    private static ObjectNode scalar(String type) {
        final ObjectNode node = NODES.objectNode();
        node.put("type", type);
        return node;
    }

    private static ObjectNode openObject() {
        return scalar("object");
    }
}
