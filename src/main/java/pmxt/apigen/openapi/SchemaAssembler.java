package pmxt.apigen.openapi;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import pmxt.apigen.model.MemberDescriptor;
import pmxt.apigen.model.ParameterDescriptor;
import pmxt.apigen.translate.NamedSchemaTable;
import pmxt.apigen.translate.TypeTranslator;

/**
 * Builds the OpenAPI document: one POST operation per member under
 * {@code /api/{exchange}/<member>}, on top of the static template.
 * <p>
 * Arguments travel as a positional {@code args} array; the result sits in the {@code data}
 * field of the shared response envelope.
 */
public final class SchemaAssembler {

    public static final String PATH_PREFIX = "/api/{exchange}/";
    public static final String BASE_RESPONSE = "BaseResponse";
    public static final String CREDENTIALS = "ExchangeCredentials";
    public static final String EXCHANGE_PARAM_REF = "#/components/parameters/ExchangeParam";
    public static final String JSON = "application/json";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final NamedSchemaTable table;
    private final OpenApiTemplate template;

    public SchemaAssembler(NamedSchemaTable table, OpenApiTemplate template) {
        this.table = Objects.requireNonNull(table, "table");
        this.template = Objects.requireNonNull(template, "template");
        checkComponents();
    }

    public static SchemaAssembler withDefaults() {
        return new SchemaAssembler(NamedSchemaTable.DEFAULT, OpenApiTemplate.loadDefault());
    }

    public ObjectNode buildDocument(List<MemberDescriptor> members) {
        final ObjectNode doc = NODES.objectNode();
        doc.set("openapi", template.openapiVersion());
        doc.set("info", template.section("info"));
        doc.set("servers", template.servers());

        final ObjectNode paths = template.section("paths");
        for (MemberDescriptor m : members) {
            paths.set(PATH_PREFIX + m.name(), buildPathItem(m));
        }
        doc.set("paths", paths);

        final ObjectNode templateComponents = template.section("components");
        final ObjectNode components = doc.putObject("components");
        components.set("parameters", templateComponents.path("parameters").deepCopy());
        components.set("schemas", templateComponents.path("schemas").deepCopy());
        return doc;
    }

    public ObjectNode buildPathItem(MemberDescriptor m) {
        final ObjectNode item = NODES.objectNode();
        item.set("post", buildOperation(m));
        return item;
    }

    public ObjectNode buildOperation(MemberDescriptor m) {
        final String summary = m.title();

        final ObjectNode op = NODES.objectNode();
        op.put("summary", summary);
        op.put("operationId", m.name());
        op.putArray("parameters").addObject().put("$ref", EXCHANGE_PARAM_REF);

        op.putObject("requestBody")
                .putObject("content")
                .putObject(JSON)
                .set("schema", requestBodySchema(m));

        final ObjectNode ok = op.putObject("responses").putObject("200");
        ok.put("description", summary + " response");
        ok.putObject("content")
                .putObject(JSON)
                .set("schema", responseSchema(m));

        if (m.documentation() != null) {
            op.put("description", m.documentation());
        }
        return op;
    }

    public ObjectNode requestBodySchema(MemberDescriptor m) {
        final ObjectNode body = NODES.objectNode();
        body.put("type", "object");
        final ObjectNode props = body.putObject("properties");
        props.set("args", argsSchema(m));
        props.putObject("credentials").put("$ref", table.refFor(CREDENTIALS));
        if (m.requiredCount() > 0) {
            body.putArray("required").add("args");
        }
        return body;
    }

    public ObjectNode argsSchema(MemberDescriptor m) {
        final List<ParameterDescriptor> params = m.parameters();
        final int total = params.size();
        final int required = m.requiredCount();

        final ObjectNode args = NODES.objectNode();
        args.put("type", "array");
        if (total == 0) {
            args.put("maxItems", 0);
            return args;
        }
        if (total == 1) {
            args.put("maxItems", 1);
            args.set("items", TypeTranslator.translateOrEmpty(params.get(0).type(), table));
            if (required == 1) {
                args.put("minItems", 1);
            }
            return args;
        }

        final List<ObjectNode> itemSchemas = new ArrayList<>(total);
        for (ParameterDescriptor p : params) {
            itemSchemas.add(TypeTranslator.translateOrEmpty(p.type(), table));
        }
        args.put("minItems", required);
        args.put("maxItems", total);
        final ArrayNode oneOf = args.putObject("items").putArray("oneOf");
        oneOf.addAll(itemSchemas);
        return args;
    }

    public ObjectNode responseSchema(MemberDescriptor m) {
        final ObjectNode envelopeRef = NODES.objectNode();
        envelopeRef.put("$ref", table.refFor(BASE_RESPONSE));

        final Optional<ObjectNode> data = m.returnType() == null
                ? Optional.empty()
                : TypeTranslator.translate(m.returnType(), table);
        if (data.isEmpty()) {
            return envelopeRef;
        }

        final ObjectNode withData = NODES.objectNode();
        withData.put("type", "object");
        withData.putObject("properties").set("data", data.get());

        final ObjectNode response = NODES.objectNode();
        final ArrayNode allOf = response.putArray("allOf");
        allOf.add(envelopeRef);
        allOf.add(withData);
        return response;
    }

    private void checkComponents() {
        final List<String> missing = new ArrayList<>();
        for (String id : table.schemaIds()) {
            if (!template.hasComponentSchema(id)) {
                missing.add(id);
            }
        }
        for (String id : List.of(BASE_RESPONSE, CREDENTIALS)) {
            if (!template.hasComponentSchema(id)) {
                missing.add(id);
            }
        }
        if (!missing.isEmpty()) {
            throw new IllegalStateException("template has no component schema for: " + String.join(", ", missing));
        }
    }
}
