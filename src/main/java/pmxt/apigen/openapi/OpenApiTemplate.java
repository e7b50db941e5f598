package pmxt.apigen.openapi;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

/**
 * The hand-maintained part of the schema document: info, servers, the health check path,
 * the exchange path parameter and every component schema.
 */
public final class OpenApiTemplate {

    public static final String DEFAULT_RESOURCE = "openapi-template.yaml";

    private final ObjectNode root;

    private OpenApiTemplate(ObjectNode root) {
        this.root = root;
    }

    public static OpenApiTemplate loadDefault() {
        final ClassLoader cl = OpenApiTemplate.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("template resource not on classpath: " + DEFAULT_RESOURCE);
            }
            return read(in);
        } catch (IOException ex) {
            throw new UncheckedIOException("cannot read template " + DEFAULT_RESOURCE, ex);
        }
    }

    public static OpenApiTemplate read(InputStream in) throws IOException {
        Objects.requireNonNull(in, "in");
        final JsonNode tree = new YAMLMapper().readTree(in);
        if (tree == null || !tree.isObject()) {
            throw new IOException("template is not a YAML mapping");
        }
        return of((ObjectNode) tree);
    }

    public static OpenApiTemplate of(ObjectNode root) {
        Objects.requireNonNull(root, "root");
        for (String required : new String[]{"openapi", "info", "components"}) {
            if (!root.has(required)) {
                throw new IllegalArgumentException("template is missing '" + required + "'");
            }
        }
        return new OpenApiTemplate(root.deepCopy());
    }

    public ObjectNode section(String name) {
        final JsonNode node = root.get(name);
        if (node instanceof ObjectNode obj) {
            return obj.deepCopy();
        }
        return root.objectNode();
    }

    public JsonNode openapiVersion() {
        return root.get("openapi").deepCopy();
    }

    public JsonNode servers() {
        final JsonNode node = root.get("servers");
        return node == null ? root.arrayNode() : node.deepCopy();
    }

    public boolean hasComponentSchema(String schemaId) {
        return root.path("components").path("schemas").has(schemaId);
    }
}
