package pmxt.apigen.client;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import pmxt.apigen.GenerationException;
import pmxt.apigen.model.MemberDescriptor;
import pmxt.apigen.model.ParameterDescriptor;
import pmxt.apigen.translate.JavaTypeRenderer;

/**
 * Renders the generated part of the Java client: an abstract class with one method per
 * mapped member, delegating transport to {@code invoke} and decoding to abstract converters.
 * <p>
 * Every member is checked against the table before anything is rendered, so an unmapped
 * member never yields a partial class.
 */
public final class ClientMethodAssembler {

    public static final String CLASS_NAME = "GeneratedExchangeMethods";
    public static final String DEFAULT_PACKAGE = "pmxt.client";

    private static final String INDENT = "    ";
    private static final String BODY = INDENT + INDENT;

    private final ClientMethodTable table;
    private final JavaTypeRenderer types;
    private final String packageName;

    public ClientMethodAssembler(ClientMethodTable table, String packageName) {
        this.table = Objects.requireNonNull(table, "table");
        this.packageName = Objects.requireNonNull(packageName, "packageName");
        this.types = new JavaTypeRenderer(table.sdkTypes());
    }

    public static ClientMethodAssembler withDefaults() {
        return new ClientMethodAssembler(ClientMethodTable.DEFAULT, DEFAULT_PACKAGE);
    }

    public ClientArtifact assemble(List<MemberDescriptor> members) {
        final List<String> unmapped = new ArrayList<>();
        final List<MemberDescriptor> rendered = new ArrayList<>();
        for (MemberDescriptor m : members) {
            if (table.isSkipped(m.name())) {
                continue;
            }
            if (table.specFor(m.name()).isEmpty()) {
                unmapped.add(m.name());
                continue;
            }
            rendered.add(m);
        }
        if (!unmapped.isEmpty()) {
            throw new UnmappedMemberException(unmapped);
        }

        final Map<String, String> converters = converterTargets(rendered);

        final StringBuilder methods = new StringBuilder();
        final List<String> names = new ArrayList<>(rendered.size());
        for (MemberDescriptor m : rendered) {
            renderMember(methods, m, table.specFor(m.name()).get());
            names.add(m.name());
        }

        final String source = header() + methods + footer(converters);
        return new ClientArtifact(packageName, CLASS_NAME, source, names);
    }

    // converter name to produced type, in first-use order
    private Map<String, String> converterTargets(List<MemberDescriptor> rendered) {
        final Map<String, String> out = new LinkedHashMap<>();
        for (MemberDescriptor m : rendered) {
            final ClientMethodSpec spec = table.specFor(m.name()).get();
            if (!spec.pattern().hasConverter()) {
                continue;
            }
            final String target = spec.pattern().converterTarget(spec.returnLabel());
            final String previous = out.putIfAbsent(spec.converter(), target);
            if (previous != null && !previous.equals(target)) {
                throw new GenerationException("converter " + spec.converter() + " used for both "
                        + previous + " and " + target + " (member " + m.name() + ")");
            }
        }
        return out;
    }

    private String header() {
        final StringBuilder sb = new StringBuilder();
        if (!packageName.isEmpty()) {
            sb.append("package ").append(packageName).append(";\n\n");
        }
        sb.append("""
                import java.util.ArrayList;
                import java.util.Iterator;
                import java.util.LinkedHashMap;
                import java.util.List;
                import java.util.Map;

                import javax.annotation.processing.Generated;

                import com.fasterxml.jackson.databind.JsonNode;

                /**
                 * Exchange methods generated from the canonical exchange declaration.
                 * Do not edit; regenerate instead. Extend this class and supply the transport and converters.
                 */
                @Generated("pmxt.apigen.client.ClientMethodAssembler")
                public abstract class GeneratedExchangeMethods {

                    /**
                     * Sends one call to the sidecar and returns the {@code data} field of the response.
                     */
                    protected abstract JsonNode invoke(String method, List<Object> args);
                """);
        return sb.toString();
    }

    private static String footer(Map<String, String> converters) {
        final StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> e : converters.entrySet()) {
            sb.append('\n')
                    .append(INDENT).append("protected abstract ").append(e.getValue()).append(' ')
                    .append(e.getKey()).append("(JsonNode node);\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    private void renderMember(StringBuilder sb, MemberDescriptor m, ClientMethodSpec spec) {
        final List<ParameterDescriptor> params = m.parameters();
        final String returnType = spec.returnLabel();

        // full arity
        sb.append('\n');
        appendJavadoc(sb, m.documentation());
        appendSignature(sb, returnType, m.name(), params, params.size());
        renderBody(sb, m, spec);
        sb.append(INDENT).append("}\n");

        // trailing omittable parameters, dropped one at a time
        for (int arity = params.size() - 1; arity >= 0 && params.get(arity).omittable(); arity--) {
            sb.append('\n');
            appendJavadoc(sb, m.documentation());
            appendSignature(sb, returnType, m.name(), params, arity);
            final List<String> callArgs = new ArrayList<>(params.size());
            for (int i = 0; i < params.size(); i++) {
                final ParameterDescriptor p = params.get(i);
                if (i < arity) {
                    callArgs.add(p.name());
                } else {
                    callArgs.add(p.hasDefault() ? p.defaultValue() : "null");
                }
            }
            sb.append(BODY);
            if (spec.pattern() != ResponsePattern.VOID) {
                sb.append("return ");
            }
            sb.append(m.name()).append('(').append(String.join(", ", callArgs)).append(");\n");
            sb.append(INDENT).append("}\n");
        }
    }

    private void appendSignature(StringBuilder sb, String returnType, String name,
                                 List<ParameterDescriptor> params, int arity) {
        final List<String> decl = new ArrayList<>(arity);
        for (int i = 0; i < arity; i++) {
            final ParameterDescriptor p = params.get(i);
            decl.add(types.render(p.type(), p.optional()) + " " + p.name());
        }
        sb.append(INDENT).append("public ").append(returnType).append(' ').append(name)
                .append('(').append(String.join(", ", decl)).append(") {\n");
    }

    private static void renderBody(StringBuilder sb, MemberDescriptor m, ClientMethodSpec spec) {
        sb.append(BODY).append("List<Object> callArgs = new ArrayList<>();\n");
        for (ParameterDescriptor p : m.parameters()) {
            if (p.optional()) {
                sb.append(BODY).append("if (").append(p.name()).append(" != null) {\n")
                        .append(BODY).append(INDENT).append("callArgs.add(").append(p.name()).append(");\n")
                        .append(BODY).append("}\n");
            } else {
                sb.append(BODY).append("callArgs.add(").append(p.name()).append(");\n");
            }
        }

        final String call = "invoke(\"" + m.name() + "\", callArgs)";
        if (spec.pattern() == ResponsePattern.VOID) {
            sb.append(BODY).append(call).append(";\n");
            return;
        }
        sb.append(BODY).append("JsonNode response = ").append(call).append(";\n");

        final String target = spec.pattern().converterTarget(spec.returnLabel());
        final String convert = spec.converter();
        switch (spec.pattern()) {
            case SINGLE:
                sb.append(BODY).append("return ").append(convert).append("(response);\n");
                break;
            case ARRAY:
                appendListLoop(sb, target, convert, "response");
                sb.append(BODY).append("return result;\n");
                break;
            case RECORD:
                sb.append(BODY).append("Map<String, ").append(target).append("> result = new LinkedHashMap<>();\n")
                        .append(BODY).append("Iterator<Map.Entry<String, JsonNode>> fields = response.fields();\n")
                        .append(BODY).append("while (fields.hasNext()) {\n")
                        .append(BODY).append(INDENT).append("Map.Entry<String, JsonNode> entry = fields.next();\n")
                        .append(BODY).append(INDENT).append("result.put(entry.getKey(), ")
                        .append(convert).append("(entry.getValue()));\n")
                        .append(BODY).append("}\n")
                        .append(BODY).append("return result;\n");
                break;
            case PAGINATED:
                appendListLoop(sb, target, convert, "response.path(\"data\")");
                sb.append(BODY).append("return new ").append(ResponsePattern.rawName(spec.returnLabel()))
                        .append("<>(result, response.path(\"total\").numberValue(), response.path(\"nextCursor\").asText(null));\n");
                break;
            default:
                throw new GenerationException("unsupported response pattern " + spec.pattern() + " for " + m.name());
        }
    }

    private static void appendListLoop(StringBuilder sb, String target, String convert, String source) {
        sb.append(BODY).append("List<").append(target).append("> result = new ArrayList<>();\n")
                .append(BODY).append("for (JsonNode item : ").append(source).append(") {\n")
                .append(BODY).append(INDENT).append("result.add(").append(convert).append("(item));\n")
                .append(BODY).append("}\n");
    }

    private static void appendJavadoc(StringBuilder sb, String documentation) {
        if (documentation == null) {
            return;
        }
        sb.append(INDENT).append("/**\n")
                .append(INDENT).append(" * ").append(documentation.replace("*/", "*&#47;")).append('\n')
                .append(INDENT).append(" */\n");
    }
}
