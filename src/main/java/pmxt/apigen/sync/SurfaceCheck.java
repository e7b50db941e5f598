package pmxt.apigen.sync;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;

import pmxt.apigen.GenerationException;
import pmxt.apigen.model.MemberDescriptor;

/**
 * Compares the declared member set with what the two artifacts actually expose.
 * <p>
 * The schema must carry exactly one operation per member plus the health check; the client
 * must implement every member that is not skipped, once at full arity, and nothing skipped.
 */
public final class SurfaceCheck {

    public static final String HEALTH_OPERATION = "healthCheck";

    private final Set<String> skipped;
    private final JavaParser parser;

    public SurfaceCheck(Set<String> skipped) {
        this.skipped = Set.copyOf(Objects.requireNonNull(skipped, "skipped"));
        this.parser = new JavaParser(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
    }

    public Report check(List<MemberDescriptor> members, JsonNode schemaDocument, String clientSource) {
        final Set<String> declared = new TreeSet<>();
        for (MemberDescriptor m : members) {
            declared.add(m.name());
        }

        final Set<String> operations = operationIds(schemaDocument);
        operations.remove(HEALTH_OPERATION);

        final Map<String, Integer> fullArity = fullArityMethods(clientSource, members);
        final Set<String> clientSurface = new TreeSet<>(fullArity.keySet());
        // skip-list entries only count for members this declaration actually has
        for (String name : skipped) {
            if (declared.contains(name)) {
                clientSurface.add(name);
            }
        }

        final List<String> problems = new ArrayList<>();
        diff(problems, "schema", declared, operations);
        diff(problems, "client", declared, clientSurface);

        for (String name : new TreeSet<>(fullArity.keySet())) {
            if (skipped.contains(name)) {
                problems.add("client renders skipped member " + name);
            }
            if (fullArity.get(name) > 1) {
                problems.add("client renders " + name + " " + fullArity.get(name) + " times at full arity");
            }
        }
        return new Report(declared, operations, clientSurface, problems);
    }

    private static void diff(List<String> problems, String artifact, Set<String> declared, Set<String> exposed) {
        for (String name : declared) {
            if (!exposed.contains(name)) {
                problems.add(artifact + " is missing member " + name);
            }
        }
        for (String name : exposed) {
            if (!declared.contains(name)) {
                problems.add(artifact + " exposes undeclared member " + name);
            }
        }
    }

    static Set<String> operationIds(JsonNode doc) {
        final Set<String> ids = new TreeSet<>();
        final Iterator<JsonNode> pathItems = doc.path("paths").elements();
        while (pathItems.hasNext()) {
            final Iterator<JsonNode> ops = pathItems.next().elements();
            while (ops.hasNext()) {
                final JsonNode id = ops.next().get("operationId");
                if (id != null && id.isTextual()) {
                    ids.add(id.asText());
                }
            }
        }
        return ids;
    }

    // public methods by name; a name matching no member counts at any arity
    private Map<String, Integer> fullArityMethods(String clientSource, List<MemberDescriptor> members) {
        final Map<String, Integer> totals = new HashMap<>();
        for (MemberDescriptor m : members) {
            totals.put(m.name(), m.totalCount());
        }

        final ParseResult<CompilationUnit> res = parser.parse(clientSource);
        if (!res.isSuccessful() || res.getResult().isEmpty()) {
            throw new GenerationException("client source does not parse: "
                    + (res.getProblems().isEmpty() ? "no compilation unit" : res.getProblems().get(0).getMessage()));
        }

        final Map<String, Integer> counts = new HashMap<>();
        for (TypeDeclaration<?> td : res.getResult().get().getTypes()) {
            for (MethodDeclaration md : td.getMethods()) {
                if (!md.isPublic()) {
                    continue;
                }
                final String name = md.getNameAsString();
                final Integer total = totals.get(name);
                if (total != null && total != md.getParameters().size()) {
                    continue;
                }
                counts.merge(name, 1, Integer::sum);
            }
        }
        return counts;
    }

    public record Report(Set<String> declared, Set<String> operations, Set<String> clientSurface, List<String> problems) {

        public Report {
            declared = Set.copyOf(declared);
            operations = Set.copyOf(operations);
            clientSurface = Set.copyOf(clientSurface);
            problems = List.copyOf(problems);
        }

        public boolean inSync() {
            return problems.isEmpty();
        }
    }
}
