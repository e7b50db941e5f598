package pmxt.apigen.translate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import pmxt.apigen.model.TypeExpression;

/**
 * Renders type expressions as Java source type names for the generated client.
 * <p>
 * Only names in the SDK type set survive as themselves; any other reference becomes
 * {@code Object} since the client has no class to bind it to.
 */
public final class JavaTypeRenderer {

    private final Set<String> sdkTypes;

    public JavaTypeRenderer(Set<String> sdkTypes) {
        this.sdkTypes = Set.copyOf(Objects.requireNonNull(sdkTypes, "sdkTypes"));
    }

    public String render(TypeExpression expr) {
        return render(expr, false);
    }

    public String render(TypeExpression expr, boolean boxed) {
        if (expr == null) {
            return "Object";
        }
        if (expr instanceof TypeExpression.Primitive p) {
            switch (p.kind()) {
                case STRING:
                    return "String";
                case NUMBER:
                    return "Number";
                case BOOLEAN:
                    return boxed ? "Boolean" : "boolean";
                case VOID:
                    return "Void";
                default:
                    return "Object";
            }
        }
        if (expr instanceof TypeExpression.ArrayOf a) {
            return "List<" + render(a.element(), true) + ">";
        }
        if (expr instanceof TypeExpression.NamedReference ref) {
            return named(ref, boxed);
        }
        if (expr instanceof TypeExpression.Union u) {
            return union(u);
        }
        if (expr instanceof TypeExpression.Literal lit) {
            return lit.isString() ? "String" : "Object";
        }
        return "Object";
    }

    private String named(TypeExpression.NamedReference ref, boolean boxed) {
        final String name = ref.name();
        if (TypeTranslator.ASYNC_WRAPPERS.contains(name)) {
            return render(ref.typeArgument(0), boxed);
        }
        if (TypeTranslator.MAP_TYPES.contains(name)) {
            return "Map<String, " + render(ref.typeArgument(1), true) + ">";
        }
        if (!sdkTypes.contains(name)) {
            return "Object";
        }
        if (ref.typeArguments().isEmpty()) {
            return name;
        }
        final List<String> args = new ArrayList<>(ref.typeArguments().size());
        for (TypeExpression arg : ref.typeArguments()) {
            args.add(render(arg, true));
        }
        return name + "<" + String.join(", ", args) + ">";
    }

    private String union(TypeExpression.Union u) {
        final List<TypeExpression> usable = new ArrayList<>(u.members().size());
        for (TypeExpression m : u.members()) {
            if (!m.isNullish()) {
                usable.add(m);
            }
        }
        if (usable.size() == 1) {
            // a nullable member always needs the reference type
            return render(usable.get(0), true);
        }
        if (!usable.isEmpty() && usable.stream().allMatch(m -> m instanceof TypeExpression.Literal l && l.isString())) {
            return "String";
        }
        return "Object";
    }
}
