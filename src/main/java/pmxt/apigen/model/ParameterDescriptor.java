package pmxt.apigen.model;

import java.util.Objects;

/**
 * One parameter of a canonical member.
 * <p>
 * defaultValue is the literal source text of the default (e.g. {@code false}),
 * present iff hasDefault.
 */
public record ParameterDescriptor(
        String name,
        TypeExpression type,
        boolean optional,
        boolean hasDefault,
        String defaultValue
) {
    public ParameterDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        if (hasDefault && defaultValue == null) {
            throw new IllegalArgumentException("parameter '" + name + "' has a default but no literal");
        }
        if (!hasDefault && defaultValue != null) {
            throw new IllegalArgumentException("parameter '" + name + "' has a literal but no default");
        }
    }

    public static ParameterDescriptor required(String name, TypeExpression type) {
        return new ParameterDescriptor(name, type, false, false, null);
    }

    public static ParameterDescriptor optional(String name, TypeExpression type) {
        return new ParameterDescriptor(name, type, true, false, null);
    }

    public static ParameterDescriptor withDefault(String name, TypeExpression type, String literal) {
        return new ParameterDescriptor(name, type, false, true, literal);
    }

    public boolean required() {
        return !optional && !hasDefault;
    }

    public boolean omittable() {
        return optional || hasDefault;
    }
}
