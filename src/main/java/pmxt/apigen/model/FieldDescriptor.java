package pmxt.apigen.model;

import java.util.Objects;

public record FieldDescriptor(
        String name,
        TypeExpression type,
        boolean optional
) {
    public FieldDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }
}
