package pmxt.apigen.model;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * Closed vocabulary of type expressions the generators translate.
 * Exactly one variant describes a given use site; expressions are finite trees.
 */
public sealed interface TypeExpression
        permits TypeExpression.Primitive,
        TypeExpression.ArrayOf,
        TypeExpression.NamedReference,
        TypeExpression.Union,
        TypeExpression.Literal,
        TypeExpression.InlineRecord,
        TypeExpression.FunctionType {

    Primitive STRING = new Primitive(PrimitiveKind.STRING);
    Primitive NUMBER = new Primitive(PrimitiveKind.NUMBER);
    Primitive BOOLEAN = new Primitive(PrimitiveKind.BOOLEAN);
    Primitive VOID = new Primitive(PrimitiveKind.VOID);
    Primitive NULL = new Primitive(PrimitiveKind.NULL);
    Primitive UNDEFINED = new Primitive(PrimitiveKind.UNDEFINED);
    Primitive ANY = new Primitive(PrimitiveKind.ANY);

    static ArrayOf arrayOf(TypeExpression element) {
        return new ArrayOf(element);
    }

    static NamedReference named(String name, TypeExpression... typeArguments) {
        return new NamedReference(name, List.of(typeArguments));
    }

    static Union union(TypeExpression... members) {
        return new Union(List.of(members));
    }

    static Literal literal(Object value) {
        return new Literal(value);
    }

    default boolean isNullish() {
        return this instanceof Primitive p
                && (p.kind() == PrimitiveKind.NULL || p.kind() == PrimitiveKind.UNDEFINED);
    }

    record Primitive(PrimitiveKind kind) implements TypeExpression {
        public Primitive {
            Objects.requireNonNull(kind, "kind");
        }
    }

    // element is null when the item type is unknown
    record ArrayOf(TypeExpression element) implements TypeExpression {
    }

    record NamedReference(String name, List<TypeExpression> typeArguments) implements TypeExpression {
        public NamedReference {
            Objects.requireNonNull(name, "name");
            typeArguments = List.copyOf(typeArguments);
        }

        public TypeExpression typeArgument(int index) {
            return index < typeArguments.size() ? typeArguments.get(index) : null;
        }
    }

    // declaration order is kept
    record Union(List<TypeExpression> members) implements TypeExpression {
        public Union {
            members = List.copyOf(members);
        }
    }

    record Literal(Object value) implements TypeExpression {
        public Literal {
            Objects.requireNonNull(value, "value");
            if (!(value instanceof String) && !(value instanceof Number) && !(value instanceof Boolean)) {
                throw new IllegalArgumentException("unsupported literal: " + value.getClass().getSimpleName());
            }
        }

        public boolean isString() {
            return value instanceof String;
        }
    }

    record InlineRecord(List<FieldDescriptor> fields) implements TypeExpression {
        public InlineRecord {
            fields = List.copyOf(fields);
            final var seen = new HashSet<String>();
            for (FieldDescriptor f : fields) {
                if (!seen.add(f.name())) {
                    throw new IllegalArgumentException("duplicate field in inline record: " + f.name());
                }
            }
        }
    }

    record FunctionType() implements TypeExpression {
    }
}
