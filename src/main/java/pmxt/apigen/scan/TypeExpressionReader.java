package pmxt.apigen.scan;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.EnumConstantDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.PrimitiveType;
import com.github.javaparser.ast.type.Type;

import pmxt.apigen.model.FieldDescriptor;
import pmxt.apigen.model.TypeExpression;

/**
 * Reads JavaParser types into {@link TypeExpression}s.
 * <p>
 * Nested enums, records, sealed interfaces and functional interfaces of the declaration are
 * expanded in place; every other class type stays a named reference.
 */
public final class TypeExpressionReader {

    private static final Set<String> STRING_TYPES = Set.of("String", "CharSequence", "Character");

    private static final Set<String> NUMBER_TYPES = Set.of(
            "Byte", "Short", "Integer", "Long", "Float", "Double",
            "Number", "BigDecimal", "BigInteger");

    private static final Set<String> ARRAY_TYPES = Set.of(
            "List", "Set", "Collection", "Iterable", "Queue", "Deque", "SortedSet", "NavigableSet");

    private static final Set<String> OPTIONAL_NUMBER_TYPES = Set.of("OptionalInt", "OptionalLong", "OptionalDouble");

    private static final Set<String> FUNCTION_TYPES = Set.of(
            "Function", "BiFunction", "Consumer", "BiConsumer", "Supplier", "Predicate", "BiPredicate",
            "UnaryOperator", "BinaryOperator", "Runnable", "Callable");

    private final DeclarationIndex index;
    private final Deque<String> expanding = new ArrayDeque<>();

    public TypeExpressionReader(DeclarationIndex index) {
        this.index = Objects.requireNonNull(index, "index");
    }

    public TypeExpression read(Type type) {
        final TypeExpression bare = readBare(type);
        if (Annotations.has(type.getAnnotations(), Annotations.NULLABLE)) {
            return TypeExpression.union(bare, TypeExpression.NULL);
        }
        return bare;
    }

    public ReadParameter readParameter(Parameter p) {
        final Type type = p.getType();
        boolean optional = Annotations.has(p, Annotations.NULLABLE);
        TypeExpression expr;

        final var unwrapped = unwrapOptional(type);
        if (unwrapped != null) {
            optional = true;
            expr = unwrapped;
        } else {
            expr = read(type);
        }
        if (p.isVarArgs()) {
            expr = TypeExpression.arrayOf(expr);
        }
        return new ReadParameter(expr, optional);
    }

    private TypeExpression unwrapOptional(Type type) {
        if (!type.isClassOrInterfaceType()) {
            return null;
        }
        final ClassOrInterfaceType cit = type.asClassOrInterfaceType();
        final String name = cit.getNameAsString();
        if (OPTIONAL_NUMBER_TYPES.contains(name)) {
            return TypeExpression.NUMBER;
        }
        if (!"Optional".equals(name)) {
            return null;
        }
        final List<Type> args = typeArguments(cit);
        return args.isEmpty() ? TypeExpression.ANY : read(args.get(0));
    }

    private TypeExpression readBare(Type type) {
        if (type.isPrimitiveType()) {
            final PrimitiveType.Primitive p = type.asPrimitiveType().getType();
            if (p == PrimitiveType.Primitive.BOOLEAN) {
                return TypeExpression.BOOLEAN;
            }
            if (p == PrimitiveType.Primitive.CHAR) {
                return TypeExpression.STRING;
            }
            return TypeExpression.NUMBER;
        }
        if (type.isVoidType()) {
            return TypeExpression.VOID;
        }
        if (type.isArrayType()) {
            return TypeExpression.arrayOf(read(type.asArrayType().getComponentType()));
        }
        if (type.isWildcardType()) {
            return type.asWildcardType().getExtendedType()
                    .map(this::read)
                    .orElse(TypeExpression.ANY);
        }
        if (type.isClassOrInterfaceType()) {
            return readClassType(type.asClassOrInterfaceType());
        }
        // var, intersection types and anything the vocabulary has no word for
        return TypeExpression.ANY;
    }

    private TypeExpression readClassType(ClassOrInterfaceType cit) {
        final String name = cit.getNameAsString();
        final List<Type> args = typeArguments(cit);

        if (STRING_TYPES.contains(name)) {
            return TypeExpression.STRING;
        }
        if (NUMBER_TYPES.contains(name)) {
            return TypeExpression.NUMBER;
        }
        switch (name) {
            case "Boolean":
                return TypeExpression.BOOLEAN;
            case "Void":
                return TypeExpression.VOID;
            case "Object":
                return TypeExpression.ANY;
            case "Optional":
                return TypeExpression.union(
                        args.isEmpty() ? TypeExpression.ANY : read(args.get(0)),
                        TypeExpression.UNDEFINED);
            default:
                break;
        }
        if (OPTIONAL_NUMBER_TYPES.contains(name)) {
            return TypeExpression.union(TypeExpression.NUMBER, TypeExpression.UNDEFINED);
        }
        if (ARRAY_TYPES.contains(name)) {
            return TypeExpression.arrayOf(args.isEmpty() ? null : read(args.get(0)));
        }
        if (FUNCTION_TYPES.contains(name)) {
            return new TypeExpression.FunctionType();
        }

        final var declared = index.lookup(name);
        if (declared.isPresent() && !expanding.contains(name)) {
            expanding.push(name);
            try {
                final TypeExpression expanded = expand(declared.get());
                if (expanded != null) {
                    return expanded;
                }
            } finally {
                expanding.pop();
            }
        }

        final List<TypeExpression> typeArgs = new ArrayList<>(args.size());
        for (Type arg : args) {
            typeArgs.add(read(arg));
        }
        return new TypeExpression.NamedReference(name, typeArgs);
    }

    private TypeExpression expand(TypeDeclaration<?> td) {
        if (td instanceof EnumDeclaration ed) {
            final List<TypeExpression> literals = new ArrayList<>(ed.getEntries().size());
            for (EnumConstantDeclaration entry : ed.getEntries()) {
                final String wire = Annotations.find(entry, Annotations.JSON_PROPERTY)
                        .flatMap(Annotations::value)
                        .orElse(entry.getNameAsString());
                literals.add(TypeExpression.literal(wire));
            }
            return new TypeExpression.Union(literals);
        }
        if (td instanceof RecordDeclaration rd) {
            final List<FieldDescriptor> fields = new ArrayList<>(rd.getParameters().size());
            for (Parameter component : rd.getParameters()) {
                final ReadParameter rp = readParameter(component);
                fields.add(new FieldDescriptor(component.getNameAsString(), rp.type(), rp.optional()));
            }
            return new TypeExpression.InlineRecord(fields);
        }
        if (td instanceof ClassOrInterfaceDeclaration cid && cid.isInterface()) {
            if (Annotations.has(cid, Annotations.FUNCTIONAL_INTERFACE)) {
                return new TypeExpression.FunctionType();
            }
            final NodeList<ClassOrInterfaceType> permitted = cid.getPermittedTypes();
            if (!permitted.isEmpty()) {
                final List<TypeExpression> members = new ArrayList<>(permitted.size());
                for (ClassOrInterfaceType t : permitted) {
                    members.add(readClassType(t));
                }
                return new TypeExpression.Union(members);
            }
        }
        return null;
    }

    private static List<Type> typeArguments(ClassOrInterfaceType cit) {
        return cit.getTypeArguments()
                .<List<Type>>map(ArrayList::new)
                .orElseGet(List::of);
    }

    public record ReadParameter(TypeExpression type, boolean optional) {
    }
}
