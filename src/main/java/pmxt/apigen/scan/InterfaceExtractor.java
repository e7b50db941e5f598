package pmxt.apigen.scan;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;

import pmxt.apigen.model.MemberDescriptor;
import pmxt.apigen.model.Names;
import pmxt.apigen.model.ParameterDescriptor;
import pmxt.apigen.model.TypeExpression;
import pmxt.apigen.model.Visibility;

/**
 * Reads the canonical declaration and yields its generated surface, in declaration order.
 * <p>
 * Only methods declared directly in top-level types are members. Nested declarations are
 * indexed so that their enums, records and sealed interfaces can be expanded in signatures,
 * but their own methods are never extracted.
 */
public final class InterfaceExtractor {

    private final JavaParser parser;

    public InterfaceExtractor() {
        this.parser = new JavaParser(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
    }

    public List<MemberDescriptor> extractMembers(Path declaration, MemberFilter filter) throws IOException {
        Objects.requireNonNull(declaration, "declaration");
        final String source = Files.readString(declaration, StandardCharsets.UTF_8);
        return extractMembers(source, declaration.toString(), filter);
    }

    public List<MemberDescriptor> extractMembers(String source, String origin, MemberFilter filter) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(filter, "filter");

        final CompilationUnit cu = parse(source, origin);
        final TypeExpressionReader reader = new TypeExpressionReader(DeclarationIndex.of(cu));

        final List<MemberDescriptor> members = new ArrayList<>();
        final Set<String> seen = new HashSet<>();

        for (TypeDeclaration<?> td : cu.getTypes()) {
            for (BodyDeclaration<?> bd : td.getMembers()) {
                if (!(bd instanceof MethodDeclaration md)) {
                    continue;
                }
                final String name = md.getNameAsString();
                if (!Names.isJavaIdentifier(name)) {
                    continue;
                }
                final MemberDescriptor member = describe(md, reader);
                if (!filter.test(member)) {
                    continue;
                }
                if (!seen.add(name)) {
                    throw new DeclarationException("overloaded member '" + name + "' in " + origin
                            + ": generated operation names must be unique");
                }
                members.add(member);
            }
        }
        return List.copyOf(members);
    }

    private CompilationUnit parse(String source, String origin) {
        final ParseResult<CompilationUnit> res = parser.parse(source);
        if (!res.isSuccessful() || res.getResult().isEmpty()) {
            final String msg = res.getProblems().isEmpty()
                    ? "no compilation unit"
                    : Names.safeMsg(res.getProblems().get(0).getVerboseMessage());
            throw new DeclarationException("cannot parse declaration " + origin + " -> " + msg);
        }
        return res.getResult().get();
    }

    private static MemberDescriptor describe(MethodDeclaration md, TypeExpressionReader reader) {
        final List<ParameterDescriptor> params = new ArrayList<>(md.getParameters().size());
        for (Parameter p : md.getParameters()) {
            params.add(describeParameter(p, reader));
        }

        TypeExpression returnType = null;
        if (!md.getType().isVoidType()) {
            returnType = reader.read(md.getType());
            if (Annotations.has(md, Annotations.NULLABLE)) {
                returnType = TypeExpression.union(returnType, TypeExpression.NULL);
            }
        }

        return new MemberDescriptor(
                md.getNameAsString(),
                params,
                returnType,
                DocComments.summaryOf(md),
                visibility(md),
                md.isAbstract()
        );
    }

    private static ParameterDescriptor describeParameter(Parameter p, TypeExpressionReader reader) {
        final var read = reader.readParameter(p);
        final var defaultLiteral = Annotations.find(p, Annotations.DEFAULT).flatMap(Annotations::value);
        if (defaultLiteral.isPresent()) {
            return new ParameterDescriptor(p.getNameAsString(), read.type(), false, true, defaultLiteral.get());
        }
        return new ParameterDescriptor(p.getNameAsString(), read.type(), read.optional(), false, null);
    }

    private static Visibility visibility(MethodDeclaration md) {
        if (md.isPublic()) {
            return Visibility.PUBLIC;
        }
        if (md.isProtected()) {
            return Visibility.PROTECTED;
        }
        if (md.isPrivate()) {
            return Visibility.PRIVATE;
        }
        return Visibility.PACKAGE;
    }
}
