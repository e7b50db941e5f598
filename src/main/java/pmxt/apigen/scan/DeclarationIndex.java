package pmxt.apigen.scan;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.TypeDeclaration;

/**
 * Nested type declarations of the canonical file, by simple name.
 * A simple name declared more than once is ambiguous and does not resolve.
 */
public final class DeclarationIndex {

    private final Map<String, TypeDeclaration<?>> bySimpleName = new HashMap<>();
    private final Set<String> ambiguous = new HashSet<>();

    public static DeclarationIndex of(CompilationUnit cu) {
        final DeclarationIndex index = new DeclarationIndex();
        for (TypeDeclaration<?> td : cu.findAll(TypeDeclaration.class)) {
            if (!td.isTopLevelType()) {
                index.register(td);
            }
        }
        return index;
    }

    private void register(TypeDeclaration<?> td) {
        final String simple = td.getNameAsString();
        if (ambiguous.contains(simple)) {
            return;
        }
        if (bySimpleName.putIfAbsent(simple, td) != null) {
            bySimpleName.remove(simple);
            ambiguous.add(simple);
        }
    }

    public Optional<TypeDeclaration<?>> lookup(String simpleName) {
        if (simpleName == null || simpleName.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(bySimpleName.get(simpleName));
    }
}
