package pmxt.apigen.scan;

import java.util.Optional;

import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MemberValuePair;
import com.github.javaparser.ast.expr.NormalAnnotationExpr;
import com.github.javaparser.ast.expr.SingleMemberAnnotationExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithAnnotations;

/**
 * Annotation lookups by simple name. The declaration is never compiled, so
 * {@code @Nullable}, {@code @javax.annotation.Nullable} and {@code @org.jspecify.annotations.Nullable}
 * all count as the same marker.
 */
final class Annotations {

    static final String NULLABLE = "Nullable";
    static final String DEFAULT = "Default";
    static final String JSON_PROPERTY = "JsonProperty";
    static final String FUNCTIONAL_INTERFACE = "FunctionalInterface";

    private Annotations() {
    }

    static boolean has(NodeWithAnnotations<?> n, String simpleName) {
        return find(n, simpleName).isPresent();
    }

    static boolean has(NodeList<AnnotationExpr> annotations, String simpleName) {
        return find(annotations, simpleName).isPresent();
    }

    static Optional<AnnotationExpr> find(NodeWithAnnotations<?> n, String simpleName) {
        return find(n.getAnnotations(), simpleName);
    }

    static Optional<AnnotationExpr> find(NodeList<AnnotationExpr> annotations, String simpleName) {
        for (AnnotationExpr a : annotations) {
            if (simpleName.equals(simpleName(a))) {
                return Optional.of(a);
            }
        }
        return Optional.empty();
    }

    static Optional<String> value(AnnotationExpr a) {
        Expression value = null;
        if (a instanceof SingleMemberAnnotationExpr single) {
            value = single.getMemberValue();
        } else if (a instanceof NormalAnnotationExpr normal) {
            for (MemberValuePair pair : normal.getPairs()) {
                if ("value".equals(pair.getNameAsString())) {
                    value = pair.getValue();
                }
            }
        }
        if (value == null) {
            return Optional.empty();
        }
        if (value.isStringLiteralExpr()) {
            return Optional.of(value.asStringLiteralExpr().asString());
        }
        return Optional.of(value.toString());
    }

    private static String simpleName(AnnotationExpr a) {
        final var n = a.getNameAsString();
        final var lastDot = n.lastIndexOf('.');
        return lastDot >= 0 ? n.substring(lastDot + 1) : n;
    }
}
