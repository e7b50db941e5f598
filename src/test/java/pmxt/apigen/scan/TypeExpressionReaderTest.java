package pmxt.apigen.scan;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.MethodDeclaration;

import pmxt.apigen.model.FieldDescriptor;
import pmxt.apigen.model.TypeExpression;

import static org.junit.jupiter.api.Assertions.*;
import static pmxt.apigen.model.TypeExpression.*;

class TypeExpressionReaderTest {

    private static final JavaParser PARSER = new JavaParser(new ParserConfiguration()
            .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));

    private static final String NESTED = """
            public sealed interface Query permits OHLCVParams, HistoryFilterParams { }

            public enum Side {
                @JsonProperty("buy") BUY,
                @JsonProperty("sell") SELL,
                UNKNOWN
            }

            public record Range(@Nullable Double min, double max) { }

            public record Node(String value, @Nullable Node next) { }

            @FunctionalInterface
            public interface MarketFilter {
                boolean test(Object market);
            }
            """;

    private static CompilationUnit parse(String methods) {
        return PARSER.parse("public class X {\n" + methods + "\n" + NESTED + "\n}").getResult().orElseThrow();
    }

    private static TypeExpression returnOf(String returnType) {
        final CompilationUnit cu = parse("public " + returnType + " m() { return null; }");
        final MethodDeclaration md = cu.findFirst(MethodDeclaration.class, x -> x.getNameAsString().equals("m")).orElseThrow();
        return new TypeExpressionReader(DeclarationIndex.of(cu)).read(md.getType());
    }

    private static TypeExpressionReader.ReadParameter paramOf(String parameter) {
        final CompilationUnit cu = parse("public void m(" + parameter + ") { }");
        final MethodDeclaration md = cu.findFirst(MethodDeclaration.class, x -> x.getNameAsString().equals("m")).orElseThrow();
        return new TypeExpressionReader(DeclarationIndex.of(cu)).readParameter(md.getParameter(0));
    }

    @Test
    void scalars() {
        assertEquals(STRING, returnOf("String"));
        assertEquals(STRING, returnOf("char"));
        assertEquals(NUMBER, returnOf("long"));
        assertEquals(NUMBER, returnOf("BigDecimal"));
        assertEquals(BOOLEAN, returnOf("Boolean"));
        assertEquals(ANY, returnOf("Object"));
        assertEquals(VOID, returnOf("Void"));
    }

    @Test
    void collectionsAndArrays() {
        assertEquals(arrayOf(STRING), returnOf("List<String>"));
        assertEquals(arrayOf(NUMBER), returnOf("int[]"));
        assertEquals(arrayOf(named("Order")), returnOf("Set<Order>"));
        assertEquals(arrayOf(null), returnOf("Collection"));
    }

    @Test
    void genericReferencesKeepTheirArguments() {
        assertEquals(named("CompletableFuture", named("Map", STRING, named("UnifiedMarket"))),
                returnOf("CompletableFuture<Map<String, UnifiedMarket>>"));
    }

    @Test
    void optionalReturnMayBeUndefined() {
        assertEquals(union(STRING, UNDEFINED), returnOf("Optional<String>"));
    }

    @Test
    void nestedEnumBecomesWireLiterals() {
        assertEquals(union(literal("buy"), literal("sell"), literal("UNKNOWN")), returnOf("Side"));
    }

    @Test
    void nestedRecordBecomesInlineRecord() {
        assertEquals(new InlineRecord(List.of(
                new FieldDescriptor("min", NUMBER, true),
                new FieldDescriptor("max", NUMBER, false))), returnOf("Range"));
    }

    @Test
    void recursiveRecordStopsAtItself() {
        final TypeExpression node = returnOf("Node");
        final InlineRecord rec = assertInstanceOf(InlineRecord.class, node);
        assertEquals(named("Node"), rec.fields().get(1).type());
        assertTrue(rec.fields().get(1).optional());
    }

    @Test
    void sealedInterfaceBecomesUnionOfPermits() {
        assertEquals(union(named("OHLCVParams"), named("HistoryFilterParams")), returnOf("Query"));
    }

    @Test
    void callbacksBecomeFunctionTypes() {
        assertEquals(new FunctionType(), returnOf("Predicate<UnifiedMarket>"));
        assertEquals(new FunctionType(), returnOf("MarketFilter"));
    }

    @Test
    void parameterMarkers() {
        final var nullable = paramOf("@Nullable String marketId");
        assertTrue(nullable.optional());
        assertEquals(STRING, nullable.type());

        final var opt = paramOf("Optional<Integer> limit");
        assertTrue(opt.optional());
        assertEquals(NUMBER, opt.type());

        final var plain = paramOf("String id");
        assertFalse(plain.optional());

        final var varargs = paramOf("String... ids");
        assertEquals(arrayOf(STRING), varargs.type());
    }
}
