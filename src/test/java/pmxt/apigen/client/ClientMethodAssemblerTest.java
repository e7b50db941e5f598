package pmxt.apigen.client;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import javax.tools.JavaCompiler;
import javax.tools.ToolProvider;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.TreeNode;
import com.fasterxml.jackson.databind.JsonNode;
import com.github.javaparser.JavaParser;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.type.ClassOrInterfaceType;

import pmxt.apigen.GenerationException;
import pmxt.apigen.model.MemberDescriptor;
import pmxt.apigen.model.ParameterDescriptor;
import pmxt.apigen.model.TypeExpression;
import pmxt.apigen.scan.InterfaceExtractor;
import pmxt.apigen.scan.MemberFilter;

import static org.junit.jupiter.api.Assertions.*;
import static pmxt.apigen.model.TypeExpression.*;

class ClientMethodAssemblerTest {

    static final Path BUNDLED = Paths.get("src", "main", "resources", "declarations", "BaseExchange.java");

    static final Set<String> JDK_AND_JACKSON_TYPES = Set.of(
            "String", "Number", "Boolean", "Object", "Void", "Integer", "Long", "Double",
            "List", "ArrayList", "Map", "LinkedHashMap", "Iterator", "Entry", "JsonNode");

    private final ClientMethodAssembler assembler = ClientMethodAssembler.withDefaults();

    private static MemberDescriptor member(String name, TypeExpression returnType, ParameterDescriptor... params) {
        return MemberDescriptor.publicMember(name, List.of(params), named("CompletableFuture", returnType), null);
    }

    private static int occurrences(String haystack, String needle) {
        int count = 0;
        int from = 0;
        while ((from = haystack.indexOf(needle, from)) >= 0) {
            count++;
            from += needle.length();
        }
        return count;
    }

    @Test
    void unmappedMembersFailBeforeRendering() {
        final UnmappedMemberException ex = assertThrows(UnmappedMemberException.class, () -> assembler.assemble(List.of(
                member("fetchMarkets", arrayOf(named("UnifiedMarket"))),
                member("mysteryMethod", STRING),
                member("fetchOHLCV", arrayOf(named("PriceCandle"))),
                member("otherMystery", NUMBER))));
        assertEquals(List.of("mysteryMethod", "otherMystery"), ex.members());
        assertTrue(ex.getMessage().contains("mysteryMethod"));
        assertTrue(ex.getMessage().contains("otherMystery"));
    }

    @Test
    void skippedMembersAreNotRendered() {
        final ClientArtifact artifact = assembler.assemble(List.of(
                member("fetchOHLCV", arrayOf(named("PriceCandle")), ParameterDescriptor.required("id", STRING)),
                member("fetchOrderBook", named("OrderBook"), ParameterDescriptor.required("id", STRING))));
        assertEquals(List.of("fetchOrderBook"), artifact.methodNames());
        assertFalse(artifact.source().contains("fetchOHLCV"));
    }

    @Test
    void defaultedParameterGetsDelegatingOverload() {
        final String src = assembler.assemble(List.of(
                member("loadMarkets", named("Map", STRING, named("UnifiedMarket")),
                        ParameterDescriptor.withDefault("reload", BOOLEAN, "false")))).source();

        assertTrue(src.contains("public Map<String, UnifiedMarket> loadMarkets(boolean reload) {"));
        assertTrue(src.contains("public Map<String, UnifiedMarket> loadMarkets() {"));
        assertTrue(src.contains("return loadMarkets(false);"));
        assertTrue(src.contains("callArgs.add(reload);"));
        assertTrue(src.contains("Iterator<Map.Entry<String, JsonNode>> fields = response.fields();"));
    }

    @Test
    void optionalParameterIsPushedOnlyWhenPresent() {
        final String src = assembler.assemble(List.of(
                member("fetchOpenOrders", arrayOf(named("Order")),
                        ParameterDescriptor.optional("marketId", STRING)))).source();

        assertTrue(src.contains("public List<Order> fetchOpenOrders(String marketId) {"));
        assertTrue(src.contains("if (marketId != null) {"));
        assertTrue(src.contains("public List<Order> fetchOpenOrders() {"));
        assertTrue(src.contains("return fetchOpenOrders(null);"));
        assertTrue(src.contains("JsonNode response = invoke(\"fetchOpenOrders\", callArgs);"));
        assertTrue(src.contains("result.add(convertOrder(item));"));
    }

    @Test
    void requiredParameterHasNoOverload() {
        final String src = assembler.assemble(List.of(
                member("cancelOrder", named("Order"), ParameterDescriptor.required("orderId", STRING)))).source();
        assertEquals(1, occurrences(src, "public Order cancelOrder("));
        assertTrue(src.contains("return convertOrder(response);"));
    }

    @Test
    void voidMemberReturnsNothing() {
        final String src = assembler.assemble(List.of(member("close", VOID))).source();
        assertTrue(src.contains("public void close() {"));
        assertTrue(src.contains("        invoke(\"close\", callArgs);"));
        assertFalse(src.contains("return close"));
    }

    @Test
    void paginatedMemberBuildsThePage() {
        final String src = assembler.assemble(List.of(
                member("fetchMarketsPaginated", named("PaginatedResult", named("UnifiedMarket")),
                        ParameterDescriptor.optional("params", named("MarketFetchParams"))))).source();
        assertTrue(src.contains("public PaginatedResult<UnifiedMarket> fetchMarketsPaginated(MarketFetchParams params) {"));
        assertTrue(src.contains("for (JsonNode item : response.path(\"data\")) {"));
        assertTrue(src.contains("return new PaginatedResult<>(result, response.path(\"total\").numberValue(), "
                + "response.path(\"nextCursor\").asText(null));"));
    }

    @Test
    void convertersAreDeclaredOncePerName() {
        final String src = assembler.assemble(List.of(
                member("fetchMarket", named("UnifiedMarket")),
                member("fetchMarkets", arrayOf(named("UnifiedMarket"))),
                member("cancelOrder", named("Order"), ParameterDescriptor.required("orderId", STRING)),
                member("close", VOID))).source();

        assertEquals(1, occurrences(src, "protected abstract UnifiedMarket convertMarket(JsonNode node);"));
        assertEquals(1, occurrences(src, "protected abstract Order convertOrder(JsonNode node);"));
        assertTrue(src.contains("protected abstract JsonNode invoke(String method, List<Object> args);"));
        assertTrue(src.contains("@Generated(\"pmxt.apigen.client.ClientMethodAssembler\")"));
    }

    @Test
    void documentationIsCarriedAsJavadoc() {
        final MemberDescriptor documented = MemberDescriptor.publicMember("fetchBalance", List.of(),
                named("CompletableFuture", arrayOf(named("Balance"))), "Fetch account balances.");
        final String src = assembler.assemble(List.of(documented)).source();
        assertTrue(src.contains("    /**\n     * Fetch account balances.\n     */\n    public List<Balance> fetchBalance() {"));
    }

    @Test
    void renderedSourceParses() {
        final String src = assembler.assemble(List.of(
                member("loadMarkets", named("Map", STRING, named("UnifiedMarket")),
                        ParameterDescriptor.withDefault("reload", BOOLEAN, "false")),
                member("fetchOpenOrders", arrayOf(named("Order")), ParameterDescriptor.optional("marketId", STRING)),
                member("close", VOID))).source();
        final JavaParser parser = new JavaParser(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
        assertTrue(parser.parse(src).isSuccessful());
    }

    @Test
    void customPackage() {
        final ClientArtifact artifact = new ClientMethodAssembler(ClientMethodTable.DEFAULT, "com.acme.sdk")
                .assemble(List.of(member("close", VOID)));
        assertTrue(artifact.source().startsWith("package com.acme.sdk;\n"));
        assertEquals("com/acme/sdk/GeneratedExchangeMethods.java", artifact.relativePath());
    }

    @Test
    void converterWithTwoTargetsIsRejected() {
        final ClientMethodTable table = new ClientMethodTable(Set.of(), Map.of(
                "a", ClientMethodSpec.of("Order", ResponsePattern.SINGLE, "convertThing"),
                "b", ClientMethodSpec.of("List<Balance>", ResponsePattern.ARRAY, "convertThing")), Set.of());
        final ClientMethodAssembler custom = new ClientMethodAssembler(table, "x");
        assertThrows(GenerationException.class, () -> custom.assemble(List.of(member("a", ANY), member("b", ANY))));
    }

    @Test
    void labelMustFitItsPattern() {
        final ClientMethodTable table = new ClientMethodTable(Set.of(), Map.of(
                "a", ClientMethodSpec.of("Order", ResponsePattern.ARRAY, "convertOrder")), Set.of());
        final ClientMethodAssembler custom = new ClientMethodAssembler(table, "x");
        assertThrows(GenerationException.class, () -> custom.assemble(List.of(member("a", ANY))));
    }

    @Test
    void singleMemberConvertsTheWholePayload() {
        final String src = assembler.assemble(List.of(
                member("fetchMarket", named("UnifiedMarket"), ParameterDescriptor.required("marketId", STRING)))).source();
        assertTrue(src.contains("""
                        callArgs.add(marketId);
                        JsonNode response = invoke("fetchMarket", callArgs);
                        return convertMarket(response);
                """));
    }

    @Test
    void arrayMemberConvertsEachElement() {
        final String src = assembler.assemble(List.of(
                member("fetchMarkets", arrayOf(named("UnifiedMarket"))))).source();
        assertTrue(src.contains("""
                        JsonNode response = invoke("fetchMarkets", callArgs);
                        List<UnifiedMarket> result = new ArrayList<>();
                        for (JsonNode item : response) {
                            result.add(convertMarket(item));
                        }
                        return result;
                """));
    }

    @Test
    void recordMemberConvertsEachValueAndKeepsKeys() {
        final String src = assembler.assemble(List.of(
                member("loadMarkets", named("Map", STRING, named("UnifiedMarket")),
                        ParameterDescriptor.withDefault("reload", BOOLEAN, "false")))).source();
        assertTrue(src.contains("""
                        JsonNode response = invoke("loadMarkets", callArgs);
                        Map<String, UnifiedMarket> result = new LinkedHashMap<>();
                        Iterator<Map.Entry<String, JsonNode>> fields = response.fields();
                        while (fields.hasNext()) {
                            Map.Entry<String, JsonNode> entry = fields.next();
                            result.put(entry.getKey(), convertMarket(entry.getValue()));
                        }
                        return result;
                """));
    }

    @Test
    void bundledClientCompilesAgainstDomainTypes(@TempDir Path tmp) throws Exception {
        final List<MemberDescriptor> members = new InterfaceExtractor().extractMembers(BUNDLED, MemberFilter.DEFAULT);
        final ClientArtifact artifact = assembler.assemble(members);

        final Path pkgDir = tmp.resolve("src").resolve("pmxt/client");
        Files.createDirectories(pkgDir);
        final List<String> args = new ArrayList<>(List.of(
                "-proc:none", "-d", tmp.resolve("classes").toString(), "-classpath", jacksonClasspath()));
        args.add(Files.writeString(pkgDir.resolve(artifact.className() + ".java"), artifact.source(),
                StandardCharsets.UTF_8).toString());
        args.add(Files.writeString(pkgDir.resolve("PaginatedResult.java"), """
                package pmxt.client;

                import java.util.List;

                public class PaginatedResult<T> {
                    public PaginatedResult(List<T> data, Number total, String nextCursor) {
                    }
                }
                """, StandardCharsets.UTF_8).toString());
        for (String type : domainTypes(artifact.source())) {
            args.add(Files.writeString(pkgDir.resolve(type + ".java"),
                    "package pmxt.client;\n\npublic class " + type + " {\n}\n", StandardCharsets.UTF_8).toString());
        }

        final JavaCompiler javac = ToolProvider.getSystemJavaCompiler();
        assertNotNull(javac, "a JDK compiler is required");
        final ByteArrayOutputStream err = new ByteArrayOutputStream();
        final int rc = javac.run(null, null, err, args.toArray(new String[0]));
        assertEquals(0, rc, () -> err.toString(StandardCharsets.UTF_8));
    }

    private static Set<String> domainTypes(String source) {
        final CompilationUnit cu = new JavaParser(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)).parse(source).getResult().orElseThrow();
        final Set<String> out = new TreeSet<>();
        for (ClassOrInterfaceType t : cu.findAll(ClassOrInterfaceType.class)) {
            final String name = t.getNameAsString();
            if (!JDK_AND_JACKSON_TYPES.contains(name) && !name.equals("PaginatedResult")) {
                out.add(name);
            }
        }
        return out;
    }

    private static String jacksonClasspath() throws URISyntaxException {
        final List<String> entries = new ArrayList<>();
        for (Class<?> c : List.of(JsonNode.class, TreeNode.class, JsonInclude.class)) {
            entries.add(Paths.get(c.getProtectionDomain().getCodeSource().getLocation().toURI()).toString());
        }
        return String.join(File.pathSeparator, entries);
    }
}
