package pmxt.apigen.generate;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

import pmxt.apigen.client.UnmappedMemberException;
import pmxt.apigen.scan.DeclarationException;

import static org.junit.jupiter.api.Assertions.*;

class ArtifactGeneratorTest {

    static final Path BUNDLED = Paths.get("src", "main", "resources", "declarations", "BaseExchange.java");

    @TempDir
    Path tmp;

    private GeneratorSettings settings(Path declaration, SchemaFormat format) {
        return GeneratorSettings.defaults()
                .withDeclaration(declaration)
                .withOutDir(tmp.resolve("out"))
                .withSchemaFormat(format);
    }

    private Path schemaFile() {
        return tmp.resolve("out/openapi.yaml");
    }

    private Path clientFile() {
        return tmp.resolve("out/pmxt/client/GeneratedExchangeMethods.java");
    }

    @Test
    void regenerationIsByteIdentical() throws IOException {
        final ArtifactGenerator generator = new ArtifactGenerator(settings(BUNDLED, SchemaFormat.YAML));

        generator.generate();
        final byte[] schema1 = Files.readAllBytes(schemaFile());
        final byte[] client1 = Files.readAllBytes(clientFile());

        generator.generate();
        assertArrayEquals(schema1, Files.readAllBytes(schemaFile()));
        assertArrayEquals(client1, Files.readAllBytes(clientFile()));
    }

    @Test
    void writtenSchemaMatchesTheBuiltDocument() throws IOException {
        final GenerationResult result = new ArtifactGenerator(settings(BUNDLED, SchemaFormat.YAML)).generate();

        final JsonNode written = new YAMLMapper().readTree(schemaFile().toFile());
        assertEquals(result.schemaDocument(), written);
        assertEquals(25, result.members().size());
        assertEquals(9, result.skippedCount());
        assertEquals(result.client().source(), Files.readString(clientFile(), StandardCharsets.UTF_8));
    }

    @Test
    void jsonFormatWritesOpenapiJson() throws IOException {
        new ArtifactGenerator(settings(BUNDLED, SchemaFormat.JSON)).generate();

        final JsonNode doc = new ObjectMapper().readTree(tmp.resolve("out/openapi.json").toFile());
        assertEquals("3.0.0", doc.get("openapi").asText());
        assertTrue(doc.path("paths").has("/api/{exchange}/fetchMarkets"));
        assertFalse(Files.exists(schemaFile()));
    }

    @Test
    void unmappedMemberLeavesEarlierArtifactsUntouched() throws IOException {
        new ArtifactGenerator(settings(BUNDLED, SchemaFormat.YAML)).generate();
        final byte[] schemaBefore = Files.readAllBytes(schemaFile());
        final byte[] clientBefore = Files.readAllBytes(clientFile());

        final Path grown = tmp.resolve("Grown.java");
        final String bundled = Files.readString(BUNDLED, StandardCharsets.UTF_8);
        final int lastBrace = bundled.lastIndexOf('}');
        Files.writeString(grown, bundled.substring(0, lastBrace)
                + "    public CompletableFuture<String> mysteryMethod() { return null; }\n}\n", StandardCharsets.UTF_8);

        final UnmappedMemberException ex = assertThrows(UnmappedMemberException.class,
                () -> new ArtifactGenerator(settings(grown, SchemaFormat.YAML)).generate());
        assertTrue(ex.getMessage().contains("mysteryMethod"));
        assertArrayEquals(schemaBefore, Files.readAllBytes(schemaFile()));
        assertArrayEquals(clientBefore, Files.readAllBytes(clientFile()));
    }

    @Test
    void unparsableDeclarationWritesNothing() throws IOException {
        final Path broken = tmp.resolve("Broken.java");
        Files.writeString(broken, "public abstract class BaseExchange { public void oops( }", StandardCharsets.UTF_8);

        assertThrows(DeclarationException.class,
                () -> new ArtifactGenerator(settings(broken, SchemaFormat.YAML)).generate());
        assertFalse(Files.exists(tmp.resolve("out")));
    }

    @Test
    void buildDoesNotWrite() throws IOException {
        final GenerationResult result = new ArtifactGenerator(settings(BUNDLED, SchemaFormat.YAML)).build();
        assertFalse(result.client().methodNames().isEmpty());
        assertFalse(Files.exists(tmp.resolve("out")));
    }
}
