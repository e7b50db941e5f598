package pmxt.apigen.generate;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

import pmxt.apigen.client.ClientMethodAssembler;

/**
 * Everything one generation run needs. Relative paths resolve against the working directory.
 */
public record GeneratorSettings(Path declaration, Path outDir, SchemaFormat schemaFormat, String clientPackage) {

    public static final Path DEFAULT_DECLARATION = Paths.get("src", "main", "resources", "declarations", "BaseExchange.java");
    public static final Path DEFAULT_OUT_DIR = Paths.get("generated");

    public GeneratorSettings {
        Objects.requireNonNull(declaration, "declaration");
        Objects.requireNonNull(outDir, "outDir");
        Objects.requireNonNull(schemaFormat, "schemaFormat");
        Objects.requireNonNull(clientPackage, "clientPackage");
    }

    public static GeneratorSettings defaults() {
        return new GeneratorSettings(DEFAULT_DECLARATION, DEFAULT_OUT_DIR, SchemaFormat.YAML,
                ClientMethodAssembler.DEFAULT_PACKAGE);
    }

    public GeneratorSettings withDeclaration(Path declaration) {
        return new GeneratorSettings(declaration, outDir, schemaFormat, clientPackage);
    }

    public GeneratorSettings withOutDir(Path outDir) {
        return new GeneratorSettings(declaration, outDir, schemaFormat, clientPackage);
    }

    public GeneratorSettings withSchemaFormat(SchemaFormat schemaFormat) {
        return new GeneratorSettings(declaration, outDir, schemaFormat, clientPackage);
    }

    public GeneratorSettings withClientPackage(String clientPackage) {
        return new GeneratorSettings(declaration, outDir, schemaFormat, clientPackage);
    }
}
