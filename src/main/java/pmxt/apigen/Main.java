package pmxt.apigen;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Paths;

import pmxt.apigen.client.ClientMethodTable;
import pmxt.apigen.generate.ArtifactGenerator;
import pmxt.apigen.generate.GenerationResult;
import pmxt.apigen.generate.GeneratorSettings;
import pmxt.apigen.generate.SchemaFormat;
import pmxt.apigen.model.MemberDescriptor;
import pmxt.apigen.model.Names;
import pmxt.apigen.openapi.SchemaAssembler;
import pmxt.apigen.sync.SurfaceCheck;

public final class Main {

    public static void main(String[] args) {
        final int code = run(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args) {
        GeneratorSettings settings = GeneratorSettings.defaults();

        for (String arg : args) {
            if ("--help".equals(arg) || "-h".equals(arg)) {
                printUsage();
                return 0;
            }
            if (arg.startsWith("--declaration=")) {
                settings = settings.withDeclaration(Paths.get(arg.substring("--declaration=".length())));
                continue;
            }
            if (arg.startsWith("--outDir=")) {
                settings = settings.withOutDir(Paths.get(arg.substring("--outDir=".length())));
                continue;
            }
            if (arg.startsWith("--schemaFormat=")) {
                try {
                    settings = settings.withSchemaFormat(SchemaFormat.parse(arg.substring("--schemaFormat=".length())));
                } catch (IllegalArgumentException ex) {
                    System.err.println("ERROR: " + ex.getMessage());
                    printUsage();
                    return 2;
                }
                continue;
            }
            if (arg.startsWith("--clientPackage=")) {
                final String pkg = arg.substring("--clientPackage=".length()).trim();
                if (!isPackageName(pkg)) {
                    System.err.println("ERROR: not a package name: " + pkg);
                    return 2;
                }
                settings = settings.withClientPackage(pkg);
                continue;
            }
            System.err.println("ERROR: unknown argument: " + arg);
            printUsage();
            return 2;
        }

        try {
            if (!Files.isRegularFile(settings.declaration())) {
                throw new IOException("declaration not found: " + settings.declaration().toAbsolutePath());
            }

            final GenerationResult result = new ArtifactGenerator(settings).generate();

            System.out.println("Schema written to: "
                    + settings.outDir().resolve(settings.schemaFormat().fileName()));
            System.out.println("Client written to: "
                    + settings.outDir().resolve(result.client().relativePath()));
            System.out.println("Members: " + result.members().size()
                    + ", client methods: " + result.client().methodNames().size()
                    + ", skipped: " + result.skippedCount());
            for (MemberDescriptor m : result.members()) {
                final boolean inClient = result.client().methodNames().contains(m.name());
                System.out.println("  - " + m.name() + "  POST " + SchemaAssembler.PATH_PREFIX + m.name()
                        + (inClient ? "" : "  (client: hand-written)"));
            }
            final SurfaceCheck.Report report = new SurfaceCheck(ClientMethodTable.DEFAULT_SKIPPED)
                    .check(result.members(), result.schemaDocument(), result.client().source());
            for (String problem : report.problems()) {
                System.err.println("WARN: " + problem);
            }
            return 0;
        } catch (IOException ex) {
            System.err.println("ERROR: IO failure: " + Names.safeMsg(ex.getMessage()));
            return 2;
        } catch (UncheckedIOException ex) {
            System.err.println("ERROR: IO failure: " + Names.safeMsg(ex.getMessage()));
            return 2;
        } catch (GenerationException ex) {
            System.err.println("ERROR: generation failed: " + Names.safeMsg(ex.getMessage()));
            return 1;
        } catch (Exception ex) {
            System.err.println("ERROR: failed to generate artifacts: "
                    + ex.getClass().getSimpleName() + ": " + Names.safeMsg(ex.getMessage()));
            return 1;
        }
    }

    private static boolean isPackageName(String pkg) {
        if (pkg.isEmpty()) {
            return false;
        }
        for (String part : pkg.split("\\.", -1)) {
            if (!Names.isJavaIdentifier(part)) {
                return false;
            }
        }
        return true;
    }

    private static void printUsage() {
        System.out.println("Usage: pmxt-apigen [options]");
        System.out.println("Options:");
        System.out.println("  --declaration=<path>    Canonical exchange declaration (default: "
                + GeneratorSettings.DEFAULT_DECLARATION + ")");
        System.out.println("  --outDir=<path>         Output directory (default: " + GeneratorSettings.DEFAULT_OUT_DIR + ")");
        System.out.println("  --schemaFormat=<fmt>    yaml or json (default: yaml)");
        System.out.println("  --clientPackage=<pkg>   Package of the generated client class (default: pmxt.client)");
        System.out.println("  --help, -h              Show this help");
    }
}
