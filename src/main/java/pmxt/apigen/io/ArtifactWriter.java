package pmxt.apigen.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

import pmxt.apigen.generate.GenerationResult;
import pmxt.apigen.generate.SchemaFormat;

/**
 * Writes the schema document and the client source under one output directory.
 * <p>
 * Both files are staged as temporary siblings before either target is replaced. If a
 * replacement fails, the targets already replaced are restored, so a failed run leaves
 * the previous pair on disk.
 */
public final class ArtifactWriter {

    private final Path outDir;
    private final SchemaFormat schemaFormat;
    private final ObjectMapper jsonMapper;
    private final YAMLMapper yamlMapper;

    public ArtifactWriter(Path outDir, SchemaFormat schemaFormat) {
        this.outDir = Objects.requireNonNull(outDir, "outDir");
        this.schemaFormat = Objects.requireNonNull(schemaFormat, "schemaFormat");
        this.jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        this.yamlMapper = YAMLMapper.builder()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
                .build();
    }

    public List<Path> writeAll(GenerationResult result) throws IOException {
        Objects.requireNonNull(result, "result");

        final Path schemaFile = outDir.resolve(schemaFormat.fileName());
        final Path clientFile = outDir.resolve(result.client().relativePath());

        final Map<Path, String> contents = new LinkedHashMap<>();
        contents.put(schemaFile, renderSchema(result.schemaDocument()));
        contents.put(clientFile, result.client().source());
        writeTogether(contents);
        return List.of(schemaFile, clientFile);
    }

    public String renderSchema(JsonNode document) throws IOException {
        if (schemaFormat == SchemaFormat.JSON) {
            return jsonMapper.writeValueAsString(document) + "\n";
        }
        return yamlMapper.writeValueAsString(document);
    }

    static void writeTogether(Map<Path, String> contents) throws IOException {
        final List<StagedFile> staged = new ArrayList<>(contents.size());
        final List<StagedFile> committed = new ArrayList<>(contents.size());
        try {
            for (Map.Entry<Path, String> e : contents.entrySet()) {
                staged.add(StagedFile.stage(e.getKey(), e.getValue()));
            }
            for (StagedFile file : staged) {
                file.commit();
                committed.add(file);
            }
        } catch (IOException | RuntimeException ex) {
            for (int i = committed.size() - 1; i >= 0; i--) {
                try {
                    committed.get(i).rollback();
                } catch (IOException rollbackEx) {
                    ex.addSuppressed(rollbackEx);
                }
            }
            throw ex;
        } finally {
            for (StagedFile file : staged) {
                file.cleanup();
            }
        }
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static final class StagedFile {

        private final Path target;
        private final Path tmp;
        // copy of the previous target; null when there was none
        private final Path backup;

        private StagedFile(Path target, Path tmp, Path backup) {
            this.target = target;
            this.tmp = tmp;
            this.backup = backup;
        }

        static StagedFile stage(Path target, String content) throws IOException {
            final Path dir = target.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            final String name = target.getFileName().toString();
            final Path tmp = Files.createTempFile(dir, name, ".tmp");
            Path backup = null;
            try {
                Files.writeString(tmp, content, StandardCharsets.UTF_8);
                if (Files.isRegularFile(target)) {
                    backup = Files.createTempFile(dir, name, ".bak");
                    Files.copy(target, backup, StandardCopyOption.REPLACE_EXISTING);
                }
                return new StagedFile(target, tmp, backup);
            } catch (IOException | RuntimeException ex) {
                Files.deleteIfExists(tmp);
                if (backup != null) {
                    Files.deleteIfExists(backup);
                }
                throw ex;
            }
        }

        void commit() throws IOException {
            move(tmp, target);
        }

        void rollback() throws IOException {
            if (backup != null) {
                move(backup, target);
            } else {
                Files.deleteIfExists(target);
            }
        }

        void cleanup() throws IOException {
            Files.deleteIfExists(tmp);
            if (backup != null) {
                Files.deleteIfExists(backup);
            }
        }
    }
}
