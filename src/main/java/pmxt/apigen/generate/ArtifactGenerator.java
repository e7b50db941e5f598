package pmxt.apigen.generate;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.node.ObjectNode;

import pmxt.apigen.client.ClientArtifact;
import pmxt.apigen.client.ClientMethodAssembler;
import pmxt.apigen.client.ClientMethodTable;
import pmxt.apigen.io.ArtifactWriter;
import pmxt.apigen.model.MemberDescriptor;
import pmxt.apigen.openapi.SchemaAssembler;
import pmxt.apigen.scan.InterfaceExtractor;
import pmxt.apigen.scan.MemberFilter;

/**
 * Extract once, build the schema document and the client in memory, then write both.
 * A failure while building leaves any earlier artifacts on disk as they were.
 */
public final class ArtifactGenerator {

    private final GeneratorSettings settings;
    private final InterfaceExtractor extractor;
    private final MemberFilter filter;
    private final SchemaAssembler schemas;
    private final ClientMethodAssembler client;

    public ArtifactGenerator(GeneratorSettings settings) {
        this(settings, MemberFilter.DEFAULT, SchemaAssembler.withDefaults(), ClientMethodTable.DEFAULT);
    }

    public ArtifactGenerator(GeneratorSettings settings,
                             MemberFilter filter,
                             SchemaAssembler schemas,
                             ClientMethodTable clientTable) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.filter = Objects.requireNonNull(filter, "filter");
        this.schemas = Objects.requireNonNull(schemas, "schemas");
        this.client = new ClientMethodAssembler(clientTable, settings.clientPackage());
        this.extractor = new InterfaceExtractor();
    }

    public GenerationResult build() throws IOException {
        final List<MemberDescriptor> members = extractor.extractMembers(settings.declaration(), filter);

        // client first: an unmapped member must fail before the schema is even assembled
        final ClientArtifact clientArtifact = client.assemble(members);
        final ObjectNode document = schemas.buildDocument(members);

        return new GenerationResult(members, document, clientArtifact);
    }

    public GenerationResult generate() throws IOException {
        final GenerationResult result = build();
        new ArtifactWriter(settings.outDir(), settings.schemaFormat()).writeAll(result);
        return result;
    }
}
