package pmxt.apigen.generate;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.node.ObjectNode;

import pmxt.apigen.client.ClientArtifact;
import pmxt.apigen.model.MemberDescriptor;

/**
 * Both artifacts of one run, fully built in memory before anything touches the disk.
 */
public record GenerationResult(List<MemberDescriptor> members, ObjectNode schemaDocument, ClientArtifact client) {

    public GenerationResult {
        members = List.copyOf(members);
        Objects.requireNonNull(schemaDocument, "schemaDocument");
        Objects.requireNonNull(client, "client");
    }

    public int skippedCount() {
        return members.size() - client.methodNames().size();
    }
}
