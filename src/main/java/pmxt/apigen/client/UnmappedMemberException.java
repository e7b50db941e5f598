package pmxt.apigen.client;

import java.util.List;

import pmxt.apigen.GenerationException;

/**
 * Raised before any client code is rendered when members are neither skipped nor in the lookup table.
 */
public class UnmappedMemberException extends GenerationException {

    private final List<String> members;

    public UnmappedMemberException(List<String> members) {
        super("no client mapping for member(s): " + String.join(", ", members)
                + " (add them to the client lookup table or the skip-list)");
        this.members = List.copyOf(members);
    }

    public List<String> members() {
        return members;
    }
}
