package pmxt.apigen.scan;

import java.util.Set;
import java.util.function.Predicate;

import pmxt.apigen.model.MemberDescriptor;
import pmxt.apigen.model.Visibility;

/**
 * Which extracted members belong to the generated surface: everything not marked
 * private, protected or abstract whose name is not excluded.
 */
public record MemberFilter(Set<String> exclusions) implements Predicate<MemberDescriptor> {

    public static final Set<String> DEFAULT_EXCLUSIONS = Set.of("callApi", "defineImplicitApi", "implicitApi");

    public static final MemberFilter DEFAULT = new MemberFilter(DEFAULT_EXCLUSIONS);

    public MemberFilter {
        exclusions = Set.copyOf(exclusions);
    }

    @Override
    public boolean test(MemberDescriptor m) {
        if (m.visibility() == Visibility.PRIVATE || m.visibility() == Visibility.PROTECTED) {
            return false;
        }
        if (m.isAbstract()) {
            return false;
        }
        return !exclusions.contains(m.name());
    }
}
