package pmxt.apigen.model;

import java.util.List;
import java.util.Objects;

/**
 * Generator-facing view of one method of the canonical declaration.
 * <p>
 * returnType null means void; documentation null means no attached Javadoc.
 */
public record MemberDescriptor(
        String name,
        List<ParameterDescriptor> parameters,
        TypeExpression returnType,
        String documentation,
        Visibility visibility,
        boolean isAbstract
) {
    public MemberDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(visibility, "visibility");
        parameters = List.copyOf(parameters);
    }

    public static MemberDescriptor publicMember(String name,
                                                List<ParameterDescriptor> parameters,
                                                TypeExpression returnType,
                                                String documentation) {
        return new MemberDescriptor(name, parameters, returnType, documentation, Visibility.PUBLIC, false);
    }

    public int requiredCount() {
        int n = 0;
        for (ParameterDescriptor p : parameters) {
            if (p.required()) {
                n++;
            }
        }
        return n;
    }

    public int totalCount() {
        return parameters.size();
    }

    public String title() {
        return Names.camelToTitle(name);
    }
}
