package pmxt.apigen.client;

import java.util.List;
import java.util.Objects;

public record ClientArtifact(String packageName, String className, String source, List<String> methodNames) {

    public ClientArtifact {
        Objects.requireNonNull(packageName, "packageName");
        Objects.requireNonNull(className, "className");
        Objects.requireNonNull(source, "source");
        methodNames = List.copyOf(methodNames);
    }

    public String relativePath() {
        final String dir = packageName.isEmpty() ? "" : packageName.replace('.', '/') + "/";
        return dir + className + ".java";
    }
}
