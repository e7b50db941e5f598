package pmxt.apigen.generate;

import java.util.Locale;

public enum SchemaFormat {
    YAML("openapi.yaml"),
    JSON("openapi.json");

    private final String fileName;

    SchemaFormat(String fileName) {
        this.fileName = fileName;
    }

    public String fileName() {
        return fileName;
    }

    public static SchemaFormat parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("unknown schema format '" + value + "' (expected yaml or json)", ex);
        }
    }
}
