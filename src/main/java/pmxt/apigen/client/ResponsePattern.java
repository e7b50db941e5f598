package pmxt.apigen.client;

import pmxt.apigen.GenerationException;

/**
 * How a client method turns the {@code data} node of a response into its return value.
 */
public enum ResponsePattern {

    VOID,
    SINGLE,
    ARRAY,
    RECORD,
    PAGINATED;

    public boolean hasConverter() {
        return this != VOID;
    }

    public String converterTarget(String label) {
        switch (this) {
            case VOID:
                throw new GenerationException("void pattern has no converter (label " + label + ")");
            case SINGLE:
                if (label.startsWith("List<") || label.startsWith("Map<") || "void".equals(label)) {
                    throw new GenerationException("single pattern cannot return " + label);
                }
                return label;
            case ARRAY:
                return genericArgument(label, "List");
            case RECORD: {
                final String inner = genericArgument(label, "Map");
                final int comma = topLevelComma(inner);
                if (comma < 0 || !"String".equals(inner.substring(0, comma).trim())) {
                    throw new GenerationException("record pattern needs Map<String, X>, got " + label);
                }
                return inner.substring(comma + 1).trim();
            }
            case PAGINATED:
                return genericArgument(label, null);
            default:
                throw new IllegalStateException("unknown pattern " + this);
        }
    }

    static String rawName(String label) {
        final int lt = label.indexOf('<');
        return lt < 0 ? label : label.substring(0, lt).trim();
    }

    private static String genericArgument(String label, String expectedRaw) {
        final int lt = label.indexOf('<');
        if (lt <= 0 || !label.endsWith(">")) {
            throw new GenerationException("expected a generic label, got " + label);
        }
        if (expectedRaw != null && !expectedRaw.equals(label.substring(0, lt).trim())) {
            throw new GenerationException("expected " + expectedRaw + "<...>, got " + label);
        }
        final String inner = label.substring(lt + 1, label.length() - 1).trim();
        if (inner.isEmpty()) {
            throw new GenerationException("empty type argument in " + label);
        }
        return inner;
    }

    private static int topLevelComma(String s) {
        int depth = 0;
        for (int i = 0; i < s.length(); i++) {
            final char c = s.charAt(i);
            if (c == '<') {
                depth++;
            } else if (c == '>') {
                depth--;
            } else if (c == ',' && depth == 0) {
                return i;
            }
        }
        return -1;
    }
}
