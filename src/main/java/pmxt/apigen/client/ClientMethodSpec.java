package pmxt.apigen.client;

import java.util.Objects;

/**
 * One row of the client lookup table: the declared Java return type, how the response is
 * unpacked, and which converter turns a JSON node into the element type.
 */
public record ClientMethodSpec(String returnLabel, ResponsePattern pattern, String converter) {

    public ClientMethodSpec {
        Objects.requireNonNull(returnLabel, "returnLabel");
        Objects.requireNonNull(pattern, "pattern");
        if (pattern.hasConverter() && (converter == null || converter.isBlank())) {
            throw new IllegalArgumentException(pattern + " needs a converter");
        }
        if (!pattern.hasConverter() && converter != null) {
            throw new IllegalArgumentException("void methods take no converter");
        }
    }

    public static ClientMethodSpec voidMethod() {
        return new ClientMethodSpec("void", ResponsePattern.VOID, null);
    }

    public static ClientMethodSpec of(String returnLabel, ResponsePattern pattern, String converter) {
        return new ClientMethodSpec(returnLabel, pattern, converter);
    }
}
