package pmxt.apigen.model;

public enum PrimitiveKind {
    STRING,
    NUMBER,
    BOOLEAN,
    VOID,
    NULL,
    UNDEFINED,
    ANY
}
