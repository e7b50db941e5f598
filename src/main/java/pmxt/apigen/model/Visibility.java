package pmxt.apigen.model;

public enum Visibility {
    PUBLIC,
    PACKAGE,
    PROTECTED,
    PRIVATE
}
