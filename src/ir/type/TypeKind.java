package ir.type;

public enum TypeKind {
    VOID,
    INTEGER,
    FLOAT,
    POINTER,
    ARRAY,
    STRUCT,
    FUNC,
    VECTOR,
    LABEL
}
