package io.github.yok.stagemerge.core;

/**
 * Dialect-independent column types carried by upload schemas.
 */
public enum CanonicalType {
    INT("int"),
    FLOAT("float"),
    STRING("string"),
    DATETIME("datetime"),
    BOOLEAN("boolean"),
    JSON("json");

    private final String typeName;

    CanonicalType(String typeName) {
        this.typeName = typeName;
    }

    @Override
    public String toString() {
        return typeName;
    }
}
