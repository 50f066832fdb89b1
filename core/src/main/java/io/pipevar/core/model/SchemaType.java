package io.pipevar.core.model;

import java.util.Arrays;
import java.util.Optional;

/** Type tag of a {@link SchemaNode}. */
public enum SchemaType {
    STRING("string"),
    INT("int"),
    FLOAT("float"),
    BOOLEAN("boolean"),
    ARRAY("array"),
    OBJECT("object");

    private final String wireName;

    SchemaType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isScalar() {
        return this != ARRAY && this != OBJECT;
    }

    public static Optional<SchemaType> fromWireName(String name) {
        return Arrays.stream(values()).filter(t -> t.wireName.equals(name)).findFirst();
    }
}
