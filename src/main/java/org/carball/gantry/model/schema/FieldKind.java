package org.carball.gantry.model.schema;

public enum FieldKind {
    STRING,
    INTEGER,
    TIMESTAMP
}
