package org.carball.gantry.model.schema;

import java.util.List;
import java.util.Objects;

/**
 * A set of fields generated by one oracle call, after its prerequisite groups.
 */
public record FieldGroup(String name, List<String> fields, List<String> prerequisites) {

    public FieldGroup {
        Objects.requireNonNull(name, "name");
        fields = List.copyOf(fields);
        prerequisites = List.copyOf(prerequisites);
    }

    public static FieldGroup of(String name, List<String> fields, String... prerequisites) {
        return new FieldGroup(name, fields, List.of(prerequisites));
    }
}
