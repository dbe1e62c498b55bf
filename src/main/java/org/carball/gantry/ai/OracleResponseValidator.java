package org.carball.gantry.ai;

import lombok.extern.slf4j.Slf4j;
import org.carball.gantry.model.schema.FieldGroup;
import org.carball.gantry.model.schema.FieldGroupSchema;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ingestion boundary for oracle answers: every expected key present, each value convertible
 * to its field kind and within range. Keys outside the group are dropped.
 */
@Slf4j
public class OracleResponseValidator {

    private final FieldGroupSchema schema;

    public OracleResponseValidator(FieldGroupSchema schema) {
        this.schema = schema;
    }

    public Map<String, Object> validate(FieldGroup group, Map<String, Object> response)
            throws InvalidOracleResponseException {
        if (response == null) {
            throw new InvalidOracleResponseException("No response for group " + group.name());
        }
        Map<String, Object> typed = new LinkedHashMap<>();
        for (String field : group.fields()) {
            if (!response.containsKey(field)) {
                throw new InvalidOracleResponseException("Missing field '" + field + "' in " + group.name() + " response");
            }
            try {
                typed.put(field, schema.getSpec(field).coerce(response.get(field)));
            } catch (IllegalArgumentException e) {
                throw new InvalidOracleResponseException(e.getMessage(), e);
            }
        }
        if (response.size() > typed.size()) {
            log.trace("Ignoring extra keys in {} response: {}", group.name(), response.keySet());
        }
        return typed;
    }
}
