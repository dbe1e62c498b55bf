package org.carball.gantry.model.record;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.extern.slf4j.Slf4j;
import org.carball.gantry.model.schema.FieldGroupSchema;
import org.carball.gantry.model.schema.FieldSpec;
import org.carball.gantry.model.schema.GantryFields;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A single gantry transaction under construction or curation.
 *
 * <p>Fields are write-once: a field produced by one group can only change afterwards through
 * {@link #replace(String, Object, String)}, which records the change in the correction log.
 * The transaction id never changes once assigned.
 */
@Slf4j
public class TransactionRecord {

    private static final Set<String> LABEL_FIELDS = Set.of(
            GantryFields.VEHICLE_CATEGORY, GantryFields.TIME_PERIOD, GantryFields.SCENARIO);

    private final Map<String, Object> fields = new LinkedHashMap<>();
    private final RecordMetadata metadata;

    public TransactionRecord() {
        this.metadata = new RecordMetadata();
    }

    private TransactionRecord(Map<String, Object> fields, RecordMetadata metadata) {
        this.fields.putAll(fields);
        this.metadata = metadata;
    }

    /**
     * Builds a record from loosely typed values, e.g. one row of a reference pool export.
     * Values that do not fit their field spec are dropped; unknown keys are ignored.
     */
    public static TransactionRecord fromRaw(Map<String, ?> raw, FieldGroupSchema schema) {
        TransactionRecord record = new TransactionRecord();
        for (String field : schema.getAllFields()) {
            Object value = raw.get(field);
            if (value == null) {
                continue;
            }
            FieldSpec spec = schema.getSpec(field);
            try {
                record.fields.put(field, spec.coerce(value));
            } catch (IllegalArgumentException e) {
                log.debug("Dropping reference value: {}", e.getMessage());
            }
        }
        for (String label : LABEL_FIELDS) {
            Object value = raw.get(label);
            if (value != null) {
                record.fields.put(label, String.valueOf(value));
            }
        }
        return record;
    }

    /**
     * Sets a field that has no value yet.
     *
     * @throws IllegalStateException when the field is already assigned
     */
    public void assign(String field, Object value) {
        if (fields.containsKey(field)) {
            throw new IllegalStateException("Field '" + field + "' is already assigned");
        }
        fields.put(field, value);
    }

    /**
     * Overwrites a field and appends the change to the correction log.
     */
    public void replace(String field, Object newValue, String reason) {
        if (GantryFields.TRANSACTION_ID.equals(field) && fields.containsKey(field)) {
            throw new IllegalStateException("The transaction id cannot be changed");
        }
        Object old = fields.put(field, newValue);
        metadata.getCorrectionLog().add(new CorrectionEntry(field, old, newValue, reason));
    }

    /**
     * Sets a derived label. Labels are recomputed freely and are not logged.
     */
    public void putLabel(String label, String value) {
        if (!LABEL_FIELDS.contains(label)) {
            throw new IllegalArgumentException("Not a label field: " + label);
        }
        fields.put(label, value);
    }

    public void logCorrection(String field, Object oldValue, Object newValue, String reason) {
        metadata.getCorrectionLog().add(new CorrectionEntry(field, oldValue, newValue, reason));
    }

    public void addIssue(String issue) {
        metadata.getValidationIssues().add(issue);
    }

    public boolean has(String field) {
        return fields.get(field) != null;
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public String getString(String field) {
        Object value = fields.get(field);
        return value == null ? null : String.valueOf(value);
    }

    /**
     * Returns the value as a long when it is numeric (or a numeric string), otherwise null.
     */
    public Long getLong(String field) {
        Object value = fields.get(field);
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text) {
            try {
                return Long.parseLong(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public LocalDateTime getTime(String field) {
        Object value = fields.get(field);
        return value instanceof LocalDateTime time ? time : null;
    }

    public String getId() {
        return getString(GantryFields.TRANSACTION_ID);
    }

    @JsonAnyGetter
    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    @JsonProperty("_metadata")
    public RecordMetadata getMetadata() {
        return metadata;
    }

    /**
     * Deep enough copy for curation: fields are immutable values, metadata lists are duplicated.
     */
    public TransactionRecord copy() {
        return new TransactionRecord(fields, metadata.copy());
    }

    @Override
    public String toString() {
        return "TransactionRecord" + fields;
    }
}
