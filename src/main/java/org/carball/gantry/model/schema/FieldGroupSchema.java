package org.carball.gantry.model.schema;

import lombok.extern.slf4j.Slf4j;
import org.carball.gantry.PipelineException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validated field-group DAG. The generation order is computed once, at construction.
 */
@Slf4j
public class FieldGroupSchema {

    private final Map<String, FieldGroup> groups;
    private final Map<String, FieldSpec> specs;
    private final Map<String, String> groupOfField;
    private final List<FieldGroup> generationOrder;

    public FieldGroupSchema(List<FieldGroup> declaredGroups, Map<String, FieldSpec> specs) {
        this.groups = indexGroups(declaredGroups);
        this.specs = Collections.unmodifiableMap(new LinkedHashMap<>(specs));
        this.groupOfField = indexFields(declaredGroups, specs);
        this.generationOrder = Collections.unmodifiableList(topologicalOrder(declaredGroups));

        log.debug("Field group order: {}", generationOrder.stream().map(FieldGroup::name).toList());
    }

    public static FieldGroupSchema gantryDefault() {
        return new FieldGroupSchema(GantryFields.defaultGroups(), GantryFields.defaultSpecs());
    }

    public List<FieldGroup> getGenerationOrder() {
        return generationOrder;
    }

    public FieldGroup getGroup(String name) {
        FieldGroup group = groups.get(name);
        if (group == null) {
            throw new IllegalArgumentException("Unknown field group: " + name);
        }
        return group;
    }

    public FieldSpec getSpec(String field) {
        return specs.get(field);
    }

    public Map<String, FieldSpec> getSpecs() {
        return specs;
    }

    /**
     * Every field produced by some group, in generation order.
     */
    public List<String> getAllFields() {
        List<String> fields = new ArrayList<>();
        for (FieldGroup group : generationOrder) {
            fields.addAll(group.fields());
        }
        return fields;
    }

    public String groupOf(String field) {
        return groupOfField.get(field);
    }

    private static Map<String, FieldGroup> indexGroups(List<FieldGroup> declaredGroups) {
        if (declaredGroups == null || declaredGroups.isEmpty()) {
            throw PipelineException.configuration("Field group schema declares no groups");
        }
        Map<String, FieldGroup> index = new LinkedHashMap<>();
        for (FieldGroup group : declaredGroups) {
            if (index.put(group.name(), group) != null) {
                throw PipelineException.configuration("Duplicate field group: " + group.name());
            }
        }
        for (FieldGroup group : declaredGroups) {
            for (String prerequisite : group.prerequisites()) {
                if (!index.containsKey(prerequisite)) {
                    throw PipelineException.configuration(String.format(
                            "Field group '%s' depends on unknown group '%s'", group.name(), prerequisite));
                }
            }
        }
        return Collections.unmodifiableMap(index);
    }

    private static Map<String, String> indexFields(List<FieldGroup> declaredGroups, Map<String, FieldSpec> specs) {
        Map<String, String> index = new LinkedHashMap<>();
        for (FieldGroup group : declaredGroups) {
            if (group.fields().isEmpty()) {
                throw PipelineException.configuration("Field group '" + group.name() + "' has no fields");
            }
            for (String field : group.fields()) {
                if (!specs.containsKey(field)) {
                    throw PipelineException.configuration(String.format(
                            "Field '%s' of group '%s' has no field spec", field, group.name()));
                }
                String previous = index.put(field, group.name());
                if (previous != null) {
                    throw PipelineException.configuration(String.format(
                            "Field '%s' is declared by both '%s' and '%s'", field, previous, group.name()));
                }
            }
        }
        return Collections.unmodifiableMap(index);
    }

    /**
     * Kahn's algorithm; among ready groups the earliest declared one goes first.
     */
    private static List<FieldGroup> topologicalOrder(List<FieldGroup> declaredGroups) {
        List<FieldGroup> order = new ArrayList<>();
        Set<String> emitted = new HashSet<>();
        Set<FieldGroup> pending = new LinkedHashSet<>(declaredGroups);

        while (!pending.isEmpty()) {
            FieldGroup ready = null;
            for (FieldGroup candidate : pending) {
                if (emitted.containsAll(candidate.prerequisites())) {
                    ready = candidate;
                    break;
                }
            }
            if (ready == null) {
                List<String> stuck = pending.stream().map(FieldGroup::name).toList();
                throw PipelineException.configuration("Cyclic field group dependencies among " + stuck);
            }
            order.add(ready);
            emitted.add(ready.name());
            pending.remove(ready);
        }
        return order;
    }
}
