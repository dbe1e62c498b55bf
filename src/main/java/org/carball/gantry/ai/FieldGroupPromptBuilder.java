package org.carball.gantry.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.gantry.model.condition.GenerationCondition;
import org.carball.gantry.model.condition.Scenario;
import org.carball.gantry.model.condition.VehicleCategory;
import org.carball.gantry.model.record.TransactionRecord;
import org.carball.gantry.model.schema.FieldGroup;
import org.carball.gantry.model.schema.FieldGroupSchema;
import org.carball.gantry.model.schema.FieldSpec;
import org.carball.gantry.model.schema.GantryFields;
import org.carball.gantry.reference.FeeCalculator;
import org.carball.gantry.reference.ReferenceTables;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the prompt for one field group: target fields, condition constraints, values already
 * generated for the record and a few demonstrations.
 */
@Slf4j
public class FieldGroupPromptBuilder {

    private final FieldGroupSchema schema;
    private final ReferenceTables tables;
    private final FeeCalculator feeCalculator;
    private final ObjectMapper objectMapper;

    public FieldGroupPromptBuilder(FieldGroupSchema schema, ReferenceTables tables, FeeCalculator feeCalculator) {
        this.schema = schema;
        this.tables = tables;
        this.feeCalculator = feeCalculator;

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public String build(FieldGroup group, PromptContext context) {
        GenerationCondition condition = context.condition();
        StringBuilder prompt = new StringBuilder();

        prompt.append("## Field group: ").append(group.name()).append("\n\n");
        prompt.append("**Generation condition:** ").append(condition.describe()).append("\n\n");

        prompt.append("## Fields to generate:\n\n");
        for (String field : group.fields()) {
            FieldSpec spec = schema.getSpec(field);
            prompt.append("- ").append(field).append(" (").append(spec.getKind().name().toLowerCase()).append("): ")
                    .append(spec.getDescription());
            if (!spec.getAllowedValues().isEmpty()) {
                prompt.append("; one of ").append(spec.getAllowedValues());
            } else if (spec.getMin() != null || spec.getMax() != null) {
                prompt.append("; range ").append(spec.getMin() == null ? "" : spec.getMin())
                        .append("..").append(spec.getMax() == null ? "" : spec.getMax());
            }
            prompt.append("\n");
        }
        prompt.append("\n");

        String rules = groupRules(group, context);
        if (!rules.isEmpty()) {
            prompt.append("## Constraints:\n\n").append(rules).append("\n");
        }

        Map<String, Object> known = context.partial().getFields();
        if (!known.isEmpty()) {
            prompt.append("## Already generated for this record (do not change):\n\n");
            prompt.append(toJson(known)).append("\n\n");
        }

        if (!context.demonstrations().isEmpty()) {
            prompt.append("## Reference examples:\n\n");
            int index = 1;
            for (TransactionRecord demonstration : context.demonstrations()) {
                Map<String, Object> excerpt = new LinkedHashMap<>();
                for (String field : group.fields()) {
                    if (demonstration.has(field)) {
                        excerpt.put(field, demonstration.get(field));
                    }
                }
                if (!excerpt.isEmpty()) {
                    prompt.append("### Example ").append(index++).append("\n```json\n")
                            .append(toJson(excerpt)).append("\n```\n\n");
                }
            }
        }

        prompt.append("Output a JSON object with exactly these keys: ").append(group.fields()).append("\n");
        return prompt.toString();
    }

    private String groupRules(FieldGroup group, PromptContext context) {
        GenerationCondition condition = context.condition();
        StringBuilder rules = new StringBuilder();
        switch (group.name()) {
            case GantryFields.GROUP_IDENTITY -> {
                rules.append("- gantry_id, section_id and section_name must come from this catalog:\n");
                for (ReferenceTables.Section section : tables.getSections()) {
                    rules.append("  - ").append(section.getId()).append(" ").append(section.getName())
                            .append(": ").append(section.getGantries()).append("\n");
                }
                rules.append("- gantry_transaction_id starts with the gantry_id\n");
            }
            case GantryFields.GROUP_TIME -> {
                if (context.samplingDate() != null) {
                    rules.append("- transaction_time falls on ").append(context.samplingDate()).append("\n");
                }
                rules.append("- transaction_time lies within ").append(condition.timePeriod().getWindow()).append("\n");
                rules.append("- entrance_time is 30 minutes to 3 hours before transaction_time\n");
            }
            case GantryFields.GROUP_VEHICLE -> {
                VehicleCategory category = condition.scenario() == Scenario.OVERLOADED
                        && condition.vehicleCategory() == VehicleCategory.PASSENGER
                        ? VehicleCategory.TRUCK : condition.vehicleCategory();
                rules.append("- vehicle_type between ").append(category.getMinCode())
                        .append(" and ").append(category.getMaxCode()).append("\n");
                rules.append("- axle_count matches the vehicle_type; weight limits by axle count (kg): ")
                        .append(tables.getAxleWeightLimits()).append("\n");
                if (category == VehicleCategory.PASSENGER) {
                    rules.append("- passenger vehicles have 2 axles and weigh ")
                            .append(tables.getPassengerWeight().getMin()).append("-")
                            .append(tables.getPassengerWeight().getMax()).append(" kg\n");
                } else if (condition.scenario() == Scenario.OVERLOADED) {
                    rules.append("- overloaded scenario: total_weight 5%-20% above the axle limit\n");
                } else {
                    rules.append("- total_weight close to but not above the axle limit\n");
                }
            }
            case GantryFields.GROUP_STATUS -> {
                rules.append("- gantry_type 1 for about 80% of records; media_type 1 (OBU) for about 85%\n");
                if (condition.scenario() == Scenario.ANOMALOUS) {
                    rules.append("- anomalous scenario: pass_state \"2\" and/or transaction_type \"09\"\n");
                } else {
                    rules.append("- transaction_type \"06\" and pass_state \"1\"\n");
                }
            }
            case GantryFields.GROUP_FEE -> {
                Long vehicleType = context.partial().getLong(GantryFields.VEHICLE_TYPE);
                if (vehicleType != null) {
                    rules.append(String.format("- toll rate %.2f yuan/km for vehicle_type %d; pay_fee in cents%n",
                            feeCalculator.ratePerKm(vehicleType), vehicleType));
                    if (context.mileageHint() != null) {
                        rules.append("- fee_mileage about ").append(context.mileageHint()).append(" m, so pay_fee about ")
                                .append(feeCalculator.expectedFee(vehicleType, context.mileageHint())).append(" cents\n");
                    }
                }
                rules.append("- discount_fee is 5% of pay_fee for most OBU (media_type 1) users, otherwise 0\n");
            }
            default -> log.debug("No extra rules for field group {}", group.name());
        }
        return rules.toString();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize prompt context: {}", e.getMessage());
            return String.valueOf(value);
        }
    }
}
