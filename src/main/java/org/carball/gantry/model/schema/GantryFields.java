package org.carball.gantry.model.schema;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Field names and specs of a gantry transaction.
 */
public final class GantryFields {

    public static final String GROUP_IDENTITY = "identity";
    public static final String GROUP_TIME = "time";
    public static final String GROUP_VEHICLE = "vehicle";
    public static final String GROUP_STATUS = "status";
    public static final String GROUP_FEE = "fee";

    public static final String TRANSACTION_ID = "gantry_transaction_id";
    public static final String PASS_ID = "pass_id";
    public static final String GANTRY_ID = "gantry_id";
    public static final String SECTION_ID = "section_id";
    public static final String SECTION_NAME = "section_name";

    public static final String TRANSACTION_TIME = "transaction_time";
    public static final String ENTRANCE_TIME = "entrance_time";

    public static final String VEHICLE_TYPE = "vehicle_type";
    public static final String AXLE_COUNT = "axle_count";
    public static final String TOTAL_WEIGHT = "total_weight";
    public static final String VEHICLE_SIGN = "vehicle_sign";

    public static final String GANTRY_TYPE = "gantry_type";
    public static final String MEDIA_TYPE = "media_type";
    public static final String TRANSACTION_TYPE = "transaction_type";
    public static final String PASS_STATE = "pass_state";
    public static final String CPU_CARD_TYPE = "cpu_card_type";

    public static final String PAY_FEE = "pay_fee";
    public static final String DISCOUNT_FEE = "discount_fee";
    public static final String FEE_MILEAGE = "fee_mileage";

    // Labels derived by the enhancer, not produced by any group
    public static final String VEHICLE_CATEGORY = "vehicle_category";
    public static final String TIME_PERIOD = "time_period";
    public static final String SCENARIO = "scenario";

    public static final List<String> NUMERIC_STATISTIC_FIELDS = List.of(PAY_FEE, FEE_MILEAGE, TOTAL_WEIGHT, DISCOUNT_FEE);
    public static final List<String> WEIGHTED_FIELDS = List.of(PAY_FEE, FEE_MILEAGE, TOTAL_WEIGHT);

    public static final String PASS_STATE_NO_ENTRY = "2";
    public static final String TRANSACTION_TYPE_COMPOSITE = "09";
    public static final long MEDIA_TYPE_OBU = 1L;

    private GantryFields() {
    }

    public static List<FieldGroup> defaultGroups() {
        return List.of(
                FieldGroup.of(GROUP_IDENTITY, List.of(TRANSACTION_ID, PASS_ID, GANTRY_ID, SECTION_ID, SECTION_NAME)),
                FieldGroup.of(GROUP_TIME, List.of(TRANSACTION_TIME, ENTRANCE_TIME), GROUP_IDENTITY),
                FieldGroup.of(GROUP_VEHICLE, List.of(VEHICLE_TYPE, AXLE_COUNT, TOTAL_WEIGHT, VEHICLE_SIGN)),
                FieldGroup.of(GROUP_STATUS, List.of(GANTRY_TYPE, MEDIA_TYPE, TRANSACTION_TYPE, PASS_STATE, CPU_CARD_TYPE),
                        GROUP_VEHICLE),
                FieldGroup.of(GROUP_FEE, List.of(PAY_FEE, DISCOUNT_FEE, FEE_MILEAGE), GROUP_VEHICLE, GROUP_STATUS)
        );
    }

    public static Map<String, FieldSpec> defaultSpecs() {
        Map<String, FieldSpec> specs = new LinkedHashMap<>();
        put(specs, text(TRANSACTION_ID, "gantry id + batch timestamp + serial number"));
        put(specs, text(PASS_ID, "passage id: media prefix + card number + entry time"));
        put(specs, text(GANTRY_ID, "gantry id from the gantry catalog"));
        put(specs, text(SECTION_ID, "road section id that owns the gantry"));
        put(specs, text(SECTION_NAME, "road section name"));

        put(specs, FieldSpec.builder().name(TRANSACTION_TIME).kind(FieldKind.TIMESTAMP)
                .description("ISO timestamp of the gantry transaction").build());
        put(specs, FieldSpec.builder().name(ENTRANCE_TIME).kind(FieldKind.TIMESTAMP)
                .description("ISO timestamp of highway entry, earlier than transaction_time").build());

        put(specs, FieldSpec.builder().name(VEHICLE_TYPE).kind(FieldKind.INTEGER)
                .description("vehicle class code: 1-4 passenger, 11-16 truck, 21-26 special")
                .allowedValues(List.of("1", "2", "3", "4", "11", "12", "13", "14", "15", "16",
                        "21", "22", "23", "24", "25", "26"))
                .build());
        put(specs, FieldSpec.builder().name(AXLE_COUNT).kind(FieldKind.INTEGER)
                .description("number of axles").min(2L).max(6L).build());
        put(specs, FieldSpec.builder().name(TOTAL_WEIGHT).kind(FieldKind.INTEGER)
                .description("gross weight in kg").min(500L).max(100_000L).build());
        put(specs, FieldSpec.builder().name(VEHICLE_SIGN).kind(FieldKind.STRING)
                .description("vehicle status flag: 0x00 oversize, 0x01 regular, 0x02 green lane, 0x03 harvester, 0x04 container, 0xff default")
                .allowedValues(List.of("0x00", "0x01", "0x02", "0x03", "0x04", "0xff"))
                .build());

        put(specs, FieldSpec.builder().name(GANTRY_TYPE).kind(FieldKind.STRING)
                .description("1 road section, 2 provincial entry, 3 provincial exit")
                .allowedValues(List.of("1", "2", "3")).build());
        put(specs, FieldSpec.builder().name(MEDIA_TYPE).kind(FieldKind.INTEGER)
                .description("1 OBU, 2 CPC card").min(1L).max(2L).build());
        put(specs, FieldSpec.builder().name(TRANSACTION_TYPE).kind(FieldKind.STRING)
                .description("06 traditional PBOC transaction, 09 composite transaction")
                .allowedValues(List.of("06", "09")).build());
        put(specs, FieldSpec.builder().name(PASS_STATE).kind(FieldKind.STRING)
                .description("1 with entry record, 2 without entry record")
                .allowedValues(List.of("1", "2")).build());
        put(specs, FieldSpec.builder().name(CPU_CARD_TYPE).kind(FieldKind.STRING)
                .description("0 default, 1 stored value card, 2 account card")
                .allowedValues(List.of("0", "1", "2")).build());

        put(specs, FieldSpec.builder().name(PAY_FEE).kind(FieldKind.INTEGER)
                .description("fee before discount, in cents").min(0L).max(10_000_000L).build());
        put(specs, FieldSpec.builder().name(DISCOUNT_FEE).kind(FieldKind.INTEGER)
                .description("discount in cents, 0 when none").min(0L).max(10_000_000L).build());
        put(specs, FieldSpec.builder().name(FEE_MILEAGE).kind(FieldKind.INTEGER)
                .description("charged distance in meters").min(1L).max(2_000_000L).build());
        return specs;
    }

    private static FieldSpec text(String name, String description) {
        return FieldSpec.builder().name(name).kind(FieldKind.STRING).description(description).build();
    }

    private static void put(Map<String, FieldSpec> specs, FieldSpec spec) {
        specs.put(spec.getName(), spec);
    }
}
