package org.carball.gantry.generation;

import net.datafaker.Faker;
import org.carball.gantry.model.condition.GenerationCondition;
import org.carball.gantry.model.condition.Scenario;
import org.carball.gantry.model.condition.TimePeriod;
import org.carball.gantry.model.condition.VehicleCategory;
import org.carball.gantry.model.record.TransactionRecord;
import org.carball.gantry.model.schema.GantryFields;
import org.carball.gantry.model.stats.FieldStatistics;
import org.carball.gantry.model.stats.LearnedStatistics;
import org.carball.gantry.reference.FeeCalculator;
import org.carball.gantry.reference.ReferenceTables;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Deterministic stand-in for the oracle. Given the same request (and the same per-record random)
 * it produces the same values, already typed and within every field spec.
 */
public class RuleBasedGroupGenerator {

    private static final DateTimeFormatter BATCH_FORMAT = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");
    private static final long MIN_MILEAGE = 1_000;
    private static final long MAX_MILEAGE = 2_000_000;
    private static final long MIN_FEE = 10;
    private static final double ETC_DISCOUNT_SHARE = 0.85;
    private static final double STRONG_CORRELATION = 0.3;

    private final ReferenceTables tables;
    private final FeeCalculator feeCalculator;
    private final SectionDateMapper dateMapper;
    private final LearnedStatistics statistics;

    public RuleBasedGroupGenerator(ReferenceTables tables, FeeCalculator feeCalculator,
                                   SectionDateMapper dateMapper, LearnedStatistics statistics) {
        this.tables = tables;
        this.feeCalculator = feeCalculator;
        this.dateMapper = dateMapper;
        this.statistics = statistics == null ? LearnedStatistics.empty() : statistics;
    }

    public Map<String, Object> generate(GroupRequest request) {
        Faker faker = new Faker(request.random());
        return switch (request.group().name()) {
            case GantryFields.GROUP_IDENTITY -> identity(request, faker);
            case GantryFields.GROUP_TIME -> time(request);
            case GantryFields.GROUP_VEHICLE -> vehicle(request);
            case GantryFields.GROUP_STATUS -> status(request);
            case GantryFields.GROUP_FEE -> fee(request);
            default -> throw new IllegalArgumentException("No rule for field group " + request.group().name());
        };
    }

    private Map<String, Object> identity(GroupRequest request, Faker faker) {
        List<String> gantries = tables.allGantries();
        String gantryId = gantries.get(request.random().nextInt(gantries.size()));
        ReferenceTables.Section section = tables.sectionOfGantry(gantryId);
        String batch = request.condition().baseTime().format(BATCH_FORMAT);

        Map<String, Object> values = new LinkedHashMap<>();
        values.put(GantryFields.TRANSACTION_ID, gantryId + batch + "1"
                + String.format("%05d", request.sequence() % 100_000) + faker.number().digits(3));
        values.put(GantryFields.PASS_ID, "015301" + faker.number().digits(16) + batch);
        values.put(GantryFields.GANTRY_ID, gantryId);
        values.put(GantryFields.SECTION_ID, section.getId());
        values.put(GantryFields.SECTION_NAME, section.getName());
        return values;
    }

    private Map<String, Object> time(GroupRequest request) {
        Random random = request.random();
        String sectionId = request.partial().getString(GantryFields.SECTION_ID);
        LocalDate date = sectionId != null
                ? dateMapper.dateFor(sectionId, random)
                : request.condition().baseTime().toLocalDate();

        LocalDateTime transaction = date.atTime(hourIn(request.condition().timePeriod(), random),
                random.nextInt(60), random.nextInt(60));
        long travelSeconds = 1_800 + random.nextInt(9_000);

        Map<String, Object> values = new LinkedHashMap<>();
        values.put(GantryFields.TRANSACTION_TIME, transaction);
        values.put(GantryFields.ENTRANCE_TIME, transaction.minusSeconds(travelSeconds));
        return values;
    }

    static int hourIn(TimePeriod period, Random random) {
        return switch (period) {
            case MORNING_PEAK -> 7 + random.nextInt(2);
            case EVENING_PEAK -> 17 + random.nextInt(2);
            case OFF_PEAK -> 9 + random.nextInt(8);
            case NIGHT -> {
                int hour = random.nextInt(6);
                yield hour == 5 ? 23 : hour;
            }
        };
    }

    private Map<String, Object> vehicle(GroupRequest request) {
        GenerationCondition condition = request.condition();
        Random random = request.random();
        VehicleCategory category = condition.vehicleCategory();
        if (condition.scenario() == Scenario.OVERLOADED && category == VehicleCategory.PASSENGER) {
            category = VehicleCategory.TRUCK;
        }

        Map<String, Object> values = new LinkedHashMap<>();
        if (category == VehicleCategory.PASSENGER) {
            long vehicleType = random.nextDouble() < 0.85 ? 1 : 2;
            ReferenceTables.WeightRange range = tables.getPassengerWeight();
            values.put(GantryFields.VEHICLE_TYPE, vehicleType);
            values.put(GantryFields.AXLE_COUNT, 2L);
            values.put(GantryFields.TOTAL_WEIGHT, range.getMin() + (long) (random.nextDouble() * (range.getMax() - range.getMin())));
            values.put(GantryFields.VEHICLE_SIGN, random.nextDouble() < 0.8 ? "0x01" : "0xff");
            return values;
        }

        long vehicleType = category.getMinCode() + random.nextInt(category.getMaxCode() - category.getMinCode() + 1);
        Integer expected = tables.expectedAxles(vehicleType);
        long axles = expected != null ? expected : 2;
        long limit = tables.axleLimit(axles);
        double load = condition.scenario() == Scenario.OVERLOADED
                ? 1.05 + random.nextDouble() * 0.15
                : 0.6 + random.nextDouble() * 0.35;

        values.put(GantryFields.VEHICLE_TYPE, vehicleType);
        values.put(GantryFields.AXLE_COUNT, axles);
        values.put(GantryFields.TOTAL_WEIGHT, (long) (limit * load));
        values.put(GantryFields.VEHICLE_SIGN, vehicleSign(category, random));
        return values;
    }

    private static String vehicleSign(VehicleCategory category, Random random) {
        if (category == VehicleCategory.SPECIAL) {
            return random.nextDouble() < 0.5 ? "0x00" : "0x03";
        }
        double roll = random.nextDouble();
        if (roll < 0.75) {
            return "0x01";
        } else if (roll < 0.85) {
            return "0x02";
        } else if (roll < 0.95) {
            return "0x04";
        }
        return "0xff";
    }

    private Map<String, Object> status(GroupRequest request) {
        Random random = request.random();
        Scenario scenario = request.condition().scenario();

        double gantryRoll = random.nextDouble();
        String gantryType = gantryRoll < 0.8 ? "1" : gantryRoll < 0.9 ? "2" : "3";
        long mediaType = random.nextDouble() < 0.85 ? 1 : 2;
        String transactionType = scenario == Scenario.ANOMALOUS && random.nextBoolean() ? "09" : "06";
        String passState = scenario == Scenario.NORMAL ? "1" : "2";
        double cardRoll = random.nextDouble();
        String cardType = cardRoll < 0.1 ? "0" : cardRoll < 0.55 ? "1" : "2";

        Map<String, Object> values = new LinkedHashMap<>();
        values.put(GantryFields.GANTRY_TYPE, gantryType);
        values.put(GantryFields.MEDIA_TYPE, mediaType);
        values.put(GantryFields.TRANSACTION_TYPE, transactionType);
        values.put(GantryFields.PASS_STATE, passState);
        values.put(GantryFields.CPU_CARD_TYPE, cardType);
        return values;
    }

    private Map<String, Object> fee(GroupRequest request) {
        Random random = request.random();
        TransactionRecord partial = request.partial();
        Long vehicleTypeValue = partial.getLong(GantryFields.VEHICLE_TYPE);
        long vehicleType = vehicleTypeValue != null ? vehicleTypeValue : 1;
        VehicleCategory category = VehicleCategory.fromCode(vehicleType);

        long mileage;
        long payFee;
        FieldStatistics mileageStats = statistics.get(category, GantryFields.FEE_MILEAGE);
        FieldStatistics feeStats = statistics.get(category, GantryFields.PAY_FEE);
        if (mileageStats != null && feeStats != null) {
            mileage = clampMileage((long) (mileageStats.mean() + random.nextGaussian() * mileageStats.std()));
            double correlation = statistics.correlation(category);
            if (Math.abs(correlation) > STRONG_CORRELATION) {
                double slope = correlation * feeStats.std() / (mileageStats.std() + 1e-10);
                double expected = feeStats.mean() + slope * (mileage - mileageStats.mean());
                double noise = feeStats.std() * Math.sqrt(Math.max(0, 1 - correlation * correlation));
                payFee = Math.max(MIN_FEE, (long) (expected + random.nextGaussian() * noise));
            } else {
                payFee = Math.max(MIN_FEE, (long) (feeStats.mean() + random.nextGaussian() * feeStats.std()));
            }
        } else {
            mileage = 20_000 + random.nextInt(130_001);
            payFee = feeCalculator.expectedFee(vehicleType, mileage);
        }

        Long mediaType = partial.getLong(GantryFields.MEDIA_TYPE);
        boolean etc = mediaType == null || mediaType == GantryFields.MEDIA_TYPE_OBU;
        long discount = etc && random.nextDouble() < ETC_DISCOUNT_SHARE ? feeCalculator.etcDiscount(payFee) : 0;

        Map<String, Object> values = new LinkedHashMap<>();
        values.put(GantryFields.PAY_FEE, payFee);
        values.put(GantryFields.DISCOUNT_FEE, discount);
        values.put(GantryFields.FEE_MILEAGE, mileage);
        return values;
    }

    private static long clampMileage(long mileage) {
        return Math.max(MIN_MILEAGE, Math.min(MAX_MILEAGE, mileage));
    }
}
