package org.carball.gantry.reference;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.AccessLevel;
import lombok.Data;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.carball.gantry.FailureKind;
import org.carball.gantry.PipelineException;

import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static business tables: axle weight limits, toll rates and the gantry/section catalog.
 */
@Data
@Slf4j
public class ReferenceTables {

    public static final String DEFAULT_RESOURCE = "/reference-tables.yml";

    private Map<Integer, Long> axleWeightLimits = new LinkedHashMap<>();
    private Map<Integer, Integer> expectedAxles = new LinkedHashMap<>();
    private WeightRange passengerWeight = new WeightRange();
    private TollRates tollRates = new TollRates();
    private double etcDiscountRate = 0.05;
    private List<Section> sections = new ArrayList<>();

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private transient Map<String, Section> sectionByGantry = Map.of();
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private transient Map<String, Section> sectionById = Map.of();

    @Data
    public static class WeightRange {
        private long min;
        private long max;
    }

    @Data
    public static class TollRates {
        private Map<Integer, Double> passenger = new LinkedHashMap<>();
        private double truckNormal;
        private double truckBridge;
        private double truckNormalShare;

        /**
         * Blended truck and special-vehicle rate over plain and bridge/tunnel stretches.
         */
        public double truckBlended() {
            return truckNormal * truckNormalShare + truckBridge * (1 - truckNormalShare);
        }
    }

    @Data
    public static class Section {
        private String id;
        private String name;
        private List<String> gantries = new ArrayList<>();
        private List<LocalDate> dates = new ArrayList<>();
    }

    private static volatile ReferenceTables defaultTables;

    /**
     * Tables bundled with the application, parsed once.
     */
    public static ReferenceTables loadDefault() {
        ReferenceTables tables = defaultTables;
        if (tables == null) {
            synchronized (ReferenceTables.class) {
                if (defaultTables == null) {
                    defaultTables = load(DEFAULT_RESOURCE);
                }
                tables = defaultTables;
            }
        }
        return tables;
    }

    public static ReferenceTables load(String resource) {
        ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
        yamlMapper.registerModule(new JavaTimeModule());
        yamlMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        try (InputStream in = ReferenceTables.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw PipelineException.configuration("Reference tables not found on classpath: " + resource);
            }
            ReferenceTables tables = yamlMapper.readValue(in, ReferenceTables.class);
            tables.check(resource);
            log.debug("Loaded reference tables from {}: {} sections, {} axle limits",
                    resource, tables.sections.size(), tables.axleWeightLimits.size());
            return tables;
        } catch (IOException e) {
            throw new PipelineException(FailureKind.CONFIGURATION,
                    "Failed to read reference tables " + resource + ": " + e.getMessage(), e);
        }
    }

    private void check(String resource) {
        if (axleWeightLimits.isEmpty() || sections.isEmpty() || tollRates.getPassenger().isEmpty()) {
            throw PipelineException.configuration("Reference tables " + resource + " are incomplete");
        }
        Map<String, Section> byGantry = new LinkedHashMap<>();
        Map<String, Section> byId = new LinkedHashMap<>();
        for (Section section : sections) {
            byId.put(section.getId(), section);
            for (String gantry : section.getGantries()) {
                byGantry.put(gantry, section);
            }
        }
        sectionByGantry = Collections.unmodifiableMap(byGantry);
        sectionById = Collections.unmodifiableMap(byId);
    }

    /**
     * Section owning a gantry, or null for an unknown gantry.
     */
    public Section sectionOfGantry(String gantryId) {
        return gantryId == null ? null : sectionByGantry.get(gantryId);
    }

    public Section section(String sectionId) {
        return sectionId == null ? null : sectionById.get(sectionId);
    }

    public List<String> allGantries() {
        return new ArrayList<>(sectionByGantry.keySet());
    }

    /**
     * Weight limit for an axle count; counts beyond the table use the largest configured limit.
     */
    public long axleLimit(long axleCount) {
        Long limit = axleWeightLimits.get((int) axleCount);
        if (limit != null) {
            return limit;
        }
        int nearest = axleCount < 2 ? 2 : Collections.max(axleWeightLimits.keySet());
        return axleWeightLimits.getOrDefault(nearest, Collections.max(axleWeightLimits.values()));
    }

    /**
     * Expected axle count for a vehicle_type code, or null when the code is unknown.
     */
    public Integer expectedAxles(long vehicleType) {
        return expectedAxles.get((int) vehicleType);
    }
}
