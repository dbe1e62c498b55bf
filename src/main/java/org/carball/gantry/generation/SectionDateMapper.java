package org.carball.gantry.generation;

import lombok.extern.slf4j.Slf4j;
import org.carball.gantry.model.record.TransactionRecord;
import org.carball.gantry.model.schema.GantryFields;
import org.carball.gantry.reference.ReferenceTables;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeSet;

/**
 * Known sampling dates per road section. Generated transactions for a section should fall on one
 * of its real sampling dates.
 */
@Slf4j
public class SectionDateMapper {

    private final Map<String, TreeSet<LocalDate>> sectionDates = new LinkedHashMap<>();
    private LocalDate defaultStart;
    private LocalDate defaultEnd;

    public SectionDateMapper(ReferenceTables tables) {
        for (ReferenceTables.Section section : tables.getSections()) {
            if (!section.getDates().isEmpty()) {
                sectionDates.put(section.getId(), new TreeSet<>(section.getDates()));
            }
        }
        updateDefaultRange();
    }

    /**
     * Merges the dates observed in a reference pool into the preconfigured ones.
     */
    public void learnFromSamples(List<TransactionRecord> samples) {
        int learned = 0;
        for (TransactionRecord sample : samples) {
            String sectionId = sample.getString(GantryFields.SECTION_ID);
            LocalDateTime time = sample.getTime(GantryFields.TRANSACTION_TIME);
            if (sectionId == null || time == null) {
                continue;
            }
            if (sectionDates.computeIfAbsent(sectionId, id -> new TreeSet<>()).add(time.toLocalDate())) {
                learned++;
            }
        }
        updateDefaultRange();
        log.info("Section-date map covers {} sections ({} new dates learned), default range {} ~ {}",
                sectionDates.size(), learned, defaultStart, defaultEnd);
    }

    /**
     * A sampling date for the section, or a date from the overall range for unknown sections.
     */
    public LocalDate dateFor(String sectionId, Random random) {
        TreeSet<LocalDate> dates = sectionId == null ? null : sectionDates.get(sectionId);
        if (dates == null || dates.isEmpty()) {
            return anyDate(random);
        }
        List<LocalDate> choices = new ArrayList<>(dates);
        return choices.get(random.nextInt(choices.size()));
    }

    public LocalDate anyDate(Random random) {
        long span = ChronoUnit.DAYS.between(defaultStart, defaultEnd);
        return defaultStart.plusDays(span <= 0 ? 0 : random.nextInt((int) span + 1));
    }

    /**
     * Section-date factual check. Sections without known dates pass.
     */
    public boolean isPlausible(String sectionId, LocalDate date) {
        TreeSet<LocalDate> dates = sectionId == null ? null : sectionDates.get(sectionId);
        if (dates == null || dates.isEmpty()) {
            return true;
        }
        return date != null && dates.contains(date);
    }

    public Map<String, List<LocalDate>> snapshot() {
        Map<String, List<LocalDate>> copy = new LinkedHashMap<>();
        sectionDates.forEach((id, dates) -> copy.put(id, List.copyOf(dates)));
        return Collections.unmodifiableMap(copy);
    }

    private void updateDefaultRange() {
        TreeSet<LocalDate> all = new TreeSet<>();
        sectionDates.values().forEach(all::addAll);
        if (all.isEmpty()) {
            defaultEnd = LocalDate.now();
            defaultStart = defaultEnd.minusDays(30);
        } else {
            defaultStart = all.first();
            defaultEnd = all.last();
        }
    }
}
