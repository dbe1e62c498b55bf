package org.carball.gantry.curation;

import org.carball.gantry.GantryFixtures;
import org.carball.gantry.model.record.TransactionRecord;
import org.carball.gantry.model.schema.GantryFields;
import org.carball.gantry.reference.FeeCalculator;
import org.carball.gantry.reference.VehicleClassifier;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class RuleBasedAuxiliaryVerifierTest {

    private final AuxiliaryVerifier verifier = new RuleBasedAuxiliaryVerifier(
            new VehicleClassifier(GantryFixtures.tables()), new FeeCalculator(GantryFixtures.tables()));

    @Test
    void shouldAlignAxlesWithVehicleClass() {
        // Given
        TransactionRecord truck = GantryFixtures.truck(Map.of(GantryFields.VEHICLE_TYPE, 14));
        TransactionRecord passenger = GantryFixtures.passenger(Map.of(GantryFields.AXLE_COUNT, 3));

        // When
        List<TransactionRecord> verified = verifier.verify(List.of(truck, passenger));

        // Then
        assertThat(verified.get(0).get(GantryFields.AXLE_COUNT)).isEqualTo(4L);
        assertThat(verified.get(1).get(GantryFields.AXLE_COUNT)).isEqualTo(2L);
        assertThat(verified.get(0).getMetadata().getCorrectionLog()).singleElement()
                .satisfies(entry -> assertThat(entry.reason()).contains("vehicle_type 14"));
        assertThat(truck.get(GantryFields.AXLE_COUNT)).isEqualTo(3L);
    }

    @Test
    void shouldFlagFeeFarFromTariffWithoutChangingIt() {
        // When
        TransactionRecord verified = verifier.verify(List.of(GantryFixtures.truck(Map.of(GantryFields.PAY_FEE, 20000)))).get(0);

        // Then
        assertThat(verified.get(GantryFields.PAY_FEE)).isEqualTo(20000L);
        assertThat(verified.getMetadata().getValidationIssues()).singleElement().asString().contains("deviates");
        assertThat(verified.getMetadata().getCorrectionLog()).isEmpty();
    }

    @Test
    void shouldLeaveConsistentRecordUntouched() {
        TransactionRecord verified = verifier.verify(List.of(GantryFixtures.truck())).get(0);

        assertThat(verified.getFields()).isEqualTo(GantryFixtures.truck().getFields());
        assertThat(verified.getMetadata().getCorrectionLog()).isEmpty();
    }
}
