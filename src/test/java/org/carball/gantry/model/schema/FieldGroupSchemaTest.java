package org.carball.gantry.model.schema;

import org.carball.gantry.FailureKind;
import org.carball.gantry.PipelineException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class FieldGroupSchemaTest {

    private static final Map<String, FieldSpec> SPECS = Map.of(
            "a", spec("a"), "b", spec("b"), "c", spec("c"));

    @Test
    void shouldOrderGantryGroupsByDependencies() {
        // When
        FieldGroupSchema schema = FieldGroupSchema.gantryDefault();

        // Then
        assertThat(schema.getGenerationOrder()).extracting(FieldGroup::name)
                .containsExactly("identity", "time", "vehicle", "status", "fee");
        assertThat(schema.getAllFields()).hasSize(19).startsWith("gantry_transaction_id");
        assertThat(schema.groupOf("pay_fee")).isEqualTo("fee");
    }

    @Test
    void shouldPlaceGroupsAfterLaterDeclaredPrerequisites() {
        // Given
        List<FieldGroup> groups = List.of(
                FieldGroup.of("first", List.of("a"), "last"),
                FieldGroup.of("middle", List.of("b")),
                FieldGroup.of("last", List.of("c")));

        // When
        FieldGroupSchema schema = new FieldGroupSchema(groups, SPECS);

        // Then
        assertThat(schema.getGenerationOrder()).extracting(FieldGroup::name)
                .containsExactly("middle", "last", "first");
    }

    @Test
    void shouldRejectCyclicDependencies() {
        // Given
        List<FieldGroup> groups = List.of(
                FieldGroup.of("x", List.of("a"), "y"),
                FieldGroup.of("y", List.of("b"), "x"));

        // When/Then
        assertThatThrownBy(() -> new FieldGroupSchema(groups, SPECS))
                .isInstanceOf(PipelineException.class)
                .hasMessageContaining("Cyclic")
                .satisfies(e -> assertThat(((PipelineException) e).getKind()).isEqualTo(FailureKind.CONFIGURATION));
    }

    @Test
    void shouldRejectUnknownPrerequisite() {
        // Given
        List<FieldGroup> groups = List.of(FieldGroup.of("x", List.of("a"), "missing"));

        // When/Then
        assertThatThrownBy(() -> new FieldGroupSchema(groups, SPECS))
                .isInstanceOf(PipelineException.class)
                .hasMessageContaining("unknown group 'missing'");
    }

    @Test
    void shouldRejectFieldDeclaredTwice() {
        // Given
        List<FieldGroup> groups = List.of(
                FieldGroup.of("x", List.of("a")),
                FieldGroup.of("y", List.of("a", "b")));

        // When/Then
        assertThatThrownBy(() -> new FieldGroupSchema(groups, SPECS))
                .isInstanceOf(PipelineException.class)
                .hasMessageContaining("declared by both");
    }

    @Test
    void shouldRejectFieldWithoutSpec() {
        // Given
        List<FieldGroup> groups = List.of(FieldGroup.of("x", List.of("unknown")));

        // When/Then
        assertThatThrownBy(() -> new FieldGroupSchema(groups, SPECS))
                .isInstanceOf(PipelineException.class)
                .hasMessageContaining("has no field spec");
    }

    @Test
    void shouldThrowForUnknownGroupLookup() {
        FieldGroupSchema schema = FieldGroupSchema.gantryDefault();

        assertThatThrownBy(() -> schema.getGroup("tolls"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static FieldSpec spec(String name) {
        return FieldSpec.builder().name(name).kind(FieldKind.STRING).description(name).build();
    }
}
