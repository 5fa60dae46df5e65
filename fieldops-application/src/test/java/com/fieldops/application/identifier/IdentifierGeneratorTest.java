package com.fieldops.application.identifier;

import com.fieldops.application.CoreFixture;
import com.fieldops.application.TestMetadata;
import com.fieldops.application.ports.IdentifierSequencePort;
import com.fieldops.application.ports.impl.InMemoryRecordStore;
import com.fieldops.domain.error.ConfigurationException;
import com.fieldops.domain.metadata.EntityMetadata;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IdentifierGeneratorTest {

    private final EntityMetadata workOrder = TestMetadata.workOrder();

    private static IdentifierGenerator withMax(String max) {
        IdentifierSequencePort port = (table, field, prefix) -> Optional.ofNullable(max);
        return new IdentifierGenerator(port, CoreFixture.CLOCK);
    }

    @Test
    void firstIdentifierOfTheYearIsOne() {
        assertThat(withMax(null).generateIdentifier(workOrder)).isEqualTo("WO-2026-0001");
    }

    @Test
    void incrementsExistingMaximum() {
        assertThat(withMax("WO-2026-0009").generateIdentifier(workOrder)).isEqualTo("WO-2026-0010");
        assertThat(withMax("WO-2026-0410").generateIdentifier(workOrder)).isEqualTo("WO-2026-0411");
    }

    @Test
    void growsPastFourDigits() {
        String next = withMax("WO-2026-9999").generateIdentifier(workOrder);
        assertThat(next).isEqualTo("WO-2026-10000");
        assertThat(IdentifierGenerator.IDENTIFIER_PATTERN.matcher(next).matches()).isTrue();
        assertThat(withMax("WO-2026-10000").generateIdentifier(workOrder)).isEqualTo("WO-2026-10001");
    }

    @Test
    void asksForTheCurrentYearOnly() {
        IdentifierSequencePort port = (table, field, prefix) -> {
            assertThat(table).isEqualTo("work_orders");
            assertThat(field).isEqualTo("work_order_number");
            assertThat(prefix).isEqualTo("WO-2026-");
            return Optional.empty();
        };
        new IdentifierGenerator(port, CoreFixture.CLOCK).generateIdentifier(workOrder);
    }

    @Test
    void maximumIsNumericNotLexicographic() {
        InMemoryRecordStore store = new InMemoryRecordStore();
        store.seed(workOrder, Map.of("work_order_number", "WO-2026-9999"));
        store.seed(workOrder, Map.of("work_order_number", "WO-2026-10000"));
        store.seed(workOrder, Map.of("work_order_number", "WO-2025-12345"));

        assertThat(new IdentifierGenerator(store, CoreFixture.CLOCK).generateIdentifier(workOrder))
                .isEqualTo("WO-2026-10001");
    }

    @Test
    void deletedIdentifiersAreNotReused() {
        InMemoryRecordStore store = new InMemoryRecordStore();
        store.seed(workOrder, Map.of("id", 1L, "work_order_number", "WO-2026-0001"));
        store.seed(workOrder, Map.of("id", 2L, "work_order_number", "WO-2026-0002"));
        store.delete(workOrder, 2L);

        assertThat(new IdentifierGenerator(store, CoreFixture.CLOCK).generateIdentifier(workOrder))
                .isEqualTo("WO-2026-0003");
    }

    @Test
    void missingConfigurationIsReported() {
        EntityMetadata noPrefix = TestMetadata.customer();
        assertThatThrownBy(() -> withMax(null).generateIdentifier(noPrefix))
                .isInstanceOf(ConfigurationException.class)
                .satisfies(e -> assertThat(((ConfigurationException) e).details())
                        .containsExactly("identifierPrefix", "identityField"));
    }

    @Test
    void rejectsNonNumericSequences() {
        assertThatThrownBy(() -> withMax("WO-2026-00A1").generateIdentifier(workOrder))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void rejectsSequencesTooLongToCount() {
        assertThatThrownBy(() -> withMax("WO-2026-12345678901234567890").generateIdentifier(workOrder))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("out of range")
                .hasCauseInstanceOf(NumberFormatException.class);
    }
}
