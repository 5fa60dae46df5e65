package com.fieldops.domain.role;

import com.fieldops.domain.ErrorCategory;
import com.fieldops.domain.error.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoleHierarchyTest {

    private final RoleHierarchy hierarchy = RoleHierarchy.of(List.of(
            RoleRecord.of("customer", 1),
            RoleRecord.of("technician", 2),
            RoleRecord.of("dispatcher", 3),
            RoleRecord.of("manager", 4),
            RoleRecord.of("admin", 5)));

    @Test
    void ranksFollowListOrder() {
        assertThat(hierarchy.rank("customer")).isZero();
        assertThat(hierarchy.rank("admin")).isEqualTo(4);
        assertThat(hierarchy.rank(" Manager ")).isEqualTo(3);
        assertThat(hierarchy.rank("janitor")).isEqualTo(RoleHierarchy.UNKNOWN);
        assertThat(hierarchy.rank(null)).isEqualTo(RoleHierarchy.UNKNOWN);
    }

    @Test
    void resolvesPriorityToName() {
        assertThat(hierarchy.nameForPriority(3)).isEqualTo("dispatcher");
        assertThat(hierarchy.nameForPriority(42)).isNull();
        assertThat(hierarchy.lowest().name()).isEqualTo("customer");
        assertThat(hierarchy.highest().name()).isEqualTo("admin");
    }

    @Test
    void namesAreLowercased() {
        RoleHierarchy h = RoleHierarchy.of(List.of(RoleRecord.of("Customer", 1), RoleRecord.of("ADMIN", 2)));
        assertThat(h.names()).containsExactly("customer", "admin");
    }

    @Test
    void rejectsNonIncreasingPriorities() {
        assertThatThrownBy(() -> RoleHierarchy.of(List.of(
                RoleRecord.of("customer", 2),
                RoleRecord.of("technician", 2))))
                .isInstanceOf(ConfigurationException.class)
                .satisfies(e -> {
                    ConfigurationException ce = (ConfigurationException) e;
                    assertThat(ce.category()).isEqualTo(ErrorCategory.CONFIGURATION_ERROR);
                    assertThat(ce.details()).hasSize(1);
                });
    }

    @Test
    void rejectsDuplicatesAndEmpty() {
        assertThatThrownBy(() -> RoleHierarchy.of(List.of(RoleRecord.of("a", 1), RoleRecord.of("A", 2))))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Invalid role hierarchy");
        assertThatThrownBy(() -> RoleHierarchy.of(List.of()))
                .isInstanceOf(ConfigurationException.class);
    }
}
