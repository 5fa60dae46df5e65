package com.fieldops.application.validation;

import com.fieldops.application.CoreFixture;
import com.fieldops.application.TestMetadata;
import com.fieldops.domain.error.FieldViolation;
import com.fieldops.domain.error.ValidationFailedException;
import com.fieldops.domain.error.ViolationKind;
import com.fieldops.domain.metadata.EntityMetadata;
import com.fieldops.domain.metadata.Operation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValidationSchemaBuilderTest {

    private CoreFixture core;
    private ValidationSchemaBuilder builder;
    private final EntityMetadata workOrder = TestMetadata.workOrder();
    private final EntityMetadata invoice = TestMetadata.invoice();

    @BeforeEach
    void setUp() {
        core = new CoreFixture();
        builder = core.schemas;
    }

    @Test
    void createRequirementsNarrowToWhatTheRoleMayCreate() {
        ValidationSchema asCustomer = builder.buildEntitySchema(workOrder, Operation.CREATE, "customer");
        // priority is required in metadata but only dispatchers may set it
        assertThat(asCustomer.requiredFields()).containsExactly("title", "customer_id");
        assertThat(asCustomer.fields()).doesNotContainKeys("priority", "scheduled_date", "work_order_number");

        Map<String, Object> ok = asCustomer.validateOrThrow(Map.of("title", "Leaking tap", "customer_id", 4));
        assertThat(ok).containsEntry("title", "Leaking tap").containsEntry("customer_id", 4L);

        ValidationSchema asDispatcher = builder.buildEntitySchema(workOrder, Operation.CREATE, "dispatcher");
        assertThat(asDispatcher.requiredFields()).containsExactly("title", "customer_id", "priority");
        assertThatThrownBy(() -> asDispatcher.validateOrThrow(Map.of("title", "Leaking tap", "customer_id", 4)))
                .isInstanceOf(ValidationFailedException.class)
                .satisfies(e -> assertThat(((ValidationFailedException) e).violations())
                        .extracting(FieldViolation::field).containsExactly("priority"));
    }

    @Test
    void missingRequiredFieldIsRejectedWithCustomMessage() {
        ValidationSchema s = builder.buildEntitySchema(workOrder, Operation.CREATE, "customer");
        ValidationResult r = s.validate(Map.of("customer_id", 4));
        assertThat(r.isValid()).isFalse();
        assertThat(r.violations()).containsExactly(
                new FieldViolation("title", ViolationKind.REQUIRED, "A title is needed"));
    }

    @Test
    void unknownFieldsAreStrippedNotRejected() {
        ValidationSchema s = builder.buildEntitySchema(workOrder, Operation.CREATE, "customer");
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("title", "Broken boiler");
        payload.put("customer_id", 1);
        payload.put("is_admin", true);
        payload.put("priority", "urgent");

        ValidationResult r = s.validate(payload);
        assertThat(r.isValid()).isTrue();
        assertThat(r.value()).containsOnlyKeys("title", "customer_id");
        assertThat(r.stripped()).containsExactlyInAnyOrder("is_admin", "priority");
    }

    @Test
    void collectsAllViolations() {
        ValidationSchema s = builder.buildEntitySchema(invoice, Operation.CREATE, "dispatcher");
        ValidationResult r = s.validate(Map.of("customer_id", 0, "amount", "12.345", "due_date", "soon"));
        assertThat(r.violations()).extracting(FieldViolation::field)
                .containsExactly("customer_id", "amount", "due_date");
        assertThat(r.violations()).extracting(FieldViolation::kind)
                .containsExactly(ViolationKind.RANGE, ViolationKind.FORMAT, ViolationKind.FORMAT);
    }

    @Test
    void statusIsValidatedForDispatcherOnInvoiceCreate() {
        ValidationSchema s = builder.buildEntitySchema(invoice, Operation.CREATE, "dispatcher");
        Map<String, Object> value = s.validateOrThrow(Map.of("customer_id", 2, "amount", 40, "status", "sent"));
        assertThat(value).containsEntry("status", "sent").containsEntry("amount", new BigDecimal("40"));

        assertThat(s.validate(Map.of("customer_id", 2, "amount", 40, "status", "lost")).violations())
                .extracting(FieldViolation::kind).containsExactly(ViolationKind.ENUM);
    }

    @Test
    void defaultsApplyOnCreateOnly() {
        ValidationSchema create = builder.buildEntitySchema(invoice, Operation.CREATE, "dispatcher");
        assertThat(create.validateOrThrow(Map.of("customer_id", 2, "amount", 1))).containsEntry("status", "draft");

        ValidationSchema update = builder.buildEntitySchema(invoice, Operation.UPDATE, "manager");
        assertThat(update.validateOrThrow(Map.of("amount", 2))).doesNotContainKey("status");
    }

    @Test
    void updateSchemaExcludesImmutableAndMakesEverythingOptional() {
        ValidationSchema s = builder.buildEntitySchema(workOrder, Operation.UPDATE, "admin");
        assertThat(s.fields()).doesNotContainKeys("work_order_number", "customer_id");
        assertThat(s.requiredFields()).isEmpty();
        assertThat(s.validateOrThrow(Map.of())).isEmpty();
    }

    @Test
    void unrestrictedSchemaForSystemCallers() {
        ValidationSchema s = builder.buildEntitySchema(workOrder, Operation.CREATE, null);
        assertThat(s.role()).isNull();
        assertThat(s.fields()).containsKeys("priority", "scheduled_date", "work_order_number");
        assertThat(s.requiredFields()).containsExactly("title", "customer_id", "priority");
    }

    @Test
    void schemasAreCachedPerEntityOperationAndNormalizedRole() {
        ValidationSchema a = builder.buildEntitySchema(workOrder, Operation.CREATE, "Dispatcher");
        ValidationSchema b = builder.buildEntitySchema(workOrder, Operation.CREATE, 3);
        ValidationSchema c = builder.buildEntitySchema(workOrder, Operation.CREATE, null);
        builder.buildEntitySchema(workOrder, Operation.UPDATE, "dispatcher");

        assertThat(a).isSameAs(b);
        assertThat(c).isNotSameAs(a);
        assertThat(builder.cachedKeys()).containsExactlyInAnyOrder(
                "work_order:create:dispatcher", "work_order:create", "work_order:update:dispatcher");

        builder.clearCache();
        assertThat(builder.cachedKeys()).isEmpty();
        assertThat(builder.buildEntitySchema(workOrder, Operation.CREATE, "dispatcher")).isNotSameAs(a);
    }

    @Test
    void reloadingRolesClearsSchemaCache() {
        builder.buildEntitySchema(invoice, Operation.CREATE, "dispatcher");
        core.roles.reload();
        assertThat(builder.cachedKeys()).isEmpty();
    }

    @Test
    void onlyWriteOperationsHaveSchemas() {
        assertThatThrownBy(() -> builder.buildEntitySchema(invoice, Operation.READ, "admin"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
