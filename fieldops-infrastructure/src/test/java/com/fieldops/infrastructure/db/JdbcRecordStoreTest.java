package com.fieldops.infrastructure.db;

import com.fieldops.application.errors.ConstraintKind;
import com.fieldops.application.errors.StorageConstraintException;
import com.fieldops.application.query.FilterCondition;
import com.fieldops.application.query.FilterOperator;
import com.fieldops.application.query.ListQuery;
import com.fieldops.domain.metadata.EntityMetadata;
import com.fieldops.domain.metadata.SortDirection;
import com.fieldops.infrastructure.H2Fixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcRecordStoreTest {

  private H2Fixture db;
  private JdbcRecordStore store;
  private EntityMetadata workOrder;
  private EntityMetadata customer;
  private long customerId;

  @BeforeEach
  void setUp() {
    db = new H2Fixture();
    store = new JdbcRecordStore(db.jdbc, db.txManager, db.json, new SqlConstraintClassifier());
    workOrder = db.catalog.require("work_order");
    customer = db.catalog.require("customer");
    customerId = db.insertCustomer("Acme", "ops@acme.test");
  }

  @Test
  void insertReturnsRowWithGeneratedColumns() {
    Map<String, Object> row = store.insert(workOrder, workOrder("WO-2026-0001", "Fix boiler"));

    assertThat(row.get("id")).isInstanceOf(Number.class);
    assertThat(row).containsEntry("work_order_number", "WO-2026-0001")
        .containsEntry("status", "pending")
        .containsEntry("scheduled_date", LocalDate.of(2026, 4, 2));
    assertThat(row.get("created_at")).isInstanceOf(OffsetDateTime.class);
    assertThat((BigDecimal) row.get("estimated_cost")).isEqualByComparingTo("125.50");
  }

  @Test
  void objectFieldsAreStoredAsJsonAndReadBack() {
    EntityMetadata technician = db.catalog.require("technician");
    Map<String, Object> values = new LinkedHashMap<>();
    values.put("first_name", "Dana");
    values.put("last_name", "Reyes");
    values.put("email", "dana@fieldops.test");
    values.put("certifications", Map.of("hvac", List.of("EPA-608"), "level", 2));

    Map<String, Object> row = store.insert(technician, values);

    assertThat(row.get("certifications")).isInstanceOf(Map.class);
    @SuppressWarnings("unchecked")
    Map<String, Object> certs = (Map<String, Object>) row.get("certifications");
    assertThat(certs).containsEntry("level", 2).containsEntry("hvac", List.of("EPA-608"));
  }

  @Test
  void duplicateIdentifierIsUniqueViolationOnThatColumn() {
    store.insert(workOrder, workOrder("WO-2026-0001", "First"));

    assertThatThrownBy(() -> store.insert(workOrder, workOrder("WO-2026-0001", "Second")))
        .isInstanceOfSatisfying(StorageConstraintException.class, e -> {
          assertThat(e.violation().kind()).isEqualTo(ConstraintKind.UNIQUE);
          assertThat(e.violation().columnName()).isEqualTo("work_order_number");
        });
  }

  @Test
  void missingParentIsForeignKeyViolation() {
    Map<String, Object> values = workOrder("WO-2026-0002", "Orphan");
    values.put("customer_id", 9999L);

    assertThatThrownBy(() -> store.insert(workOrder, values))
        .isInstanceOfSatisfying(StorageConstraintException.class, e -> {
          assertThat(e.violation().kind()).isEqualTo(ConstraintKind.FOREIGN_KEY);
          assertThat(e.violation().columnName()).isEqualTo("customer_id");
        });
  }

  @Test
  void deletingReferencedParentIsBlockedAndRowSurvives() {
    store.insert(workOrder, workOrder("WO-2026-0003", "Keep me"));

    assertThatThrownBy(() -> store.delete(customer, customerId))
        .isInstanceOfSatisfying(StorageConstraintException.class, e -> {
          assertThat(e.violation().kind()).isEqualTo(ConstraintKind.FOREIGN_KEY);
          assertThat(e.violation().detail()).contains("\"work_orders\"");
        });
    assertThat(store.findById(customer, customerId)).isPresent();
  }

  @Test
  void checkConstraintIsTagged() {
    Map<String, Object> values = workOrder("WO-2026-0004", "Bad priority");
    values.put("priority", "whenever");

    assertThatThrownBy(() -> store.insert(workOrder, values))
        .isInstanceOfSatisfying(StorageConstraintException.class,
            e -> assertThat(e.violation().kind()).isEqualTo(ConstraintKind.CHECK));
  }

  @Test
  void updateChangesGivenColumnsOnly() {
    Map<String, Object> row = store.insert(workOrder, workOrder("WO-2026-0005", "Old title"));
    Object id = row.get("id");

    Map<String, Object> updated = store.update(workOrder, id, Map.of("title", "New title")).orElseThrow();

    assertThat(updated).containsEntry("title", "New title").containsEntry("work_order_number", "WO-2026-0005");
    assertThat(store.update(workOrder, 424242L, Map.of("title", "x"))).isEmpty();
  }

  @Test
  void deleteRetiresIdentifier() {
    Map<String, Object> row = store.insert(workOrder, workOrder("WO-2026-0006", "Short lived"));

    assertThat(store.delete(workOrder, String.valueOf(row.get("id")))).isTrue();
    assertThat(store.delete(workOrder, row.get("id"))).isFalse();

    Integer retired = db.jdbc.queryForObject(
        "SELECT COUNT(*) FROM retired_identifiers WHERE table_name = 'work_orders' AND identifier = 'WO-2026-0006'",
        Map.of(), Integer.class);
    assertThat(retired).isEqualTo(1);
  }

  @Test
  void listIsOrderedByPrimaryKeyAndPaged() {
    for (int i = 1; i <= 5; i++) {
      store.insert(workOrder, workOrder(String.format("WO-2026-%04d", i), "Order " + i));
    }

    List<Map<String, Object>> page = store.findAll(workOrder, ListQuery.page(2, 1));

    assertThat(page).extracting(r -> r.get("work_order_number"))
        .containsExactly("WO-2026-0002", "WO-2026-0003");
  }

  @Test
  void searchIsCaseInsensitiveSubstringAcrossColumns() {
    store.insert(customer, Map.of("name", "Dana Boiler", "email", "dana@acme.test"));
    store.insert(customer, Map.of("name", "Lee", "company_name", "BoilerWorks Ltd", "email", "lee@acme.test"));
    store.insert(customer, Map.of("name", "Kim", "email", "kim@acme.test"));

    List<Map<String, Object>> hits = store.findAll(customer, new ListQuery("BOILER",
        List.of("name", "company_name"), List.of(), null, SortDirection.ASC, 10, 0));

    assertThat(hits).extracting(r -> r.get("name")).containsExactly("Dana Boiler", "Lee");
  }

  @Test
  void searchTreatsLikeWildcardsLiterally() {
    store.insert(workOrder, workOrder("WO-2026-0001", "100% done"));
    store.insert(workOrder, workOrder("WO-2026-0002", "1000 units"));

    List<Map<String, Object>> hits = store.findAll(workOrder, new ListQuery("0%",
        List.of("title"), List.of(), null, SortDirection.ASC, 10, 0));

    assertThat(hits).extracting(r -> r.get("title")).containsExactly("100% done");
  }

  @Test
  void filtersAreAndedAndTyped() {
    Map<String, Object> cheap = workOrder("WO-2026-0001", "Cheap");
    cheap.put("estimated_cost", new BigDecimal("20.00"));
    cheap.put("priority", "high");
    store.insert(workOrder, cheap);
    Map<String, Object> urgent = workOrder("WO-2026-0002", "Urgent");
    urgent.put("priority", "urgent");
    store.insert(workOrder, urgent);
    store.insert(workOrder, workOrder("WO-2026-0003", "Normal"));

    List<Map<String, Object>> hits = store.findAll(workOrder, new ListQuery(null, List.of(),
        List.of(
            new FilterCondition("priority", FilterOperator.IN, List.of("high", "urgent")),
            FilterCondition.of("estimated_cost", FilterOperator.GT, new BigDecimal("100")),
            FilterCondition.of("scheduled_date", FilterOperator.EQ, LocalDate.of(2026, 4, 2))),
        null, SortDirection.ASC, 10, 0));

    assertThat(hits).extracting(r -> r.get("work_order_number")).containsExactly("WO-2026-0002");
  }

  @Test
  void sortUsesPrimaryKeyAsTieBreakAndKeepsNullsLast() {
    Map<String, Object> unscheduled = workOrder("WO-2026-0001", "Unscheduled");
    unscheduled.put("scheduled_date", null);
    store.insert(workOrder, unscheduled);
    store.insert(workOrder, workOrder("WO-2026-0002", "Same day A"));
    store.insert(workOrder, workOrder("WO-2026-0003", "Same day B"));
    Map<String, Object> later = workOrder("WO-2026-0004", "Later");
    later.put("scheduled_date", LocalDate.of(2026, 5, 1));
    store.insert(workOrder, later);

    List<Map<String, Object>> rows = store.findAll(workOrder, new ListQuery(null, List.of(), List.of(),
        "scheduled_date", SortDirection.DESC, 10, 0));

    assertThat(rows).extracting(r -> r.get("work_order_number"))
        .containsExactly("WO-2026-0004", "WO-2026-0002", "WO-2026-0003", "WO-2026-0001");
  }

  @Test
  void listColumnsOutsideMetadataAreRejectedBeforeSql() {
    ListQuery byPassword = new ListQuery(null, List.of(),
        List.of(FilterCondition.of("password", FilterOperator.EQ, "x")), null, SortDirection.ASC, 10, 0);
    ListQuery injected = new ListQuery(null, List.of(), List.of(), "title; DROP TABLE roles",
        SortDirection.ASC, 10, 0);

    assertThatThrownBy(() -> store.findAll(workOrder, byPassword))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("password");
    assertThatThrownBy(() -> store.findAll(workOrder, injected))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(store.findAll(workOrder, new ListQuery(null, List.of(), List.of(), "created_at",
        SortDirection.DESC, 10, 0))).isEmpty();
  }

  @Test
  void nonNumericIdMatchesNothing() {
    assertThat(store.findById(workOrder, "abc")).isEmpty();
    assertThat(store.delete(workOrder, "1 OR 1=1")).isFalse();
  }

  @Test
  void undefinedColumnIsRejectedBeforeSql() {
    assertThatThrownBy(() -> store.insert(customer, Map.of("name", "X", "email", "x@y.test", "password", "p")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("password");
    assertThatThrownBy(() -> JdbcRecordStore.sqlName("customers; DROP TABLE roles"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private Map<String, Object> workOrder(String number, String title) {
    Map<String, Object> values = new LinkedHashMap<>();
    values.put("work_order_number", number);
    values.put("customer_id", customerId);
    values.put("title", title);
    values.put("priority", "normal");
    values.put("scheduled_date", LocalDate.of(2026, 4, 2));
    values.put("estimated_cost", new BigDecimal("125.50"));
    return values;
  }
}
