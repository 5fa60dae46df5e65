package com.fieldops.api.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.RequestPostProcessor;

import java.util.Map;
import java.util.UUID;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.matchesPattern;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class EntityControllerTest {

  @Autowired MockMvc mvc;
  @Autowired ObjectMapper mapper;

  @Test
  void createMintsIdentifierAndReturns201() throws Exception {
    long customerId = createCustomer();

    mvc.perform(post("/api/v1/entities/work_order").with(as("dispatcher"))
            .contentType(MediaType.APPLICATION_JSON)
            .content(json(Map.of("customer_id", customerId, "title", "Replace thermostat"))))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.work_order_number", matchesPattern("^WO-\\d{4}-\\d{4,}$")))
        .andExpect(jsonPath("$.status").value("pending"));
  }

  @Test
  void forbiddenFieldsAreAllReported() throws Exception {
    long customerId = createCustomer();

    mvc.perform(post("/api/v1/entities/work_order").with(as("customer"))
            .contentType(MediaType.APPLICATION_JSON)
            .content(json(Map.of("customer_id", customerId, "title", "Leaking tap",
                "status", "assigned", "assigned_technician_id", 1))))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.category").value("PermissionDenied"))
        .andExpect(jsonPath("$.details", containsInAnyOrder("status", "assigned_technician_id")));
  }

  @Test
  void invalidValueIs400WithField() throws Exception {
    long customerId = createCustomer();

    mvc.perform(post("/api/v1/entities/work_order").with(as("dispatcher"))
            .header("X-Request-Id", "req-validation-1")
            .contentType(MediaType.APPLICATION_JSON)
            .content(json(Map.of("customer_id", customerId, "title", "ab"))))
        .andExpect(status().isBadRequest())
        .andExpect(header().string("X-Request-Id", "req-validation-1"))
        .andExpect(jsonPath("$.category").value("ValidationFailed"))
        .andExpect(jsonPath("$.field").value("title"))
        .andExpect(jsonPath("$.message").value("title must be at least 3 characters long"))
        .andExpect(jsonPath("$.requestId").value("req-validation-1"));
  }

  @Test
  void duplicateIsConflict() throws Exception {
    String email = unique("dup");
    createCustomer(email);

    mvc.perform(post("/api/v1/entities/customer").with(as("dispatcher"))
            .contentType(MediaType.APPLICATION_JSON)
            .content(json(Map.of("name", "Second", "email", email))))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.category").value("ConflictError"))
        .andExpect(jsonPath("$.message").value("Email already exists"));
  }

  @Test
  void missingReferenceIs400() throws Exception {
    mvc.perform(post("/api/v1/entities/work_order").with(as("dispatcher"))
            .contentType(MediaType.APPLICATION_JSON)
            .content(json(Map.of("customer_id", 987654, "title", "Nobody home"))))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.category").value("NotFoundReference"))
        .andExpect(jsonPath("$.message").value("Customer not found. Please provide a valid customer_id."));
  }

  @Test
  void deletingReferencedCustomerIs409() throws Exception {
    long customerId = createCustomer();
    mvc.perform(post("/api/v1/entities/work_order").with(as("dispatcher"))
            .contentType(MediaType.APPLICATION_JSON)
            .content(json(Map.of("customer_id", customerId, "title", "Anchor order"))))
        .andExpect(status().isCreated());

    mvc.perform(delete("/api/v1/entities/customer/" + customerId).with(as("manager")))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.category").value("DeleteBlocked"));
  }

  @Test
  void readsAreMaskedByRole() throws Exception {
    long customerId = createCustomer();
    String body = mvc.perform(post("/api/v1/entities/work_order").with(as("dispatcher"))
            .contentType(MediaType.APPLICATION_JSON)
            .content(json(Map.of("customer_id", customerId, "title", "Quote job", "estimated_cost", 250.75))))
        .andExpect(status().isCreated())
        .andReturn().getResponse().getContentAsString();
    long id = mapper.readTree(body).get("id").asLong();

    mvc.perform(get("/api/v1/entities/work_order/" + id).with(as("technician")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.title").value("Quote job"))
        .andExpect(jsonPath("$.estimated_cost").doesNotExist());
    mvc.perform(get("/api/v1/entities/work_order/" + id).with(as("manager")))
        .andExpect(jsonPath("$.estimated_cost").value(250.75));
  }

  @Test
  void legacyNumericRoleClaimIsAccepted() throws Exception {
    mvc.perform(post("/api/v1/entities/customer").with(jwt().jwt(j -> j.claim("role", 3)))
            .contentType(MediaType.APPLICATION_JSON)
            .content(json(Map.of("name", "Numeric Role Ltd", "email", unique("numeric")))))
        .andExpect(status().isCreated());
  }

  @Test
  void identifierIsNotWritableOverHttp() throws Exception {
    long customerId = createCustomer();
    String body = mvc.perform(post("/api/v1/entities/work_order").with(as("dispatcher"))
            .contentType(MediaType.APPLICATION_JSON)
            .content(json(Map.of("customer_id", customerId, "title", "Fixed number"))))
        .andReturn().getResponse().getContentAsString();
    long id = mapper.readTree(body).get("id").asLong();

    mvc.perform(patch("/api/v1/entities/work_order/" + id).with(as("admin"))
            .contentType(MediaType.APPLICATION_JSON)
            .content(json(Map.of("work_order_number", "WO-2000-0001"))))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.field").value("work_order_number"))
        .andExpect(jsonPath("$.details[0]").value("work_order_number"));

    mvc.perform(patch("/api/v1/entities/work_order/" + id).with(as("technician"))
            .contentType(MediaType.APPLICATION_JSON)
            .content(json(Map.of("status", "in_progress"))))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("in_progress"));
  }

  @Test
  void listFiltersSearchesAndSorts() throws Exception {
    long customerId = createCustomer();
    createWorkOrder(customerId, "Bleed radiators", "low");
    createWorkOrder(customerId, "Boiler pressure drop", "urgent");
    createWorkOrder(customerId, "Boiler annual service", "high");

    mvc.perform(get("/api/v1/entities/work_order").with(as("customer"))
            .param("customer_id", String.valueOf(customerId))
            .param("priority[in]", "high,urgent")
            .param("sortBy", "priority")
            .param("sortOrder", "asc"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[*].title", contains("Boiler annual service", "Boiler pressure drop")));

    mvc.perform(get("/api/v1/entities/work_order").with(as("customer"))
            .param("customer_id", String.valueOf(customerId))
            .param("search", "RADIATOR"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[*].title", contains("Bleed radiators")));
  }

  @Test
  void filterOnFieldHiddenFromRoleIs400() throws Exception {
    long customerId = createCustomer();

    mvc.perform(get("/api/v1/entities/work_order").with(as("customer"))
            .param("customer_id", String.valueOf(customerId))
            .param("estimated_cost[gt]", "0"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.category").value("ValidationFailed"))
        .andExpect(jsonPath("$.field").value("estimated_cost"))
        .andExpect(jsonPath("$.message").value("Cannot filter by estimated_cost"));

    mvc.perform(get("/api/v1/entities/work_order").with(as("dispatcher"))
            .param("customer_id", String.valueOf(customerId))
            .param("estimated_cost[gt]", "0"))
        .andExpect(status().isOk());
  }

  @Test
  void unknownEntityAndRecordAre404() throws Exception {
    mvc.perform(get("/api/v1/entities/spaceship").with(as("admin")))
        .andExpect(status().isNotFound());
    mvc.perform(get("/api/v1/entities/customer/99999999").with(as("admin")))
        .andExpect(status().isNotFound());
  }

  @Test
  void deleteReturns204() throws Exception {
    long customerId = createCustomer();

    mvc.perform(delete("/api/v1/entities/customer/" + customerId).with(as("manager")))
        .andExpect(status().isNoContent());
    mvc.perform(get("/api/v1/entities/customer/" + customerId).with(as("manager")))
        .andExpect(status().isNotFound());
  }

  private long createCustomer() throws Exception {
    return createCustomer(unique("cust"));
  }

  private long createCustomer(String email) throws Exception {
    String body = mvc.perform(post("/api/v1/entities/customer").with(as("dispatcher"))
            .contentType(MediaType.APPLICATION_JSON)
            .content(json(Map.of("name", "Acme Heating", "email", email))))
        .andExpect(status().isCreated())
        .andReturn().getResponse().getContentAsString();
    JsonNode node = mapper.readTree(body);
    return node.get("id").asLong();
  }

  private void createWorkOrder(long customerId, String title, String priority) throws Exception {
    mvc.perform(post("/api/v1/entities/work_order").with(as("dispatcher"))
            .contentType(MediaType.APPLICATION_JSON)
            .content(json(Map.of("customer_id", customerId, "title", title, "priority", priority))))
        .andExpect(status().isCreated());
  }

  private static RequestPostProcessor as(String role) {
    return jwt().jwt(j -> j.subject("user-" + role).claim("role", role));
  }

  private static String unique(String prefix) {
    return prefix + "-" + UUID.randomUUID().toString().substring(0, 8) + "@fieldops.test";
  }

  private String json(Object value) throws Exception {
    return mapper.writeValueAsString(value);
  }
}
