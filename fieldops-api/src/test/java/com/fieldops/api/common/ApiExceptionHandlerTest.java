package com.fieldops.api.common;

import com.fieldops.application.errors.StorageFailureException;
import com.fieldops.domain.ErrorCategory;
import com.fieldops.domain.error.ConfigurationException;
import com.fieldops.domain.error.ConflictException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.sql.SQLException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ApiExceptionHandlerTest {

  private final ApiExceptionHandler handler = new ApiExceptionHandler();

  @Test
  void everyCategoryHasAStatus() {
    assertThat(ApiExceptionHandler.statusFor(ErrorCategory.PERMISSION_DENIED)).isEqualTo(HttpStatus.FORBIDDEN);
    assertThat(ApiExceptionHandler.statusFor(ErrorCategory.VALIDATION_FAILED)).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(ApiExceptionHandler.statusFor(ErrorCategory.NOT_FOUND_REFERENCE)).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(ApiExceptionHandler.statusFor(ErrorCategory.CONFLICT_ERROR)).isEqualTo(HttpStatus.CONFLICT);
    assertThat(ApiExceptionHandler.statusFor(ErrorCategory.DELETE_BLOCKED)).isEqualTo(HttpStatus.CONFLICT);
    assertThat(ApiExceptionHandler.statusFor(ErrorCategory.CONFIGURATION_ERROR))
        .isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
  }

  @Test
  void conflictBodyCarriesFieldAndMessage() {
    var res = handler.domain(new ConflictException("email", "Email already exists"));

    assertThat(res.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    assertThat(res.getBody())
        .containsEntry("category", "ConflictError")
        .containsEntry("message", "Email already exists")
        .containsEntry("field", "email")
        .containsKey("ts");
  }

  @Test
  void configurationProblemsStayInTheLog() {
    var res = handler.domain(new ConfigurationException("Invalid metadata", List.of("work_order: unknown role 'boss'")));

    assertThat(res.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(res.getBody().get("message")).isEqualTo(StorageFailureException.GENERIC_MESSAGE);
    assertThat(res.getBody().toString()).doesNotContain("boss");
  }

  @Test
  void storageFailureHidesDriverText() {
    var res = handler.storage(new StorageFailureException(new SQLException("relation \"secret_table\" does not exist")));

    assertThat(res.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(res.getBody()).containsEntry("category", "InternalError");
    assertThat(res.getBody().toString()).doesNotContain("secret_table");
  }
}
