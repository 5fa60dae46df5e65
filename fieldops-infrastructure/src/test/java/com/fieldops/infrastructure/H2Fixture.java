package com.fieldops.infrastructure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldops.application.metadata.MetadataRegistry;
import com.fieldops.infrastructure.metadata.JsonMetadataLoader;
import org.flywaydb.core.Flyway;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;
import java.util.Map;
import java.util.UUID;

/**
 * Fresh H2 database in PostgreSQL mode, migrated with the production scripts.
 */
public final class H2Fixture {

  public final DataSource dataSource;
  public final NamedParameterJdbcTemplate jdbc;
  public final DataSourceTransactionManager txManager;
  public final ObjectMapper json = new ObjectMapper().findAndRegisterModules();
  public final MetadataRegistry catalog;

  public H2Fixture() {
    DriverManagerDataSource ds = new DriverManagerDataSource(
        "jdbc:h2:mem:" + UUID.randomUUID()
            + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DEFAULT_NULL_ORDERING=HIGH;DB_CLOSE_DELAY=-1",
        "sa", "");
    Flyway.configure().dataSource(ds).locations("classpath:db/migration").load().migrate();
    this.dataSource = ds;
    this.jdbc = new NamedParameterJdbcTemplate(ds);
    this.txManager = new DataSourceTransactionManager(ds);
    this.catalog = MetadataRegistry.of(new JsonMetadataLoader(json, "classpath*:metadata/*.json").loadAll());
  }

  public long insertCustomer(String name, String email) {
    jdbc.update("INSERT INTO customers (name, email) VALUES (:name, :email)",
        Map.of("name", name, "email", email));
    Long id = jdbc.queryForObject("SELECT id FROM customers WHERE email = :email", Map.of("email", email), Long.class);
    return id == null ? -1 : id;
  }
}
