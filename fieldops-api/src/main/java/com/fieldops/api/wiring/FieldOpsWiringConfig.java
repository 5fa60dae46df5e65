package com.fieldops.api.wiring;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldops.api.config.FieldOpsProperties;
import com.fieldops.api.metrics.WriteMetrics;
import com.fieldops.application.access.FieldAccessController;
import com.fieldops.application.errors.StorageConstraintTranslator;
import com.fieldops.application.hygiene.DataHygiene;
import com.fieldops.application.identifier.IdentifierGenerator;
import com.fieldops.application.metadata.MetadataRegistry;
import com.fieldops.application.metadata.MetadataValidator;
import com.fieldops.application.ports.AuditPort;
import com.fieldops.application.ports.IdentifierSequencePort;
import com.fieldops.application.ports.RecordStore;
import com.fieldops.application.ports.RoleSource;
import com.fieldops.application.ports.impl.StaticRoleSource;
import com.fieldops.application.role.RoleHierarchyResolver;
import com.fieldops.application.service.AuditEmitter;
import com.fieldops.application.service.EntityReadService;
import com.fieldops.application.service.EntityWriteService;
import com.fieldops.application.service.RoleAdminService;
import com.fieldops.application.validation.FieldRuleFactory;
import com.fieldops.application.validation.TypeBuilderRegistry;
import com.fieldops.application.validation.ValidationSchemaBuilder;
import com.fieldops.infrastructure.audit.AuditLogRepository;
import com.fieldops.infrastructure.audit.JpaAuditAdapter;
import com.fieldops.infrastructure.db.JdbcIdentifierSequenceAdapter;
import com.fieldops.infrastructure.db.JdbcRecordStore;
import com.fieldops.infrastructure.db.JdbcRoleSource;
import com.fieldops.infrastructure.db.SqlConstraintClassifier;
import com.fieldops.infrastructure.metadata.JsonMetadataLoader;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;

@Configuration
public class FieldOpsWiringConfig {

  private static final Logger log = LoggerFactory.getLogger(FieldOpsWiringConfig.class);

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  /**
   * Roles come from the roles table unless fieldops.roles.source=static.
   */
  @Bean
  public RoleSource roleSource(FieldOpsProperties props, JdbcTemplate jdbc) {
    if (props.roles().isStatic()) {
      log.info("[ROLES] source=static");
      return new StaticRoleSource();
    }
    return new JdbcRoleSource(jdbc);
  }

  @Bean
  public RoleHierarchyResolver roleHierarchyResolver(RoleSource source) {
    return new RoleHierarchyResolver(source);
  }

  @Bean
  public TypeBuilderRegistry typeBuilderRegistry() {
    return TypeBuilderRegistry.standard();
  }

  @Bean
  public FieldAccessController fieldAccessController(RoleHierarchyResolver roles) {
    return new FieldAccessController(roles);
  }

  @Bean
  public ValidationSchemaBuilder validationSchemaBuilder(TypeBuilderRegistry types, FieldAccessController access,
                                                         RoleHierarchyResolver roles) {
    return new ValidationSchemaBuilder(new FieldRuleFactory(types), access, roles);
  }

  @Bean
  public DataHygiene dataHygiene(TypeBuilderRegistry types) {
    return new DataHygiene(types);
  }

  /**
   * Loads and validates entity metadata. Any problem aborts startup.
   */
  @Bean
  public MetadataRegistry metadataRegistry(FieldOpsProperties props, ObjectMapper mapper,
                                           TypeBuilderRegistry types, RoleHierarchyResolver roles) {
    String location = props.metadata().location();
    MetadataRegistry registry = MetadataRegistry.of(new JsonMetadataLoader(mapper, location).loadAll());
    new MetadataValidator(types).validateOrThrow(registry, roles.hierarchy());
    log.info("[METADATA] validated entities={}", registry.entityNames());
    return registry;
  }

  @Bean
  public SqlConstraintClassifier sqlConstraintClassifier() {
    return new SqlConstraintClassifier();
  }

  @Bean
  public JdbcRecordStore recordStore(NamedParameterJdbcTemplate jdbc, PlatformTransactionManager txManager,
                                     ObjectMapper mapper, SqlConstraintClassifier classifier) {
    return new JdbcRecordStore(jdbc, txManager, mapper, classifier);
  }

  @Bean
  public IdentifierSequencePort identifierSequencePort(NamedParameterJdbcTemplate jdbc) {
    return new JdbcIdentifierSequenceAdapter(jdbc);
  }

  @Bean
  public IdentifierGenerator identifierGenerator(IdentifierSequencePort sequences, Clock clock) {
    return new IdentifierGenerator(sequences, clock);
  }

  @Bean
  public AuditPort auditPort(AuditLogRepository repository, ObjectMapper mapper) {
    return new JpaAuditAdapter(repository, mapper);
  }

  @Bean
  public WriteMetrics writeMetrics(MeterRegistry registry) {
    return new WriteMetrics(registry);
  }

  @Bean
  public AuditEmitter auditEmitter(AuditPort auditPort, WriteMetrics metrics, Clock clock) {
    return new AuditEmitter(auditPort, metrics, clock);
  }

  @Bean
  public EntityWriteService entityWriteService(
      MetadataRegistry registry,
      RoleHierarchyResolver roles,
      DataHygiene hygiene,
      FieldAccessController access,
      ValidationSchemaBuilder schemas,
      IdentifierGenerator identifiers,
      RecordStore store,
      AuditEmitter audit,
      WriteMetrics metrics,
      FieldOpsProperties props
  ) {
    return new EntityWriteService(registry, roles, hygiene, access, schemas, identifiers, store,
        new StorageConstraintTranslator(), audit, metrics, props.identifiers().maxAttempts());
  }

  @Bean
  public EntityReadService entityReadService(MetadataRegistry registry, FieldAccessController access,
                                             RecordStore store, FieldOpsProperties props) {
    return new EntityReadService(registry, access, store, props.read().maxPageSize());
  }

  @Bean
  public RoleAdminService roleAdminService(RoleHierarchyResolver roles, AuditEmitter audit) {
    return new RoleAdminService(roles, audit);
  }
}
