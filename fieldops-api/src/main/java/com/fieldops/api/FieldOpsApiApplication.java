package com.fieldops.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(scanBasePackages = "com.fieldops.api")
@EnableJpaRepositories(basePackages = "com.fieldops.infrastructure")
@EntityScan(basePackages = "com.fieldops.infrastructure")
@ConfigurationPropertiesScan(basePackages = "com.fieldops.api")
public class FieldOpsApiApplication {
  public static void main(String[] args) {
    SpringApplication.run(FieldOpsApiApplication.class, args);
  }
}
