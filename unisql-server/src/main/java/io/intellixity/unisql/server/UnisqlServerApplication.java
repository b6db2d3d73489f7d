package io.intellixity.unisql.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

// The pool is built from unisql.transactional.*, not spring.datasource.*.
@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class})
public class UnisqlServerApplication {
  public static void main(String[] args) {
    SpringApplication.run(UnisqlServerApplication.class, args);
  }
}
