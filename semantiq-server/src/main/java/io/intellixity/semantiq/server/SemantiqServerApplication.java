package io.intellixity.semantiq.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class})
public class SemantiqServerApplication {
  public static void main(String[] args) {
    SpringApplication.run(SemantiqServerApplication.class, args);
  }
}
