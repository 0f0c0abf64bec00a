package com.ospicorp.filingmetrics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FilingMetricsApplication {

  public static void main(String[] args) {
    SpringApplication.run(FilingMetricsApplication.class, args);
  }
}
