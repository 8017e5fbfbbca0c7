package com.speculum.archiver;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SpeculumArchiverApplication {

  public static void main(String[] args) {
    SpringApplication.run(SpeculumArchiverApplication.class, args);
  }
}
