package com.grale.harvester;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class GraleHarvesterApplication {

  public static void main(String[] args) {
    SpringApplication.run(GraleHarvesterApplication.class, args);
  }
}
