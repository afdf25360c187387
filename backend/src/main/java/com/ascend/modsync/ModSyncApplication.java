package com.ascend.modsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ModSyncApplication {

  public static void main(String[] args) {
    SpringApplication.run(ModSyncApplication.class, args);
  }
}
