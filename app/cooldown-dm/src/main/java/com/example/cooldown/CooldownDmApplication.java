/*
 * Where: cooldown-dm application entry point
 * What: boots Spring with properties scan and the scheduler
 * Why: the delivery worker runs on @Scheduled inside the same process as the API
 */
package com.example.cooldown;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class CooldownDmApplication {

  public static void main(String[] args) {
    SpringApplication.run(CooldownDmApplication.class, args);
  }
}
