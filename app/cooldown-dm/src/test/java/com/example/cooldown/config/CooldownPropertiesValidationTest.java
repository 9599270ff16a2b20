/*
 * Where: Cooldown configuration validation test
 * What: Bean Validation of delivery and profile properties
 * Why: Detect invalid settings at startup
 */
package com.example.cooldown.config;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CooldownPropertiesValidationTest {

  private Validator validator;

  @BeforeEach
  void setUp() {
    validator = Validation.buildDefaultValidatorFactory().getValidator();
  }

  @Test
  void deliveryPropertiesPassWithDefaults() {
    assertThat(validator.validate(new TimerDeliveryProperties(true, null, null))).isEmpty();
  }

  @Test
  void deliveryPropertiesRejectNonPositiveValues() {
    assertThat(validator.validate(new TimerDeliveryProperties(true, Duration.ZERO, 50)))
        .isNotEmpty();
    assertThat(validator.validate(new TimerDeliveryProperties(true, Duration.ofSeconds(5), 0)))
        .isNotEmpty();
  }

  @Test
  void profilePropertiesRejectUnknownDefaultZone() {
    assertThat(validator.validate(new UserProfileProperties("Asia/Seoul"))).isEmpty();
    assertThat(validator.validate(new UserProfileProperties("Nowhere/City"))).isNotEmpty();
  }
}
