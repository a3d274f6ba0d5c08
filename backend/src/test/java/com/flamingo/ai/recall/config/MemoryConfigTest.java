package com.flamingo.ai.recall.config;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import java.util.Set;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("MemoryConfig Tests")
class MemoryConfigTest {

  private static ValidatorFactory validatorFactory;
  private static Validator validator;

  @BeforeAll
  static void setUpValidator() {
    validatorFactory = Validation.buildDefaultValidatorFactory();
    validator = validatorFactory.getValidator();
  }

  @AfterAll
  static void closeValidator() {
    validatorFactory.close();
  }

  @Test
  @DisplayName("should accept the defaults")
  void shouldAcceptDefaults() {
    assertThat(validator.validate(new MemoryConfig())).isEmpty();
  }

  @ParameterizedTest
  @ValueSource(doubles = {-0.1, 1.5})
  @DisplayName("should reject a scoring weight outside [0, 1]")
  void shouldRejectWeightOutOfRange(double weight) {
    MemoryConfig config = new MemoryConfig();
    config.getRetrieval().setRecencyWeight(weight);

    Set<ConstraintViolation<MemoryConfig>> violations = validator.validate(config);

    assertThat(violations)
        .extracting(v -> v.getPropertyPath().toString())
        .containsExactly("retrieval.recencyWeight");
  }

  @Test
  @DisplayName("should reject a duplicate threshold above one")
  void shouldRejectThresholdAboveOne() {
    MemoryConfig config = new MemoryConfig();
    config.getDedup().setDuplicateThreshold(1.2);

    assertThat(validator.validate(config))
        .extracting(v -> v.getPropertyPath().toString())
        .containsExactly("dedup.duplicateThreshold");
  }
}
