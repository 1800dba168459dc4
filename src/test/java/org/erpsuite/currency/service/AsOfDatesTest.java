package org.erpsuite.currency.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;

import org.junit.jupiter.api.Test;

import org.erpsuite.currency.service.exception.InvalidRequestException;

class AsOfDatesTest {

  @Test
  void blankMeansNow() {
    assertThat(AsOfDates.parse(null)).isNull();
    assertThat(AsOfDates.parse("  ")).isNull();
  }

  @Test
  void plainDateIsStartOfDayUtc() {
    assertThat(AsOfDates.parse("2024-07-01")).isEqualTo(Instant.parse("2024-07-01T00:00:00Z"));
  }

  @Test
  void dateTimeWithOffsetIsConvertedToInstant() {
    assertThat(AsOfDates.parse("2024-07-01T12:00:00+02:00"))
        .isEqualTo(Instant.parse("2024-07-01T10:00:00Z"));
  }

  @Test
  void malformedDateIsInvalidRequest() {
    assertThatThrownBy(() -> AsOfDates.parse("01/07/2024"))
        .isInstanceOf(InvalidRequestException.class)
        .hasFieldOrPropertyWithValue("code", CurrencyServiceError.VALIDATION_ERROR.name());
    assertThatThrownBy(() -> AsOfDates.parse("2024-13-01"))
        .isInstanceOf(InvalidRequestException.class);
  }
}
