package org.erpsuite.currency.service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

import org.erpsuite.currency.service.exception.InvalidRequestException;

/** Parsing of the optional as-of date accepted by rate lookups and conversions. */
public final class AsOfDates {

  private AsOfDates() {}

  /**
   * Parses an ISO-8601 date-time with offset ({@code 2024-07-01T12:00:00Z}) or a plain date ({@code
   * 2024-07-01}), which is taken as the start of that day in UTC.
   *
   * @param date the date text, may be null or blank
   * @return the instant, or null when no date was given
   * @throws InvalidRequestException if the text is not in either format
   */
  public static Instant parse(String date) {
    if (date == null || date.isBlank()) {
      return null;
    }

    try {
      if (date.length() == 10) {
        return LocalDate.parse(date).atStartOfDay(ZoneOffset.UTC).toInstant();
      }
      return OffsetDateTime.parse(date).toInstant();
    } catch (DateTimeParseException e) {
      throw new InvalidRequestException(
          "Invalid date: " + date, CurrencyServiceError.VALIDATION_ERROR.name());
    }
  }
}
