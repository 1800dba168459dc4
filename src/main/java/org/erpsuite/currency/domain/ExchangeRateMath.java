package org.erpsuite.currency.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Decimal arithmetic shared by rate storage and conversion. */
public final class ExchangeRateMath {

  /** Number of fractional digits kept for a stored inverse rate. */
  public static final int INVERSE_RATE_SCALE = 8;

  /** Rounding applied to inverse rates and converted amounts. */
  public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

  private ExchangeRateMath() {}

  /**
   * Computes {@code 1 / rate} rounded to {@link #INVERSE_RATE_SCALE} fractional digits.
   *
   * @param rate strictly positive rate
   * @return the inverse rate
   * @throws IllegalArgumentException if the rate is null, zero or negative
   */
  public static BigDecimal inverseOf(BigDecimal rate) {
    if (rate == null || rate.signum() <= 0) {
      throw new IllegalArgumentException("Exchange rate must be greater than zero: " + rate);
    }

    return BigDecimal.ONE.divide(rate, INVERSE_RATE_SCALE, ROUNDING);
  }

  /**
   * Multiplies an amount by a rate and rounds the product to the target precision.
   *
   * @param amount amount in the source currency
   * @param rate rate from source to target currency
   * @param decimalPlaces decimal places of the target currency
   * @return converted amount with exactly {@code decimalPlaces} fractional digits
   */
  public static BigDecimal convert(BigDecimal amount, BigDecimal rate, int decimalPlaces) {
    return amount.multiply(rate).setScale(decimalPlaces, ROUNDING);
  }
}
