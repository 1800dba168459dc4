package org.erpsuite.currency.service;

import java.math.BigDecimal;

import org.springframework.stereotype.Component;

import org.erpsuite.currency.domain.Currency;
import org.erpsuite.currency.domain.ExchangeRateMath;
import org.erpsuite.currency.domain.SymbolPosition;

/**
 * Renders amounts using a currency's own formatting settings.
 *
 * <p>The amount is rounded to the currency's decimal places, the integer part is grouped by
 * thousands with the currency's grouping separator, and the symbol is placed before or after the
 * number. A minus sign belongs to the number, so a negative amount in a currency with the symbol
 * before reads {@code $-1,234.50}.
 */
@Component
public class MoneyFormatter {

  public String format(BigDecimal amount, Currency currency) {
    var scaled = amount.setScale(currency.getDecimalPlaces(), ExchangeRateMath.ROUNDING);
    var plain = scaled.abs().toPlainString();

    var dot = plain.indexOf('.');
    var integerPart = dot < 0 ? plain : plain.substring(0, dot);
    var fractionPart = dot < 0 ? "" : plain.substring(dot + 1);

    var number = group(integerPart, currency.getThousandsSeparator());
    if (!fractionPart.isEmpty()) {
      number = number + currency.getDecimalSeparator() + fractionPart;
    }
    if (scaled.signum() < 0) {
      number = "-" + number;
    }

    return currency.getSymbolPosition() == SymbolPosition.AFTER
        ? number + currency.getSymbol()
        : currency.getSymbol() + number;
  }

  private static String group(String digits, String separator) {
    if (separator == null || separator.isEmpty() || digits.length() <= 3) {
      return digits;
    }

    var sb = new StringBuilder(digits.length() + digits.length() / 3 * separator.length());
    var leading = digits.length() % 3;
    if (leading > 0) {
      sb.append(digits, 0, leading);
    }
    for (var i = leading; i < digits.length(); i += 3) {
      if (sb.length() > 0) {
        sb.append(separator);
      }
      sb.append(digits, i, i + 3);
    }

    return sb.toString();
  }
}
