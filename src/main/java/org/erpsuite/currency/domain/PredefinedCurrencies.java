package org.erpsuite.currency.domain;

import static org.erpsuite.currency.domain.SymbolPosition.AFTER;
import static org.erpsuite.currency.domain.SymbolPosition.BEFORE;

import java.util.List;
import java.util.Optional;

/** Read-only catalog of common currencies offered as templates when registering a currency. */
public final class PredefinedCurrencies {

  private static final List<PredefinedCurrency> ALL =
      List.of(
          // Major
          new PredefinedCurrency("USD", "US Dollar", "$", 2, BEFORE, "United States"),
          new PredefinedCurrency("EUR", "Euro", "€", 2, AFTER, "European Union"),
          new PredefinedCurrency(
              "GBP", "British Pound Sterling", "£", 2, BEFORE, "United Kingdom"),
          new PredefinedCurrency("JPY", "Japanese Yen", "¥", 0, BEFORE, "Japan"),
          new PredefinedCurrency("CHF", "Swiss Franc", "CHF", 2, BEFORE, "Switzerland"),
          new PredefinedCurrency("CAD", "Canadian Dollar", "C$", 2, BEFORE, "Canada"),
          new PredefinedCurrency("AUD", "Australian Dollar", "A$", 2, BEFORE, "Australia"),
          new PredefinedCurrency("NZD", "New Zealand Dollar", "NZ$", 2, BEFORE, "New Zealand"),
          // Asia
          new PredefinedCurrency("CNY", "Chinese Yuan", "¥", 2, BEFORE, "China"),
          new PredefinedCurrency("HKD", "Hong Kong Dollar", "HK$", 2, BEFORE, "Hong Kong"),
          new PredefinedCurrency("TWD", "New Taiwan Dollar", "NT$", 0, BEFORE, "Taiwan"),
          new PredefinedCurrency("KRW", "South Korean Won", "₩", 0, BEFORE, "South Korea"),
          new PredefinedCurrency("SGD", "Singapore Dollar", "S$", 2, BEFORE, "Singapore"),
          new PredefinedCurrency("MYR", "Malaysian Ringgit", "RM", 2, BEFORE, "Malaysia"),
          new PredefinedCurrency("THB", "Thai Baht", "฿", 2, BEFORE, "Thailand"),
          new PredefinedCurrency("IDR", "Indonesian Rupiah", "Rp", 0, BEFORE, "Indonesia"),
          new PredefinedCurrency("PHP", "Philippine Peso", "₱", 2, BEFORE, "Philippines"),
          new PredefinedCurrency("VND", "Vietnamese Dong", "₫", 0, AFTER, "Vietnam"),
          new PredefinedCurrency("INR", "Indian Rupee", "₹", 2, BEFORE, "India"),
          // Middle East
          new PredefinedCurrency("AED", "UAE Dirham", "د.إ", 2, AFTER, "United Arab Emirates"),
          new PredefinedCurrency("SAR", "Saudi Riyal", "﷼", 2, AFTER, "Saudi Arabia"),
          new PredefinedCurrency("ILS", "Israeli Shekel", "₪", 2, BEFORE, "Israel"),
          new PredefinedCurrency("TRY", "Turkish Lira", "₺", 2, BEFORE, "Turkey"),
          // Europe
          new PredefinedCurrency("SEK", "Swedish Krona", "kr", 2, AFTER, "Sweden"),
          new PredefinedCurrency("NOK", "Norwegian Krone", "kr", 2, AFTER, "Norway"),
          new PredefinedCurrency("DKK", "Danish Krone", "kr", 2, AFTER, "Denmark"),
          new PredefinedCurrency("PLN", "Polish Zloty", "zł", 2, AFTER, "Poland"),
          new PredefinedCurrency("CZK", "Czech Koruna", "Kč", 2, AFTER, "Czech Republic"),
          new PredefinedCurrency("HUF", "Hungarian Forint", "Ft", 0, AFTER, "Hungary"),
          new PredefinedCurrency("RUB", "Russian Ruble", "₽", 2, AFTER, "Russia"),
          // Americas
          new PredefinedCurrency("MXN", "Mexican Peso", "Mex$", 2, BEFORE, "Mexico"),
          new PredefinedCurrency("BRL", "Brazilian Real", "R$", 2, BEFORE, "Brazil"),
          new PredefinedCurrency("ARS", "Argentine Peso", "$", 2, BEFORE, "Argentina"),
          new PredefinedCurrency("CLP", "Chilean Peso", "$", 0, BEFORE, "Chile"),
          new PredefinedCurrency("COP", "Colombian Peso", "$", 0, BEFORE, "Colombia"),
          // Africa
          new PredefinedCurrency("ZAR", "South African Rand", "R", 2, BEFORE, "South Africa"),
          new PredefinedCurrency("EGP", "Egyptian Pound", "E£", 2, BEFORE, "Egypt"),
          new PredefinedCurrency("NGN", "Nigerian Naira", "₦", 2, BEFORE, "Nigeria"),
          new PredefinedCurrency("KES", "Kenyan Shilling", "KSh", 2, BEFORE, "Kenya"));

  private PredefinedCurrencies() {}

  public static List<PredefinedCurrency> all() {
    return ALL;
  }

  /**
   * Looks up a catalog entry by code, ignoring case.
   *
   * @param code currency code
   * @return the entry, or empty if the code is not in the catalog
   */
  public static Optional<PredefinedCurrency> findByCode(String code) {
    if (code == null) {
      return Optional.empty();
    }

    return ALL.stream().filter(c -> c.code().equalsIgnoreCase(code)).findFirst();
  }
}
