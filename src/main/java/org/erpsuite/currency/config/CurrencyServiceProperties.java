package org.erpsuite.currency.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "currency-service")
@Validated
public class CurrencyServiceProperties {

  @Valid private Conversion conversion = new Conversion();

  public Conversion getConversion() {
    return conversion;
  }

  public void setConversion(Conversion conversion) {
    this.conversion = conversion;
  }

  public static class Conversion {

    /** Maximum number of items accepted by a single bulk conversion request. */
    @Min(1)
    @Max(1000)
    private int bulkMaxItems = 100;

    public int getBulkMaxItems() {
      return bulkMaxItems;
    }

    public void setBulkMaxItems(int bulkMaxItems) {
      this.bulkMaxItems = bulkMaxItems;
    }
  }
}
