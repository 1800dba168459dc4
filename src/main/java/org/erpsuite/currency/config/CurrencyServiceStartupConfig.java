package org.erpsuite.currency.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

@Component
public class CurrencyServiceStartupConfig {

  private static final Logger log = LoggerFactory.getLogger(CurrencyServiceStartupConfig.class);

  private final CurrencyServiceProperties currencyServiceProperties;
  private final ObjectMapper objectMapper;

  public CurrencyServiceStartupConfig(
      CurrencyServiceProperties properties, ObjectMapper objectMapper) {
    this.currencyServiceProperties = properties;
    this.objectMapper = objectMapper;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void onStartup() {
    logConfiguration();
  }

  private void logConfiguration() {
    try {
      var writer = objectMapper.writerWithDefaultPrettyPrinter();
      var json = writer.writeValueAsString(currencyServiceProperties);
      log.info("Currency Service Configuration:\n{}", json);
    } catch (JsonProcessingException e) {
      log.warn("Could not serialize Currency Service configuration", e);
    }
  }
}
