package org.erpsuite.currency.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.math.BigDecimal;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import org.erpsuite.currency.domain.RateSource;
import org.erpsuite.currency.fixture.TestConstants;
import org.erpsuite.currency.http.TenantHeaders;
import org.erpsuite.currency.service.CurrencyConversionService;
import org.erpsuite.currency.service.CurrencyServiceError;
import org.erpsuite.currency.service.dto.ConversionQuery;
import org.erpsuite.currency.service.dto.ConversionResult;
import org.erpsuite.currency.service.dto.ResolutionKind;
import org.erpsuite.currency.service.exception.InvalidRequestException;

/** Web layer tests for {@link CurrencyConversionController}. */
@WebMvcTest(CurrencyConversionController.class)
class CurrencyConversionControllerTest {

  private static final String TENANT = TestConstants.TENANT_ACME;

  @Autowired private MockMvc mockMvc;

  @MockitoBean private CurrencyConversionService conversionService;

  private static ConversionResult usdToJpy(String amount, String converted) {
    return new ConversionResult(
        new BigDecimal(amount),
        new BigDecimal(converted),
        "USD",
        "JPY",
        TestConstants.RATE_USD_JPY,
        new BigDecimal("0.00668896"),
        TestConstants.JAN_1,
        RateSource.MANUAL,
        ResolutionKind.DIRECT,
        "¥" + converted);
  }

  // ===========================================================================================
  // A. Single conversion
  // ===========================================================================================

  @Test
  void shouldConvertAmount() throws Exception {
    when(conversionService.convert(eq(TENANT), any(ConversionQuery.class)))
        .thenReturn(usdToJpy("100", "14950"));

    mockMvc
        .perform(
            post("/v1/currencies/convert")
                .header(TenantHeaders.TENANT_ID, TENANT)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"amount": 100, "fromCurrency": "USD", "toCurrency": "JPY"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.convertedAmount").value(14950))
        .andExpect(jsonPath("$.fromCurrency").value("USD"))
        .andExpect(jsonPath("$.toCurrency").value("JPY"))
        .andExpect(jsonPath("$.resolution").value("DIRECT"))
        .andExpect(jsonPath("$.formattedAmount").value("¥14950"));

    var query = ArgumentCaptor.forClass(ConversionQuery.class);
    verify(conversionService).convert(eq(TENANT), query.capture());
    assertThat(query.getValue().amount()).isEqualByComparingTo("100");
    assertThat(query.getValue().date()).isNull();
  }

  @Test
  void shouldRejectNegativeAmount() throws Exception {
    mockMvc
        .perform(
            post("/v1/currencies/convert")
                .header(TenantHeaders.TENANT_ID, TENANT)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"amount": -1, "fromCurrency": "USD", "toCurrency": "JPY"}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.type").value("VALIDATION_ERROR"))
        .andExpect(jsonPath("$.fieldErrors[0].field").value("amount"));

    verifyNoInteractions(conversionService);
  }

  @Test
  void shouldRejectMalformedBody() throws Exception {
    mockMvc
        .perform(
            post("/v1/currencies/convert")
                .header(TenantHeaders.TENANT_ID, TENANT)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\": "))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("Malformed request body"));
  }

  // ===========================================================================================
  // B. Bulk conversion
  // ===========================================================================================

  @Test
  @SuppressWarnings("unchecked")
  void shouldBulkConvertAndPassInvalidItemsThrough() throws Exception {
    when(conversionService.bulkConvert(eq(TENANT), anyList()))
        .thenReturn(List.of(usdToJpy("1", "150")));

    mockMvc
        .perform(
            post("/v1/currencies/bulk-convert")
                .header(TenantHeaders.TENANT_ID, TENANT)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    [
                      {"amount": 1, "fromCurrency": "USD", "toCurrency": "JPY"},
                      {"amount": -1, "fromCurrency": "USD", "toCurrency": "JPY"},
                      null
                    ]
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(1))
        .andExpect(jsonPath("$[0].convertedAmount").value(150));

    ArgumentCaptor<List<ConversionQuery>> queries = ArgumentCaptor.forClass(List.class);
    verify(conversionService).bulkConvert(eq(TENANT), queries.capture());
    assertThat(queries.getValue()).hasSize(3);
    assertThat(queries.getValue().get(1).amount()).isEqualByComparingTo("-1");
    assertThat(queries.getValue().get(2)).isNull();
  }

  @Test
  void shouldRejectWholeBatchWhenAnItemIsNotReadable() throws Exception {
    mockMvc
        .perform(
            post("/v1/currencies/bulk-convert")
                .header(TenantHeaders.TENANT_ID, TENANT)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    [
                      {"amount": 1, "fromCurrency": "USD", "toCurrency": "JPY"},
                      {"amount": "abc", "fromCurrency": "USD", "toCurrency": "JPY"}
                    ]
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
        .andExpect(jsonPath("$.message").value("Malformed request body"));

    verifyNoInteractions(conversionService);
  }

  @Test
  void shouldRejectTooManyItems() throws Exception {
    when(conversionService.bulkConvert(eq(TENANT), anyList()))
        .thenThrow(
            new InvalidRequestException(
                "Maximum 100 conversions per request", CurrencyServiceError.TOO_MANY_ITEMS.name()));

    mockMvc
        .perform(
            post("/v1/currencies/bulk-convert")
                .header(TenantHeaders.TENANT_ID, TENANT)
                .contentType(MediaType.APPLICATION_JSON)
                .content("[{\"amount\": 1, \"fromCurrency\": \"USD\", \"toCurrency\": \"JPY\"}]"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.type").value("INVALID_REQUEST"))
        .andExpect(jsonPath("$.code").value("TOO_MANY_ITEMS"))
        .andExpect(jsonPath("$.message").value("Maximum 100 conversions per request"));
  }
}
