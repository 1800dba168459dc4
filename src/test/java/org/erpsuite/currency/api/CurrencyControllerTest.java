package org.erpsuite.currency.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.endsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import org.erpsuite.currency.domain.Currency;
import org.erpsuite.currency.domain.PredefinedCurrencies;
import org.erpsuite.currency.fixture.CurrencyTestBuilder;
import org.erpsuite.currency.fixture.TestConstants;
import org.erpsuite.currency.http.TenantHeaders;
import org.erpsuite.currency.service.CurrencyService;
import org.erpsuite.currency.service.CurrencyServiceError;
import org.erpsuite.currency.service.exception.BusinessException;
import org.erpsuite.currency.service.exception.ResourceNotFoundException;

/**
 * Web layer tests for {@link CurrencyController}.
 *
 * <p>The service is mocked; these tests cover request binding, validation, status codes and the
 * error body produced by {@link GlobalExceptionHandler}.
 */
@WebMvcTest(CurrencyController.class)
class CurrencyControllerTest {

  private static final String TENANT = TestConstants.TENANT_ACME;

  @Autowired private MockMvc mockMvc;

  @MockitoBean private CurrencyService currencyService;

  // ===========================================================================================
  // A. Tenant header / correlation id
  // ===========================================================================================

  @Test
  void shouldRejectRequestWithoutTenantHeader() throws Exception {
    mockMvc
        .perform(get("/v1/currencies"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.type").value("VALIDATION_ERROR"))
        .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

    verifyNoInteractions(currencyService);
  }

  @Test
  void shouldEchoCorrelationId() throws Exception {
    when(currencyService.getBaseCurrency(TENANT)).thenReturn(Optional.empty());

    mockMvc
        .perform(
            get("/v1/currencies/base")
                .header(TenantHeaders.TENANT_ID, TENANT)
                .header(TenantHeaders.CORRELATION_ID, "corr-123"))
        .andExpect(header().string(TenantHeaders.CORRELATION_ID, "corr-123"));
  }

  // ===========================================================================================
  // B. List
  // ===========================================================================================

  @Test
  void shouldListWithDefaults() throws Exception {
    var usd = CurrencyTestBuilder.defaultUsd().buildPersisted();
    when(currencyService.search(eq(TENANT), isNull(), eq(true), any(Pageable.class)))
        .thenReturn(new PageImpl<>(List.of(usd), PageRequest.of(0, 50), 1));

    mockMvc
        .perform(get("/v1/currencies").header(TenantHeaders.TENANT_ID, TENANT))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data.length()").value(1))
        .andExpect(jsonPath("$.data[0].code").value("USD"))
        .andExpect(jsonPath("$.data[0].decimalPlaces").value(2))
        .andExpect(jsonPath("$.data[0].symbolPosition").value("BEFORE"))
        .andExpect(jsonPath("$.meta.page").value(1))
        .andExpect(jsonPath("$.meta.limit").value(50))
        .andExpect(jsonPath("$.meta.total").value(1))
        .andExpect(jsonPath("$.meta.totalPages").value(1));

    var pageable = ArgumentCaptor.forClass(Pageable.class);
    verify(currencyService).search(eq(TENANT), isNull(), eq(true), pageable.capture());
    assertThat(pageable.getValue().getPageNumber()).isZero();
    assertThat(pageable.getValue().getPageSize()).isEqualTo(50);
    assertThat(pageable.getValue().getSort().getOrderFor("sortOrder").getDirection())
        .isEqualTo(Sort.Direction.ASC);
  }

  @Test
  void shouldPassSearchAndSortToService() throws Exception {
    when(currencyService.search(eq(TENANT), eq("yen"), eq(false), any(Pageable.class)))
        .thenReturn(new PageImpl<>(List.of(), PageRequest.of(1, 10), 0));

    mockMvc
        .perform(
            get("/v1/currencies")
                .header(TenantHeaders.TENANT_ID, TENANT)
                .param("page", "2")
                .param("limit", "10")
                .param("sortBy", "name")
                .param("sortOrder", "desc")
                .param("search", "yen")
                .param("activeOnly", "false"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.meta.page").value(2));

    var pageable = ArgumentCaptor.forClass(Pageable.class);
    verify(currencyService).search(eq(TENANT), eq("yen"), eq(false), pageable.capture());
    assertThat(pageable.getValue().getPageNumber()).isEqualTo(1);
    assertThat(pageable.getValue().getSort().getOrderFor("name").getDirection())
        .isEqualTo(Sort.Direction.DESC);
  }

  @Test
  void shouldRejectLimitAboveMaximum() throws Exception {
    mockMvc
        .perform(
            get("/v1/currencies").header(TenantHeaders.TENANT_ID, TENANT).param("limit", "101"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.type").value("VALIDATION_ERROR"));

    verifyNoInteractions(currencyService);
  }

  @Test
  void shouldRejectUnknownSortField() throws Exception {
    mockMvc
        .perform(
            get("/v1/currencies").header(TenantHeaders.TENANT_ID, TENANT).param("sortBy", "symbol"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
  }

  // ===========================================================================================
  // C. Base / predefined / by id
  // ===========================================================================================

  @Test
  void shouldReturnNoContentWhenNoBaseCurrency() throws Exception {
    when(currencyService.getBaseCurrency(TENANT)).thenReturn(Optional.empty());

    mockMvc
        .perform(get("/v1/currencies/base").header(TenantHeaders.TENANT_ID, TENANT))
        .andExpect(status().isNoContent());
  }

  @Test
  void shouldReturnBaseCurrency() throws Exception {
    var eur = CurrencyTestBuilder.defaultEur().baseCurrency(true).buildPersisted();
    when(currencyService.getBaseCurrency(TENANT)).thenReturn(Optional.of(eur));

    mockMvc
        .perform(get("/v1/currencies/base").header(TenantHeaders.TENANT_ID, TENANT))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.code").value("EUR"))
        .andExpect(jsonPath("$.baseCurrency").value(true));
  }

  @Test
  void shouldListPredefinedCurrencies() throws Exception {
    mockMvc
        .perform(get("/v1/currencies/predefined"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(PredefinedCurrencies.all().size()))
        .andExpect(jsonPath("$[0].code").value("USD"));
  }

  @Test
  void shouldReturnNotFoundForUnknownId() throws Exception {
    when(currencyService.getById(TENANT, TestConstants.EUR_ID))
        .thenThrow(
            new ResourceNotFoundException("Currency not found with id: " + TestConstants.EUR_ID));

    mockMvc
        .perform(
            get("/v1/currencies/{id}", TestConstants.EUR_ID)
                .header(TenantHeaders.TENANT_ID, TENANT))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.type").value("NOT_FOUND"));
  }

  @Test
  void shouldRejectMalformedId() throws Exception {
    mockMvc
        .perform(get("/v1/currencies/{id}", "not-a-uuid").header(TenantHeaders.TENANT_ID, TENANT))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.type").value("VALIDATION_ERROR"));
  }

  // ===========================================================================================
  // D. Register / retire
  // ===========================================================================================

  @Test
  void shouldRegisterCurrency() throws Exception {
    var saved = CurrencyTestBuilder.defaultJpy().buildPersisted();
    when(currencyService.register(eq(TENANT), any(Currency.class))).thenReturn(saved);

    mockMvc
        .perform(
            post("/v1/currencies")
                .header(TenantHeaders.TENANT_ID, TENANT)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"code": "jpy", "name": "Japanese Yen", "symbol": "¥", "decimalPlaces": 0}
                    """))
        .andExpect(status().isCreated())
        .andExpect(header().string("Location", endsWith("/v1/currencies/" + saved.getId())))
        .andExpect(jsonPath("$.id").value(saved.getId().toString()))
        .andExpect(jsonPath("$.code").value("JPY"))
        .andExpect(jsonPath("$.decimalPlaces").value(0));

    var captor = ArgumentCaptor.forClass(Currency.class);
    verify(currencyService).register(eq(TENANT), captor.capture());
    assertThat(captor.getValue().getDecimalPlaces()).isZero();
    assertThat(captor.getValue().isBaseCurrency()).isFalse();
  }

  @Test
  void shouldRejectInvalidCurrencyBody() throws Exception {
    mockMvc
        .perform(
            post("/v1/currencies")
                .header(TenantHeaders.TENANT_ID, TENANT)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"code": "US1", "name": "Broken", "symbol": "$", "decimalPlaces": 2}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.type").value("VALIDATION_ERROR"))
        .andExpect(jsonPath("$.fieldErrors[0].field").value("code"));

    verifyNoInteractions(currencyService);
  }

  @Test
  void shouldRejectTooManyDecimalPlaces() throws Exception {
    mockMvc
        .perform(
            post("/v1/currencies")
                .header(TenantHeaders.TENANT_ID, TENANT)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"code": "XAU", "name": "Gold", "symbol": "Au", "decimalPlaces": 5}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.fieldErrors[0].field").value("decimalPlaces"));
  }

  @Test
  void shouldReturnUnprocessableEntityForDuplicateCode() throws Exception {
    when(currencyService.register(eq(TENANT), any(Currency.class)))
        .thenThrow(
            new BusinessException(
                "Currency code 'USD' already exists",
                CurrencyServiceError.DUPLICATE_CURRENCY_CODE.name()));

    mockMvc
        .perform(
            post("/v1/currencies")
                .header(TenantHeaders.TENANT_ID, TENANT)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"code": "USD", "name": "US Dollar", "symbol": "$"}
                    """))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.type").value("APPLICATION_ERROR"))
        .andExpect(jsonPath("$.code").value("DUPLICATE_CURRENCY_CODE"));
  }

  @Test
  void shouldRetireCurrency() throws Exception {
    mockMvc
        .perform(
            delete("/v1/currencies/{id}", TestConstants.EUR_ID)
                .header(TenantHeaders.TENANT_ID, TENANT))
        .andExpect(status().isNoContent());

    verify(currencyService).retire(TENANT, TestConstants.EUR_ID);
  }

  @Test
  void shouldRefuseToRetireBaseCurrency() throws Exception {
    doThrow(
            new BusinessException(
                "Base currency 'USD' cannot be retired",
                CurrencyServiceError.CANNOT_RETIRE_BASE_CURRENCY.name()))
        .when(currencyService)
        .retire(TENANT, TestConstants.USD_ID);

    mockMvc
        .perform(
            delete("/v1/currencies/{id}", TestConstants.USD_ID)
                .header(TenantHeaders.TENANT_ID, TENANT))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.code").value("CANNOT_RETIRE_BASE_CURRENCY"));
  }
}
