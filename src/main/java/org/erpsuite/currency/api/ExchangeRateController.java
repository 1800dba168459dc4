package org.erpsuite.currency.api;

import java.util.UUID;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.erpsuite.currency.api.request.ExchangeRateCreateRequest;
import org.erpsuite.currency.api.request.ExchangeRateUpdateRequest;
import org.erpsuite.currency.api.response.ExchangeRateResponse;
import org.erpsuite.currency.api.response.PageResponse;
import org.erpsuite.currency.api.response.RateResolutionResponse;
import org.erpsuite.currency.http.TenantHeaders;
import org.erpsuite.currency.repository.ExchangeRateRepository;
import org.erpsuite.currency.service.AsOfDates;
import org.erpsuite.currency.service.ExchangeRateService;
import org.erpsuite.currency.service.RateResolutionService;

@Tag(name = "Exchange Rates Handler", description = "Endpoints for managing exchange rates")
@RestController
@RequestMapping(path = "/v1/exchange-rates")
public class ExchangeRateController {

  private static final Logger log = LoggerFactory.getLogger(ExchangeRateController.class);

  private final ExchangeRateService exchangeRateService;
  private final RateResolutionService rateResolutionService;

  public ExchangeRateController(
      ExchangeRateService exchangeRateService, RateResolutionService rateResolutionService) {
    this.exchangeRateService = exchangeRateService;
    this.rateResolutionService = rateResolutionService;
  }

  @Operation(
      summary = "List exchange rates",
      description = "List the tenant's stored exchange rates, latest effective date first")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Page of exchange rates"),
        @ApiResponse(responseCode = "400", description = "Invalid paging parameters")
      })
  @GetMapping(produces = "application/json")
  public PageResponse<ExchangeRateResponse> list(
      @RequestHeader(TenantHeaders.TENANT_ID) String tenantId,
      @Parameter(description = "One-based page number")
          @RequestParam(defaultValue = "1")
          @Min(1)
          int page,
      @Parameter(description = "Page size")
          @RequestParam(defaultValue = "50")
          @Min(1)
          @Max(100)
          int limit,
      @Parameter(description = "Return only active rates")
          @RequestParam(defaultValue = "true")
          boolean activeOnly) {
    log.info("Listing exchange rates for tenant {}, page: {}, limit: {}", tenantId, page, limit);

    var pageable = PageRequest.of(page - 1, limit, ExchangeRateRepository.LATEST_FIRST);
    var result = exchangeRateService.search(tenantId, activeOnly, pageable);

    return PageResponse.of(result, ExchangeRateResponse::from);
  }

  @Operation(
      summary = "Resolve the effective rate for a currency pair",
      description =
          "Resolve the rate from one currency to another at the given date (default now). Falls"
              + " back to the inverse of the opposite direction when no direct rate applies.")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Rate resolved",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = RateResolutionResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid currency code or date"),
        @ApiResponse(responseCode = "404", description = "Currency or rate not found")
      })
  @GetMapping(path = "/{fromCode}/{toCode}", produces = "application/json")
  public RateResolutionResponse resolve(
      @RequestHeader(TenantHeaders.TENANT_ID) String tenantId,
      @PathVariable @Pattern(regexp = "^[A-Za-z]{3}$") String fromCode,
      @PathVariable @Pattern(regexp = "^[A-Za-z]{3}$") String toCode,
      @Parameter(description = "As-of date, ISO-8601 date or date-time", example = "2024-07-01")
          @RequestParam(required = false)
          String date) {
    log.info("Resolving rate {} -> {} for tenant {}, date: {}", fromCode, toCode, tenantId, date);

    var resolution =
        rateResolutionService.resolveRate(tenantId, fromCode, toCode, AsOfDates.parse(date));

    return RateResolutionResponse.from(resolution);
  }

  @Operation(summary = "Get exchange rate by ID")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ExchangeRateResponse.class))),
        @ApiResponse(responseCode = "404", description = "Exchange rate not found")
      })
  @GetMapping(path = "/{id}", produces = "application/json")
  public ExchangeRateResponse getById(
      @RequestHeader(TenantHeaders.TENANT_ID) String tenantId, @PathVariable UUID id) {
    log.info("Retrieving exchange rate id: {} for tenant {}", id, tenantId);

    return ExchangeRateResponse.from(exchangeRateService.getById(tenantId, id));
  }

  @Operation(
      summary = "Create an exchange rate",
      description =
          "Store a rate for a directed currency pair. The inverse rate is derived automatically.")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "201",
            description = "Exchange rate created",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ExchangeRateResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid request"),
        @ApiResponse(
            responseCode = "422",
            description = "Unknown currency, identical currencies or inverted validity window")
      })
  @PostMapping(produces = "application/json", consumes = "application/json")
  @ResponseStatus(HttpStatus.CREATED)
  public ResponseEntity<ExchangeRateResponse> create(
      @RequestHeader(TenantHeaders.TENANT_ID) String tenantId,
      @Valid @RequestBody ExchangeRateCreateRequest request) {
    log.info(
        "Creating exchange rate {} -> {} for tenant {}",
        request.fromCurrencyId(),
        request.toCurrencyId(),
        tenantId);

    var created = exchangeRateService.create(tenantId, request.toEntity());

    var location =
        ServletUriComponentsBuilder.fromCurrentRequest()
            .path("/{id}")
            .buildAndExpand(created.getId())
            .toUri();

    return ResponseEntity.created(location).body(ExchangeRateResponse.from(created));
  }

  @Operation(
      summary = "Update an exchange rate",
      description = "Partially update a rate. A new rate also recomputes the inverse rate.")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ExchangeRateResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid request"),
        @ApiResponse(responseCode = "404", description = "Exchange rate not found"),
        @ApiResponse(responseCode = "422", description = "Inverted validity window")
      })
  @PatchMapping(path = "/{id}", produces = "application/json", consumes = "application/json")
  public ExchangeRateResponse update(
      @RequestHeader(TenantHeaders.TENANT_ID) String tenantId,
      @PathVariable UUID id,
      @Valid @RequestBody ExchangeRateUpdateRequest request) {
    log.info("Updating exchange rate id: {} for tenant {}", id, tenantId);

    return ExchangeRateResponse.from(exchangeRateService.update(tenantId, id, request.toUpdate()));
  }

  @Operation(
      summary = "Deactivate an exchange rate",
      description = "Deactivated rates are kept but ignored by rate resolution")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "204", description = "Exchange rate deactivated"),
        @ApiResponse(responseCode = "404", description = "Exchange rate not found")
      })
  @DeleteMapping(path = "/{id}")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void deactivate(
      @RequestHeader(TenantHeaders.TENANT_ID) String tenantId, @PathVariable UUID id) {
    log.info("Deactivating exchange rate id: {} for tenant {}", id, tenantId);

    exchangeRateService.deactivate(tenantId, id);
  }
}
