package org.erpsuite.currency.api;

import java.util.List;
import java.util.Set;
import java.util.UUID;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
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
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.erpsuite.currency.api.request.CurrencyCreateRequest;
import org.erpsuite.currency.api.request.CurrencyUpdateRequest;
import org.erpsuite.currency.api.response.CurrencyResponse;
import org.erpsuite.currency.api.response.PageResponse;
import org.erpsuite.currency.api.response.PredefinedCurrencyResponse;
import org.erpsuite.currency.domain.PredefinedCurrencies;
import org.erpsuite.currency.http.TenantHeaders;
import org.erpsuite.currency.service.CurrencyService;
import org.erpsuite.currency.service.CurrencyServiceError;
import org.erpsuite.currency.service.exception.InvalidRequestException;

/** Endpoints for the tenant's currency registry. */
@Tag(name = "Currency Handler", description = "Endpoints for managing tenant currencies")
@RestController
@RequestMapping(path = "/v1/currencies")
public class CurrencyController {

  private static final Logger log = LoggerFactory.getLogger(CurrencyController.class);

  private static final Set<String> SORTABLE_FIELDS =
      Set.of("sortOrder", "code", "name", "createdAt");

  private final CurrencyService currencyService;

  public CurrencyController(CurrencyService currencyService) {
    this.currencyService = currencyService;
  }

  @Operation(
      summary = "List currencies",
      description =
          "List the tenant's currencies, excluding retired ones. Supports paging, sorting and a"
              + " case-insensitive search over name, code and symbol.")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Page of currencies"),
        @ApiResponse(responseCode = "400", description = "Invalid paging or sort parameters")
      })
  @GetMapping(produces = "application/json")
  public PageResponse<CurrencyResponse> list(
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
      @Parameter(description = "Sort field: sortOrder, code, name or createdAt")
          @RequestParam(defaultValue = "sortOrder")
          String sortBy,
      @Parameter(description = "Sort direction: asc or desc")
          @RequestParam(defaultValue = "asc")
          String sortOrder,
      @Parameter(description = "Search term") @RequestParam(required = false) String search,
      @Parameter(description = "Return only active currencies")
          @RequestParam(defaultValue = "true")
          boolean activeOnly) {
    log.info(
        "Listing currencies for tenant {}, page: {}, limit: {}, search: {}",
        tenantId,
        page,
        limit,
        search);

    var pageable = PageRequest.of(page - 1, limit, sort(sortBy, sortOrder));
    var result = currencyService.search(tenantId, search, activeOnly, pageable);

    return PageResponse.of(result, CurrencyResponse::from);
  }

  @Operation(
      summary = "Get base currency",
      description = "Retrieve the tenant's base currency. Returns 204 when none is designated.")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Base currency",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = CurrencyResponse.class))),
        @ApiResponse(responseCode = "204", description = "No base currency designated")
      })
  @GetMapping(path = "/base", produces = "application/json")
  public ResponseEntity<CurrencyResponse> getBaseCurrency(
      @RequestHeader(TenantHeaders.TENANT_ID) String tenantId) {
    log.info("Getting base currency for tenant {}", tenantId);

    return currencyService
        .getBaseCurrency(tenantId)
        .map(currency -> ResponseEntity.ok(CurrencyResponse.from(currency)))
        .orElseGet(() -> ResponseEntity.noContent().build());
  }

  @Operation(
      summary = "List predefined currencies",
      description = "Catalog of common currencies that can be used as registration templates")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    array =
                        @ArraySchema(
                            schema = @Schema(implementation = PredefinedCurrencyResponse.class))))
      })
  @GetMapping(path = "/predefined", produces = "application/json")
  public List<PredefinedCurrencyResponse> getPredefined() {
    return PredefinedCurrencies.all().stream().map(PredefinedCurrencyResponse::from).toList();
  }

  @Operation(summary = "Get currency by ID")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Currency retrieved successfully",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = CurrencyResponse.class))),
        @ApiResponse(responseCode = "404", description = "Currency not found")
      })
  @GetMapping(path = "/{id}", produces = "application/json")
  public CurrencyResponse getById(
      @RequestHeader(TenantHeaders.TENANT_ID) String tenantId, @PathVariable UUID id) {
    log.info("Retrieving currency id: {} for tenant {}", id, tenantId);

    return CurrencyResponse.from(currencyService.getById(tenantId, id));
  }

  @Operation(
      summary = "Register a currency",
      description =
          "Register a currency for the tenant. Registering it as base currency clears the flag on"
              + " the previous base currency.")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "201",
            description = "Currency registered successfully",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = CurrencyResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid request"),
        @ApiResponse(
            responseCode = "422",
            description = "Business validation failed",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class),
                    examples = {
                      @ExampleObject(
                          name = "Duplicate Currency Code",
                          summary = "Currency code already registered",
                          value =
                              """
                      {
                        "type": "APPLICATION_ERROR",
                        "message": "Currency code 'EUR' already exists",
                        "code": "DUPLICATE_CURRENCY_CODE"
                      }
                      """)
                    }))
      })
  @PostMapping(produces = "application/json", consumes = "application/json")
  @ResponseStatus(HttpStatus.CREATED)
  public ResponseEntity<CurrencyResponse> create(
      @RequestHeader(TenantHeaders.TENANT_ID) String tenantId,
      @Valid @RequestBody CurrencyCreateRequest request) {
    log.info("Registering currency {} for tenant {}", request.code(), tenantId);

    var created = currencyService.register(tenantId, request.toEntity());

    var location =
        ServletUriComponentsBuilder.fromCurrentRequest()
            .path("/{id}")
            .buildAndExpand(created.getId())
            .toUri();

    return ResponseEntity.created(location).body(CurrencyResponse.from(created));
  }

  @Operation(
      summary = "Update currency",
      description = "Partially update a currency; omitted fields keep their current value")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Currency updated successfully",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = CurrencyResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid request"),
        @ApiResponse(responseCode = "404", description = "Currency not found"),
        @ApiResponse(responseCode = "422", description = "Business validation failed")
      })
  @PatchMapping(path = "/{id}", produces = "application/json", consumes = "application/json")
  public CurrencyResponse update(
      @RequestHeader(TenantHeaders.TENANT_ID) String tenantId,
      @PathVariable UUID id,
      @Valid @RequestBody CurrencyUpdateRequest request) {
    log.info("Updating currency id: {} for tenant {}", id, tenantId);

    return CurrencyResponse.from(currencyService.update(tenantId, id, request.toUpdate()));
  }

  @Operation(
      summary = "Retire currency",
      description = "Soft-delete a currency. The base currency cannot be retired.")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "204", description = "Currency retired"),
        @ApiResponse(responseCode = "404", description = "Currency not found"),
        @ApiResponse(responseCode = "422", description = "Currency is the base currency")
      })
  @DeleteMapping(path = "/{id}")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void retire(
      @RequestHeader(TenantHeaders.TENANT_ID) String tenantId, @PathVariable UUID id) {
    log.info("Retiring currency id: {} for tenant {}", id, tenantId);

    currencyService.retire(tenantId, id);
  }

  private static Sort sort(String sortBy, String sortOrder) {
    if (!SORTABLE_FIELDS.contains(sortBy)) {
      throw new InvalidRequestException(
          "Unsupported sort field: " + sortBy, CurrencyServiceError.VALIDATION_ERROR.name());
    }

    Sort.Direction direction;
    if ("asc".equalsIgnoreCase(sortOrder)) {
      direction = Sort.Direction.ASC;
    } else if ("desc".equalsIgnoreCase(sortOrder)) {
      direction = Sort.Direction.DESC;
    } else {
      throw new InvalidRequestException(
          "Unsupported sort direction: " + sortOrder, CurrencyServiceError.VALIDATION_ERROR.name());
    }

    return Sort.by(direction, sortBy).and(Sort.by("id"));
  }
}
