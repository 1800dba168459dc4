package org.erpsuite.currency.api;

import java.util.List;

import jakarta.validation.Valid;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.erpsuite.currency.api.request.ConversionRequest;
import org.erpsuite.currency.api.response.ConversionResponse;
import org.erpsuite.currency.http.TenantHeaders;
import org.erpsuite.currency.service.CurrencyConversionService;

@Tag(name = "Currency Conversion Handler", description = "Endpoints for converting amounts")
@RestController
@RequestMapping(path = "/v1/currencies")
public class CurrencyConversionController {

  private static final Logger log = LoggerFactory.getLogger(CurrencyConversionController.class);

  private final CurrencyConversionService conversionService;

  public CurrencyConversionController(CurrencyConversionService conversionService) {
    this.conversionService = conversionService;
  }

  @Operation(
      summary = "Convert an amount",
      description =
          "Convert an amount using the rate effective at the given date (default now). The result"
              + " is rounded to the target currency's decimal places.")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Amount converted",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ConversionResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid request"),
        @ApiResponse(
            responseCode = "404",
            description = "Currency or rate not found",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class),
                    examples = {
                      @ExampleObject(
                          name = "Rate Not Found",
                          summary = "No rate applies in either direction",
                          value =
                              """
                      {
                        "type": "NOT_FOUND",
                        "message": "Exchange rate not found for USD -> EUR as of 2024-01-01T00:00:00Z",
                        "code": "RATE_NOT_FOUND"
                      }
                      """)
                    }))
      })
  @PostMapping(path = "/convert", produces = "application/json", consumes = "application/json")
  public ConversionResponse convert(
      @RequestHeader(TenantHeaders.TENANT_ID) String tenantId,
      @Valid @RequestBody ConversionRequest request) {
    log.info(
        "Converting {} {} to {} for tenant {}",
        request.amount(),
        request.fromCurrency(),
        request.toCurrency(),
        tenantId);

    return ConversionResponse.from(conversionService.convert(tenantId, request.toQuery()));
  }

  @Operation(
      summary = "Convert several amounts",
      description =
          "Convert up to 100 amounts in one request. Items that cannot be converted are left out"
              + " of the response; the remaining results keep the request order.")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Results of the convertible items",
            content =
                @Content(
                    mediaType = "application/json",
                    array =
                        @ArraySchema(schema = @Schema(implementation = ConversionResponse.class)))),
        @ApiResponse(responseCode = "400", description = "Empty list or too many items")
      })
  @PostMapping(
      path = "/bulk-convert",
      produces = "application/json",
      consumes = "application/json")
  public List<ConversionResponse> bulkConvert(
      @RequestHeader(TenantHeaders.TENANT_ID) String tenantId,
      @RequestBody List<ConversionRequest> requests) {
    log.info("Bulk converting {} items for tenant {}", requests.size(), tenantId);

    var queries = requests.stream().map(r -> r != null ? r.toQuery() : null).toList();

    return conversionService.bulkConvert(tenantId, queries).stream()
        .map(ConversionResponse::from)
        .toList();
  }
}
