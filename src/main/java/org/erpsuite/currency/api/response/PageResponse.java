package org.erpsuite.currency.api.response;

import java.util.List;
import java.util.function.Function;

import org.springframework.data.domain.Page;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * One page of a list endpoint.
 *
 * @param <T> item type
 */
@Schema(description = "Paginated list")
public record PageResponse<T>(
    @Schema(description = "Items of this page", requiredMode = Schema.RequiredMode.REQUIRED)
        List<T> data,
    @Schema(description = "Pagination details", requiredMode = Schema.RequiredMode.REQUIRED)
        PaginationMeta meta) {

  /**
   * Builds a page response, converting Spring Data's zero-based page number to the one-based number
   * used by the API.
   */
  public static <E, T> PageResponse<T> of(Page<E> page, Function<E, T> mapper) {
    return new PageResponse<>(
        page.getContent().stream().map(mapper).toList(),
        new PaginationMeta(
            page.getNumber() + 1, page.getSize(), page.getTotalElements(), page.getTotalPages()));
  }

  /**
   * @param page one-based page number
   * @param limit page size
   * @param total total number of items
   * @param totalPages total number of pages
   */
  public record PaginationMeta(int page, int limit, long total, int totalPages) {}
}
