package io.shortshop.ecommerce.application.product.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.shortshop.ecommerce.domain.product.VariantSize;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * 옵션 추가/수정 공용 요청 (수정 시에도 세 필드 모두 교체)
 */
public record VariantRequest(
    @NotBlank(message = "color is required")
    @Size(max = 50, message = "color must be at most 50 characters")
    String color,

    @NotNull(message = "size is required")
    VariantSize size,

    @JsonProperty("in_stock")
    Boolean inStock
) {
    public boolean inStockOrDefault() {
        return inStock != null && inStock;
    }
}
