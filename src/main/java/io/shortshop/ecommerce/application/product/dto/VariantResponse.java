package io.shortshop.ecommerce.application.product.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.shortshop.ecommerce.domain.product.ProductVariant;
import io.shortshop.ecommerce.domain.product.VariantSize;

public record VariantResponse(
    Long id,
    String color,
    VariantSize size,
    @JsonProperty("in_stock")
    boolean inStock
) {
    public static VariantResponse from(ProductVariant variant) {
        return new VariantResponse(
            variant.getId(),
            variant.getColor(),
            variant.getSize(),
            variant.isInStock()
        );
    }
}
