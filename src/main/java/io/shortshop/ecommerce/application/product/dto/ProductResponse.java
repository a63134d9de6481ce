package io.shortshop.ecommerce.application.product.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.shortshop.ecommerce.domain.product.Product;

import java.math.BigDecimal;
import java.util.List;

public record ProductResponse(
    Long id,
    String name,
    BigDecimal price,
    String description,
    @JsonProperty("lifetime_guarantee")
    boolean lifetimeGuarantee,
    List<VariantResponse> variants,
    List<ImageResponse> images
) {
    public static ProductResponse from(Product product) {
        return new ProductResponse(
            product.getId(),
            product.getName(),
            product.getPrice(),
            product.getDescription(),
            product.isLifetimeGuarantee(),
            product.getVariants().stream().map(VariantResponse::from).toList(),
            product.getImages().stream().map(ImageResponse::from).toList()
        );
    }
}
