package io.shortshop.ecommerce.application.product.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.shortshop.ecommerce.domain.product.ProductImage;

public record ImageResponse(
    Long id,
    String color,
    @JsonProperty("image_url")
    String imageUrl
) {
    public static ImageResponse from(ProductImage image) {
        return new ImageResponse(
            image.getId(),
            image.getColor(),
            image.getImageUrl()
        );
    }
}
