package io.shortshop.ecommerce.application.product.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.shortshop.ecommerce.domain.product.ProductRecommendation;

public record RecommendationResponse(
    Long id,
    @JsonProperty("base_product_id")
    Long baseProductId,
    @JsonProperty("recommended_product_id")
    Long recommendedProductId
) {
    public static RecommendationResponse from(ProductRecommendation recommendation) {
        return new RecommendationResponse(
            recommendation.getId(),
            recommendation.getBaseProductId(),
            recommendation.getRecommendedProductId()
        );
    }
}
