package io.shortshop.ecommerce.application.review.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.shortshop.ecommerce.domain.review.ProductReview;

public record ReviewResponse(
    Long id,
    @JsonProperty("product_id")
    Long productId,
    String title,
    String description,
    @JsonProperty("author_name")
    String authorName,
    Integer score
) {
    public static ReviewResponse from(ProductReview review) {
        return new ReviewResponse(
            review.getId(),
            review.getProductId(),
            review.getTitle(),
            review.getDescription(),
            review.getAuthorName(),
            review.getScore()
        );
    }
}
