package io.shortshop.ecommerce.application.review.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateReviewRequest(
    @JsonProperty("product_id")
    @NotNull(message = "product_id is required")
    Long productId,

    @NotBlank(message = "title is required")
    @Size(min = 10, max = 120, message = "title must be 10-120 characters")
    String title,

    @NotBlank(message = "description is required")
    @Size(min = 20, max = 300, message = "description must be 20-300 characters")
    String description,

    @JsonProperty("author_name")
    @NotBlank(message = "author_name is required")
    @Size(max = 100, message = "author_name must be at most 100 characters")
    String authorName,

    @NotNull(message = "score is required")
    @Min(value = 1, message = "score must be between 1 and 5")
    @Max(value = 5, message = "score must be between 1 and 5")
    Integer score
) {}
