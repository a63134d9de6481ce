package io.shortshop.ecommerce.application.product.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ImageRequest(
    @Size(max = 50, message = "color must be at most 50 characters")
    String color,

    @JsonProperty("image_url")
    @NotBlank(message = "image_url is required")
    @Size(max = 255, message = "image_url must be at most 255 characters")
    String imageUrl
) {}
