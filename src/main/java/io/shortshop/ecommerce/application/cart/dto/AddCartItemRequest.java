package io.shortshop.ecommerce.application.cart.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.shortshop.ecommerce.domain.cart.CartItem;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record AddCartItemRequest(
    @JsonProperty("variant_id")
    @NotNull(message = "variant_id is required")
    @Positive(message = "variant_id must be greater than 0")
    Long variantId,

    @NotNull(message = "quantity is required")
    @Min(value = 1, message = "quantity must be between 1 and 10000")
    @Max(value = CartItem.MAX_QUANTITY, message = "quantity must be between 1 and 10000")
    Integer quantity
) {}
