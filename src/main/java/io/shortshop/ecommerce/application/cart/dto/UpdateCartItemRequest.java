package io.shortshop.ecommerce.application.cart.dto;

import io.shortshop.ecommerce.domain.cart.CartItem;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record UpdateCartItemRequest(
    @NotNull(message = "quantity is required")
    @Min(value = 1, message = "quantity must be between 1 and 10000")
    @Max(value = CartItem.MAX_QUANTITY, message = "quantity must be between 1 and 10000")
    Integer quantity
) {}
