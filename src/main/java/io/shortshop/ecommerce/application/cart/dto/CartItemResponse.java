package io.shortshop.ecommerce.application.cart.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.shortshop.ecommerce.domain.cart.CartItem;

public record CartItemResponse(
    Long id,
    @JsonProperty("variant_id")
    Long variantId,
    Integer quantity
) {
    public static CartItemResponse from(CartItem cartItem) {
        return new CartItemResponse(
            cartItem.getId(),
            cartItem.getVariantId(),
            cartItem.getQuantity()
        );
    }
}
