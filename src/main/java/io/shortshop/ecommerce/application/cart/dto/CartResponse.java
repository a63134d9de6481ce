package io.shortshop.ecommerce.application.cart.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.shortshop.ecommerce.domain.cart.Cart;

import java.util.List;

public record CartResponse(
    Long id,
    @JsonProperty("session_id")
    String sessionId,
    List<CartItemResponse> items
) {
    public static CartResponse from(Cart cart) {
        return new CartResponse(
            cart.getId(),
            cart.getSessionId(),
            cart.getItems().stream().map(CartItemResponse::from).toList()
        );
    }
}
