package io.shortshop.ecommerce.presentation.api.cart;

import io.shortshop.ecommerce.application.cart.CartService;
import io.shortshop.ecommerce.application.cart.dto.AddCartItemRequest;
import io.shortshop.ecommerce.application.cart.dto.CartItemResponse;
import io.shortshop.ecommerce.application.cart.dto.CartResponse;
import io.shortshop.ecommerce.application.cart.dto.CreateCartRequest;
import io.shortshop.ecommerce.application.cart.dto.UpdateCartItemRequest;
import io.shortshop.ecommerce.presentation.common.MessageResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@Tag(name = "Cart", description = "세션 장바구니")
@Validated
@RestController
@RequestMapping("/api/v1/cart")
@RequiredArgsConstructor
public class CartController {

    private final CartService cartService;

    @Operation(summary = "장바구니 생성 (이미 있으면 기존 장바구니 반환)")
    @PostMapping({"", "/"})
    public ResponseEntity<CartResponse> createCart(@Valid @RequestBody CreateCartRequest request) {
        CartResponse response = cartService.createCart(request.sessionId());
        return ResponseEntity
            .status(HttpStatus.CREATED)
            .body(response);
    }

    @Operation(summary = "장바구니 조회")
    @GetMapping("/{sessionId}")
    public ResponseEntity<CartResponse> getCart(@PathVariable String sessionId) {
        return ResponseEntity.ok(cartService.getCart(sessionId));
    }

    @Operation(summary = "장바구니 비우기")
    @DeleteMapping("/{sessionId}")
    public ResponseEntity<MessageResponse> clearCart(@PathVariable String sessionId) {
        cartService.clearCart(sessionId);
        return ResponseEntity.ok(MessageResponse.of("Cart cleared"));
    }

    @Operation(summary = "장바구니 담기")
    @PostMapping("/{sessionId}/items")
    public ResponseEntity<CartItemResponse> addItem(
        @PathVariable String sessionId,
        @Valid @RequestBody AddCartItemRequest request
    ) {
        CartItemResponse response = cartService.addItem(sessionId, request.variantId(), request.quantity());
        return ResponseEntity
            .status(HttpStatus.CREATED)
            .body(response);
    }

    @Operation(summary = "장바구니 항목 수량 변경")
    @PutMapping("/{sessionId}/items/{itemId}")
    public ResponseEntity<CartItemResponse> updateItem(
        @PathVariable String sessionId,
        @PathVariable Long itemId,
        @Valid @RequestBody UpdateCartItemRequest request
    ) {
        return ResponseEntity.ok(cartService.updateItem(sessionId, itemId, request.quantity()));
    }

    @Operation(summary = "장바구니 항목 삭제")
    @DeleteMapping("/{sessionId}/items/{itemId}")
    public ResponseEntity<MessageResponse> deleteItem(
        @PathVariable String sessionId,
        @PathVariable Long itemId
    ) {
        cartService.deleteItem(sessionId, itemId);
        return ResponseEntity.ok(MessageResponse.of("Cart item deleted"));
    }
}
