package io.shortshop.ecommerce.application.cart;

import io.shortshop.ecommerce.application.cart.dto.CartItemResponse;
import io.shortshop.ecommerce.application.cart.dto.CartResponse;
import io.shortshop.ecommerce.common.exception.BusinessException;
import io.shortshop.ecommerce.common.exception.ErrorCode;
import io.shortshop.ecommerce.domain.cart.Cart;
import io.shortshop.ecommerce.domain.cart.CartItem;
import io.shortshop.ecommerce.domain.cart.CartItemRepository;
import io.shortshop.ecommerce.domain.cart.CartRepository;
import io.shortshop.ecommerce.domain.product.ProductVariant;
import io.shortshop.ecommerce.domain.product.ProductVariantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 장바구니 서비스
 *
 * 장바구니는 클라이언트가 전달한 session_id로 식별한다.
 * session_id 유니크 제약 위반(동시 생성)은 GlobalExceptionHandler에서 409로 응답한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CartService {

    private final CartRepository cartRepository;
    private final CartItemRepository cartItemRepository;
    private final ProductVariantRepository variantRepository;

    /**
     * 장바구니 생성
     * 같은 session_id의 장바구니가 이미 있으면 기존 장바구니를 반환한다.
     */
    @Transactional
    public CartResponse createCart(String sessionId) {
        log.info("Creating cart for session: {}", sessionId);

        Cart cart = getOrCreateCart(sessionId);
        return CartResponse.from(cart);
    }

    @Transactional(readOnly = true)
    public CartResponse getCart(String sessionId) {
        log.info("Getting cart for session: {}", sessionId);

        Cart cart = cartRepository.findBySessionIdOrThrow(sessionId);
        return CartResponse.from(cart);
    }

    /**
     * 장바구니 비우기 (장바구니 자체는 유지)
     */
    @Transactional
    public void clearCart(String sessionId) {
        log.info("Clearing cart for session: {}", sessionId);

        Cart cart = cartRepository.findBySessionIdOrThrow(sessionId);
        int itemCount = cart.getItems().size();
        cart.clear();

        log.debug("Cleared {} item(s) from cart: {}", itemCount, cart.getId());
    }

    /**
     * 장바구니 담기
     *
     * 1. 옵션 존재 확인 (없으면 장바구니도 만들지 않음)
     * 2. 장바구니 조회 또는 생성
     * 3. 같은 옵션이 있으면 수량 합산, 없으면 새 항목 추가
     */
    @Transactional
    public CartItemResponse addItem(String sessionId, Long variantId, Integer quantity) {
        log.info("Adding item to cart - session: {}, variantId: {}, quantity: {}", sessionId, variantId, quantity);

        // 1. 옵션 조회
        ProductVariant variant = variantRepository.findByIdOrThrow(variantId);

        // 2. 장바구니 조회 또는 생성
        Cart cart = getOrCreateCart(sessionId);

        // 3. 항목 추가 또는 수량 합산
        CartItem item = cart.addItem(variant, quantity);
        if (item.getId() == null) {
            cartItemRepository.save(item);
        }

        log.debug("Cart item: {}, quantity: {}", item.getId(), item.getQuantity());
        return CartItemResponse.from(item);
    }

    @Transactional
    public CartItemResponse updateItem(String sessionId, Long itemId, Integer quantity) {
        log.info("Updating cart item - session: {}, itemId: {}, quantity: {}", sessionId, itemId, quantity);

        Cart cart = cartRepository.findBySessionIdOrThrow(sessionId);
        CartItem item = findItemOrThrow(cart, itemId);

        item.updateQuantity(quantity);

        return CartItemResponse.from(item);
    }

    @Transactional
    public void deleteItem(String sessionId, Long itemId) {
        log.info("Deleting cart item - session: {}, itemId: {}", sessionId, itemId);

        Cart cart = cartRepository.findBySessionIdOrThrow(sessionId);
        CartItem item = findItemOrThrow(cart, itemId);

        cart.removeItem(item);
    }

    private Cart getOrCreateCart(String sessionId) {
        return cartRepository.findBySessionId(sessionId)
            .orElseGet(() -> {
                Cart saved = cartRepository.save(Cart.create(sessionId));
                log.info("New cart created: {} for session: {}", saved.getId(), sessionId);
                return saved;
            });
    }

    private CartItem findItemOrThrow(Cart cart, Long itemId) {
        return cart.findItem(itemId)
            .orElseThrow(() -> new BusinessException(
                ErrorCode.CART_ITEM_NOT_FOUND,
                String.format("Item not found in this cart. cartId: %d, itemId: %d", cart.getId(), itemId)
            ));
    }
}
