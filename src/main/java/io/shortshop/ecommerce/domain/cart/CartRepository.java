package io.shortshop.ecommerce.domain.cart;

import io.shortshop.ecommerce.common.exception.BusinessException;
import io.shortshop.ecommerce.common.exception.ErrorCode;

import java.util.Optional;

public interface CartRepository {

    Optional<Cart> findBySessionId(String sessionId);

    Cart save(Cart cart);

    default Cart findBySessionIdOrThrow(String sessionId) {
        return findBySessionId(sessionId)
            .orElseThrow(() -> new BusinessException(
                ErrorCode.CART_NOT_FOUND,
                "Cart not found. sessionId: " + sessionId
            ));
    }
}
