package io.shortshop.ecommerce.domain.cart;

import java.util.Collection;

public interface CartItemRepository {

    CartItem save(CartItem cartItem);

    /**
     * 삭제되는 옵션을 참조하는 장바구니 항목 일괄 삭제
     */
    int deleteAllByVariantIds(Collection<Long> variantIds);
}
