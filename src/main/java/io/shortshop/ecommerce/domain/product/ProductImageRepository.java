package io.shortshop.ecommerce.domain.product;

import java.util.Optional;

public interface ProductImageRepository {

    /**
     * 이미지가 해당 상품 소속일 때만 조회된다.
     */
    Optional<ProductImage> findByIdAndProductId(Long id, Long productId);
}
