package io.shortshop.ecommerce.domain.product;

import io.shortshop.ecommerce.common.exception.BusinessException;
import io.shortshop.ecommerce.common.exception.ErrorCode;

import java.util.List;
import java.util.Optional;

public interface ProductRecommendationRepository {

    Optional<ProductRecommendation> findById(Long id);

    List<ProductRecommendation> findByBaseProductIdOrderByIdAsc(Long baseProductId);

    boolean existsByBaseProductIdAndRecommendedProductId(Long baseProductId, Long recommendedProductId);

    ProductRecommendation save(ProductRecommendation recommendation);

    void delete(ProductRecommendation recommendation);

    /**
     * 상품이 base 또는 recommended 쪽에 걸린 간선을 모두 삭제
     */
    int deleteAllByProductId(Long productId);

    default ProductRecommendation findByIdOrThrow(Long id) {
        return findById(id)
            .orElseThrow(() -> new BusinessException(
                ErrorCode.RECOMMENDATION_NOT_FOUND,
                "Recommendation not found. recommendationId: " + id
            ));
    }
}
