package io.shortshop.ecommerce.application.product;

import io.shortshop.ecommerce.application.product.dto.RecommendationResponse;
import io.shortshop.ecommerce.common.exception.BusinessException;
import io.shortshop.ecommerce.common.exception.ErrorCode;
import io.shortshop.ecommerce.domain.product.ProductRecommendation;
import io.shortshop.ecommerce.domain.product.ProductRecommendationRepository;
import io.shortshop.ecommerce.domain.product.ProductRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * 추천 상품 관리
 *
 * - 자기 자신 추천 불가
 * - 같은 (base, recommended) 쌍은 한 번만 등록
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProductRecommendationService {

    private final ProductRepository productRepository;
    private final ProductRecommendationRepository recommendationRepository;

    @Transactional
    public RecommendationResponse addRecommendation(Long productId, Long recommendedProductId) {
        log.info("Adding recommendation: {} -> {}", productId, recommendedProductId);

        // 1. 자기 자신 추천 검증
        if (productId.equals(recommendedProductId)) {
            throw new BusinessException(ErrorCode.SELF_RECOMMENDATION);
        }

        // 2. 양쪽 상품 존재 확인
        productRepository.verifyExists(productId);
        productRepository.verifyExists(recommendedProductId);

        // 3. 중복 검증
        if (recommendationRepository.existsByBaseProductIdAndRecommendedProductId(productId, recommendedProductId)) {
            throw new BusinessException(
                ErrorCode.DUPLICATE_RECOMMENDATION,
                String.format("Recommendation already exists. %d -> %d", productId, recommendedProductId)
            );
        }

        ProductRecommendation saved = recommendationRepository.save(
            ProductRecommendation.create(productId, recommendedProductId)
        );

        log.debug("Created recommendation: {}", saved.getId());
        return RecommendationResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public List<RecommendationResponse> getRecommendations(Long productId) {
        log.info("Getting recommendations for product: {}", productId);

        productRepository.verifyExists(productId);

        return recommendationRepository.findByBaseProductIdOrderByIdAsc(productId).stream()
            .map(RecommendationResponse::from)
            .toList();
    }

    @Transactional
    public void deleteRecommendation(Long recommendationId) {
        log.info("Deleting recommendation: {}", recommendationId);

        ProductRecommendation recommendation = recommendationRepository.findByIdOrThrow(recommendationId);
        recommendationRepository.delete(recommendation);
    }
}
