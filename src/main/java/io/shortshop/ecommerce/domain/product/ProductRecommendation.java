package io.shortshop.ecommerce.domain.product;

import io.shortshop.ecommerce.common.exception.BusinessException;
import io.shortshop.ecommerce.common.exception.ErrorCode;
import io.shortshop.ecommerce.domain.common.BaseEntity;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * ProductRecommendation Entity (추천 관계: base → recommended 방향 간선)
 *
 * 간선마다 자체 ID를 가지며 삭제도 이 ID로 한다.
 * 상품 양쪽 모두 ID로만 참조 (간접 참조)
 */
@Entity
@Table(
    name = "product_recommendations",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_recommendation", columnNames = {"base_product_id", "recommended_product_id"})
    },
    indexes = {
        @Index(name = "idx_recommended_product_id", columnList = "recommended_product_id")
    }
)
@Getter
@NoArgsConstructor
public class ProductRecommendation extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "base_product_id", nullable = false)
    private Long baseProductId;

    @Column(name = "recommended_product_id", nullable = false)
    private Long recommendedProductId;

    public static ProductRecommendation create(Long baseProductId, Long recommendedProductId) {
        if (baseProductId == null || recommendedProductId == null) {
            throw new BusinessException(
                ErrorCode.INVALID_INPUT,
                "Both product ids are required"
            );
        }
        if (baseProductId.equals(recommendedProductId)) {
            throw new BusinessException(ErrorCode.SELF_RECOMMENDATION);
        }

        ProductRecommendation recommendation = new ProductRecommendation();
        recommendation.baseProductId = baseProductId;
        recommendation.recommendedProductId = recommendedProductId;
        return recommendation;
    }
}
