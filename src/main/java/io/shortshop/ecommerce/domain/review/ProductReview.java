package io.shortshop.ecommerce.domain.review;

import io.shortshop.ecommerce.common.exception.BusinessException;
import io.shortshop.ecommerce.common.exception.ErrorCode;
import io.shortshop.ecommerce.domain.common.BaseEntity;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * ProductReview Entity
 *
 * 상품은 ID로만 참조 (간접 참조), 상품 삭제 시 ProductService가 함께 정리한다.
 */
@Entity
@Table(
    name = "product_reviews",
    indexes = {
        @Index(name = "idx_review_product_id", columnList = "product_id")
    }
)
@Getter
@NoArgsConstructor
public class ProductReview extends BaseEntity {

    public static final int TITLE_MIN_LENGTH = 10;
    public static final int TITLE_MAX_LENGTH = 120;
    public static final int DESCRIPTION_MIN_LENGTH = 20;
    public static final int DESCRIPTION_MAX_LENGTH = 300;
    public static final int AUTHOR_NAME_MAX_LENGTH = 100;
    public static final int MIN_SCORE = 1;
    public static final int MAX_SCORE = 5;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "product_id", nullable = false)
    private Long productId;

    @Column(nullable = false, length = TITLE_MAX_LENGTH)
    private String title;

    @Column(nullable = false, length = DESCRIPTION_MAX_LENGTH)
    private String description;

    @Column(name = "author_name", nullable = false, length = AUTHOR_NAME_MAX_LENGTH)
    private String authorName;

    @Column(nullable = false)
    private Integer score;

    public static ProductReview create(Long productId, String title, String description, String authorName, Integer score) {
        validateProductId(productId);
        validateLength("title", title, TITLE_MIN_LENGTH, TITLE_MAX_LENGTH);
        validateLength("description", description, DESCRIPTION_MIN_LENGTH, DESCRIPTION_MAX_LENGTH);
        validateLength("author_name", authorName, 1, AUTHOR_NAME_MAX_LENGTH);
        validateScore(score);

        ProductReview review = new ProductReview();
        review.productId = productId;
        review.title = title;
        review.description = description;
        review.authorName = authorName;
        review.score = score;
        return review;
    }

    // ====================================
    // Validation Methods
    // ====================================

    private static void validateProductId(Long productId) {
        if (productId == null) {
            throw new BusinessException(
                ErrorCode.INVALID_INPUT,
                "Product id is required"
            );
        }
    }

    private static void validateLength(String field, String value, int min, int max) {
        if (value == null || value.isBlank() || value.length() < min || value.length() > max) {
            throw new BusinessException(
                ErrorCode.INVALID_INPUT,
                String.format("Review %s must be %d-%d characters", field, min, max)
            );
        }
    }

    private static void validateScore(Integer score) {
        if (score == null || score < MIN_SCORE || score > MAX_SCORE) {
            throw new BusinessException(
                ErrorCode.INVALID_INPUT,
                String.format("Review score must be between %d and %d", MIN_SCORE, MAX_SCORE)
            );
        }
    }
}
