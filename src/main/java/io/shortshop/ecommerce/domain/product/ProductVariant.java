package io.shortshop.ecommerce.domain.product;

import io.shortshop.ecommerce.common.exception.BusinessException;
import io.shortshop.ecommerce.common.exception.ErrorCode;
import io.shortshop.ecommerce.domain.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * ProductVariant Entity (상품 옵션: 색상 + 사이즈 + 재고 여부)
 *
 * CartItem이 variant_id로 참조한다.
 */
@Entity
@Table(
    name = "product_variants",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_variant", columnNames = {"product_id", "color", "size"})
    },
    indexes = {
        @Index(name = "idx_variant_product_id", columnList = "product_id")
    }
)
@Getter
@NoArgsConstructor
public class ProductVariant extends BaseTimeEntity {

    public static final int COLOR_MAX_LENGTH = 50;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "product_id", nullable = false, foreignKey = @ForeignKey(name = "fk_variant_product"))
    private Product product;

    @Column(nullable = false, length = COLOR_MAX_LENGTH)
    private String color;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 4)
    private VariantSize size;

    @Column(name = "in_stock", nullable = false)
    private boolean inStock;

    /**
     * Product.addVariant()를 통해서만 생성 (양방향 관계 유지)
     */
    static ProductVariant create(Product product, String color, VariantSize size, boolean inStock) {
        validateColor(color);
        validateSize(size);

        ProductVariant variant = new ProductVariant();
        variant.product = product;
        variant.color = color;
        variant.size = size;
        variant.inStock = inStock;
        return variant;
    }

    /**
     * 옵션 전체 교체 (color, size, inStock)
     */
    public void update(String color, VariantSize size, boolean inStock) {
        validateColor(color);
        validateSize(size);
        product.ensureVariantAvailable(color, size, this.id);

        this.color = color;
        this.size = size;
        this.inStock = inStock;
    }

    boolean matches(String color, VariantSize size) {
        return this.color.equals(color) && this.size == size;
    }

    // ====================================
    // Validation Methods
    // ====================================

    private static void validateColor(String color) {
        if (color == null || color.isBlank() || color.length() > COLOR_MAX_LENGTH) {
            throw new BusinessException(
                ErrorCode.INVALID_INPUT,
                "Variant color must be 1-" + COLOR_MAX_LENGTH + " characters"
            );
        }
    }

    private static void validateSize(VariantSize size) {
        if (size == null) {
            throw new BusinessException(
                ErrorCode.INVALID_INPUT,
                "Variant size is required"
            );
        }
    }
}
