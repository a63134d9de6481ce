package io.shortshop.ecommerce.domain.product;

import io.shortshop.ecommerce.common.exception.BusinessException;
import io.shortshop.ecommerce.common.exception.ErrorCode;
import io.shortshop.ecommerce.domain.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Product Entity (상품 집합 루트)
 *
 * 1. ProductVariant, ProductImage와 양방향 관계 (1:N)
 *    - cascade ALL + orphanRemoval: 상품 삭제 시 옵션/이미지 함께 삭제
 * 2. 추천(ProductRecommendation), 리뷰, 장바구니 항목은 ID로만 참조하므로
 *    상품 삭제 시 ProductService에서 직접 정리한다.
 */
@Entity
@Table(name = "products")
@Getter
@NoArgsConstructor
public class Product extends BaseTimeEntity {

    public static final int NAME_MAX_LENGTH = 120;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = NAME_MAX_LENGTH)
    private String name;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String description;

    @Column(name = "lifetime_guarantee", nullable = false)
    private boolean lifetimeGuarantee;

    @OneToMany(mappedBy = "product", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @OrderBy("id ASC")
    private List<ProductVariant> variants = new ArrayList<>();

    @OneToMany(mappedBy = "product", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @OrderBy("id ASC")
    private List<ProductImage> images = new ArrayList<>();

    public static Product create(String name, BigDecimal price, String description, boolean lifetimeGuarantee) {
        validateName(name);
        validatePrice(price);
        validateDescription(description);

        Product product = new Product();
        product.name = name;
        product.price = price;
        product.description = description;
        product.lifetimeGuarantee = lifetimeGuarantee;
        // createdAt, updatedAt은 JPA Auditing이 자동 처리

        return product;
    }

    /**
     * 부분 수정: null로 전달된 필드는 변경하지 않는다.
     */
    public void update(String name, BigDecimal price, String description, Boolean lifetimeGuarantee) {
        if (name != null) {
            validateName(name);
            this.name = name;
        }
        if (price != null) {
            validatePrice(price);
            this.price = price;
        }
        if (description != null) {
            validateDescription(description);
            this.description = description;
        }
        if (lifetimeGuarantee != null) {
            this.lifetimeGuarantee = lifetimeGuarantee;
        }
    }

    /**
     * 옵션 추가 (양방향 관계 동기화)
     * 같은 색상/사이즈 조합은 상품 내에서 하나만 허용
     */
    public ProductVariant addVariant(String color, VariantSize size, boolean inStock) {
        ensureVariantAvailable(color, size, null);

        ProductVariant variant = ProductVariant.create(this, color, size, inStock);
        this.variants.add(variant);
        return variant;
    }

    public void removeVariant(ProductVariant variant) {
        this.variants.remove(variant);
    }

    /**
     * 이미지 추가 (양방향 관계 동기화)
     */
    public ProductImage addImage(String color, String imageUrl) {
        ProductImage image = ProductImage.create(this, color, imageUrl);
        this.images.add(image);
        return image;
    }

    public void removeImage(ProductImage image) {
        this.images.remove(image);
    }

    public List<Long> getVariantIds() {
        return variants.stream()
            .map(ProductVariant::getId)
            .toList();
    }

    /**
     * 색상/사이즈 조합 중복 검사
     *
     * @param excludeVariantId 수정 중인 옵션 자신은 검사에서 제외 (신규 추가 시 null)
     */
    void ensureVariantAvailable(String color, VariantSize size, Long excludeVariantId) {
        boolean duplicated = variants.stream()
            .filter(v -> excludeVariantId == null || !excludeVariantId.equals(v.getId()))
            .anyMatch(v -> v.matches(color, size));

        if (duplicated) {
            throw new BusinessException(
                ErrorCode.DUPLICATE_VARIANT,
                String.format("Variant already exists. productId: %d, color: %s, size: %s", id, color, size)
            );
        }
    }

    // ====================================
    // Validation Methods
    // ====================================

    private static void validateName(String name) {
        if (name == null || name.isBlank() || name.length() > NAME_MAX_LENGTH) {
            throw new BusinessException(
                ErrorCode.INVALID_INPUT,
                "Product name must be 1-" + NAME_MAX_LENGTH + " characters"
            );
        }
    }

    private static void validatePrice(BigDecimal price) {
        if (price == null || price.signum() <= 0) {
            throw new BusinessException(
                ErrorCode.INVALID_INPUT,
                "Product price must be greater than 0"
            );
        }
    }

    private static void validateDescription(String description) {
        if (description == null || description.isBlank()) {
            throw new BusinessException(
                ErrorCode.INVALID_INPUT,
                "Product description is required"
            );
        }
    }
}
