package io.shortshop.ecommerce.domain.cart;

import io.shortshop.ecommerce.common.exception.BusinessException;
import io.shortshop.ecommerce.common.exception.ErrorCode;
import io.shortshop.ecommerce.domain.common.BaseTimeEntity;
import io.shortshop.ecommerce.domain.product.ProductVariant;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * CartItem Entity
 *
 * Cart, ProductVariant 엔티티 직접 참조
 * (cart_id, variant_id) 조합은 유일하다.
 */
@Entity
@Table(
    name = "cart_items",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_cart_variant", columnNames = {"cart_id", "variant_id"})
    },
    indexes = {
        @Index(name = "idx_cart_item_variant_id", columnList = "variant_id")
    }
)
@Getter
@NoArgsConstructor
public class CartItem extends BaseTimeEntity {

    public static final int MAX_QUANTITY = 10_000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "cart_id", nullable = false, foreignKey = @ForeignKey(name = "fk_cart_item_cart"))
    private Cart cart;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "variant_id", nullable = false, foreignKey = @ForeignKey(name = "fk_cart_item_variant"))
    private ProductVariant variant;

    @Column(nullable = false)
    private Integer quantity;

    /**
     * Cart.addItem()을 통해 생성 (양방향 관계 유지)
     */
    static CartItem create(Cart cart, ProductVariant variant, Integer quantity) {
        validateCart(cart);
        validateVariant(variant);
        validateQuantity(quantity);

        CartItem cartItem = new CartItem();
        cartItem.cart = cart;
        cartItem.variant = variant;
        cartItem.quantity = quantity;
        return cartItem;
    }

    public Long getVariantId() {
        return variant != null ? variant.getId() : null;
    }

    public void updateQuantity(Integer quantity) {
        validateQuantity(quantity);
        this.quantity = quantity;
    }

    /**
     * 수량 합산: 합계도 MAX_QUANTITY를 넘을 수 없다.
     */
    public void increaseQuantity(Integer additionalQuantity) {
        validateQuantity(additionalQuantity);
        validateQuantity((long) this.quantity + additionalQuantity);
        this.quantity += additionalQuantity;
    }

    // ====================================
    // Validation Methods
    // ====================================

    private static void validateCart(Cart cart) {
        if (cart == null) {
            throw new BusinessException(
                ErrorCode.INVALID_INPUT,
                "Cart is required"
            );
        }
    }

    private static void validateVariant(ProductVariant variant) {
        if (variant == null) {
            throw new BusinessException(
                ErrorCode.INVALID_INPUT,
                "Variant is required"
            );
        }
    }

    private static void validateQuantity(Integer quantity) {
        if (quantity == null) {
            throw new BusinessException(ErrorCode.INVALID_QUANTITY);
        }
        validateQuantity(quantity.longValue());
    }

    private static void validateQuantity(long quantity) {
        if (quantity <= 0 || quantity > MAX_QUANTITY) {
            throw new BusinessException(
                ErrorCode.INVALID_QUANTITY,
                "Quantity must be between 1 and " + MAX_QUANTITY
            );
        }
    }
}
