package io.shortshop.ecommerce.domain.cart;

import io.shortshop.ecommerce.common.exception.BusinessException;
import io.shortshop.ecommerce.common.exception.ErrorCode;
import io.shortshop.ecommerce.domain.common.BaseTimeEntity;
import io.shortshop.ecommerce.domain.product.ProductVariant;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Cart Entity (장바구니 집합 루트)
 *
 * 1. session_id로 식별 (클라이언트가 전달, 서버가 생성하지 않음)
 * 2. CartItem과 양방향 관계 설정 (1:N)
 * 3. cascade, orphanRemoval로 CartItem 라이프사이클 관리
 */
@Entity
@Table(
    name = "carts",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_cart_session_id", columnNames = "session_id")
    }
)
@Getter
@NoArgsConstructor
public class Cart extends BaseTimeEntity {

    public static final int SESSION_ID_MAX_LENGTH = 128;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false, length = SESSION_ID_MAX_LENGTH)
    private String sessionId;

    @OneToMany(mappedBy = "cart", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @OrderBy("id ASC")
    private List<CartItem> items = new ArrayList<>();

    public static Cart create(String sessionId) {
        validateSessionId(sessionId);

        Cart cart = new Cart();
        cart.sessionId = sessionId;
        return cart;
    }

    /**
     * 같은 옵션이 이미 담겨 있으면 수량을 합산하고, 없으면 새 항목을 추가한다.
     */
    public CartItem addItem(ProductVariant variant, Integer quantity) {
        return findItemByVariantId(variant.getId())
            .map(existing -> {
                existing.increaseQuantity(quantity);
                return existing;
            })
            .orElseGet(() -> {
                CartItem item = CartItem.create(this, variant, quantity);
                this.items.add(item);
                return item;
            });
    }

    public Optional<CartItem> findItem(Long itemId) {
        return items.stream()
            .filter(item -> item.getId() != null && item.getId().equals(itemId))
            .findFirst();
    }

    public Optional<CartItem> findItemByVariantId(Long variantId) {
        return items.stream()
            .filter(item -> item.getVariantId() != null && item.getVariantId().equals(variantId))
            .findFirst();
    }

    /**
     * CartItem 제거 (orphanRemoval로 삭제 쿼리 발생)
     */
    public void removeItem(CartItem item) {
        this.items.remove(item);
    }

    /**
     * 전체 비우기: 장바구니 자체는 유지된다.
     */
    public void clear() {
        this.items.clear();
    }

    private static void validateSessionId(String sessionId) {
        if (sessionId == null || sessionId.isBlank() || sessionId.length() > SESSION_ID_MAX_LENGTH) {
            throw new BusinessException(
                ErrorCode.INVALID_INPUT,
                "Session id must be 1-" + SESSION_ID_MAX_LENGTH + " characters"
            );
        }
    }
}
