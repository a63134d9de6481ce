package io.shortshop.ecommerce.domain.cart;

import io.shortshop.ecommerce.common.exception.BusinessException;
import io.shortshop.ecommerce.common.exception.ErrorCode;
import io.shortshop.ecommerce.domain.product.Product;
import io.shortshop.ecommerce.domain.product.ProductVariant;
import io.shortshop.ecommerce.domain.product.VariantSize;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.*;

class CartTest {

    private ProductVariant variant;

    @BeforeEach
    void setUp() {
        Product product = Product.create("Trail Jacket", BigDecimal.TEN, "Waterproof shell", true);
        variant = product.addVariant("red", VariantSize.M, true);
        ReflectionTestUtils.setField(variant, "id", 10L);
    }

    @Test
    @DisplayName("장바구니 생성 - 실패 (session_id 공백)")
    void create_실패_세션공백() {
        assertThatThrownBy(() -> Cart.create(" "))
            .isInstanceOf(BusinessException.class)
            .extracting("errorCode")
            .isEqualTo(ErrorCode.INVALID_INPUT);
    }

    @Test
    @DisplayName("항목 추가 - 신규 옵션")
    void addItem_신규() {
        // Given
        Cart cart = Cart.create("session-1");

        // When
        CartItem item = cart.addItem(variant, 2);

        // Then
        assertThat(cart.getItems()).containsExactly(item);
        assertThat(item.getCart()).isSameAs(cart);
        assertThat(item.getVariantId()).isEqualTo(10L);
        assertThat(item.getQuantity()).isEqualTo(2);
    }

    @Test
    @DisplayName("항목 추가 - 같은 옵션은 수량 합산")
    void addItem_수량합산() {
        // Given
        Cart cart = Cart.create("session-1");
        CartItem first = cart.addItem(variant, 2);

        // When
        CartItem second = cart.addItem(variant, 3);

        // Then
        assertThat(second).isSameAs(first);
        assertThat(cart.getItems()).hasSize(1);
        assertThat(first.getQuantity()).isEqualTo(5);
    }

    @Test
    @DisplayName("항목 추가 - 합산 수량이 최대치를 넘으면 실패, 기존 수량 유지")
    void addItem_실패_합산초과() {
        // Given
        Cart cart = Cart.create("session-1");
        CartItem item = cart.addItem(variant, CartItem.MAX_QUANTITY);

        // When & Then
        assertThatThrownBy(() -> cart.addItem(variant, 1))
            .isInstanceOf(BusinessException.class)
            .extracting("errorCode")
            .isEqualTo(ErrorCode.INVALID_QUANTITY);
        assertThat(item.getQuantity()).isEqualTo(CartItem.MAX_QUANTITY);
        assertThat(cart.getItems()).hasSize(1);
    }

    @Test
    @DisplayName("항목 추가 - 정수 최대값을 더해도 음수가 되지 않음")
    void addItem_실패_정수최대값() {
        // Given
        Cart cart = Cart.create("session-1");
        CartItem item = cart.addItem(variant, 5);

        // When & Then
        assertThatThrownBy(() -> cart.addItem(variant, Integer.MAX_VALUE))
            .isInstanceOf(BusinessException.class)
            .extracting("errorCode")
            .isEqualTo(ErrorCode.INVALID_QUANTITY);
        assertThat(item.getQuantity()).isEqualTo(5);
    }

    @Test
    @DisplayName("항목 조회 - 다른 장바구니 항목 ID는 찾지 못함")
    void findItem_없음() {
        Cart cart = Cart.create("session-1");
        CartItem item = cart.addItem(variant, 1);
        ReflectionTestUtils.setField(item, "id", 100L);

        assertThat(cart.findItem(100L)).contains(item);
        assertThat(cart.findItem(999L)).isEmpty();
    }

    @Test
    @DisplayName("비우기 - 항목만 삭제")
    void clear() {
        Cart cart = Cart.create("session-1");
        cart.addItem(variant, 1);

        cart.clear();

        assertThat(cart.getItems()).isEmpty();
        assertThat(cart.getSessionId()).isEqualTo("session-1");
    }
}
