package io.shortshop.ecommerce.domain.product;

import io.shortshop.ecommerce.common.exception.BusinessException;
import io.shortshop.ecommerce.common.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.*;

class ProductTest {

    @Test
    @DisplayName("상품 생성 - 성공")
    void create_성공() {
        // When
        Product product = Product.create("Trail Jacket", new BigDecimal("129.90"), "Waterproof shell", true);

        // Then
        assertThat(product.getName()).isEqualTo("Trail Jacket");
        assertThat(product.getPrice()).isEqualByComparingTo("129.90");
        assertThat(product.isLifetimeGuarantee()).isTrue();
        assertThat(product.getVariants()).isEmpty();
        assertThat(product.getImages()).isEmpty();
    }

    @Test
    @DisplayName("상품 생성 - 실패 (가격 0 이하)")
    void create_실패_가격() {
        assertThatThrownBy(() -> Product.create("Trail Jacket", BigDecimal.ZERO, "Waterproof shell", true))
            .isInstanceOf(BusinessException.class)
            .extracting("errorCode")
            .isEqualTo(ErrorCode.INVALID_INPUT);
    }

    @Test
    @DisplayName("상품 생성 - 실패 (이름 공백)")
    void create_실패_이름공백() {
        assertThatThrownBy(() -> Product.create("   ", BigDecimal.TEN, "Waterproof shell", true))
            .isInstanceOf(BusinessException.class)
            .extracting("errorCode")
            .isEqualTo(ErrorCode.INVALID_INPUT);
    }

    @Test
    @DisplayName("부분 수정 - null 필드는 유지")
    void update_부분수정() {
        // Given
        Product product = Product.create("Trail Jacket", new BigDecimal("129.90"), "Waterproof shell", true);

        // When
        product.update(null, new BigDecimal("99.00"), null, false);

        // Then
        assertThat(product.getName()).isEqualTo("Trail Jacket");
        assertThat(product.getDescription()).isEqualTo("Waterproof shell");
        assertThat(product.getPrice()).isEqualByComparingTo("99.00");
        assertThat(product.isLifetimeGuarantee()).isFalse();
    }

    @Test
    @DisplayName("옵션 추가 - 양방향 관계 설정")
    void addVariant_성공() {
        // Given
        Product product = Product.create("Trail Jacket", BigDecimal.TEN, "Waterproof shell", true);

        // When
        ProductVariant variant = product.addVariant("red", VariantSize.M, true);

        // Then
        assertThat(product.getVariants()).containsExactly(variant);
        assertThat(variant.getProduct()).isSameAs(product);
        assertThat(variant.isInStock()).isTrue();
    }

    @Test
    @DisplayName("옵션 추가 - 실패 (같은 색상/사이즈 중복)")
    void addVariant_실패_중복() {
        // Given
        Product product = Product.create("Trail Jacket", BigDecimal.TEN, "Waterproof shell", true);
        product.addVariant("red", VariantSize.M, true);

        // When & Then
        assertThatThrownBy(() -> product.addVariant("red", VariantSize.M, false))
            .isInstanceOf(BusinessException.class)
            .extracting("errorCode")
            .isEqualTo(ErrorCode.DUPLICATE_VARIANT);
    }

    @Test
    @DisplayName("옵션 추가 - 같은 색상 다른 사이즈는 허용")
    void addVariant_다른사이즈() {
        Product product = Product.create("Trail Jacket", BigDecimal.TEN, "Waterproof shell", true);
        product.addVariant("red", VariantSize.M, true);
        product.addVariant("red", VariantSize.L, true);

        assertThat(product.getVariants()).hasSize(2);
    }

    @Test
    @DisplayName("옵션 수정 - 자기 자신과는 충돌하지 않음")
    void updateVariant_자기자신() {
        // Given
        Product product = Product.create("Trail Jacket", BigDecimal.TEN, "Waterproof shell", true);
        ProductVariant variant = product.addVariant("red", VariantSize.M, true);
        ReflectionTestUtils.setField(variant, "id", 1L);

        // When
        variant.update("red", VariantSize.M, false);

        // Then
        assertThat(variant.isInStock()).isFalse();
    }

    @Test
    @DisplayName("옵션 수정 - 실패 (다른 옵션과 충돌)")
    void updateVariant_실패_충돌() {
        // Given
        Product product = Product.create("Trail Jacket", BigDecimal.TEN, "Waterproof shell", true);
        ProductVariant red = product.addVariant("red", VariantSize.M, true);
        ProductVariant blue = product.addVariant("blue", VariantSize.M, true);
        ReflectionTestUtils.setField(red, "id", 1L);
        ReflectionTestUtils.setField(blue, "id", 2L);

        // When & Then
        assertThatThrownBy(() -> blue.update("red", VariantSize.M, true))
            .isInstanceOf(BusinessException.class)
            .extracting("errorCode")
            .isEqualTo(ErrorCode.DUPLICATE_VARIANT);
        assertThat(blue.getColor()).isEqualTo("blue");
    }

    @Test
    @DisplayName("이미지 추가/삭제")
    void addAndRemoveImage() {
        // Given
        Product product = Product.create("Trail Jacket", BigDecimal.TEN, "Waterproof shell", true);

        // When
        ProductImage image = product.addImage(null, "https://cdn.example.com/a.jpg");

        // Then
        assertThat(product.getImages()).containsExactly(image);
        assertThat(image.getColor()).isNull();

        product.removeImage(image);
        assertThat(product.getImages()).isEmpty();
    }
}
