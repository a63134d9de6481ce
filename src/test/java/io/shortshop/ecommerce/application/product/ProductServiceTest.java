package io.shortshop.ecommerce.application.product;

import io.shortshop.ecommerce.application.product.dto.CreateProductRequest;
import io.shortshop.ecommerce.application.product.dto.ImageRequest;
import io.shortshop.ecommerce.application.product.dto.ProductResponse;
import io.shortshop.ecommerce.application.product.dto.UpdateProductRequest;
import io.shortshop.ecommerce.application.product.dto.VariantRequest;
import io.shortshop.ecommerce.common.exception.BusinessException;
import io.shortshop.ecommerce.common.exception.ErrorCode;
import io.shortshop.ecommerce.domain.cart.CartItemRepository;
import io.shortshop.ecommerce.domain.product.Product;
import io.shortshop.ecommerce.domain.product.ProductRecommendationRepository;
import io.shortshop.ecommerce.domain.product.ProductRepository;
import io.shortshop.ecommerce.domain.product.ProductVariant;
import io.shortshop.ecommerce.domain.product.VariantSize;
import io.shortshop.ecommerce.domain.review.ProductReviewRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ProductServiceTest {

    @Mock
    private ProductRepository productRepository;

    @Mock
    private ProductRecommendationRepository recommendationRepository;

    @Mock
    private ProductReviewRepository reviewRepository;

    @Mock
    private CartItemRepository cartItemRepository;

    @InjectMocks
    private ProductService productService;

    private Product product(Long id) {
        Product product = Product.create("Trail Jacket", new BigDecimal("129.90"), "Waterproof shell", true);
        ReflectionTestUtils.setField(product, "id", id);
        return product;
    }

    // ====================================
    // 조회
    // ====================================

    @Test
    @DisplayName("상품 목록 조회 - skip/limit 전달")
    void getProducts_성공() {
        // Given
        when(productRepository.findPage(10, 5)).thenReturn(List.of(product(11L), product(12L)));

        // When
        List<ProductResponse> result = productService.getProducts(10, 5);

        // Then
        assertThat(result).extracting(ProductResponse::id).containsExactly(11L, 12L);
    }

    @Test
    @DisplayName("상품 상세 조회 - 실패 (상품 없음)")
    void getProduct_실패_상품없음() {
        // Given
        when(productRepository.findByIdOrThrow(99L))
            .thenThrow(new BusinessException(ErrorCode.PRODUCT_NOT_FOUND));

        // When & Then
        assertThatThrownBy(() -> productService.getProduct(99L))
            .isInstanceOf(BusinessException.class)
            .extracting("errorCode")
            .isEqualTo(ErrorCode.PRODUCT_NOT_FOUND);
    }

    // ====================================
    // 생성 / 수정
    // ====================================

    @Test
    @DisplayName("상품 생성 - 옵션/이미지 포함, lifetime_guarantee 기본값 true")
    void createProduct_성공() {
        // Given
        CreateProductRequest request = new CreateProductRequest(
            "Trail Jacket", new BigDecimal("129.90"), "Waterproof shell", null,
            List.of(new VariantRequest("red", VariantSize.M, true), new VariantRequest("red", VariantSize.L, null)),
            List.of(new ImageRequest("red", "https://cdn.example.com/red.jpg"))
        );
        when(productRepository.save(any(Product.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        ProductResponse response = productService.createProduct(request);

        // Then
        assertThat(response.name()).isEqualTo("Trail Jacket");
        assertThat(response.lifetimeGuarantee()).isTrue();
        assertThat(response.variants()).hasSize(2);
        assertThat(response.variants().get(1).inStock()).isFalse();
        assertThat(response.images()).hasSize(1);
        verify(productRepository).save(any(Product.class));
    }

    @Test
    @DisplayName("상품 생성 - 실패 (요청 내 옵션 중복), 저장하지 않음")
    void createProduct_실패_옵션중복() {
        // Given
        CreateProductRequest request = new CreateProductRequest(
            "Trail Jacket", new BigDecimal("129.90"), "Waterproof shell", true,
            List.of(new VariantRequest("red", VariantSize.M, true), new VariantRequest("red", VariantSize.M, false)),
            null
        );

        // When & Then
        assertThatThrownBy(() -> productService.createProduct(request))
            .isInstanceOf(BusinessException.class)
            .extracting("errorCode")
            .isEqualTo(ErrorCode.DUPLICATE_VARIANT);
        verify(productRepository, never()).save(any());
    }

    @Test
    @DisplayName("상품 수정 - 전달한 필드만 변경")
    void updateProduct_부분수정() {
        // Given
        Product product = product(1L);
        when(productRepository.findByIdOrThrow(1L)).thenReturn(product);

        // When
        ProductResponse response = productService.updateProduct(
            1L, new UpdateProductRequest("Storm Jacket", null, null, null));

        // Then
        assertThat(response.name()).isEqualTo("Storm Jacket");
        assertThat(response.price()).isEqualByComparingTo("129.90");
        assertThat(response.description()).isEqualTo("Waterproof shell");
    }

    // ====================================
    // 삭제
    // ====================================

    @Test
    @DisplayName("상품 삭제 - 장바구니 항목, 추천, 리뷰 정리 후 삭제")
    void deleteProduct_연관데이터_정리() {
        // Given
        Product product = product(1L);
        ProductVariant variant = product.addVariant("red", VariantSize.M, true);
        ReflectionTestUtils.setField(variant, "id", 10L);
        when(productRepository.findByIdOrThrow(1L)).thenReturn(product);

        // When
        productService.deleteProduct(1L);

        // Then
        InOrder inOrder = inOrder(cartItemRepository, recommendationRepository, reviewRepository, productRepository);
        inOrder.verify(cartItemRepository).deleteAllByVariantIds(List.of(10L));
        inOrder.verify(recommendationRepository).deleteAllByProductId(1L);
        inOrder.verify(reviewRepository).deleteAllByProductId(1L);
        inOrder.verify(productRepository).delete(product);
    }

    @Test
    @DisplayName("상품 삭제 - 옵션이 없으면 장바구니 정리 생략")
    void deleteProduct_옵션없음() {
        // Given
        Product product = product(1L);
        when(productRepository.findByIdOrThrow(1L)).thenReturn(product);

        // When
        productService.deleteProduct(1L);

        // Then
        verifyNoInteractions(cartItemRepository);
        verify(productRepository).delete(product);
    }

    @Test
    @DisplayName("상품 삭제 - 실패 (상품 없음), 아무것도 삭제하지 않음")
    void deleteProduct_실패_상품없음() {
        // Given
        when(productRepository.findByIdOrThrow(99L))
            .thenThrow(new BusinessException(ErrorCode.PRODUCT_NOT_FOUND));

        // When & Then
        assertThatThrownBy(() -> productService.deleteProduct(99L))
            .isInstanceOf(BusinessException.class);
        verifyNoInteractions(cartItemRepository, recommendationRepository, reviewRepository);
    }
}
