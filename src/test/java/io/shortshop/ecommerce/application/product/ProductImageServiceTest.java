package io.shortshop.ecommerce.application.product;

import io.shortshop.ecommerce.application.product.dto.ImageRequest;
import io.shortshop.ecommerce.common.exception.BusinessException;
import io.shortshop.ecommerce.common.exception.ErrorCode;
import io.shortshop.ecommerce.domain.product.Product;
import io.shortshop.ecommerce.domain.product.ProductImage;
import io.shortshop.ecommerce.domain.product.ProductImageRepository;
import io.shortshop.ecommerce.domain.product.ProductRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ProductImageServiceTest {

    @Mock
    private ProductRepository productRepository;

    @Mock
    private ProductImageRepository imageRepository;

    @InjectMocks
    private ProductImageService imageService;

    private Product product;

    @BeforeEach
    void setUp() {
        product = Product.create("Trail Jacket", BigDecimal.TEN, "Waterproof shell", true);
        ReflectionTestUtils.setField(product, "id", 1L);
    }

    @Test
    @DisplayName("이미지 추가 - 추가된 개수 반환")
    void addImages_성공() {
        // Given
        when(productRepository.findByIdOrThrow(1L)).thenReturn(product);

        // When
        int added = imageService.addImages(1L, List.of(
            new ImageRequest("red", "https://cdn.example.com/1.jpg"),
            new ImageRequest(null, "https://cdn.example.com/2.jpg")
        ));

        // Then
        assertThat(added).isEqualTo(2);
        assertThat(product.getImages()).hasSize(2);
    }

    @Test
    @DisplayName("이미지 추가 - 실패 (빈 목록)")
    void addImages_실패_빈목록() {
        // Given
        when(productRepository.findByIdOrThrow(1L)).thenReturn(product);

        // When & Then
        assertThatThrownBy(() -> imageService.addImages(1L, List.of()))
            .isInstanceOf(BusinessException.class)
            .extracting("errorCode")
            .isEqualTo(ErrorCode.NO_IMAGES_PROVIDED);
    }

    @Test
    @DisplayName("이미지 삭제 - 성공")
    void deleteImage_성공() {
        // Given
        ProductImage image = product.addImage(null, "https://cdn.example.com/1.jpg");
        when(imageRepository.findByIdAndProductId(5L, 1L)).thenReturn(Optional.of(image));

        // When
        imageService.deleteImage(1L, 5L);

        // Then
        assertThat(product.getImages()).isEmpty();
    }

    @Test
    @DisplayName("이미지 삭제 - 실패 (다른 상품의 이미지)")
    void deleteImage_실패_다른상품() {
        // Given
        when(imageRepository.findByIdAndProductId(5L, 2L)).thenReturn(Optional.empty());

        // When & Then
        assertThatThrownBy(() -> imageService.deleteImage(2L, 5L))
            .isInstanceOf(BusinessException.class)
            .extracting("errorCode")
            .isEqualTo(ErrorCode.IMAGE_NOT_FOUND);
    }
}
