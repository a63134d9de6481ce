package io.shortshop.ecommerce.application.review;

import io.shortshop.ecommerce.application.review.dto.CreateReviewRequest;
import io.shortshop.ecommerce.application.review.dto.ReviewResponse;
import io.shortshop.ecommerce.common.exception.BusinessException;
import io.shortshop.ecommerce.common.exception.ErrorCode;
import io.shortshop.ecommerce.domain.product.ProductRepository;
import io.shortshop.ecommerce.domain.review.ProductReview;
import io.shortshop.ecommerce.domain.review.ProductReviewRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReviewServiceTest {

    @Mock
    private ProductReviewRepository reviewRepository;

    @Mock
    private ProductRepository productRepository;

    @InjectMocks
    private ReviewService reviewService;

    private final CreateReviewRequest request = new CreateReviewRequest(
        1L, "Great jacket overall", "Kept me dry on a three day hike.", "Jamie", 5);

    @Test
    @DisplayName("리뷰 작성 - 성공")
    void createReview_성공() {
        // Given
        when(reviewRepository.save(any(ProductReview.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        ReviewResponse response = reviewService.createReview(request);

        // Then
        assertThat(response.productId()).isEqualTo(1L);
        assertThat(response.authorName()).isEqualTo("Jamie");
        verify(productRepository).verifyExists(1L);
    }

    @Test
    @DisplayName("리뷰 작성 - 실패 (상품 없음)")
    void createReview_실패_상품없음() {
        // Given
        doThrow(new BusinessException(ErrorCode.PRODUCT_NOT_FOUND)).when(productRepository).verifyExists(1L);

        // When & Then
        assertThatThrownBy(() -> reviewService.createReview(request))
            .isInstanceOf(BusinessException.class)
            .extracting("errorCode")
            .isEqualTo(ErrorCode.PRODUCT_NOT_FOUND);
        verify(reviewRepository, never()).save(any());
    }
}
