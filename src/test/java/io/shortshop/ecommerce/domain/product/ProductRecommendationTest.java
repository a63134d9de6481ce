package io.shortshop.ecommerce.domain.product;

import io.shortshop.ecommerce.common.exception.BusinessException;
import io.shortshop.ecommerce.common.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ProductRecommendationTest {

    @Test
    @DisplayName("추천 생성 - 성공")
    void create_성공() {
        ProductRecommendation recommendation = ProductRecommendation.create(1L, 2L);

        assertThat(recommendation.getBaseProductId()).isEqualTo(1L);
        assertThat(recommendation.getRecommendedProductId()).isEqualTo(2L);
    }

    @Test
    @DisplayName("추천 생성 - 실패 (자기 자신 추천)")
    void create_실패_자기자신() {
        assertThatThrownBy(() -> ProductRecommendation.create(1L, 1L))
            .isInstanceOf(BusinessException.class)
            .extracting("errorCode")
            .isEqualTo(ErrorCode.SELF_RECOMMENDATION);
    }
}
