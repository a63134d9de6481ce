package io.shortshop.ecommerce.infrastructure.persistence.product;

import io.shortshop.ecommerce.domain.product.ProductRecommendation;
import io.shortshop.ecommerce.domain.product.ProductRecommendationRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface JpaProductRecommendationRepository
    extends JpaRepository<ProductRecommendation, Long>, ProductRecommendationRepository {

    @Override
    Optional<ProductRecommendation> findById(Long id);

    @Override
    ProductRecommendation save(ProductRecommendation recommendation);

    @Override
    void delete(ProductRecommendation recommendation);

    @Override
    List<ProductRecommendation> findByBaseProductIdOrderByIdAsc(Long baseProductId);

    @Override
    boolean existsByBaseProductIdAndRecommendedProductId(Long baseProductId, Long recommendedProductId);

    @Override
    @Modifying
    @Query("""
        DELETE FROM ProductRecommendation r
        WHERE r.baseProductId = :productId
           OR r.recommendedProductId = :productId
        """)
    int deleteAllByProductId(@Param("productId") Long productId);
}
