package io.shortshop.ecommerce.infrastructure.persistence.review;

import io.shortshop.ecommerce.domain.review.ProductReview;
import io.shortshop.ecommerce.domain.review.ProductReviewRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface JpaProductReviewRepository extends JpaRepository<ProductReview, Long>, ProductReviewRepository {

    @Override
    ProductReview save(ProductReview review);

    @Override
    @Query(value = "SELECT * FROM product_reviews ORDER BY id LIMIT :limit OFFSET :skip", nativeQuery = true)
    List<ProductReview> findPage(@Param("skip") int skip, @Param("limit") int limit);

    @Override
    @Modifying
    @Query("DELETE FROM ProductReview r WHERE r.productId = :productId")
    int deleteAllByProductId(@Param("productId") Long productId);
}
