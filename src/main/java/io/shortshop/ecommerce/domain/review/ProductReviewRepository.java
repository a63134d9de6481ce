package io.shortshop.ecommerce.domain.review;

import java.util.List;

public interface ProductReviewRepository {

    ProductReview save(ProductReview review);

    List<ProductReview> findPage(int skip, int limit);

    int deleteAllByProductId(Long productId);
}
