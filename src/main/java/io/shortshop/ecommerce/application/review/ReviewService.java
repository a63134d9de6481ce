package io.shortshop.ecommerce.application.review;

import io.shortshop.ecommerce.application.review.dto.CreateReviewRequest;
import io.shortshop.ecommerce.application.review.dto.ReviewResponse;
import io.shortshop.ecommerce.domain.product.ProductRepository;
import io.shortshop.ecommerce.domain.review.ProductReview;
import io.shortshop.ecommerce.domain.review.ProductReviewRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ReviewService {

    private final ProductReviewRepository reviewRepository;
    private final ProductRepository productRepository;

    @Transactional(readOnly = true)
    public List<ReviewResponse> getReviews(int skip, int limit) {
        log.info("Getting reviews - skip: {}, limit: {}", skip, limit);

        return reviewRepository.findPage(skip, limit).stream()
            .map(ReviewResponse::from)
            .toList();
    }

    @Transactional
    public ReviewResponse createReview(CreateReviewRequest request) {
        log.info("Creating review for product: {}", request.productId());

        productRepository.verifyExists(request.productId());

        ProductReview saved = reviewRepository.save(ProductReview.create(
            request.productId(),
            request.title(),
            request.description(),
            request.authorName(),
            request.score()
        ));

        log.debug("Created review: {}", saved.getId());
        return ReviewResponse.from(saved);
    }
}
