package io.shortshop.ecommerce.presentation.api.review;

import io.shortshop.ecommerce.application.review.ReviewService;
import io.shortshop.ecommerce.application.review.dto.CreateReviewRequest;
import io.shortshop.ecommerce.application.review.dto.ReviewResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Tag(name = "Review", description = "상품 리뷰")
@Validated
@RestController
@RequestMapping("/api/v1/review")
@RequiredArgsConstructor
public class ReviewController {

    private final ReviewService reviewService;

    @Operation(summary = "리뷰 목록 조회")
    @GetMapping({"", "/"})
    public ResponseEntity<List<ReviewResponse>> getReviews(
        @RequestParam(defaultValue = "0") @Min(value = 0, message = "skip must be 0 or greater") int skip,
        @RequestParam(defaultValue = "100") @Min(value = 1, message = "limit must be between 1 and 1000")
        @Max(value = 1000, message = "limit must be between 1 and 1000") int limit
    ) {
        return ResponseEntity.ok(reviewService.getReviews(skip, limit));
    }

    @Operation(summary = "리뷰 작성")
    @PostMapping({"", "/"})
    public ResponseEntity<ReviewResponse> createReview(@Valid @RequestBody CreateReviewRequest request) {
        ReviewResponse response = reviewService.createReview(request);
        return ResponseEntity
            .status(HttpStatus.CREATED)
            .body(response);
    }
}
