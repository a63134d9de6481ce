package io.shortshop.ecommerce.presentation.api.product;

import io.shortshop.ecommerce.application.product.ProductImageService;
import io.shortshop.ecommerce.application.product.ProductRecommendationService;
import io.shortshop.ecommerce.application.product.ProductService;
import io.shortshop.ecommerce.application.product.ProductVariantService;
import io.shortshop.ecommerce.application.product.dto.CreateProductRequest;
import io.shortshop.ecommerce.application.product.dto.ImageRequest;
import io.shortshop.ecommerce.application.product.dto.ProductResponse;
import io.shortshop.ecommerce.application.product.dto.RecommendationResponse;
import io.shortshop.ecommerce.application.product.dto.UpdateProductRequest;
import io.shortshop.ecommerce.application.product.dto.VariantRequest;
import io.shortshop.ecommerce.application.product.dto.VariantResponse;
import io.shortshop.ecommerce.presentation.common.MessageResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 상품 API (옵션, 이미지, 추천 하위 리소스 포함)
 */
@Tag(name = "Product", description = "상품 / 옵션 / 이미지 / 추천 상품")
@Validated
@RestController
@RequestMapping("/api/v1/product")
@RequiredArgsConstructor
public class ProductController {

    private final ProductService productService;
    private final ProductVariantService variantService;
    private final ProductImageService imageService;
    private final ProductRecommendationService recommendationService;

    // ====================================
    // 상품
    // ====================================

    @Operation(summary = "상품 목록 조회")
    @GetMapping({"", "/"})
    public ResponseEntity<List<ProductResponse>> getProducts(
        @RequestParam(defaultValue = "0") @Min(value = 0, message = "skip must be 0 or greater") int skip,
        @RequestParam(defaultValue = "100") @Min(value = 1, message = "limit must be between 1 and 1000")
        @Max(value = 1000, message = "limit must be between 1 and 1000") int limit
    ) {
        return ResponseEntity.ok(productService.getProducts(skip, limit));
    }

    @Operation(summary = "상품 상세 조회")
    @GetMapping("/{productId}")
    public ResponseEntity<ProductResponse> getProduct(@PathVariable Long productId) {
        return ResponseEntity.ok(productService.getProduct(productId));
    }

    @Operation(summary = "상품 생성 (옵션, 이미지 포함)")
    @PostMapping({"", "/"})
    public ResponseEntity<ProductResponse> createProduct(@Valid @RequestBody CreateProductRequest request) {
        ProductResponse response = productService.createProduct(request);
        return ResponseEntity
            .status(HttpStatus.CREATED)
            .body(response);
    }

    @Operation(summary = "상품 부분 수정")
    @PutMapping("/{productId}")
    public ResponseEntity<ProductResponse> updateProduct(
        @PathVariable Long productId,
        @Valid @RequestBody UpdateProductRequest request
    ) {
        return ResponseEntity.ok(productService.updateProduct(productId, request));
    }

    @Operation(summary = "상품 삭제")
    @DeleteMapping("/{productId}")
    public ResponseEntity<MessageResponse> deleteProduct(@PathVariable Long productId) {
        productService.deleteProduct(productId);
        return ResponseEntity.ok(MessageResponse.of("Product deleted"));
    }

    // ====================================
    // 이미지
    // ====================================

    @Operation(summary = "상품 이미지 추가")
    @PostMapping("/{productId}/images")
    public ResponseEntity<MessageResponse> addImages(
        @PathVariable Long productId,
        @RequestBody @NotNull List<@Valid @NotNull ImageRequest> images
    ) {
        int added = imageService.addImages(productId, images);
        return ResponseEntity
            .status(HttpStatus.CREATED)
            .body(MessageResponse.of(added + " image(s) added successfully"));
    }

    @Operation(summary = "상품 이미지 삭제")
    @DeleteMapping("/{productId}/images/{imageId}")
    public ResponseEntity<MessageResponse> deleteImage(
        @PathVariable Long productId,
        @PathVariable Long imageId
    ) {
        imageService.deleteImage(productId, imageId);
        return ResponseEntity.ok(MessageResponse.of("Image deleted"));
    }

    // ====================================
    // 옵션
    // ====================================

    @Operation(summary = "상품 옵션 추가")
    @PostMapping("/{productId}/variants")
    public ResponseEntity<VariantResponse> addVariant(
        @PathVariable Long productId,
        @Valid @RequestBody VariantRequest request
    ) {
        return ResponseEntity.ok(variantService.addVariant(productId, request));
    }

    @Operation(summary = "상품 옵션 수정")
    @PutMapping("/variant/{variantId}")
    public ResponseEntity<VariantResponse> updateVariant(
        @PathVariable Long variantId,
        @Valid @RequestBody VariantRequest request
    ) {
        return ResponseEntity.ok(variantService.updateVariant(variantId, request));
    }

    @Operation(summary = "상품 옵션 삭제")
    @DeleteMapping("/variant/{variantId}")
    public ResponseEntity<MessageResponse> deleteVariant(@PathVariable Long variantId) {
        variantService.deleteVariant(variantId);
        return ResponseEntity.ok(MessageResponse.of("Variant deleted"));
    }

    // ====================================
    // 추천 상품
    // ====================================

    @Operation(summary = "추천 상품 등록")
    @PostMapping("/{productId}/recommendations/{recommendedProductId}")
    public ResponseEntity<MessageResponse> addRecommendation(
        @PathVariable Long productId,
        @PathVariable Long recommendedProductId
    ) {
        recommendationService.addRecommendation(productId, recommendedProductId);
        return ResponseEntity.ok(MessageResponse.of("Recommendation added"));
    }

    @Operation(summary = "추천 상품 목록 조회")
    @GetMapping("/{productId}/recommendations")
    public ResponseEntity<List<RecommendationResponse>> getRecommendations(@PathVariable Long productId) {
        return ResponseEntity.ok(recommendationService.getRecommendations(productId));
    }

    @Operation(summary = "추천 상품 삭제")
    @DeleteMapping("/recommendations/{recommendationId}")
    public ResponseEntity<MessageResponse> deleteRecommendation(@PathVariable Long recommendationId) {
        recommendationService.deleteRecommendation(recommendationId);
        return ResponseEntity.ok(MessageResponse.of("Recommendation deleted"));
    }
}
