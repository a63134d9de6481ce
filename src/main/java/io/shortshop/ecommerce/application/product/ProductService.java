package io.shortshop.ecommerce.application.product;

import io.shortshop.ecommerce.application.product.dto.CreateProductRequest;
import io.shortshop.ecommerce.application.product.dto.ImageRequest;
import io.shortshop.ecommerce.application.product.dto.ProductResponse;
import io.shortshop.ecommerce.application.product.dto.UpdateProductRequest;
import io.shortshop.ecommerce.application.product.dto.VariantRequest;
import io.shortshop.ecommerce.domain.cart.CartItemRepository;
import io.shortshop.ecommerce.domain.product.Product;
import io.shortshop.ecommerce.domain.product.ProductRecommendationRepository;
import io.shortshop.ecommerce.domain.product.ProductRepository;
import io.shortshop.ecommerce.domain.review.ProductReviewRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ProductService {

    private final ProductRepository productRepository;
    private final ProductRecommendationRepository recommendationRepository;
    private final ProductReviewRepository reviewRepository;
    private final CartItemRepository cartItemRepository;

    public List<ProductResponse> getProducts(int skip, int limit) {
        log.info("Getting products - skip: {}, limit: {}", skip, limit);

        List<ProductResponse> products = productRepository.findPage(skip, limit).stream()
            .map(ProductResponse::from)
            .toList();

        log.debug("Found {} products", products.size());
        return products;
    }

    public ProductResponse getProduct(Long productId) {
        log.info("Getting product detail for productId: {}", productId);

        Product product = productRepository.findByIdOrThrow(productId);
        return ProductResponse.from(product);
    }

    /**
     * 상품 생성 (옵션/이미지 포함)
     * 하나의 트랜잭션에서 상품과 하위 엔티티를 함께 저장한다.
     */
    @Transactional
    public ProductResponse createProduct(CreateProductRequest request) {
        log.info("Creating product - name: {}, variants: {}, images: {}",
            request.name(), request.variantsOrEmpty().size(), request.imagesOrEmpty().size());

        // 1. 상품 생성 (도메인 검증)
        Product product = Product.create(
            request.name(),
            request.price(),
            request.description(),
            request.lifetimeGuaranteeOrDefault()
        );

        // 2. 이미지, 옵션 추가 (옵션 색상/사이즈 중복 시 예외)
        for (ImageRequest image : request.imagesOrEmpty()) {
            product.addImage(image.color(), image.imageUrl());
        }
        for (VariantRequest variant : request.variantsOrEmpty()) {
            product.addVariant(variant.color(), variant.size(), variant.inStockOrDefault());
        }

        // 3. 저장 (cascade로 옵션/이미지 함께 INSERT)
        Product saved = productRepository.save(product);

        log.info("Created product: {}", saved.getId());
        return ProductResponse.from(saved);
    }

    @Transactional
    public ProductResponse updateProduct(Long productId, UpdateProductRequest request) {
        log.info("Updating product: {}", productId);

        Product product = productRepository.findByIdOrThrow(productId);
        product.update(
            request.name(),
            request.price(),
            request.description(),
            request.lifetimeGuarantee()
        );

        return ProductResponse.from(product);
    }

    /**
     * 상품 삭제
     *
     * 옵션/이미지는 cascade로 삭제되고,
     * ID로만 참조하는 장바구니 항목, 추천 관계(양방향), 리뷰는 여기서 먼저 정리한다.
     */
    @Transactional
    public void deleteProduct(Long productId) {
        log.info("Deleting product: {}", productId);

        Product product = productRepository.findByIdOrThrow(productId);

        // 1. 이 상품의 옵션을 담고 있는 장바구니 항목 삭제
        List<Long> variantIds = product.getVariantIds();
        if (!variantIds.isEmpty()) {
            int deletedItems = cartItemRepository.deleteAllByVariantIds(variantIds);
            log.debug("Deleted {} cart items referencing product: {}", deletedItems, productId);
        }

        // 2. 추천 관계 (base / recommended 양쪽) 삭제
        int deletedRecommendations = recommendationRepository.deleteAllByProductId(productId);

        // 3. 리뷰 삭제
        int deletedReviews = reviewRepository.deleteAllByProductId(productId);

        // 4. 상품 삭제 (옵션, 이미지 cascade)
        productRepository.delete(product);

        log.debug("Deleted product: {} (recommendations: {}, reviews: {})",
            productId, deletedRecommendations, deletedReviews);
    }
}
