package io.shortshop.ecommerce.application.product;

import io.shortshop.ecommerce.application.product.dto.VariantRequest;
import io.shortshop.ecommerce.application.product.dto.VariantResponse;
import io.shortshop.ecommerce.domain.cart.CartItemRepository;
import io.shortshop.ecommerce.domain.product.Product;
import io.shortshop.ecommerce.domain.product.ProductRepository;
import io.shortshop.ecommerce.domain.product.ProductVariant;
import io.shortshop.ecommerce.domain.product.ProductVariantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ProductVariantService {

    private final ProductRepository productRepository;
    private final ProductVariantRepository variantRepository;
    private final CartItemRepository cartItemRepository;

    @Transactional
    public VariantResponse addVariant(Long productId, VariantRequest request) {
        log.info("Adding variant to product: {}, color: {}, size: {}", productId, request.color(), request.size());

        Product product = productRepository.findByIdOrThrow(productId);
        ProductVariant variant = product.addVariant(request.color(), request.size(), request.inStockOrDefault());

        // ID 확보를 위해 바로 저장 (IDENTITY)
        variantRepository.save(variant);

        log.debug("Created variant: {}", variant.getId());
        return VariantResponse.from(variant);
    }

    @Transactional
    public VariantResponse updateVariant(Long variantId, VariantRequest request) {
        log.info("Updating variant: {}, color: {}, size: {}", variantId, request.color(), request.size());

        ProductVariant variant = variantRepository.findByIdOrThrow(variantId);
        variant.update(request.color(), request.size(), request.inStockOrDefault());

        return VariantResponse.from(variant);
    }

    /**
     * 옵션 삭제: 이 옵션을 담은 장바구니 항목도 함께 삭제
     */
    @Transactional
    public void deleteVariant(Long variantId) {
        log.info("Deleting variant: {}", variantId);

        ProductVariant variant = variantRepository.findByIdOrThrow(variantId);

        int deletedItems = cartItemRepository.deleteAllByVariantIds(List.of(variantId));
        variant.getProduct().removeVariant(variant);

        log.debug("Deleted variant: {} (cart items: {})", variantId, deletedItems);
    }
}
