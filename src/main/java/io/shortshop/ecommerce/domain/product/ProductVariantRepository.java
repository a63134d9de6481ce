package io.shortshop.ecommerce.domain.product;

import io.shortshop.ecommerce.common.exception.BusinessException;
import io.shortshop.ecommerce.common.exception.ErrorCode;

import java.util.Optional;

public interface ProductVariantRepository {

    Optional<ProductVariant> findById(Long id);

    ProductVariant save(ProductVariant variant);

    default ProductVariant findByIdOrThrow(Long id) {
        return findById(id)
            .orElseThrow(() -> new BusinessException(
                ErrorCode.VARIANT_NOT_FOUND,
                "Variant not found. variantId: " + id
            ));
    }
}
