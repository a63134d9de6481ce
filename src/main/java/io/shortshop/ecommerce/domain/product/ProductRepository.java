package io.shortshop.ecommerce.domain.product;

import io.shortshop.ecommerce.common.exception.BusinessException;
import io.shortshop.ecommerce.common.exception.ErrorCode;

import java.util.List;
import java.util.Optional;

public interface ProductRepository {

    Optional<Product> findById(Long id);

    List<Product> findPage(int skip, int limit);

    boolean existsById(Long id);

    Product save(Product product);

    void delete(Product product);

    default Product findByIdOrThrow(Long id) {
        return findById(id)
            .orElseThrow(() -> new BusinessException(
                ErrorCode.PRODUCT_NOT_FOUND,
                "Product not found. productId: " + id
            ));
    }

    default void verifyExists(Long id) {
        if (!existsById(id)) {
            throw new BusinessException(
                ErrorCode.PRODUCT_NOT_FOUND,
                "Product not found. productId: " + id
            );
        }
    }
}
