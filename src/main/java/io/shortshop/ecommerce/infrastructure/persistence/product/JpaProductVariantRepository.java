package io.shortshop.ecommerce.infrastructure.persistence.product;

import io.shortshop.ecommerce.domain.product.ProductVariant;
import io.shortshop.ecommerce.domain.product.ProductVariantRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface JpaProductVariantRepository extends JpaRepository<ProductVariant, Long>, ProductVariantRepository {

    @Override
    Optional<ProductVariant> findById(Long id);

    @Override
    ProductVariant save(ProductVariant variant);
}
