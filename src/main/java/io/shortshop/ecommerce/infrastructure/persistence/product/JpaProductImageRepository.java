package io.shortshop.ecommerce.infrastructure.persistence.product;

import io.shortshop.ecommerce.domain.product.ProductImage;
import io.shortshop.ecommerce.domain.product.ProductImageRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface JpaProductImageRepository extends JpaRepository<ProductImage, Long>, ProductImageRepository {

    @Override
    @Query("SELECT i FROM ProductImage i WHERE i.id = :id AND i.product.id = :productId")
    Optional<ProductImage> findByIdAndProductId(@Param("id") Long id, @Param("productId") Long productId);
}
