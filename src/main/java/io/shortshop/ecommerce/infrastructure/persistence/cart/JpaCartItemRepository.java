package io.shortshop.ecommerce.infrastructure.persistence.cart;

import io.shortshop.ecommerce.domain.cart.CartItem;
import io.shortshop.ecommerce.domain.cart.CartItemRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;

@Repository
public interface JpaCartItemRepository extends JpaRepository<CartItem, Long>, CartItemRepository {

    @Override
    CartItem save(CartItem cartItem);

    @Override
    @Modifying
    @Query("DELETE FROM CartItem ci WHERE ci.variant.id IN :variantIds")
    int deleteAllByVariantIds(@Param("variantIds") Collection<Long> variantIds);
}
