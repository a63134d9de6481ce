package io.shortshop.ecommerce.infrastructure.persistence.cart;

import io.shortshop.ecommerce.domain.cart.Cart;
import io.shortshop.ecommerce.domain.cart.CartRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface JpaCartRepository extends JpaRepository<Cart, Long>, CartRepository {

    /**
     * Fetch Join으로 Cart + CartItem 한 번에 조회 (N+1 방지)
     */
    @Override
    @Query("SELECT DISTINCT c FROM Cart c LEFT JOIN FETCH c.items WHERE c.sessionId = :sessionId")
    Optional<Cart> findBySessionId(@Param("sessionId") String sessionId);

    @Override
    Cart save(Cart cart);
}
