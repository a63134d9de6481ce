package io.shortshop.ecommerce.infrastructure.persistence.product;

import io.shortshop.ecommerce.domain.product.Product;
import io.shortshop.ecommerce.domain.product.ProductRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface JpaProductRepository extends JpaRepository<Product, Long>, ProductRepository {

    // Explicitly declare methods to resolve ambiguity with ProductRepository
    @Override
    Optional<Product> findById(Long id);

    @Override
    boolean existsById(Long id);

    @Override
    Product save(Product product);

    @Override
    void delete(Product product);

    /**
     * skip/limit 기반 페이지 조회
     * - skip이 limit의 배수가 아닐 수 있어 Pageable 대신 OFFSET 직접 사용
     * - variants/images는 default_batch_fetch_size로 IN 쿼리 일괄 로딩
     */
    @Override
    @Query(value = "SELECT * FROM products ORDER BY id LIMIT :limit OFFSET :skip", nativeQuery = true)
    List<Product> findPage(@Param("skip") int skip, @Param("limit") int limit);
}
