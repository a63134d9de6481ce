package io.shortshop.ecommerce.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * JPA Auditing 설정
 *
 * BaseEntity / BaseTimeEntity의 @CreatedDate, @LastModifiedDate 자동 처리
 * 애플리케이션 클래스와 분리해 @WebMvcTest 슬라이스에서는 로드되지 않게 한다.
 */
@Configuration
@EnableJpaAuditing
public class JpaAuditingConfig {
}
