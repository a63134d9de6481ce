package io.shortshop.ecommerce.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * 애플리케이션 정보 (application.yml: shortshop.app.*)
 * 서버 상태 응답과 API 문서에 사용
 */
@ConfigurationProperties(prefix = "shortshop.app")
public record AppProperties(
    @DefaultValue("Shortshop API") String name,
    @DefaultValue("1.0.0") String version,
    @DefaultValue("") String description
) {}
