package io.shortshop.ecommerce.application.product.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * 부분 수정 요청: 전달되지 않은(null) 필드는 변경하지 않는다.
 */
public record UpdateProductRequest(
    @Size(min = 1, max = 120, message = "name must be 1-120 characters")
    @Pattern(regexp = "(?s).*\\S.*", message = "name must not be blank")
    String name,

    @DecimalMin(value = "0", inclusive = false, message = "price must be greater than 0")
    @Digits(integer = 8, fraction = 2, message = "price must have at most 8 integer and 2 fraction digits")
    BigDecimal price,

    @Pattern(regexp = "(?s).*\\S.*", message = "description must not be blank")
    String description,

    @JsonProperty("lifetime_guarantee")
    Boolean lifetimeGuarantee
) {}
