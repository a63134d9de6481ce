package io.shortshop.ecommerce.application.product.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.util.List;

public record CreateProductRequest(
    @NotBlank(message = "name is required")
    @Size(max = 120, message = "name must be at most 120 characters")
    String name,

    @NotNull(message = "price is required")
    @DecimalMin(value = "0", inclusive = false, message = "price must be greater than 0")
    @Digits(integer = 8, fraction = 2, message = "price must have at most 8 integer and 2 fraction digits")
    BigDecimal price,

    @NotBlank(message = "description is required")
    String description,

    @JsonProperty("lifetime_guarantee")
    Boolean lifetimeGuarantee,

    List<@Valid @NotNull VariantRequest> variants,

    List<@Valid @NotNull ImageRequest> images
) {
    /**
     * lifetime_guarantee 생략 시 true
     */
    public boolean lifetimeGuaranteeOrDefault() {
        return lifetimeGuarantee == null || lifetimeGuarantee;
    }

    public List<VariantRequest> variantsOrEmpty() {
        return variants != null ? variants : List.of();
    }

    public List<ImageRequest> imagesOrEmpty() {
        return images != null ? images : List.of();
    }
}
