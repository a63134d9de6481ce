package io.shortshop.ecommerce.application.cart.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateCartRequest(
    @JsonProperty("session_id")
    @NotBlank(message = "session_id is required")
    @Size(max = 128, message = "session_id must be at most 128 characters")
    String sessionId
) {}
