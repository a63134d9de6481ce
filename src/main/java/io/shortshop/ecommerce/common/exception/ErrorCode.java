package io.shortshop.ecommerce.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 비즈니스 에러 코드 정의
 * HTTP 상태 매핑은 GlobalExceptionHandler 참고
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // ====================================
    // 상품 관련 (P)
    // ====================================
    PRODUCT_NOT_FOUND("P001", "Product not found"),

    // ====================================
    // 상품 옵션 관련 (V)
    // ====================================
    VARIANT_NOT_FOUND("V001", "Variant not found"),
    DUPLICATE_VARIANT("V002", "Variant with the same color and size already exists"),

    // ====================================
    // 상품 이미지 관련 (IMG)
    // ====================================
    IMAGE_NOT_FOUND("IMG001", "Image not found for this product"),
    NO_IMAGES_PROVIDED("IMG002", "No images provided"),

    // ====================================
    // 추천 상품 관련 (R)
    // ====================================
    RECOMMENDATION_NOT_FOUND("R001", "Recommendation not found"),
    SELF_RECOMMENDATION("R002", "Cannot recommend the same product"),
    DUPLICATE_RECOMMENDATION("R003", "Recommendation already exists"),

    // ====================================
    // 장바구니 관련 (CART)
    // ====================================
    CART_NOT_FOUND("CART001", "Cart not found"),
    CART_ITEM_NOT_FOUND("CART002", "Item not found in this cart"),
    INVALID_QUANTITY("CART003", "Quantity must be between 1 and 10000"),

    // ====================================
    // 공통 (COMMON)
    // ====================================
    INTERNAL_SERVER_ERROR("COMMON001", "Internal server error"),
    INVALID_INPUT("COMMON002", "Invalid input"),
    VALIDATION_FAILED("COMMON003", "Request validation failed"),
    DATA_CONFLICT("COMMON004", "Request conflicts with the current state of the resource"),
    RESOURCE_NOT_FOUND("COMMON005", "Resource not found"),
    METHOD_NOT_ALLOWED("COMMON006", "Method not allowed");

    private final String code;
    private final String message;
}
