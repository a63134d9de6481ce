package io.shortshop.ecommerce.domain.product;

/**
 * 상품 옵션 사이즈
 * DB에는 이름 그대로(EnumType.STRING) 저장된다.
 */
public enum VariantSize {
    XS,
    S,
    M,
    L,
    XL,
    XXL
}
