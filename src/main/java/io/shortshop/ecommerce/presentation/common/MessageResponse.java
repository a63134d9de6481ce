package io.shortshop.ecommerce.presentation.common;

/**
 * 본문 없는 작업(삭제, 비우기 등)의 결과 메시지
 */
public record MessageResponse(String message) {

    public static MessageResponse of(String message) {
        return new MessageResponse(message);
    }
}
