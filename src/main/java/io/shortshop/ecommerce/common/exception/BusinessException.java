package io.shortshop.ecommerce.common.exception;

import lombok.Getter;

/**
 * 상품/장바구니 규칙 위반, 대상 미존재 예외
 *
 * 응답 코드와 HTTP 상태는 errorCode로 결정된다.
 * 메시지를 지정하지 않으면 ErrorCode의 기본 메시지를 사용한다.
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        this(errorCode, errorCode.getMessage());
    }

    public BusinessException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
