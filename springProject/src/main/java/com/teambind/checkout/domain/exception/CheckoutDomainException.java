package com.teambind.checkout.domain.exception;

import com.teambind.checkout.common.exceptions.ErrorCode;
import lombok.Getter;

/**
 * 체크아웃 도메인 예외
 * 모든 하위 예외는 경계(라인, 스캔 단위)에서 처리되며 세션 전체를 중단시키지 않는다.
 */
@Getter
public abstract class CheckoutDomainException extends RuntimeException {

    private final ErrorCode errorCode;

    protected CheckoutDomainException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected CheckoutDomainException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getCode() {
        return errorCode.getErrCode();
    }

    /**
     * 스킴에 존재하지 않는 상품 코드
     */
    public static class UnknownItem extends CheckoutDomainException {
        public UnknownItem(String itemId) {
            super(ErrorCode.UNKNOWN_ITEM, "스킴에 등록되지 않은 상품입니다: " + itemId);
        }
    }

    /**
     * 스킴 라인 파싱 실패
     */
    public static class MalformedSchemeEntry extends CheckoutDomainException {
        public MalformedSchemeEntry(String message) {
            super(ErrorCode.MALFORMED_SCHEME_ENTRY, message);
        }

        public MalformedSchemeEntry(String message, Throwable cause) {
            super(ErrorCode.MALFORMED_SCHEME_ENTRY, message, cause);
        }
    }

    /**
     * 구조적 불변식 위반 (빈 규칙, 중복 정의 등)
     */
    public static class DefinitionError extends CheckoutDomainException {
        public DefinitionError(String message) {
            super(ErrorCode.DEFINITION_ERROR, message);
        }
    }

    /**
     * 존재하지 않는 체크아웃 세션
     */
    public static class CheckoutNotFound extends CheckoutDomainException {
        public CheckoutNotFound(Long checkoutId) {
            super(ErrorCode.CHECKOUT_NOT_FOUND, "체크아웃 세션을 찾을 수 없습니다: " + checkoutId);
        }
    }
}
