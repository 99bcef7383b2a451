package com.teambind.checkout.common.exceptions;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * 공통 에러 코드
 * 도메인 예외는 자신의 코드를 가지고 있으며 응답 상태는 여기서 결정된다.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    UNKNOWN_ITEM("UNKNOWN_ITEM", "스킴에 등록되지 않은 상품입니다.", HttpStatus.UNPROCESSABLE_ENTITY),
    MALFORMED_SCHEME_ENTRY("MALFORMED_SCHEME_ENTRY", "스킴 라인을 해석할 수 없습니다.", HttpStatus.BAD_REQUEST),
    DEFINITION_ERROR("DEFINITION_ERROR", "스킴 정의가 올바르지 않습니다.", HttpStatus.BAD_REQUEST),
    CHECKOUT_NOT_FOUND("CHECKOUT_NOT_FOUND", "체크아웃 세션을 찾을 수 없습니다.", HttpStatus.NOT_FOUND),
    VALIDATION_ERROR("VALIDATION_ERROR", "입력값 검증에 실패했습니다.", HttpStatus.BAD_REQUEST),
    INTERNAL_SERVER_ERROR("INTERNAL_SERVER_ERROR", "서버 내부 오류가 발생했습니다.", HttpStatus.INTERNAL_SERVER_ERROR);

    private final String errCode;
    private final String message;
    private final HttpStatus status;
}
