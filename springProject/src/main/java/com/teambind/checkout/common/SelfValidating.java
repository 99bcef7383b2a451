package com.teambind.checkout.common;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Validation;
import jakarta.validation.Validator;

import java.util.Set;

/**
 * 생성 시점 자기 검증 지원
 * 하위 클래스는 생성자 마지막에 validateSelf() 를 호출한다.
 */
public abstract class SelfValidating<T> {

    private static final Validator VALIDATOR = Validation.buildDefaultValidatorFactory().getValidator();

    /**
     * @throws ConstraintViolationException 제약 조건 위반 시
     */
    protected void validateSelf() {
        @SuppressWarnings("unchecked")
        Set<ConstraintViolation<T>> violations = VALIDATOR.validate((T) this);
        if (!violations.isEmpty()) {
            throw new ConstraintViolationException(violations);
        }
    }
}
