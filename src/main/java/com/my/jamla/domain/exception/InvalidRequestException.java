package com.my.jamla.domain.exception;

/**
 * 외부 입력(모드, 시각, 언어 태그 등)이 계약을 위반했을 때 경계에서 던진다.
 */
public class InvalidRequestException extends RuntimeException {
    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
