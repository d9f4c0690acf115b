package com.my.jamla.domain.exception;

/**
 * 구독 저장소에 접근할 수 없을 때 호출자에게 그대로 전파된다.
 */
public class StoreUnavailableException extends RuntimeException {
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
