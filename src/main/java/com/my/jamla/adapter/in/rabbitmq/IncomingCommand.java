package com.my.jamla.adapter.in.rabbitmq;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.my.jamla.domain.exception.InvalidRequestException;

import java.util.Locale;
import java.util.Objects;

/**
 * 명령 계층이 구조화해 보낸 구독/설정 요청.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IncomingCommand(String requestId, Long userId, String action, String argument) {

    public enum Action {
        SUBSCRIBE,
        UNSUBSCRIBE,
        LIST,
        SET_MODE,
        SET_DIGEST_TIME,
        SET_LANGUAGE,
        SETTINGS,
        DIGEST
    }

    public IncomingCommand {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(action, "action");
    }

    public Action parsedAction() {
        try {
            return Action.valueOf(action.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("알 수 없는 명령입니다: " + action, e);
        }
    }
}
