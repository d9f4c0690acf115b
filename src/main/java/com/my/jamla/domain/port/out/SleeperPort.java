package com.my.jamla.domain.port.out;

import java.time.Duration;

/**
 * 호출 스레드만 멈춘다. 레이트 리밋 대기와 전송 간격에 쓰인다.
 */
@FunctionalInterface
public interface SleeperPort {
    void sleep(Duration duration) throws InterruptedException;
}
