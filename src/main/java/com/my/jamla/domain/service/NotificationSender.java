package com.my.jamla.domain.service;

import com.my.jamla.domain.model.DeliveryPolicy;
import com.my.jamla.domain.model.DeliveryResult;
import com.my.jamla.domain.model.MessageRef;
import com.my.jamla.domain.port.out.ChannelTransportPort;
import com.my.jamla.domain.port.out.SleeperPort;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * 레이트 리밋을 고려한 전송 계층 래퍼. 실시간 라우팅과 다이제스트 발송이 함께 사용한다.
 * <p>
 * 레이트 리밋 신호를 받으면 호출 스레드만 지시된 시간만큼 멈춘 뒤 정해진 횟수까지만 재시도한다.
 * 그 외 실패는 로그를 남기고 결과 값으로 돌려주며 예외를 던지지 않는다.
 */
public class NotificationSender {

    private static final Logger log = Logger.getLogger(NotificationSender.class);

    private final ChannelTransportPort transport;
    private final SleeperPort sleeper;
    private final DeliveryPolicy policy;

    public NotificationSender(ChannelTransportPort transport, SleeperPort sleeper, DeliveryPolicy policy) {
        this.transport = transport;
        this.sleeper = sleeper;
        this.policy = policy;
    }

    public DeliveryResult notify(long userId, String text) {
        return deliver(userId, "notify", () -> transport.notify(userId, text));
    }

    public DeliveryResult forward(long userId, MessageRef messageRef) {
        return deliver(userId, "forward", () -> transport.forward(userId, messageRef));
    }

    /**
     * 헤더 알림 후 원본 게시물을 전달하고, 다음 수신자 전에 고정 간격만큼 쉰다.
     */
    public DeliveryResult deliverRealtime(long userId, String header, MessageRef messageRef) {
        try {
            DeliveryResult headerResult = notify(userId, header);
            if (!headerResult.isOk()) {
                return headerResult;
            }
            return forward(userId, messageRef);
        } finally {
            pause(policy.interSendDelay());
        }
    }

    private DeliveryResult deliver(long userId, String operation, Supplier<DeliveryResult> attempt) {
        int retriesLeft = policy.rateLimitRetries();
        while (true) {
            DeliveryResult result;
            try {
                result = attempt.get();
            } catch (RuntimeException e) {
                log.warnf("%s 전송 중 예외 user=%d: %s", operation, userId, e.getMessage());
                return DeliveryResult.failed(e.getMessage());
            }
            if (result.status() == DeliveryResult.Status.OK) {
                return result;
            }
            if (result.status() == DeliveryResult.Status.FAILED) {
                log.warnf("%s 전송 실패 user=%d reason=%s", operation, userId, result.reason());
                return result;
            }
            if (retriesLeft <= 0) {
                log.warnf("%s 레이트 리밋 재시도 한도 초과로 포기합니다 user=%d", operation, userId);
                return result;
            }
            retriesLeft--;
            log.infof("%s 레이트 리밋: %d초 대기 후 재시도 user=%d", operation, result.retryAfterSeconds(), userId);
            if (!pause(Duration.ofSeconds(result.retryAfterSeconds()))) {
                return DeliveryResult.failed("interrupted");
            }
        }
    }

    private boolean pause(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return true;
        }
        try {
            sleeper.sleep(duration);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("전송 대기 중 인터럽트되었습니다.");
            return false;
        }
    }
}
