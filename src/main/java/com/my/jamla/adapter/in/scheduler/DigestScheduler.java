package com.my.jamla.adapter.in.scheduler;

import com.my.jamla.config.AppConfig;
import com.my.jamla.domain.port.out.ClockPort;
import com.my.jamla.domain.service.DigestService;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 다이제스트 틱을 분 경계마다 실행하는 단일 백그라운드 루프.
 * <p>
 * 상태는 IDLE → TICK → IDLE 로 돌고, 중지 시 진행 중인 틱이 끝날 때까지 기다린 뒤 TERMINATED 가 된다.
 * 대기 중 중지는 정상 종료로 취급한다.
 */
@Startup
@ApplicationScoped
public class DigestScheduler {

    private static final Logger log = Logger.getLogger(DigestScheduler.class);

    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofMinutes(5);

    public enum State {
        IDLE,
        TICK,
        TERMINATED
    }

    private final DigestService digestService;
    private final ClockPort clockPort;
    private final Duration period;
    private final ExecutorService executor;
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);
    private volatile boolean running;

    @Inject
    public DigestScheduler(DigestService digestService, ClockPort clockPort, AppConfig appConfig) {
        this(digestService, clockPort, Duration.ofSeconds(appConfig.digest().tickSeconds()));
    }

    DigestScheduler(DigestService digestService, ClockPort clockPort, Duration period) {
        this.digestService = digestService;
        this.clockPort = clockPort;
        this.period = period;
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "digest-scheduler");
            thread.setDaemon(true);
            return thread;
        });
    }

    @PostConstruct
    void start() {
        running = true;
        executor.execute(this::runLoop);
        log.infof("다이제스트 스케줄러 시작 (주기 %d초)", period.toSeconds());
    }

    @PreDestroy
    void stop() {
        running = false;
        stopSignal.countDown();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("진행 중인 다이제스트 틱이 제한 시간 안에 끝나지 않았습니다.");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        state.set(State.TERMINATED);
        log.info("다이제스트 스케줄러 중지");
    }

    public State state() {
        return state.get();
    }

    private void runLoop() {
        while (running) {
            state.set(State.TICK);
            try {
                digestService.tick();
            } catch (RuntimeException e) {
                log.errorf(e, "다이제스트 틱 실패");
            } finally {
                state.compareAndSet(State.TICK, State.IDLE);
            }
            if (!awaitNextBoundary()) {
                return;
            }
        }
    }

    /**
     * @return 다음 틱을 실행해야 하면 true, 중지 신호를 받았으면 false
     */
    private boolean awaitNextBoundary() {
        Duration wait = untilNextBoundary(clockPort.now());
        try {
            return !stopSignal.await(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    Duration untilNextBoundary(OffsetDateTime now) {
        long periodMillis = period.toMillis();
        long nowMillis = now.toInstant().toEpochMilli();
        long next = (nowMillis / periodMillis + 1) * periodMillis;
        return Duration.ofMillis(next - nowMillis);
    }
}
