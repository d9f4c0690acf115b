package com.my.jamla.adapter.in.rabbitmq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.jamla.domain.exception.StoreUnavailableException;
import com.my.jamla.domain.model.IncomingPost;
import com.my.jamla.domain.port.in.IngestPostUseCase;
import io.smallrye.mutiny.Uni;
import io.smallrye.reactive.messaging.annotations.Blocking;
import io.smallrye.reactive.messaging.rabbitmq.IncomingRabbitMQMetadata;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Incoming;
import org.eclipse.microprofile.reactive.messaging.Message;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * 외부 수집기가 발행한 채널 게시물을 라우터로 넘기는 진입 어댑터.
 * 저장소 장애 시 nack 하여 브로커의 재전달/DLQ 정책에 맡긴다.
 */
@ApplicationScoped
public class ChannelPostConsumer {

    private static final Logger log = Logger.getLogger(ChannelPostConsumer.class);

    private final IngestPostUseCase ingestPostUseCase;
    private final ObjectMapper objectMapper;

    @Inject
    public ChannelPostConsumer(IngestPostUseCase ingestPostUseCase, ObjectMapper objectMapper) {
        this.ingestPostUseCase = ingestPostUseCase;
        this.objectMapper = objectMapper;
    }

    @Incoming("channel-posts")
    @Blocking
    public Uni<Void> consume(Message<String> message) {
        return Uni.createFrom().completionStage(() -> route(message));
    }

    private CompletionStage<Void> route(Message<String> message) {
        IncomingPost post;
        try {
            post = objectMapper.readValue(message.getPayload(), IncomingChannelPost.class).toDomain();
        } catch (IOException e) {
            log.warnf("게시물 페이로드 파싱 실패로 건너뜁니다: %s", e.getMessage());
            return message.ack();
        }
        MDC.put("channelId", String.valueOf(post.externalChannelId()));
        correlationId(message).ifPresent(id -> MDC.put("correlationId", id));
        try {
            ingestPostUseCase.ingest(post);
            return message.ack();
        } catch (StoreUnavailableException e) {
            log.errorf(e, "게시물 라우팅 중 저장소 오류 message=%d", post.externalMessageId());
            return message.nack(e);
        } finally {
            MDC.remove("channelId");
            MDC.remove("correlationId");
        }
    }

    static Optional<String> correlationId(Message<String> message) {
        return message.getMetadata(IncomingRabbitMQMetadata.class)
                .flatMap(IncomingRabbitMQMetadata::getCorrelationId);
    }
}
