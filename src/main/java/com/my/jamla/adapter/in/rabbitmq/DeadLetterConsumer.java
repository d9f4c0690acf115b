package com.my.jamla.adapter.in.rabbitmq;

import io.quarkus.arc.profile.IfBuildProfile;
import io.smallrye.reactive.messaging.annotations.Blocking;
import io.smallrye.reactive.messaging.rabbitmq.IncomingRabbitMQMetadata;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.reactive.messaging.Incoming;
import org.eclipse.microprofile.reactive.messaging.Message;
import org.jboss.logging.Logger;

import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * 저장소 장애로 nack 된 게시물/명령이 DLQ에 쌓이는 것을 기록한다.
 */
@IfBuildProfile("prod")
@ApplicationScoped
public class DeadLetterConsumer {

    private static final Logger log = Logger.getLogger(DeadLetterConsumer.class);

    @Incoming("jamla-dlq")
    @Blocking
    public CompletionStage<Void> consume(Message<String> message) {
        var metadata = message.getMetadata(IncomingRabbitMQMetadata.class).orElse(null);
        String deathReason = header(metadata, "x-first-death-reason");
        String firstQueue = header(metadata, "x-first-death-queue");
        log.warnf("DLQ 소비: reason=%s, queue=%s, payload=%s", deathReason, firstQueue, message.getPayload());
        return message.ack();
    }

    private String header(IncomingRabbitMQMetadata metadata, String name) {
        return Optional.ofNullable(metadata)
                .map(IncomingRabbitMQMetadata::getHeaders)
                .map(headers -> String.valueOf(headers.getOrDefault(name, "unknown")))
                .orElse("unknown");
    }
}
