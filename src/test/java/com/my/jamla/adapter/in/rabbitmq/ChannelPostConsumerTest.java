package com.my.jamla.adapter.in.rabbitmq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.jamla.domain.exception.StoreUnavailableException;
import com.my.jamla.domain.model.IncomingPost;
import com.my.jamla.domain.port.in.IngestPostUseCase;
import org.eclipse.microprofile.reactive.messaging.Message;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class ChannelPostConsumerTest {

    private IngestPostUseCase ingestPostUseCase;
    private ChannelPostConsumer consumer;
    private AtomicBoolean acked;
    private AtomicReference<Throwable> nacked;

    @BeforeEach
    void setUp() {
        ingestPostUseCase = mock(IngestPostUseCase.class);
        consumer = new ChannelPostConsumer(ingestPostUseCase, new ObjectMapper());
        acked = new AtomicBoolean();
        nacked = new AtomicReference<>();
    }

    @Test
    void ingestsValidPayloadAndAcks() {
        consumer.consume(message("{\"channelId\":-100123,\"messageId\":42,\"text\":\"hello\"}")).await().indefinitely();

        verify(ingestPostUseCase).ingest(new IncomingPost(-100123L, 42L, "hello"));
        assertThat(acked).isTrue();
        assertThat(nacked.get()).isNull();
    }

    @Test
    void mediaPostWithoutTextIsIngestedWithEmptyText() {
        consumer.consume(message("{\"channelId\":-100123,\"messageId\":43}")).await().indefinitely();

        verify(ingestPostUseCase).ingest(new IncomingPost(-100123L, 43L, ""));
    }

    @Test
    void malformedPayloadIsAckedAndDropped() {
        consumer.consume(message("not json")).await().indefinitely();
        consumer.consume(message("{\"messageId\":1}")).await().indefinitely();

        verify(ingestPostUseCase, never()).ingest(any());
        assertThat(acked).isTrue();
    }

    @Test
    void storeFailureIsNacked() {
        StoreUnavailableException failure = new StoreUnavailableException("locked", new SQLException("busy"));
        doThrow(failure).when(ingestPostUseCase).ingest(any());

        consumer.consume(message("{\"channelId\":-100123,\"messageId\":44,\"text\":\"x\"}")).await().indefinitely();

        assertThat(nacked.get()).isSameAs(failure);
        assertThat(acked).isFalse();
    }

    private Message<String> message(String payload) {
        return Message.of(payload,
                () -> {
                    acked.set(true);
                    return CompletableFuture.completedFuture(null);
                },
                reason -> {
                    nacked.set(reason);
                    return CompletableFuture.completedFuture(null);
                });
    }
}
