package com.my.jamla.adapter.in.rabbitmq;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.jamla.adapter.out.reply.CommandReply;
import com.my.jamla.adapter.out.reply.CommandReplyProducer;
import com.my.jamla.domain.exception.InvalidRequestException;
import com.my.jamla.domain.exception.StoreUnavailableException;
import com.my.jamla.domain.model.Channel;
import com.my.jamla.domain.model.ChannelHandle;
import com.my.jamla.domain.model.DeliveryMode;
import com.my.jamla.domain.model.DigestTime;
import com.my.jamla.domain.model.SubscribeResult;
import com.my.jamla.domain.model.Subscriber;
import com.my.jamla.domain.model.UnsubscribeResult;
import com.my.jamla.domain.port.in.DigestUseCase;
import com.my.jamla.domain.port.in.SubscriptionUseCase;
import com.my.jamla.domain.port.in.UserSettingsUseCase;
import org.eclipse.microprofile.reactive.messaging.Emitter;
import org.eclipse.microprofile.reactive.messaging.Message;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SuppressWarnings("unchecked")
class SubscriptionCommandConsumerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private SubscriptionUseCase subscriptionUseCase;
    private UserSettingsUseCase userSettingsUseCase;
    private DigestUseCase digestUseCase;
    private Emitter<String> emitter;
    private SubscriptionCommandConsumer consumer;

    @BeforeEach
    void setUp() {
        subscriptionUseCase = mock(SubscriptionUseCase.class);
        userSettingsUseCase = mock(UserSettingsUseCase.class);
        digestUseCase = mock(DigestUseCase.class);
        emitter = (Emitter<String>) mock(Emitter.class);
        consumer = new SubscriptionCommandConsumer(subscriptionUseCase, userSettingsUseCase, digestUseCase,
                new CommandReplyProducer(emitter, objectMapper), objectMapper);
    }

    @Test
    void subscribe_maps_each_outcome() {
        when(subscriptionUseCase.subscribe(1L, "@news"))
                .thenReturn(SubscribeResult.added("News"))
                .thenReturn(SubscribeResult.alreadyAdded());
        when(subscriptionUseCase.subscribe(1L, "@nope")).thenReturn(SubscribeResult.notFound());

        CommandReply added = consumer.handle(command("subscribe", "@news"));
        CommandReply already = consumer.handle(command("subscribe", "@news"));
        CommandReply missing = consumer.handle(command("subscribe", "@nope"));

        assertThat(added.key()).isEqualTo("channel_added");
        assertThat(added.value()).isEqualTo("News");
        assertThat(already.key()).isEqualTo("channel_already_added");
        assertThat(missing.key()).isEqualTo("channel_not_found");
        assertThat(missing.value()).isEqualTo("@nope");
    }

    @Test
    void unsubscribe_maps_each_outcome() {
        when(subscriptionUseCase.unsubscribe(1L, "news")).thenReturn(UnsubscribeResult.removed("News"));
        when(subscriptionUseCase.unsubscribe(1L, "sport")).thenReturn(UnsubscribeResult.notFound());

        assertThat(consumer.handle(command("unsubscribe", "news")).key()).isEqualTo("channel_removed");
        assertThat(consumer.handle(command("unsubscribe", "sport")).key()).isEqualTo("channel_not_in_list");
    }

    @Test
    void list_returns_channels_or_empty_key() {
        when(subscriptionUseCase.listSubscriptions(1L))
                .thenReturn(List.of())
                .thenReturn(List.of(new Channel(1L, -100L, new ChannelHandle("news"), "News")));

        CommandReply empty = consumer.handle(command("list", null));
        CommandReply listed = consumer.handle(command("list", null));

        assertThat(empty.key()).isEqualTo("no_channels");
        assertThat(listed.key()).isEqualTo("your_channels");
        assertThat(listed.channels()).containsExactly(new CommandReply.ChannelView("news", "News"));
    }

    @Test
    void settings_commands_validate_arguments() {
        when(userSettingsUseCase.setMode(1L, DeliveryMode.DIGEST)).thenReturn(user(DeliveryMode.DIGEST, "09:00", "uz"));
        when(userSettingsUseCase.setDigestTime(1L, DigestTime.parse("21:30")))
                .thenReturn(user(DeliveryMode.DIGEST, "21:30", "uz"));
        when(userSettingsUseCase.setLanguage(1L, "klingon!")).thenThrow(new InvalidRequestException("bad tag"));

        assertThat(consumer.handle(command("set_mode", "digest")).value()).isEqualTo("digest");
        assertThat(consumer.handle(command("set_mode", "sometimes")).key()).isEqualTo("invalid_mode");
        assertThat(consumer.handle(command("set_digest_time", "21:30")).key()).isEqualTo("time_changed");
        assertThat(consumer.handle(command("set_digest_time", "25:00")).key()).isEqualTo("invalid_time");
        assertThat(consumer.handle(command("set_digest_time", "9am")).key()).isEqualTo("invalid_time");
        assertThat(consumer.handle(command("set_language", "klingon!")).key()).isEqualTo("invalid_language");
        verify(userSettingsUseCase, times(1)).setDigestTime(anyLong(), any(DigestTime.class));
    }

    @Test
    void settings_reply_carries_current_values() {
        when(userSettingsUseCase.getSettings(1L)).thenReturn(user(DeliveryMode.OFF, "07:15", "ru"));

        CommandReply reply = consumer.handle(command("settings", null));

        assertThat(reply.key()).isEqualTo("settings");
        assertThat(reply.settings()).isEqualTo(new CommandReply.SettingsView("off", "07:15", "ru"));
    }

    @Test
    void manual_digest_reports_whether_posts_existed() {
        when(digestUseCase.manualDigest(1L)).thenReturn(true).thenReturn(false);

        assertThat(consumer.handle(command("digest", null)).key()).isEqualTo("digest_sent");
        assertThat(consumer.handle(command("digest", null)).key()).isEqualTo("no_posts");
    }

    @Test
    void unknown_action_is_invalid_request() {
        CommandReply reply = consumer.handle(command("teleport", null));

        assertThat(reply.key()).isEqualTo("invalid_request");
        verify(subscriptionUseCase, never()).subscribe(anyLong(), anyString());
    }

    @Test
    void consume_publishes_reply_and_acks() throws Exception {
        when(subscriptionUseCase.subscribe(1L, "news")).thenReturn(SubscribeResult.added("News"));
        AtomicBoolean acked = new AtomicBoolean();

        consumer.consume(Message.of(
                "{\"requestId\":\"r-1\",\"userId\":1,\"action\":\"SUBSCRIBE\",\"argument\":\"news\"}",
                () -> {
                    acked.set(true);
                    return CompletableFuture.completedFuture(null);
                })).await().indefinitely();

        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(emitter).send(payload.capture());
        JsonNode json = objectMapper.readTree(payload.getValue());
        assertThat(json.get("requestId").asText()).isEqualTo("r-1");
        assertThat(json.get("userId").asLong()).isEqualTo(1L);
        assertThat(json.get("key").asText()).isEqualTo("channel_added");
        assertThat(json.has("channels")).isFalse();
        assertThat(acked).isTrue();
    }

    @Test
    void consume_nacks_on_store_failure() {
        when(subscriptionUseCase.listSubscriptions(1L))
                .thenThrow(new StoreUnavailableException("down", new SQLException("disk I/O error")));
        AtomicBoolean nacked = new AtomicBoolean();

        consumer.consume(Message.of(
                "{\"requestId\":\"r-2\",\"userId\":1,\"action\":\"list\"}",
                () -> CompletableFuture.completedFuture(null),
                reason -> {
                    nacked.set(true);
                    return CompletableFuture.completedFuture(null);
                })).await().indefinitely();

        assertThat(nacked).isTrue();
        verify(emitter, never()).send(anyString());
    }

    private static IncomingCommand command(String action, String argument) {
        return new IncomingCommand("req", 1L, action, argument);
    }

    private static Subscriber user(DeliveryMode mode, String time, String language) {
        return new Subscriber(1L, mode, DigestTime.parse(time), language, Instant.EPOCH);
    }
}
