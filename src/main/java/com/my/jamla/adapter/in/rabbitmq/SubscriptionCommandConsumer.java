package com.my.jamla.adapter.in.rabbitmq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.jamla.adapter.out.reply.CommandReply;
import com.my.jamla.adapter.out.reply.CommandReplyProducer;
import com.my.jamla.domain.exception.InvalidRequestException;
import com.my.jamla.domain.exception.StoreUnavailableException;
import com.my.jamla.domain.model.Channel;
import com.my.jamla.domain.model.DeliveryMode;
import com.my.jamla.domain.model.DigestTime;
import com.my.jamla.domain.model.SubscribeResult;
import com.my.jamla.domain.model.Subscriber;
import com.my.jamla.domain.model.UnsubscribeResult;
import com.my.jamla.domain.port.in.DigestUseCase;
import com.my.jamla.domain.port.in.SubscriptionUseCase;
import com.my.jamla.domain.port.in.UserSettingsUseCase;
import io.smallrye.mutiny.Uni;
import io.smallrye.reactive.messaging.annotations.Blocking;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Incoming;
import org.eclipse.microprofile.reactive.messaging.Message;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * 구독/설정 명령을 유스케이스로 연결하고 결과 키를 회신한다.
 * 예상 가능한 실패(이미 구독, 잘못된 시각 등)는 실패 키로만 회신하고 오류로 기록하지 않는다.
 */
@ApplicationScoped
public class SubscriptionCommandConsumer {

    private static final Logger log = Logger.getLogger(SubscriptionCommandConsumer.class);

    private final SubscriptionUseCase subscriptionUseCase;
    private final UserSettingsUseCase userSettingsUseCase;
    private final DigestUseCase digestUseCase;
    private final CommandReplyProducer replyProducer;
    private final ObjectMapper objectMapper;

    @Inject
    public SubscriptionCommandConsumer(SubscriptionUseCase subscriptionUseCase,
                                       UserSettingsUseCase userSettingsUseCase,
                                       DigestUseCase digestUseCase,
                                       CommandReplyProducer replyProducer,
                                       ObjectMapper objectMapper) {
        this.subscriptionUseCase = subscriptionUseCase;
        this.userSettingsUseCase = userSettingsUseCase;
        this.digestUseCase = digestUseCase;
        this.replyProducer = replyProducer;
        this.objectMapper = objectMapper;
    }

    @Incoming("subscription-commands")
    @Blocking
    public Uni<Void> consume(Message<String> message) {
        return Uni.createFrom().completionStage(() -> dispatch(message));
    }

    private CompletionStage<Void> dispatch(Message<String> message) {
        IncomingCommand command;
        try {
            command = objectMapper.readValue(message.getPayload(), IncomingCommand.class);
        } catch (IOException e) {
            log.warnf("명령 페이로드 파싱 실패로 건너뜁니다: %s", e.getMessage());
            return message.ack();
        }
        MDC.put("requestId", String.valueOf(command.requestId()));
        MDC.put("userId", String.valueOf(command.userId()));
        ChannelPostConsumer.correlationId(message).ifPresent(id -> MDC.put("correlationId", id));
        try {
            replyProducer.send(handle(command));
            return message.ack();
        } catch (StoreUnavailableException e) {
            log.errorf(e, "명령 처리 중 저장소 오류 action=%s", command.action());
            return message.nack(e);
        } finally {
            MDC.remove("requestId");
            MDC.remove("userId");
            MDC.remove("correlationId");
        }
    }

    CommandReply handle(IncomingCommand command) {
        IncomingCommand.Action action;
        try {
            action = command.parsedAction();
        } catch (InvalidRequestException e) {
            log.infof("지원하지 않는 명령: %s", command.action());
            return CommandReply.of(command, "invalid_request", command.action());
        }
        long userId = command.userId();
        String argument = command.argument();
        return switch (action) {
            case SUBSCRIBE -> subscribe(command, userId, argument);
            case UNSUBSCRIBE -> unsubscribe(command, userId, argument);
            case LIST -> list(command, userId);
            case SET_MODE -> setMode(command, userId, argument);
            case SET_DIGEST_TIME -> setDigestTime(command, userId, argument);
            case SET_LANGUAGE -> setLanguage(command, userId, argument);
            case SETTINGS -> CommandReply.settings(command, userSettingsUseCase.getSettings(userId));
            case DIGEST -> digestUseCase.manualDigest(userId)
                    ? CommandReply.of(command, "digest_sent", null)
                    : CommandReply.of(command, "no_posts", null);
        };
    }

    private CommandReply subscribe(IncomingCommand command, long userId, String handle) {
        SubscribeResult result = subscriptionUseCase.subscribe(userId, handle);
        return switch (result.status()) {
            case ADDED -> CommandReply.of(command, "channel_added", result.title());
            case ALREADY_ADDED -> CommandReply.of(command, "channel_already_added", handle);
            case NOT_FOUND -> CommandReply.of(command, "channel_not_found", handle);
        };
    }

    private CommandReply unsubscribe(IncomingCommand command, long userId, String handle) {
        UnsubscribeResult result = subscriptionUseCase.unsubscribe(userId, handle);
        return switch (result.status()) {
            case REMOVED -> CommandReply.of(command, "channel_removed", result.title());
            case NOT_FOUND -> CommandReply.of(command, "channel_not_in_list", handle);
        };
    }

    private CommandReply list(IncomingCommand command, long userId) {
        List<Channel> channels = subscriptionUseCase.listSubscriptions(userId);
        if (channels.isEmpty()) {
            return CommandReply.of(command, "no_channels", null);
        }
        return CommandReply.channels(command, channels);
    }

    private CommandReply setMode(IncomingCommand command, long userId, String argument) {
        try {
            Subscriber updated = userSettingsUseCase.setMode(userId, DeliveryMode.fromCode(argument));
            return CommandReply.of(command, "mode_changed", updated.mode().code());
        } catch (InvalidRequestException e) {
            return CommandReply.of(command, "invalid_mode", argument);
        }
    }

    private CommandReply setDigestTime(IncomingCommand command, long userId, String argument) {
        try {
            Subscriber updated = userSettingsUseCase.setDigestTime(userId, DigestTime.parse(argument));
            return CommandReply.of(command, "time_changed", updated.digestTime().format());
        } catch (InvalidRequestException e) {
            return CommandReply.of(command, "invalid_time", argument);
        }
    }

    private CommandReply setLanguage(IncomingCommand command, long userId, String argument) {
        try {
            Subscriber updated = userSettingsUseCase.setLanguage(userId, argument);
            return CommandReply.of(command, "lang_changed", updated.language());
        } catch (InvalidRequestException e) {
            return CommandReply.of(command, "invalid_language", argument);
        }
    }
}
