package com.my.jamla.adapter.out.reply;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.my.jamla.adapter.in.rabbitmq.IncomingCommand;
import com.my.jamla.domain.model.Channel;
import com.my.jamla.domain.model.Subscriber;

import java.util.List;

/**
 * 명령 처리 결과. 문구가 아닌 결과 키와 값만 담고, 표시 문구는 명령 계층이 만든다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CommandReply(String requestId,
                           long userId,
                           String key,
                           String value,
                           List<ChannelView> channels,
                           SettingsView settings) {

    public static CommandReply of(IncomingCommand command, String key, String value) {
        return new CommandReply(command.requestId(), command.userId(), key, value, null, null);
    }

    public static CommandReply channels(IncomingCommand command, List<Channel> channels) {
        List<ChannelView> views = channels.stream()
                .map(channel -> new ChannelView(channel.handle().value(), channel.title()))
                .toList();
        return new CommandReply(command.requestId(), command.userId(), "your_channels", null, views, null);
    }

    public static CommandReply settings(IncomingCommand command, Subscriber subscriber) {
        SettingsView view = new SettingsView(subscriber.mode().code(), subscriber.digestTime().format(), subscriber.language());
        return new CommandReply(command.requestId(), command.userId(), "settings", null, null, view);
    }

    public record ChannelView(String handle, String title) {
    }

    public record SettingsView(String mode, String digestTime, String language) {
    }
}
