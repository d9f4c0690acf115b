package com.my.jamla.adapter.out.reply;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Channel;
import org.eclipse.microprofile.reactive.messaging.Emitter;
import org.jboss.logging.Logger;

/**
 * 명령 처리 결과를 subscription-replies 채널로 발행한다.
 */
@ApplicationScoped
public class CommandReplyProducer {

    private static final Logger log = Logger.getLogger(CommandReplyProducer.class);

    private final Emitter<String> replyEmitter;
    private final ObjectMapper objectMapper;

    @Inject
    public CommandReplyProducer(@Channel("subscription-replies") Emitter<String> replyEmitter,
                                ObjectMapper objectMapper) {
        this.replyEmitter = replyEmitter;
        this.objectMapper = objectMapper;
    }

    public void send(CommandReply reply) {
        try {
            replyEmitter.send(objectMapper.writeValueAsString(reply));
        } catch (JsonProcessingException e) {
            log.warnf("명령 회신 직렬화 실패 key=%s: %s", reply.key(), e.getMessage());
        }
    }
}
