package com.my.jamla.domain.port.out;

import com.my.jamla.domain.model.ChannelHandle;
import com.my.jamla.domain.model.DeliveryResult;
import com.my.jamla.domain.model.MessageRef;
import com.my.jamla.domain.model.ResolveResult;

/**
 * 채팅 플랫폼 전송 계층. 구현은 예외 대신 결과 값으로 실패를 알려야 한다.
 */
public interface ChannelTransportPort {

    ResolveResult resolveChannel(ChannelHandle handle);

    DeliveryResult notify(long userId, String text);

    DeliveryResult forward(long userId, MessageRef messageRef);
}
