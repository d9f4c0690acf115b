package com.my.jamla.domain.port.in;

import com.my.jamla.domain.model.Channel;
import com.my.jamla.domain.model.SubscribeResult;
import com.my.jamla.domain.model.UnsubscribeResult;

import java.util.List;

public interface SubscriptionUseCase {

    SubscribeResult subscribe(long userId, String handle);

    UnsubscribeResult unsubscribe(long userId, String handle);

    List<Channel> listSubscriptions(long userId);
}
