package com.my.jamla.support;

import com.my.jamla.domain.model.ChannelHandle;
import com.my.jamla.domain.model.ChannelInfo;
import com.my.jamla.domain.model.DeliveryResult;
import com.my.jamla.domain.model.MessageRef;
import com.my.jamla.domain.model.ResolveResult;
import com.my.jamla.domain.port.out.ChannelTransportPort;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 결정적인 전송 계층 대역. 등록된 채널만 해석되고, 보낸 내용은 모두 기록된다.
 * 사용자별로 실패를 지정하거나 응답 순서를 미리 정해 둘 수 있다.
 */
public class FakeTransport implements ChannelTransportPort {

    public record Sent(long userId, String text) {
    }

    public record Forwarded(long userId, MessageRef ref) {
    }

    private final Map<String, ChannelInfo> channels = new ConcurrentHashMap<>();
    private final Deque<ResolveResult> scriptedResolves = new ArrayDeque<>();
    private final Deque<DeliveryResult> scriptedNotifies = new ArrayDeque<>();
    private final Set<Long> failingUsers = ConcurrentHashMap.newKeySet();
    private final Set<Long> throwingUsers = ConcurrentHashMap.newKeySet();
    private final List<Sent> sent = new CopyOnWriteArrayList<>();
    private final List<Forwarded> forwarded = new CopyOnWriteArrayList<>();
    private final AtomicInteger resolveCalls = new AtomicInteger();

    public FakeTransport withChannel(String handle, long externalId, String title) {
        channels.put(handle, new ChannelInfo(new ChannelHandle(handle), externalId, title));
        return this;
    }

    public FakeTransport thenResolve(ResolveResult result) {
        synchronized (scriptedResolves) {
            scriptedResolves.add(result);
        }
        return this;
    }

    public FakeTransport thenNotify(DeliveryResult result) {
        synchronized (scriptedNotifies) {
            scriptedNotifies.add(result);
        }
        return this;
    }

    public FakeTransport failFor(long userId) {
        failingUsers.add(userId);
        return this;
    }

    public FakeTransport throwFor(long userId) {
        throwingUsers.add(userId);
        return this;
    }

    @Override
    public ResolveResult resolveChannel(ChannelHandle handle) {
        resolveCalls.incrementAndGet();
        synchronized (scriptedResolves) {
            if (!scriptedResolves.isEmpty()) {
                return scriptedResolves.poll();
            }
        }
        ChannelInfo info = channels.get(handle.value());
        return info == null ? ResolveResult.notFound() : ResolveResult.found(info);
    }

    @Override
    public DeliveryResult notify(long userId, String text) {
        if (throwingUsers.contains(userId)) {
            throw new IllegalStateException("transport exploded for " + userId);
        }
        if (failingUsers.contains(userId)) {
            return DeliveryResult.failed("blocked");
        }
        synchronized (scriptedNotifies) {
            if (!scriptedNotifies.isEmpty()) {
                DeliveryResult scripted = scriptedNotifies.poll();
                if (scripted.isOk()) {
                    sent.add(new Sent(userId, text));
                }
                return scripted;
            }
        }
        sent.add(new Sent(userId, text));
        return DeliveryResult.ok();
    }

    @Override
    public DeliveryResult forward(long userId, MessageRef messageRef) {
        if (throwingUsers.contains(userId)) {
            throw new IllegalStateException("transport exploded for " + userId);
        }
        if (failingUsers.contains(userId)) {
            return DeliveryResult.failed("blocked");
        }
        forwarded.add(new Forwarded(userId, messageRef));
        return DeliveryResult.ok();
    }

    public List<Sent> sent() {
        return List.copyOf(sent);
    }

    public List<Sent> sentTo(long userId) {
        return sent.stream().filter(s -> s.userId() == userId).toList();
    }

    public List<Forwarded> forwarded() {
        return List.copyOf(forwarded);
    }

    public int resolveCalls() {
        return resolveCalls.get();
    }
}
