package com.my.jamla.domain.service;

import com.my.jamla.adapter.out.persistence.SqliteSubscriptionStore;
import com.my.jamla.adapter.out.render.HtmlMessageRenderer;
import com.my.jamla.domain.model.Channel;
import com.my.jamla.domain.model.ChannelHandle;
import com.my.jamla.domain.model.DeliveryMode;
import com.my.jamla.domain.model.DeliveryPolicy;
import com.my.jamla.domain.model.DigestPolicy;
import com.my.jamla.support.FakeTransport;
import com.my.jamla.support.MutableClock;
import com.my.jamla.support.RecordingSleeper;
import com.my.jamla.support.TestStores;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.OffsetDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class DigestServiceTest {

    private static final OffsetDateTime NINE = OffsetDateTime.parse("2026-03-01T09:00:00+05:00");

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private SqliteSubscriptionStore store;
    private FakeTransport transport;
    private DigestService service;
    private Channel news;
    private Channel sport;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NINE.minusHours(2));
        store = TestStores.sqlite(tempDir, clock);
        transport = new FakeTransport();
        DigestPolicy policy = DigestPolicy.defaults();
        NotificationSender sender = new NotificationSender(transport, new RecordingSleeper(),
                new DeliveryPolicy(1, Duration.ZERO));
        service = new DigestService(store, new DigestComposer(policy), sender, new HtmlMessageRenderer(), clock, policy);
        news = store.resolveOrCreateChannel(new ChannelHandle("news"), -100L, "News");
        sport = store.resolveOrCreateChannel(new ChannelHandle("sport"), -200L, "Sport");
    }

    @Test
    void scheduledDigestGroupsPostsAndMarksThemSent() {
        digestUser(1L, news, sport);
        for (long i = 1; i <= 6; i++) {
            post(news, i, "news " + i);
        }
        post(sport, 1L, "sport 1");
        post(sport, 2L, "sport 2");
        clock.set(NINE);

        DigestService.TickSummary summary = service.runTick(NINE);

        assertThat(summary.dueUsers()).isEqualTo(1);
        assertThat(summary.delivered()).isEqualTo(1);
        assertThat(transport.sentTo(1L)).hasSize(1);
        String text = transport.sentTo(1L).get(0).text();
        assertThat(text).startsWith("📰 <b>Digest for the last 24 hours</b>");
        assertThat(text).contains("📢 <b>News</b> (6 posts)", "📢 <b>Sport</b> (2 posts)", "+1 more");
        assertThat(text).contains("news 6").doesNotContain("news 1\n");
        assertThat(text.indexOf("Sport")).isLessThan(text.indexOf("News"));
        assertThat(store.unsentPostsForUser(1L, Duration.ofHours(24))).isEmpty();

        assertThat(service.manualDigest(1L)).isFalse();
        assertThat(transport.sentTo(1L)).hasSize(2);
        assertThat(transport.sentTo(1L).get(1).text()).isEqualTo("📭 No new posts in the last 24 hours.");
    }

    @Test
    void scheduledDigestWithoutPostsSendsNothing() {
        digestUser(1L, news);
        clock.set(NINE);

        DigestService.TickSummary summary = service.runTick(NINE);

        assertThat(summary.dueUsers()).isEqualTo(1);
        assertThat(summary.delivered()).isZero();
        assertThat(transport.sent()).isEmpty();
    }

    @Test
    void usersWithOtherTimesAreNotDue() {
        digestUser(1L, news);
        post(news, 1L, "hello");
        OffsetDateTime oneMinuteLater = NINE.plusMinutes(1);
        clock.set(oneMinuteLater);

        DigestService.TickSummary summary = service.runTick(oneMinuteLater);

        assertThat(summary.dueUsers()).isZero();
        assertThat(transport.sent()).isEmpty();
    }

    @Test
    void oneFailingRecipientDoesNotStopOthers() {
        digestUser(1L, news);
        digestUser(2L, news);
        post(news, 1L, "hello");
        transport.failFor(1L);
        clock.set(NINE);

        DigestService.TickSummary summary = service.runTick(NINE);

        assertThat(summary.delivered()).isEqualTo(1);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(transport.sentTo(2L)).hasSize(1);
    }

    @Test
    void failedDeliveryLeavesPostsUnsent() {
        digestUser(1L, news);
        post(news, 1L, "hello");
        transport.failFor(1L);
        clock.set(NINE);

        service.runTick(NINE);

        assertThat(store.unsentPostsForUser(1L, Duration.ofHours(24))).hasSize(1);
    }

    @Test
    void manualDigestWorksInAnyMode() {
        store.getOrCreateUser(3L);
        store.addSubscription(3L, news.id());
        post(news, 1L, "realtime user asks for digest");

        assertThat(service.manualDigest(3L)).isTrue();
        assertThat(transport.sentTo(3L)).hasSize(1);
        assertThat(store.unsentPostsForUser(3L, Duration.ofHours(24))).isEmpty();
    }

    @Test
    void purgesOldPostsAtMidnight() {
        post(news, 1L, "old");
        OffsetDateTime midnight = OffsetDateTime.parse("2026-03-09T00:00:00+05:00");
        clock.set(midnight);

        DigestService.TickSummary notMidnight = service.runTick(midnight.plusMinutes(1));
        DigestService.TickSummary atMidnight = service.runTick(midnight);

        assertThat(notMidnight.purged()).isZero();
        assertThat(atMidnight.purged()).isEqualTo(1);
    }

    @Test
    void tickUsesClock() {
        clock.set(NINE.plusMinutes(15));

        assertThat(service.tick().time().format()).isEqualTo("09:15");
    }

    @Test
    void digestOverMessageLimitIsStillAttempted() {
        digestUser(5L);
        String longText = "x".repeat(300);
        for (int i = 0; i < 20; i++) {
            Channel channel = store.resolveOrCreateChannel(new ChannelHandle("channel_" + i), -1000L - i, "Channel " + i);
            store.addSubscription(5L, channel.id());
            for (long messageId = 1; messageId <= 5; messageId++) {
                post(channel, messageId, longText);
            }
        }

        assertThat(service.manualDigest(5L)).isTrue();

        String text = transport.sentTo(5L).get(0).text();
        assertThat(text.length()).isGreaterThan(DigestService.MESSAGE_LIMIT);
        assertThat(DigestService.exceedsMessageLimit(text)).isTrue();
        assertThat(DigestService.exceedsMessageLimit("x".repeat(DigestService.MESSAGE_LIMIT))).isFalse();
    }

    private void digestUser(long userId, Channel... channels) {
        store.getOrCreateUser(userId);
        store.updateMode(userId, DeliveryMode.DIGEST);
        store.updateLanguage(userId, "en");
        for (Channel channel : channels) {
            store.addSubscription(userId, channel.id());
        }
    }

    private void post(Channel channel, long messageId, String text) {
        clock.advance(Duration.ofMinutes(1));
        store.recordPost(channel.id(), messageId, text);
    }
}
