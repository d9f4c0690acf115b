package com.my.jamla.adapter.out.persistence;

import com.my.jamla.config.AppConfig;
import com.my.jamla.domain.exception.StoreUnavailableException;
import com.my.jamla.domain.model.AddSubscriptionOutcome;
import com.my.jamla.domain.model.Channel;
import com.my.jamla.domain.model.ChannelHandle;
import com.my.jamla.domain.model.DeliveryMode;
import com.my.jamla.domain.model.DigestTime;
import com.my.jamla.domain.model.PendingPost;
import com.my.jamla.domain.model.PostRecordOutcome;
import com.my.jamla.domain.model.RemoveSubscriptionOutcome;
import com.my.jamla.domain.model.Subscriber;
import com.my.jamla.domain.port.out.ClockPort;
import com.my.jamla.domain.port.out.SubscriptionStorePort;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 파일 기반 SQLite 구독 저장소.
 * 중복 삽입은 {@code INSERT OR IGNORE}의 영향 행 수로 판별해 한 문장 안에서 원자적으로 처리한다.
 */
@ApplicationScoped
public class SqliteSubscriptionStore implements SubscriptionStorePort {

    private static final Logger log = Logger.getLogger(SqliteSubscriptionStore.class);

    private static final List<String> SCHEMA = List.of(
            """
            CREATE TABLE IF NOT EXISTS users (
                user_id INTEGER PRIMARY KEY,
                mode TEXT NOT NULL DEFAULT 'realtime',
                digest_time TEXT NOT NULL DEFAULT '09:00',
                language TEXT NOT NULL,
                created_at INTEGER NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS channels (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                handle TEXT NOT NULL UNIQUE,
                external_id INTEGER,
                title TEXT NOT NULL DEFAULT ''
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS subscriptions (
                user_id INTEGER NOT NULL REFERENCES users(user_id),
                channel_id INTEGER NOT NULL REFERENCES channels(id),
                created_at INTEGER NOT NULL,
                PRIMARY KEY (user_id, channel_id)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS posts (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                channel_id INTEGER NOT NULL REFERENCES channels(id),
                external_message_id INTEGER NOT NULL,
                text TEXT NOT NULL,
                created_at INTEGER NOT NULL,
                sent INTEGER NOT NULL DEFAULT 0,
                UNIQUE (channel_id, external_message_id)
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_channels_external ON channels(external_id)",
            "CREATE INDEX IF NOT EXISTS idx_subscriptions_channel ON subscriptions(channel_id)",
            "CREATE INDEX IF NOT EXISTS idx_posts_created ON posts(created_at)",
            "CREATE INDEX IF NOT EXISTS idx_posts_sent ON posts(sent)",
            "CREATE INDEX IF NOT EXISTS idx_users_digest ON users(mode, digest_time)"
    );

    private static final String USER_COLUMNS = "u.user_id, u.mode, u.digest_time, u.language, u.created_at";
    private static final String CHANNEL_COLUMNS = "c.id, c.external_id, c.handle, c.title";

    private static final String INSERT_USER_SQL =
            "INSERT OR IGNORE INTO users(user_id, language, created_at) VALUES (?, ?, ?)";
    private static final String SELECT_USER_SQL =
            "SELECT " + USER_COLUMNS + " FROM users u WHERE u.user_id = ?";
    private static final String UPDATE_MODE_SQL = "UPDATE users SET mode = ? WHERE user_id = ?";
    private static final String UPDATE_DIGEST_TIME_SQL = "UPDATE users SET digest_time = ? WHERE user_id = ?";
    private static final String UPDATE_LANGUAGE_SQL = "UPDATE users SET language = ? WHERE user_id = ?";
    private static final String SELECT_DIGEST_USERS_SQL =
            "SELECT " + USER_COLUMNS + " FROM users u WHERE u.mode = ? AND u.digest_time = ? ORDER BY u.user_id";

    private static final String UPSERT_CHANNEL_SQL = """
            INSERT INTO channels(handle, external_id, title) VALUES (?, ?, ?)
            ON CONFLICT(handle) DO UPDATE SET external_id = excluded.external_id, title = excluded.title
            """;
    private static final String SELECT_CHANNEL_BY_HANDLE_SQL =
            "SELECT " + CHANNEL_COLUMNS + " FROM channels c WHERE c.handle = ?";
    private static final String SELECT_CHANNEL_BY_EXTERNAL_SQL =
            "SELECT " + CHANNEL_COLUMNS + " FROM channels c WHERE c.external_id = ? ORDER BY c.id LIMIT 1";
    private static final String UPDATE_CHANNEL_SQL = "UPDATE channels SET handle = ?, title = ? WHERE id = ?";
    private static final String RELEASE_HANDLE_SQL = "UPDATE channels SET handle = ? WHERE id = ?";

    private static final String SELECT_SUBSCRIPTION_SQL =
            "SELECT 1 FROM subscriptions WHERE user_id = ? AND channel_id = ?";
    private static final String INSERT_SUBSCRIPTION_SQL =
            "INSERT OR IGNORE INTO subscriptions(user_id, channel_id, created_at) VALUES (?, ?, ?)";
    private static final String DELETE_SUBSCRIPTION_SQL =
            "DELETE FROM subscriptions WHERE user_id = ? AND channel_id = ?";
    private static final String COUNT_SUBSCRIBERS_SQL =
            "SELECT COUNT(*) FROM subscriptions WHERE channel_id = ?";
    private static final String SELECT_WATCHED_SQL = "SELECT DISTINCT " + CHANNEL_COLUMNS
            + " FROM channels c INNER JOIN subscriptions s ON s.channel_id = c.id ORDER BY c.id";
    private static final String SELECT_SUBSCRIBERS_SQL = "SELECT " + USER_COLUMNS
            + " FROM users u INNER JOIN subscriptions s ON s.user_id = u.user_id"
            + " WHERE s.channel_id = ? ORDER BY s.created_at, u.user_id";
    private static final String SELECT_USER_CHANNELS_SQL = "SELECT " + CHANNEL_COLUMNS
            + " FROM channels c INNER JOIN subscriptions s ON s.channel_id = c.id"
            + " WHERE s.user_id = ? ORDER BY c.title COLLATE NOCASE, c.handle";

    private static final String INSERT_POST_SQL =
            "INSERT OR IGNORE INTO posts(channel_id, external_message_id, text, created_at) VALUES (?, ?, ?, ?)";
    private static final String SELECT_UNSENT_SQL = """
            SELECT p.id, p.channel_id, c.title, c.handle, p.external_message_id, p.text, p.created_at
            FROM posts p
            INNER JOIN channels c ON c.id = p.channel_id
            INNER JOIN subscriptions s ON s.channel_id = c.id
            WHERE s.user_id = ? AND p.created_at > ? AND p.sent = 0
            ORDER BY p.created_at DESC, p.id DESC
            """;
    private static final String MARK_SENT_SQL = "UPDATE posts SET sent = 1 WHERE id IN (%s)";
    private static final String PURGE_SQL = "DELETE FROM posts WHERE created_at < ?";

    private final DataSource dataSource;
    private final ClockPort clockPort;
    private final String defaultLanguage;

    @Inject
    public SqliteSubscriptionStore(DataSource dataSource, AppConfig appConfig, ClockPort clockPort) {
        this.dataSource = dataSource;
        this.clockPort = clockPort;
        this.defaultLanguage = appConfig.users().defaultLanguage();
    }

    @PostConstruct
    public void initSchema() {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            for (String ddl : SCHEMA) {
                stmt.execute(ddl);
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("구독 저장소 스키마 초기화 실패", e);
        }
        log.debug("구독 저장소 스키마를 확인했습니다.");
    }

    public boolean isReachable() {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            return stmt.executeQuery("SELECT 1").next();
        } catch (SQLException e) {
            log.warnf("구독 저장소 연결 확인 실패: %s", e.getMessage());
            return false;
        }
    }

    @Override
    public Subscriber getOrCreateUser(long userId) {
        try (Connection conn = dataSource.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(INSERT_USER_SQL)) {
                ps.setLong(1, userId);
                ps.setString(2, defaultLanguage);
                ps.setLong(3, nowMillis());
                if (ps.executeUpdate() > 0) {
                    log.infof("새 사용자를 등록했습니다: %d", userId);
                }
            }
            return selectUser(conn, userId)
                    .orElseThrow(() -> new IllegalStateException("사용자 생성 직후 조회 실패: " + userId));
        } catch (SQLException e) {
            throw new StoreUnavailableException("사용자 조회/생성 실패", e);
        }
    }

    @Override
    public Optional<Subscriber> findUser(long userId) {
        try (Connection conn = dataSource.getConnection()) {
            return selectUser(conn, userId);
        } catch (SQLException e) {
            throw new StoreUnavailableException("사용자 조회 실패", e);
        }
    }

    @Override
    public void updateMode(long userId, DeliveryMode mode) {
        updateUserColumn(UPDATE_MODE_SQL, mode.code(), userId);
    }

    @Override
    public void updateDigestTime(long userId, DigestTime digestTime) {
        updateUserColumn(UPDATE_DIGEST_TIME_SQL, digestTime.format(), userId);
    }

    @Override
    public void updateLanguage(long userId, String language) {
        updateUserColumn(UPDATE_LANGUAGE_SQL, language, userId);
    }

    @Override
    public List<Subscriber> findDigestUsersAt(DigestTime digestTime) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(SELECT_DIGEST_USERS_SQL)) {
            ps.setString(1, DeliveryMode.DIGEST.code());
            ps.setString(2, digestTime.format());
            return readUsers(ps);
        } catch (SQLException e) {
            throw new StoreUnavailableException("다이제스트 대상 사용자 조회 실패", e);
        }
    }

    /**
     * 외부 채널 ID당 행을 하나로 유지한다.
     * 같은 외부 ID의 행이 이미 있으면 핸들과 제목만 갱신하고, 새 핸들을 점유한 다른 채널 행은
     * 핸들을 {@code _<행 ID>}로 비워 둔다 (구독은 외부 ID로 계속 라우팅된다).
     */
    @Override
    public Channel resolveOrCreateChannel(ChannelHandle handle, long externalId, String title) {
        String safeTitle = title == null ? "" : title;
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                Optional<Channel> byExternal = selectChannelByExternalId(conn, externalId);
                if (byExternal.isPresent()) {
                    Channel existing = byExternal.get();
                    Optional<Channel> byHandle = selectChannelByHandle(conn, handle);
                    if (byHandle.isPresent() && byHandle.get().id() != existing.id()) {
                        releaseHandle(conn, byHandle.get());
                    }
                    try (PreparedStatement ps = conn.prepareStatement(UPDATE_CHANNEL_SQL)) {
                        ps.setString(1, handle.value());
                        ps.setString(2, safeTitle);
                        ps.setLong(3, existing.id());
                        ps.executeUpdate();
                    }
                    if (!existing.handle().equals(handle)) {
                        log.infof("채널 핸들 변경 감지: %s -> %s (external=%d)", existing.handle(), handle, externalId);
                    }
                } else {
                    try (PreparedStatement ps = conn.prepareStatement(UPSERT_CHANNEL_SQL)) {
                        ps.setString(1, handle.value());
                        ps.setLong(2, externalId);
                        ps.setString(3, safeTitle);
                        ps.executeUpdate();
                    }
                }
                Channel channel = selectChannelByHandle(conn, handle)
                        .orElseThrow(() -> new IllegalStateException("채널 upsert 직후 조회 실패: " + handle));
                conn.commit();
                return channel;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("채널 등록 실패", e);
        }
    }

    @Override
    public Optional<Channel> findChannelByHandle(ChannelHandle handle) {
        try (Connection conn = dataSource.getConnection()) {
            return selectChannelByHandle(conn, handle);
        } catch (SQLException e) {
            throw new StoreUnavailableException("채널 조회 실패", e);
        }
    }

    @Override
    public Optional<Channel> findChannelByExternalId(long externalId) {
        try (Connection conn = dataSource.getConnection()) {
            return selectChannelByExternalId(conn, externalId);
        } catch (SQLException e) {
            throw new StoreUnavailableException("채널 조회 실패", e);
        }
    }

    @Override
    public boolean hasSubscription(long userId, long channelId) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(SELECT_SUBSCRIPTION_SQL)) {
            ps.setLong(1, userId);
            ps.setLong(2, channelId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("구독 조회 실패", e);
        }
    }

    @Override
    public AddSubscriptionOutcome addSubscription(long userId, long channelId) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(INSERT_SUBSCRIPTION_SQL)) {
            ps.setLong(1, userId);
            ps.setLong(2, channelId);
            ps.setLong(3, nowMillis());
            return ps.executeUpdate() > 0 ? AddSubscriptionOutcome.ADDED : AddSubscriptionOutcome.ALREADY_EXISTS;
        } catch (SQLException e) {
            throw new StoreUnavailableException("구독 추가 실패", e);
        }
    }

    @Override
    public RemoveSubscriptionOutcome removeSubscription(long userId, long channelId) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(DELETE_SUBSCRIPTION_SQL)) {
            ps.setLong(1, userId);
            ps.setLong(2, channelId);
            return ps.executeUpdate() > 0 ? RemoveSubscriptionOutcome.REMOVED : RemoveSubscriptionOutcome.NOT_FOUND;
        } catch (SQLException e) {
            throw new StoreUnavailableException("구독 해제 실패", e);
        }
    }

    @Override
    public int countSubscribers(long channelId) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(COUNT_SUBSCRIBERS_SQL)) {
            ps.setLong(1, channelId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("구독자 수 조회 실패", e);
        }
    }

    @Override
    public List<Channel> listWatchedChannels() {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(SELECT_WATCHED_SQL)) {
            return readChannels(ps);
        } catch (SQLException e) {
            throw new StoreUnavailableException("감시 채널 목록 조회 실패", e);
        }
    }

    @Override
    public List<Subscriber> listSubscribers(long channelId) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(SELECT_SUBSCRIBERS_SQL)) {
            ps.setLong(1, channelId);
            return readUsers(ps);
        } catch (SQLException e) {
            throw new StoreUnavailableException("채널 구독자 조회 실패", e);
        }
    }

    @Override
    public List<Channel> listSubscriptions(long userId) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(SELECT_USER_CHANNELS_SQL)) {
            ps.setLong(1, userId);
            return readChannels(ps);
        } catch (SQLException e) {
            throw new StoreUnavailableException("사용자 구독 목록 조회 실패", e);
        }
    }

    @Override
    public PostRecordOutcome recordPost(long channelId, long externalMessageId, String text) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(INSERT_POST_SQL)) {
            ps.setLong(1, channelId);
            ps.setLong(2, externalMessageId);
            ps.setString(3, text == null ? "" : text);
            ps.setLong(4, nowMillis());
            return ps.executeUpdate() > 0 ? PostRecordOutcome.RECORDED : PostRecordOutcome.DUPLICATE_IGNORED;
        } catch (SQLException e) {
            throw new StoreUnavailableException("게시물 저장 실패", e);
        }
    }

    @Override
    public List<PendingPost> unsentPostsForUser(long userId, Duration lookback) {
        long cutoff = nowMillis() - lookback.toMillis();
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(SELECT_UNSENT_SQL)) {
            ps.setLong(1, userId);
            ps.setLong(2, cutoff);
            List<PendingPost> posts = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    posts.add(new PendingPost(
                            rs.getLong(1),
                            rs.getLong(2),
                            rs.getString(3),
                            new ChannelHandle(rs.getString(4)),
                            rs.getLong(5),
                            rs.getString(6),
                            Instant.ofEpochMilli(rs.getLong(7))));
                }
            }
            return posts;
        } catch (SQLException e) {
            throw new StoreUnavailableException("미발송 게시물 조회 실패", e);
        }
    }

    @Override
    public void markSent(Collection<Long> postIds) {
        if (postIds == null || postIds.isEmpty()) {
            return;
        }
        String placeholders = String.join(",", Collections.nCopies(postIds.size(), "?"));
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(String.format(MARK_SENT_SQL, placeholders))) {
            int index = 1;
            for (Long postId : postIds) {
                ps.setLong(index++, postId);
            }
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreUnavailableException("게시물 발송 표시 실패", e);
        }
    }

    @Override
    public int purgeOlderThan(Duration retention) {
        long cutoff = nowMillis() - retention.toMillis();
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(PURGE_SQL)) {
            ps.setLong(1, cutoff);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreUnavailableException("오래된 게시물 정리 실패", e);
        }
    }

    private void updateUserColumn(String sql, String value, long userId) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, value);
            ps.setLong(2, userId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreUnavailableException("사용자 설정 변경 실패", e);
        }
    }

    private Optional<Subscriber> selectUser(Connection conn, long userId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SELECT_USER_SQL)) {
            ps.setLong(1, userId);
            return readUsers(ps).stream().findFirst();
        }
    }

    private Optional<Channel> selectChannelByHandle(Connection conn, ChannelHandle handle) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SELECT_CHANNEL_BY_HANDLE_SQL)) {
            ps.setString(1, handle.value());
            return readChannels(ps).stream().findFirst();
        }
    }

    private Optional<Channel> selectChannelByExternalId(Connection conn, long externalId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SELECT_CHANNEL_BY_EXTERNAL_SQL)) {
            ps.setLong(1, externalId);
            return readChannels(ps).stream().findFirst();
        }
    }

    private void releaseHandle(Connection conn, Channel stale) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(RELEASE_HANDLE_SQL)) {
            ps.setString(1, "_" + stale.id());
            ps.setLong(2, stale.id());
            ps.executeUpdate();
        }
        log.warnf("핸들 %s 가 다른 채널로 넘어가 기존 행 %d 의 핸들을 비웁니다 (external=%d)",
                stale.handle(), stale.id(), stale.externalId());
    }

    private List<Subscriber> readUsers(PreparedStatement ps) throws SQLException {
        List<Subscriber> users = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                users.add(new Subscriber(
                        rs.getLong(1),
                        DeliveryMode.fromCode(rs.getString(2)),
                        DigestTime.parse(rs.getString(3)),
                        rs.getString(4),
                        Instant.ofEpochMilli(rs.getLong(5))));
            }
        }
        return users;
    }

    private List<Channel> readChannels(PreparedStatement ps) throws SQLException {
        List<Channel> channels = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                channels.add(new Channel(
                        rs.getLong(1),
                        rs.getLong(2),
                        new ChannelHandle(rs.getString(3)),
                        rs.getString(4)));
            }
        }
        return channels;
    }

    private long nowMillis() {
        return clockPort.now().toInstant().toEpochMilli();
    }
}
