package com.my.jamla.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@ApplicationScoped
public class PersistenceConfig {

    @Produces
    @ApplicationScoped
    public DataSource subscriptionDataSource(AppConfig appConfig) {
        Path sqlitePath = Path.of(appConfig.store().sqlitePath());
        try {
            Path parent = sqlitePath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new IllegalStateException("SQLite 경로 생성 실패", e);
        }
        return sqliteDataSource(sqlitePath, appConfig.store().busyTimeoutMs());
    }

    /**
     * 동시 쓰기가 즉시 실패하지 않도록 WAL 모드와 busy timeout을 켠 데이터소스를 만든다.
     * 트랜잭션은 시작 시점에 쓰기 락을 잡는다.
     */
    public static SQLiteDataSource sqliteDataSource(Path sqlitePath, int busyTimeoutMs) {
        SQLiteConfig config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setBusyTimeout(busyTimeoutMs);
        config.enforceForeignKeys(true);
        config.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + sqlitePath.toAbsolutePath());
        return dataSource;
    }
}
