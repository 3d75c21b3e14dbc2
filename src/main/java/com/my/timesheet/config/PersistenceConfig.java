package com.my.timesheet.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 왜: 단일 프로세스 워커에서 SQLite 파일 하나를 저장소/멱등성 기록이 함께 쓰도록 DataSource를 한 곳에서 만든다.
 */
@ApplicationScoped
public class PersistenceConfig {

    @Produces
    @ApplicationScoped
    public DataSource dataSource(AppConfig appConfig) {
        Path path = Path.of(appConfig.database().path());
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new IllegalStateException("SQLite 경로 생성 실패: " + path, e);
        }
        SQLiteConfig config = new SQLiteConfig();
        config.enforceForeignKeys(true);
        config.setBusyTimeout(5000);
        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + path);
        return dataSource;
    }
}
