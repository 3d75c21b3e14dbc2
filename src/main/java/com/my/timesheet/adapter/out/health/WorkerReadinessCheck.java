package com.my.timesheet.adapter.out.health;

import com.my.timesheet.config.AppConfig;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import javax.sql.DataSource;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;

@Readiness
@ApplicationScoped
public class WorkerReadinessCheck implements HealthCheck {

    private final AppConfig appConfig;
    private final DataSource dataSource;

    public WorkerReadinessCheck(AppConfig appConfig, DataSource dataSource) {
        this.appConfig = appConfig;
        this.dataSource = dataSource;
    }

    @Override
    public HealthCheckResponse call() {
        Path database = Path.of(appConfig.database().path());
        boolean databaseExists = Files.exists(database);
        boolean connectionOk = canConnect();
        return HealthCheckResponse.named("worker-readiness")
                .withData("databasePath", database.toString())
                .withData("databaseExists", databaseExists)
                .withData("connectionOk", connectionOk)
                .status(databaseExists && connectionOk)
                .build();
    }

    private boolean canConnect() {
        try (Connection conn = dataSource.getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            return false;
        }
    }
}
