package com.my.timesheet.config;

import io.quarkus.runtime.LaunchMode;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.DateTimeException;
import java.time.ZoneId;

@Startup
@ApplicationScoped
public class ConfigValidator {

    private static final Logger log = Logger.getLogger(ConfigValidator.class);

    private final AppConfig appConfig;

    public ConfigValidator(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    @PostConstruct
    void validate() {
        boolean isProd = LaunchMode.current() == LaunchMode.NORMAL;
        AppConfig.TimesheetsConfig timesheets = appConfig.timesheets();
        validateRequired("OPENAI_API_KEY", appConfig.openai().apiKey().orElse(null), isProd);
        validatePositive("DAILY_HOUR_CAP", timesheets.dailyHourCap(), isProd);
        validatePositive("BREAK_REQUIRED_AFTER_HOURS", timesheets.breakRequiredAfterHours(), isProd);
        validatePositive("BREAK_MIN_MINUTES", timesheets.breakMinMinutes(), isProd);
        validateZone("DEFAULT_TIMEZONE", timesheets.defaultTimezone(), isProd);
    }

    private void validateRequired(String name, String value, boolean strict) {
        if (value == null || value.isBlank()) {
            fail("필수 설정이 비어 있습니다: " + name, strict);
        }
    }

    private void validatePositive(String name, double value, boolean strict) {
        if (value <= 0) {
            fail("양수여야 하는 설정입니다: " + name + "=" + value, strict);
        }
    }

    private void validateZone(String name, String zone, boolean strict) {
        try {
            ZoneId.of(zone);
        } catch (DateTimeException e) {
            fail("알 수 없는 시간대입니다: " + name + "=" + zone, strict);
        }
    }

    private void fail(String message, boolean strict) {
        if (strict) {
            throw new IllegalStateException(message);
        }
        log.warn(message);
    }
}
