package com.my.timesheet.config;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.Optional;

@StaticInitSafe
@ConfigMapping(prefix = "app")
public interface AppConfig {

    OpenAiConfig openai();

    TimesheetsConfig timesheets();

    DatabaseConfig database();

    IdempotencyConfig idempotency();

    interface OpenAiConfig {
        @WithName("api-key")
        Optional<String> apiKey();

        @WithDefault("gpt-4o-mini")
        String model();

        @WithDefault("0.0")
        double temperature();
    }

    interface TimesheetsConfig {
        @WithName("daily-hour-cap")
        @WithDefault("12")
        double dailyHourCap();

        @WithName("break-required-after-hours")
        @WithDefault("6")
        double breakRequiredAfterHours();

        @WithName("break-min-minutes")
        @WithDefault("30")
        int breakMinMinutes();

        @WithName("enforce-breaks")
        @WithDefault("false")
        boolean enforceBreaks();

        @WithName("default-timezone")
        @WithDefault("UTC")
        String defaultTimezone();

        @WithName("week-start")
        @WithDefault("monday")
        String weekStart();
    }

    interface DatabaseConfig {
        @WithName("path")
        @WithDefault("./data/timesheets.db")
        String path();
    }

    interface IdempotencyConfig {
        @WithName("backend")
        @WithDefault("sqlite")
        String backend();

        @WithName("ttl-hours")
        @WithDefault("24")
        int ttlHours();
    }
}
