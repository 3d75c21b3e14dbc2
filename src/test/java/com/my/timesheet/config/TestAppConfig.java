package com.my.timesheet.config;

import java.util.Optional;

public class TestAppConfig implements AppConfig {

    private final String databasePath;
    private final String backend;
    private final boolean enforceBreaks;

    public TestAppConfig(String databasePath, String backend, boolean enforceBreaks) {
        this.databasePath = databasePath;
        this.backend = backend;
        this.enforceBreaks = enforceBreaks;
    }

    public TestAppConfig() {
        this("./data/timesheets.db", "memory", false);
    }

    @Override
    public OpenAiConfig openai() {
        return new OpenAiConfig() {
            @Override
            public Optional<String> apiKey() {
                return Optional.empty();
            }

            @Override
            public String model() {
                return "gpt-4o-mini";
            }

            @Override
            public double temperature() {
                return 0.0;
            }
        };
    }

    @Override
    public TimesheetsConfig timesheets() {
        return new TimesheetsConfig() {
            @Override
            public double dailyHourCap() {
                return 12;
            }

            @Override
            public double breakRequiredAfterHours() {
                return 6;
            }

            @Override
            public int breakMinMinutes() {
                return 30;
            }

            @Override
            public boolean enforceBreaks() {
                return enforceBreaks;
            }

            @Override
            public String defaultTimezone() {
                return "UTC";
            }

            @Override
            public String weekStart() {
                return "monday";
            }
        };
    }

    @Override
    public DatabaseConfig database() {
        return () -> databasePath;
    }

    @Override
    public IdempotencyConfig idempotency() {
        return new IdempotencyConfig() {
            @Override
            public String backend() {
                return backend;
            }

            @Override
            public int ttlHours() {
                return 1;
            }
        };
    }
}
