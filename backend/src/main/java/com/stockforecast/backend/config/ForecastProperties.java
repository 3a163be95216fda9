package com.stockforecast.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "forecast")
@Data
public class ForecastProperties {

    /** Trailing prices fed to a model for one inference. */
    private int windowLength = 60;
    private String modelVersion = "v4_log";

    private Artifacts artifacts = new Artifacts();
    private Cache cache = new Cache();
    private Batch batch = new Batch();
    private Executor executor = new Executor();
    /** Sector name to member symbols, used for coverage reporting. */
    private Map<String, List<String>> sectors = new LinkedHashMap<>();

    @Data
    public static class Artifacts {
        private String specificDir = "trained_models/stock_specific_v4_log";
        private String generalDir = "trained_models/general_v4_log";
    }

    @Data
    public static class Cache {
        private int capacity = 20;
    }

    @Data
    public static class Batch {
        private int maxConcurrency = 4;
        private int maxConcurrencyLimit = 16;
        private int maxSymbols = 100;
    }

    @Data
    public static class Executor {
        private int corePoolSize = 4;
        private int maxPoolSize = 16;
        private int queueCapacity = 500;
        private int awaitTerminationSeconds = 30;
    }
}
