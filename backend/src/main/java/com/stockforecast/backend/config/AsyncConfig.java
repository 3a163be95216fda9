package com.stockforecast.backend.config;

import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;

@Configuration
public class AsyncConfig {

    @Bean(name = "predictionExecutor")
    public Executor predictionExecutor(ForecastProperties properties) {
        ForecastProperties.Executor settings = properties.getExecutor();
        int processors = Runtime.getRuntime().availableProcessors();
        int corePoolSize = Math.max(settings.getCorePoolSize(), 1);
        int maxPoolSize = Math.max(settings.getMaxPoolSize(), Math.max(corePoolSize, processors));

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(settings.getQueueCapacity());
        executor.setThreadNamePrefix("prediction-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(settings.getAwaitTerminationSeconds());
        executor.setTaskDecorator(AsyncConfig::withCallerMdc);
        executor.initialize();
        return executor;
    }

    // batch items log under the request and correlation ids of the call that submitted them
    static Runnable withCallerMdc(Runnable task) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return () -> {
            if (context != null) {
                MDC.setContextMap(context);
            }
            try {
                task.run();
            } finally {
                MDC.clear();
            }
        };
    }
}
