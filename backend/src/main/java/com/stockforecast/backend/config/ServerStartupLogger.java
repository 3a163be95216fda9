package com.stockforecast.backend.config;

import com.stockforecast.backend.forecast.registry.ModelRegistry;
import com.stockforecast.backend.forecast.registry.RegistryStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Announces where the forecast API is reachable and how much of the market the loaded
 * artifacts cover once the web server is up.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ServerStartupLogger implements ApplicationListener<WebServerInitializedEvent> {

    static final String API_PREFIX = "/api/v4";

    private final Environment environment;
    private final ForecastProperties properties;
    private final ModelRegistry modelRegistry;

    @Override
    public void onApplicationEvent(WebServerInitializedEvent event) {
        String apiUrl = apiUrl(environment.getProperty("server.address"),
                event.getWebServer().getPort(),
                environment.getProperty("server.servlet.context-path", ""));
        RegistryStats stats = modelRegistry.stats();
        log.info("Forecast API ready at {} (model version {}): {} specific, {} general, cache capacity {}",
                apiUrl, properties.getModelVersion(), stats.getSpecificModels(), stats.getGeneralModelSymbols(),
                stats.getCacheCapacity());
        if (stats.getTotalCoverage() == 0) {
            log.warn("No artifacts found under {} or {}; every prediction will be rejected until /refresh finds some",
                    properties.getArtifacts().getSpecificDir(), properties.getArtifacts().getGeneralDir());
        }
    }

    static String apiUrl(String address, int port, String contextPath) {
        String host = (address == null || address.isBlank() || "0.0.0.0".equals(address)) ? "localhost" : address;
        String context = contextPath == null || "/".equals(contextPath) ? "" : contextPath;
        return String.format("http://%s:%d%s%s", host, port, context, API_PREFIX);
    }
}
