package com.stockforecast.backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stockforecast.backend.forecast.artifact.ArtifactLoader;
import com.stockforecast.backend.forecast.artifact.FileSystemArtifactLoader;
import com.stockforecast.backend.forecast.registry.ModelRegistry;
import com.stockforecast.backend.service.MetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
@Slf4j
public class ForecastConfig {

    @Bean
    public ArtifactLoader artifactLoader(ObjectMapper objectMapper, ForecastProperties properties) {
        Path generalDir = resolve(properties.getArtifacts().getGeneralDir());
        return new FileSystemArtifactLoader(objectMapper, generalDir);
    }

    @Bean(initMethod = "initialize", destroyMethod = "shutdown")
    public ModelRegistry modelRegistry(ArtifactLoader artifactLoader,
                                       ForecastProperties properties,
                                       MetricsService metricsService) {
        Path specificDir = resolve(properties.getArtifacts().getSpecificDir());
        log.info("Model registry: specificDir={} generalDir={} cacheCapacity={}",
                specificDir, properties.getArtifacts().getGeneralDir(), properties.getCache().getCapacity());
        return new ModelRegistry(artifactLoader, specificDir, properties.getCache().getCapacity(), metricsService);
    }

    private static Path resolve(String directory) {
        if (directory == null || directory.isBlank()) {
            return null;
        }
        return Path.of(directory).toAbsolutePath().normalize();
    }
}
