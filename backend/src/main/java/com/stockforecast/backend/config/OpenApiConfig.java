package com.stockforecast.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI forecastOpenApi(ForecastProperties properties) {
        return new OpenAPI()
                .info(new Info()
                        .title("Stock Forecast API")
                        .description("Hybrid stock-specific / general price forecasting")
                        .version(properties.getModelVersion()));
    }
}
