package com.fintech.timeseries.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for API documentation.
 *
 * Access the interactive API documentation at:
 * - Swagger UI: http://localhost:8080/swagger-ui/index.html
 * - OpenAPI JSON: http://localhost:8080/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI timeSeriesOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Time-series Ingestion Service API")
                        .description("""
                                Aggregate queries over ingested market-data time series.

                                **Features:**
                                - Fine (5 min) and coarse (30 min) datasets of the same quantity
                                - Grouping by entity, category and attributes
                                - Net, positive-only and negative-only quantities
                                - Hourly and daily server-side buckets
                                - Cached results with a fixed TTL
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:8080")
                                .description("Local Development Server")
                ));
    }
}
