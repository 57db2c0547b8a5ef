package com.assetmetrics.history.config;

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
 * - Swagger UI: http://localhost:4242/swagger-ui/index.html
 * - OpenAPI JSON: http://localhost:4242/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI assetMetricsHistoryOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Asset Metrics History Service API")
                        .description("""
                                OpenTSDB-compatible read API over per-asset metric history.

                                **Features:**
                                - Exact [start, end) intervals over an upstream that only serves
                                  relative windows (yesterday, last_7_days, ..., today)
                                - Clock skew detection and window escalation
                                - Memoized reads of identical intervals

                                **Required tags on every query:** region, accountNumber, instanceId
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:4242")
                                .description("Local Development Server")
                ));
    }
}
