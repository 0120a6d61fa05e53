package com.surveillance.engine.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI documentation, served at /swagger-ui.html and /v3/api-docs.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI surveillanceOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Surveillance Trigger Engine API")
                        .description("Anomaly detection and retraining-trigger engine for field-sensor surveillance.\n\n" +
                                "## Flow\n\n" +
                                "1. A detection is ingested via REST or WebSocket\n" +
                                "2. Recent detections within ±0.1° are windowed and averaged\n" +
                                "3. Dense, high-confidence clusters raise an outbreak alert\n" +
                                "4. Each detection advances the per-model retraining counter\n" +
                                "5. Crossing the threshold queues a training trigger\n\n" +
                                "## WebSocket\n\n" +
                                "Connect to `ws://localhost:" + serverPort + "/ws/detections`, publish to " +
                                "`/app/detections`, subscribe to `/topic/alerts`.")
                        .version("1.0.0")
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local Development Server")
                ));
    }
}
