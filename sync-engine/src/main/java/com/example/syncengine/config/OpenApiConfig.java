package com.example.syncengine.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI syncEngineOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Sync Engine API")
                        .version("1.0.0")
                        .description("""
                                Provider synchronization and job processing.

                                ## Features
                                - Blocking sync with pollable progress sessions
                                - Persisted job queue with bounded retries
                                - Failure classification and error summaries
                                - Encrypted OAuth credentials with automatic refresh

                                ## Caller identity
                                Every endpoint reads the caller from the `X-User-Id` header,
                                which the gateway sets after authentication.
                                """));
    }
}
