package com.apex.decision.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI decisionEngineOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Apex Decision Engine API")
                        .description("Instrument registry, manual decisions and engine control")
                        .version("1.0"));
    }
}
