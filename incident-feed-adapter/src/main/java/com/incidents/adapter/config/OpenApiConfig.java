package com.incidents.adapter.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI incidentFeedOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Incident Feed Adapter")
                        .description("Ingests incident observations, reconciles them into one record per incident " +
                                "and repairs missing durations and coordinates. Data is stored in MongoDB.")
                        .version("1.0.0"))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Local Dev")
                ));
    }
}
