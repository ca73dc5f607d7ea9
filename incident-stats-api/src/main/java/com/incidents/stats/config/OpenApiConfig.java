package com.incidents.stats.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI incidentStatsOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Incident Stats API")
                        .version("1.0.0")
                        .description("Read-only statistics over reconciled incidents: open vs closed, per day, per type, " +
                                "top locations and the longest incidents since tracking started."))
                .servers(List.of(
                        new Server().url("http://localhost:8082").description("Local Development"),
                        new Server().url("http://incident-stats-api:8080").description("Docker")
                ));
    }
}
