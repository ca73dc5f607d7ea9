package com.incidents.stats;

import com.incidents.stats.config.StatsProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(StatsProperties.class)
public class IncidentStatsApplication {

    public static void main(String[] args) {
        SpringApplication.run(IncidentStatsApplication.class, args);
    }
}
