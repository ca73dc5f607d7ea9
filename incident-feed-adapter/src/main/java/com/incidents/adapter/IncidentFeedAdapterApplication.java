package com.incidents.adapter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;
import com.incidents.adapter.config.IncidentProperties;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(IncidentProperties.class)
public class IncidentFeedAdapterApplication {

    public static void main(String[] args) {
        SpringApplication.run(IncidentFeedAdapterApplication.class, args);
    }
}
