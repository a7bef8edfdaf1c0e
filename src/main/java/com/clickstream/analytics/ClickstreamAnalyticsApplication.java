package com.clickstream.analytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ClickstreamAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClickstreamAnalyticsApplication.class, args);
    }
}
