package com.reviewroster.scheduler.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "com.reviewroster.scheduler")
@ConfigurationPropertiesScan("com.reviewroster.scheduler")
@EnableScheduling
public class ReviewRosterApplication {
    public static void main(String[] args) {
        SpringApplication.run(ReviewRosterApplication.class, args);
    }
}
