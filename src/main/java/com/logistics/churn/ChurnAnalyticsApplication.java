package com.logistics.churn;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChurnAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChurnAnalyticsApplication.class, args);
    }
}
