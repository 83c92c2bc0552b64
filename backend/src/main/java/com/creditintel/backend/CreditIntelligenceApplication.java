package com.creditintel.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CreditIntelligenceApplication {

    public static void main(String[] args) {
        SpringApplication.run(CreditIntelligenceApplication.class, args);
    }
}
