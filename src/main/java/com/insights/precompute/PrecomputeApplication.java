package com.insights.precompute;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PrecomputeApplication {

    public static void main(String[] args) {
        SpringApplication.run(PrecomputeApplication.class, args);
    }
}
