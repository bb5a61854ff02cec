package com.example.apo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class AdaptiveOptimizerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AdaptiveOptimizerApplication.class, args);
    }
}
