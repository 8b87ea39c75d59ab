package com.stealthradar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StealthRadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(StealthRadarApplication.class, args);
    }
}
