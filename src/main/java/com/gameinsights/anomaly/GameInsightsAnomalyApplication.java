package com.gameinsights.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GameInsightsAnomalyApplication {

    public static void main(String[] args) {
        SpringApplication.run(GameInsightsAnomalyApplication.class, args);
    }
}
