package com.gameinsights.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI gameInsightsAnomalyOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Game Insights Anomaly Detection API")
                        .version("1.0.0")
                        .description(
                                "Statistical anomaly detection over game-analytics metrics.\n\n" +
                                "**Detection Pipeline:**\n" +
                                "1. Submit a row batch plus semantic column mapping via `POST /anomalies/detect`\n" +
                                "2. Rows are bucketed per metric by hour, day or week (distinct users for DAU-style metrics, mean otherwise)\n" +
                                "3. Baseline mean / standard deviation / median computed per series\n" +
                                "4. Three independent detectors run on every series with enough points\n" +
                                "5. Anomalies are merged and ranked: severity first, then most recent period\n\n" +
                                "**Detectors:**\n" +
                                "- `Z_SCORE`: global deviation from the series mean, severity LOW to CRITICAL by |z|\n" +
                                "- `MOVING_AVERAGE`: >30% deviation from the preceding 7-period mean (LOW / MEDIUM)\n" +
                                "- `CUSUM`: sustained shift from the first 7 periods' level (HIGH)\n\n" +
                                "Thresholds are adjustable at runtime via `/config/thresholds`; changes reset on restart.")
                        .contact(new Contact().name("Game Insights Analytics Team")));
    }
}
