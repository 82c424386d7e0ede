package com.gameinsights.anomaly.engine;

import java.util.List;
import java.util.Locale;

/**
 * Broad metric families, each with a fixed list of candidate causes for triage.
 * Classification is a keyword match; the first family whose keyword appears wins.
 */
public enum MetricCategory {

    REVENUE(List.of("revenue", "price", "arpu"), List.of(
            "Promotional event or sale",
            "App store featuring",
            "Marketing campaign launched",
            "Payment provider issues",
            "Currency exchange fluctuation",
            "New IAP content released")),

    DAU(List.of("dau", "mau", "user"), List.of(
            "Marketing campaign effect",
            "App store visibility change",
            "Competitor app launch",
            "Technical issues (crashes, servers)",
            "Seasonal effect",
            "Content update released")),

    RETENTION(List.of("retention"), List.of(
            "Onboarding flow changed",
            "Game balance adjustment",
            "New content added",
            "Technical stability issues",
            "Matchmaking changes")),

    ENGAGEMENT(List.of("session", "engagement"), List.of(
            "Event or limited-time content",
            "UI/UX changes",
            "Notification strategy change",
            "Server performance issues")),

    ERROR(List.of("error", "crash"), List.of(
            "New build deployment",
            "Third-party SDK update",
            "Server-side changes",
            "Device OS update")),

    DEFAULT(List.of(), List.of(
            "Recent update or change",
            "External factors",
            "Data collection issue"));

    private final List<String> keywords;
    private final List<String> causes;

    MetricCategory(List<String> keywords, List<String> causes) {
        this.keywords = keywords;
        this.causes = causes;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    public List<String> getCauses() {
        return causes;
    }

    public static MetricCategory classify(String name) {
        if (name == null || name.isBlank()) {
            return DEFAULT;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        for (MetricCategory category : values()) {
            for (String keyword : category.keywords) {
                if (lower.contains(keyword)) {
                    return category;
                }
            }
        }
        return DEFAULT;
    }
}
