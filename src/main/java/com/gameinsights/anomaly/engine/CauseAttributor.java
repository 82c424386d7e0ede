package com.gameinsights.anomaly.engine;

import com.gameinsights.anomaly.model.SemanticType;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Attaches templated candidate causes to an anomaly based on the metric's family.
 *
 * The family comes from the semantic role first. The raw column name is only consulted
 * when the role itself matches no family (e.g. LEVEL).
 */
@Component
public class CauseAttributor {

    static final int MAX_CAUSES = 3;

    public MetricCategory categorize(SemanticType metricType, String column) {
        MetricCategory byType = metricType == null
                ? MetricCategory.DEFAULT
                : MetricCategory.classify(metricType.getKey());
        if (byType != MetricCategory.DEFAULT) {
            return byType;
        }
        return MetricCategory.classify(column);
    }

    public List<String> possibleCauses(SemanticType metricType, String column) {
        List<String> causes = categorize(metricType, column).getCauses();
        return List.copyOf(causes.subList(0, Math.min(MAX_CAUSES, causes.size())));
    }
}
