package com.gameinsights.anomaly.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SemanticTypeTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void fromKey_lowercaseKey_resolves() {
        assertThat(SemanticType.fromKey("retention_day")).isEqualTo(SemanticType.RETENTION_DAY);
        assertThat(SemanticType.fromKey(" Revenue ")).isEqualTo(SemanticType.REVENUE);
    }

    @Test
    void fromKey_unknownOrBlank_returnsUnknown() {
        assertThat(SemanticType.fromKey("not_a_type")).isEqualTo(SemanticType.UNKNOWN);
        assertThat(SemanticType.fromKey("")).isEqualTo(SemanticType.UNKNOWN);
        assertThat(SemanticType.fromKey(null)).isEqualTo(SemanticType.UNKNOWN);
    }

    @Test
    void json_usesLowercaseKeys() throws Exception {
        assertThat(objectMapper.writeValueAsString(SemanticType.ERROR_TYPE)).isEqualTo("\"error_type\"");

        ColumnMeaning meaning = objectMapper.readValue(
                "{\"column\":\"dau\",\"semanticType\":\"dau\",\"confidence\":0.8}", ColumnMeaning.class);
        assertThat(meaning.getSemanticType()).isEqualTo(SemanticType.DAU);
    }

    @Test
    void isUserCount_onlyForActiveUserCounts() {
        assertThat(List.of(SemanticType.DAU, SemanticType.MAU)).allMatch(SemanticType::isUserCount);
        assertThat(SemanticType.USER_ID.isUserCount()).isFalse();
        assertThat(SemanticType.REVENUE.isUserCount()).isFalse();
    }

    @Test
    void isMetricRole_excludesRowKeysAndUnknown() {
        assertThat(SemanticType.REVENUE.isMetricRole()).isTrue();
        assertThat(SemanticType.RETENTION_DAY.isMetricRole()).isTrue();
        assertThat(SemanticType.TIMESTAMP.isMetricRole()).isFalse();
        assertThat(SemanticType.USER_ID.isMetricRole()).isFalse();
        assertThat(SemanticType.UNKNOWN.isMetricRole()).isFalse();
    }
}
