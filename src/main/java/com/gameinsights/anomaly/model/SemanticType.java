package com.gameinsights.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Meaning assigned to a raw column by the schema classifier. Only the metric roles
 * plus TIMESTAMP and USER_ID are read by the detection engine; the rest are accepted
 * so a classifier's full output can be passed through unchanged.
 */
public enum SemanticType {
    USER_ID, SESSION_ID, EVENT_NAME, TIMESTAMP,
    REVENUE, CURRENCY, PRICE, QUANTITY,
    LEVEL, SCORE, XP, RANK,
    COUNTRY, PLATFORM, DEVICE, VERSION,
    RETENTION_DAY, COHORT, SEGMENT,
    DAU, MAU, ARPU, LTV,
    ITEM_ID, ITEM_NAME, CATEGORY,
    FUNNEL_STEP, CONVERSION,
    ERROR_TYPE, ERROR_MESSAGE,
    MOVES, BOOSTER, LIVES,
    PRESTIGE, OFFLINE_REWARD, UPGRADE,
    RARITY, BANNER, PULL_TYPE, PITY_COUNT,
    KILLS, PLACEMENT, DAMAGE, SURVIVAL_TIME,
    AD_IMPRESSION, AD_REVENUE, AD_NETWORK, AD_TYPE, ECPM, AD_WATCHED,
    IAP_REVENUE, PURCHASE_AMOUNT, PRODUCT_ID, OFFER_ID, OFFER_SHOWN,
    SESSION_DURATION, SESSION_COUNT, ROUNDS_PLAYED, DAYS_SINCE_INSTALL,
    VIP_LEVEL, BATTLE_PASS_LEVEL, PREMIUM_CURRENCY,
    HIGH_SCORE, IS_ORGANIC, ACQUISITION_SOURCE,
    UNKNOWN;

    @JsonValue
    public String getKey() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SemanticType fromKey(String key) {
        if (key == null || key.isBlank()) {
            return UNKNOWN;
        }
        try {
            return valueOf(key.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }

    /**
     * Metrics whose buckets count distinct users rather than averaging a value.
     */
    public boolean isUserCount() {
        return this == DAU || this == MAU;
    }

    /**
     * Whether the role can be requested as a metric. Row keys and unrecognized roles cannot.
     */
    public boolean isMetricRole() {
        return this != UNKNOWN && this != TIMESTAMP && this != USER_ID;
    }
}
