package com.fleetmanager.analytics.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Metrics entities can be ranked by. Efficiency ranks ascending (lower consumption first),
 * everything else descending.
 */
public enum RankingMetric {

    TOTAL_KM("total_km", false) {
        @Override
        public Double valueOf(MetricsSnapshot snapshot) {
            return snapshot.getTotalKm();
        }
    },

    EFFICIENCY_L_PER_100KM("efficiency_l_per_100km", true) {
        @Override
        public Double valueOf(MetricsSnapshot snapshot) {
            return snapshot.efficiencyLPer100Km();
        }
    },

    TOTAL_COST("total_cost", false) {
        @Override
        public Double valueOf(MetricsSnapshot snapshot) {
            return snapshot.getTotalCost();
        }
    },

    TRIP_COUNT("trip_count", false) {
        @Override
        public Double valueOf(MetricsSnapshot snapshot) {
            return (double) snapshot.getTripCount();
        }
    };

    private final String paramName;
    private final boolean ascending;

    RankingMetric(String paramName, boolean ascending) {
        this.paramName = paramName;
        this.ascending = ascending;
    }

    /** Null means the metric is undefined for the snapshot (insufficient data). */
    public abstract Double valueOf(MetricsSnapshot snapshot);

    public String getParamName() {
        return paramName;
    }

    public boolean isAscending() {
        return ascending;
    }

    /**
     * Resolves a request parameter such as {@code total_km} or {@code TOTAL_KM}.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static RankingMetric fromParam(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (RankingMetric metric : values()) {
                if (metric.paramName.equals(normalized)) {
                    return metric;
                }
            }
        }
        throw new IllegalArgumentException("Unknown ranking metric '" + name + "'. Expected one of: "
                + Arrays.stream(values()).map(RankingMetric::getParamName).collect(Collectors.joining(", ")));
    }
}
