package com.fleetmanager.analytics.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class Ranking {

    EntityKind kind;
    RankingMetric metric;
    Period period;
    List<RankingEntry> entries;
    int skippedRecords;
}
