package com.fleetmanager.analytics.model;

import lombok.Builder;
import lombok.Value;

/**
 * One ranked entity. Entries flagged insufficientData carry no value and sort last.
 */
@Value
@Builder
public class RankingEntry {

    int position;
    Long entityId;
    Double value;
    boolean insufficientData;
}
