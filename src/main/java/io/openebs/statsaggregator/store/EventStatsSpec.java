package io.openebs.statsaggregator.store;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.TreeMap;

/**
 * Wire form of the persisted counters: category, then action, then count.
 * Kept as nested maps so entries unknown to this build round-trip unchanged.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EventStatsSpec {

    @JsonProperty("events")
    private Map<String, Map<String, Long>> events = new TreeMap<>();
}
