package org.starledger.timeline.processors;

import org.starledger.timeline.model.CountrySnapshotMetrics;

import java.util.Map;
import java.util.Optional;

/**
 * Metrics written for each country in the current snapshot.
 *
 * @param metrics Country id to metrics.
 */
public record CountryMetricsIndex(Map<Long, CountrySnapshotMetrics> metrics) {

    public CountryMetricsIndex {
        metrics = Map.copyOf(metrics);
    }

    public Optional<CountrySnapshotMetrics> get(long countryId) {
        return Optional.ofNullable(metrics.get(countryId));
    }
}
