package org.starledger.timeline.model;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.util.Map;

/**
 * Per-country metrics of one snapshot, stored as a {@link PointRecordKind#COUNTRY_METRICS} record.
 */
public record CountrySnapshotMetrics(
        double militaryPower,
        double techPower,
        double economyPower,
        double fleetSize,
        double empireSize,
        double empireCohesion,
        int techCount,
        int explorationProgress,
        int ownedPlanets,
        int controlledSystems,
        double victoryRank,
        double victoryScore,
        Map<String, Double> netResources,
        String attitudeTowardsObserver,
        boolean sensorLinkWithObserver,
        Map<String, Boolean> diplomacyWithObserver) {

    private static final Gson GSON = new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .create();

    public CountrySnapshotMetrics {
        netResources = Map.copyOf(netResources);
        diplomacyWithObserver = Map.copyOf(diplomacyWithObserver);
    }

    public PointRecord toRecord(long countryId, int day) {
        return new PointRecord(PointRecordKind.COUNTRY_METRICS, countryId, day, "",
                GSON.toJsonTree(this).getAsJsonObject());
    }
}
