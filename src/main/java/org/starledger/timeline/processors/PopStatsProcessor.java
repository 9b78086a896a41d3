package org.starledger.timeline.processors;

import com.google.gson.JsonObject;
import org.starledger.parser.model.MapValue;
import org.starledger.timeline.api.ITimelineProcessor;
import org.starledger.timeline.api.ProcessingContext;
import org.starledger.timeline.api.SnapshotInfo;
import org.starledger.timeline.model.Entity;
import org.starledger.timeline.model.PointRecord;
import org.starledger.timeline.model.PointRecordKind;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Writes population breakdowns per country: pop count and average crime, happiness and power grouped by
 * species, faction, job, stratum, ethos and planet.
 * <p>
 * Pops without a faction are grouped as {@code enslaved}, {@code robot} (non-sentient robot species),
 * {@code purge} or {@code none}. Breakdowns are written for the observer, or for every country except other
 * human players when all countries are read.
 */
public class PopStatsProcessor implements ITimelineProcessor<Void> {

    public static final String ID = "pop_stats";

    static final String POP_COUNT = "pop_count";
    private static final String[] AVERAGED = {"crime", "happiness", "power"};
    private static final String[] PLANET_METRICS = {"migration", "free_amenities", "free_housing", "stability"};

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Set<String> dependencies() {
        return Set.of(CountryProcessor.ID, SpeciesProcessor.ID, FactionProcessor.ID, CountryDataProcessor.ID,
                PlanetModelsProcessor.ID);
    }

    @Override
    public Void process(ProcessingContext context) {
        EntityIndex countries = context.output(CountryProcessor.ID, EntityIndex.class);
        CountryMetricsIndex metrics = context.output(CountryDataProcessor.ID, CountryMetricsIndex.class);
        SnapshotInfo snapshot = context.snapshot();

        Map<Long, Long> planetOwners = new HashMap<>();
        MapValue countryData = context.gamestate().map("country").orElse(MapValue.EMPTY);
        for (Map.Entry<Long, MapValue> country : countryData.objectsById().entrySet()) {
            country.getValue().longs("owned_planets").forEach(p -> planetOwners.put(p, country.getKey()));
        }

        for (Long countryId : countries.all().keySet()) {
            boolean included = !snapshot.isOtherPlayer(countryId)
                    && (snapshot.isObserver(countryId) || context.settings().readAllCountries());
            if (!included || metrics.get(countryId).isEmpty()) {
                continue;
            }
            writeBreakdowns(context, countryId, planetOwners);
        }
        return null;
    }

    private void writeBreakdowns(ProcessingContext context, long countryId, Map<Long, Long> planetOwners) {
        EntityIndex species = context.output(SpeciesProcessor.ID, EntityIndex.class);
        EntityIndex factions = context.output(FactionProcessor.ID, EntityIndex.class);
        EntityIndex planets = context.output(PlanetModelsProcessor.ID, EntityIndex.class);
        MapValue pops = context.gamestate().map("pop").orElse(MapValue.EMPTY);
        MapValue planetData = context.gamestate().map("planets").flatMap(p -> p.map("planet")).orElse(MapValue.EMPTY);
        MapValue factionData = context.gamestate().map("pop_factions").orElse(MapValue.EMPTY);

        Map<String, Stats> breakdowns = new LinkedHashMap<>();
        for (MapValue pop : pops.objectsById().values()) {
            OptionalLong planet = pop.longValue("planet");
            if (planet.isEmpty() || !Long.valueOf(countryId).equals(planetOwners.get(planet.getAsLong()))) {
                continue;
            }
            OptionalLong speciesId = pop.longValue("species");
            String stratum = pop.string("category", "unknown stratum");
            String ethos = pop.map("ethos").flatMap(e -> e.string("ethic")).orElse("ethic_no_ethos");

            if (speciesId.isPresent() && species.contains(speciesId.getAsLong())) {
                add(breakdowns, "species:" + speciesId.getAsLong(), pop);
            }
            add(breakdowns, "faction:" + faction(pop, stratum, speciesId, species, factions), pop);
            add(breakdowns, "job:" + pop.string("job", "unemployed"), pop);
            add(breakdowns, "stratum:" + stratum, pop);
            add(breakdowns, "ethos:" + ethos, pop);
            if (planets.contains(planet.getAsLong())) {
                add(breakdowns, "planet:" + planet.getAsLong(), pop);
            }
        }

        for (Map.Entry<String, Stats> entry : breakdowns.entrySet()) {
            JsonObject record = entry.getValue().toJson();
            String breakdown = entry.getKey();
            if (breakdown.startsWith("planet:")) {
                MapValue planet = planetData.map(Long.parseLong(breakdown.substring("planet:".length())))
                        .orElse(MapValue.EMPTY);
                for (String metric : PLANET_METRICS) {
                    record.addProperty(metric, planet.doubleValue(metric, 0.0));
                }
            } else if (breakdown.startsWith("faction:")) {
                String id = breakdown.substring("faction:".length());
                Optional<MapValue> faction = id.chars().allMatch(Character::isDigit)
                        ? factionData.map(Long.parseLong(id)) : Optional.empty();
                record.addProperty("faction_approval",
                        faction.map(f -> f.doubleValue("faction_approval", 0.0)).orElse(0.0));
                record.addProperty("support", faction.map(f -> f.doubleValue("support", 0.0)).orElse(0.0));
            }
            context.transaction().insertPointRecord(
                    new PointRecord(PointRecordKind.POP_STATS, countryId, context.day(), breakdown, record));
        }
    }

    private static String faction(MapValue pop, String stratum, OptionalLong speciesId, EntityIndex species,
                                  EntityIndex factions) {
        OptionalLong faction = pop.longValue("pop_faction");
        if (faction.isPresent() && factions.contains(faction.getAsLong())) {
            return Long.toString(faction.getAsLong());
        }
        if ("slave".equals(stratum)) {
            return "enslaved";
        }
        Optional<Entity> popSpecies = speciesId.isPresent() ? species.get(speciesId.getAsLong()) : Optional.empty();
        if (popSpecies.isPresent() && SpeciesProcessor.isRobot(popSpecies.get())) {
            return "robot";
        }
        if ("purge".equals(stratum)) {
            return "purge";
        }
        return "none";
    }

    private static void add(Map<String, Stats> breakdowns, String key, MapValue pop) {
        breakdowns.computeIfAbsent(key, k -> new Stats()).add(pop);
    }

    /**
     * Running sums of one breakdown.
     */
    private static final class Stats {
        private int count;
        private final double[] sums = new double[AVERAGED.length];

        void add(MapValue pop) {
            count++;
            for (int i = 0; i < AVERAGED.length; i++) {
                sums[i] += pop.doubleValue(AVERAGED[i], 0.0);
            }
        }

        JsonObject toJson() {
            JsonObject json = new JsonObject();
            json.addProperty(POP_COUNT, count);
            for (int i = 0; i < AVERAGED.length; i++) {
                json.addProperty(AVERAGED[i], sums[i] / count);
            }
            return json;
        }
    }
}
