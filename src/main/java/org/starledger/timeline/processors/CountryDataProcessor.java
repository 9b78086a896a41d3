package org.starledger.timeline.processors;

import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.starledger.parser.model.Key;
import org.starledger.parser.model.MapValue;
import org.starledger.parser.model.Value;
import org.starledger.timeline.api.ITimelineProcessor;
import org.starledger.timeline.api.ProcessingContext;
import org.starledger.timeline.api.SnapshotInfo;
import org.starledger.timeline.model.CountrySnapshotMetrics;
import org.starledger.timeline.model.Entity;
import org.starledger.timeline.model.PointRecord;
import org.starledger.timeline.model.PointRecordKind;
import org.starledger.timeline.pipeline.Visibility;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Writes one {@code COUNTRY_METRICS} record per country and snapshot.
 * <p>
 * Net resources are summed over all items of {@code budget.current_month.balance}. For the observer (every
 * country if configured, never other human players) each budget item is also written as a separate record
 * with breakdown {@code budget:<item>}.
 */
public class CountryDataProcessor implements ITimelineProcessor<CountryMetricsIndex> {

    private static final Logger log = LoggerFactory.getLogger(CountryDataProcessor.class);

    public static final String ID = "country_data";

    static final List<String> RESOURCES = List.of("energy", "minerals", "alloys", "consumer_goods", "food",
            "unity", "influence", "physics_research", "society_research", "engineering_research");

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Set<String> dependencies() {
        return Set.of(CountryProcessor.ID, DiplomacyProcessor.ID, SensorLinkProcessor.ID, SystemOwnersProcessor.ID);
    }

    @Override
    public CountryMetricsIndex process(ProcessingContext context) {
        EntityIndex countries = context.output(CountryProcessor.ID, EntityIndex.class);
        DiplomacyIndex diplomacy = context.output(DiplomacyProcessor.ID, DiplomacyIndex.class);
        IdRelation systemsByOwner = context.output(SystemOwnersProcessor.ID, IdRelation.class);
        SnapshotInfo snapshot = context.snapshot();
        MapValue countryData = context.gamestate().map("country").orElse(MapValue.EMPTY);

        Map<Long, CountrySnapshotMetrics> result = new HashMap<>();
        for (Map.Entry<Long, Entity> entry : countries.all().entrySet()) {
            long countryId = entry.getKey();
            Entity country = entry.getValue();
            MapValue data = countryData.map(countryId).orElse(MapValue.EMPTY);
            MapValue balance = data.map("budget").flatMap(b -> b.map("current_month"))
                    .flatMap(m -> m.map("balance")).orElse(MapValue.EMPTY);
            boolean writeBudget = !snapshot.isOtherPlayer(countryId)
                    && (snapshot.isObserver(countryId) || context.settings().readAllCountries());

            Map<String, Double> net = new LinkedHashMap<>();
            RESOURCES.forEach(r -> net.put(r, 0.0));
            for (Map.Entry<Key, Value> item : balance.entries().entrySet()) {
                String itemName = item.getKey().text();
                MapValue values = item.getValue().asMap().orElse(MapValue.EMPTY);
                if ("none".equals(itemName) || values.size() == 0) {
                    continue;
                }
                JsonObject itemMetrics = new JsonObject();
                for (String resource : RESOURCES) {
                    double amount = number(snapshot, itemName, values, resource);
                    net.merge(resource, amount, Double::sum);
                    itemMetrics.addProperty(resource, amount);
                }
                if (writeBudget) {
                    context.transaction().insertPointRecord(new PointRecord(PointRecordKind.COUNTRY_METRICS,
                            countryId, context.day(), "budget:" + itemName, itemMetrics));
                }
            }

            CountrySnapshotMetrics metrics = new CountrySnapshotMetrics(
                    data.doubleValue("military_power", 0.0),
                    data.doubleValue("tech_power", 0.0),
                    data.doubleValue("economy_power", 0.0),
                    data.doubleValue("fleet_size", 0.0),
                    data.doubleValue("empire_size", 0.0),
                    data.doubleValue("empire_cohesion", 0.0),
                    data.map("tech_status").map(t -> t.list("technology").size()).orElse(0),
                    data.list("surveyed").size(),
                    data.list("owned_planets").size(),
                    systemsByOwner.get(countryId).size(),
                    data.doubleValue("victory_rank", 0.0),
                    data.doubleValue("victory_score", 0.0),
                    net,
                    country.getString(Visibility.ATTITUDE).orElse("unknown"),
                    country.getBoolean(Visibility.SENSOR_LINK),
                    diplomacyWithObserver(snapshot, diplomacy, countryId));
            context.transaction().insertPointRecord(metrics.toRecord(countryId, context.day()));
            result.put(countryId, metrics);
        }
        return new CountryMetricsIndex(result);
    }

    private static Map<String, Boolean> diplomacyWithObserver(SnapshotInfo snapshot, DiplomacyIndex diplomacy,
                                                              long countryId) {
        Map<String, Boolean> flags = new LinkedHashMap<>();
        for (DiplomacyIndex.Relation relation : DiplomacyIndex.Relation.values()) {
            boolean holds = !snapshot.isObserverMode()
                    && diplomacy.has(countryId, relation, snapshot.observerCountry());
            flags.put(relation.name().toLowerCase(Locale.ROOT), holds);
        }
        return flags;
    }

    private static double number(SnapshotInfo snapshot, String itemName, MapValue values, String resource) {
        if (!values.has(resource)) {
            return 0.0;
        }
        OptionalDouble amount = values.doubleValue(resource);
        if (amount.isPresent()) {
            return amount.getAsDouble();
        }
        // repeated keys turn a number into a list
        List<Value> elements = values.list(resource);
        if (!elements.isEmpty() && elements.get(0).asDouble().isPresent()) {
            return elements.get(0).asDouble().getAsDouble();
        }
        log.warn("{} {}: Found unexpected value for {}", snapshot.logPrefix(), itemName, resource);
        return 0.0;
    }
}
