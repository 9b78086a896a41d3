package org.starledger.timeline.processors;

import org.starledger.parser.model.MapValue;
import org.starledger.timeline.api.ITimelineProcessor;
import org.starledger.timeline.api.ProcessingContext;
import org.starledger.timeline.api.SnapshotInfo;
import org.starledger.timeline.model.Entity;
import org.starledger.timeline.pipeline.Visibility;

import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Reads {@code relations_manager} of every country and records first contact with the observer.
 */
public class DiplomacyProcessor implements ITimelineProcessor<DiplomacyIndex> {

    public static final String ID = "diplomacy";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Set<String> dependencies() {
        return Set.of(CountryProcessor.ID);
    }

    @Override
    public DiplomacyIndex process(ProcessingContext context) {
        EntityIndex countries = context.output(CountryProcessor.ID, EntityIndex.class);
        MapValue countryData = context.gamestate().map("country").orElse(MapValue.EMPTY);
        DiplomacyIndex index = new DiplomacyIndex();
        for (Long countryId : countries.all().keySet()) {
            MapValue relationsManager = countryData.map(countryId).flatMap(c -> c.map("relations_manager"))
                    .orElse(MapValue.EMPTY);
            for (MapValue relation : relationsManager.maps("relation")) {
                OptionalLong target = relation.longValue("country");
                if (target.isEmpty()) {
                    continue;
                }
                for (DiplomacyIndex.Relation kind : DiplomacyIndex.Relation.values()) {
                    if (relation.isYes(kind.key())) {
                        index.add(countryId, kind, target.getAsLong());
                    }
                }
                relation.longValue("truce").ifPresent(truce -> {
                    index.addTruceParty(truce, countryId);
                    index.addTruceParty(truce, target.getAsLong());
                });
            }
        }
        recordFirstContact(context.snapshot(), countries, index, context.day());
        return index;
    }

    private static void recordFirstContact(SnapshotInfo snapshot, EntityIndex countries, DiplomacyIndex index, int day) {
        if (snapshot.isObserverMode()) {
            return;
        }
        long observer = snapshot.observerCountry();
        for (Map.Entry<Long, Entity> entry : countries.all().entrySet()) {
            Entity country = entry.getValue();
            if (country.has(Visibility.FIRST_CONTACT_DAY)) {
                continue;
            }
            if (index.has(entry.getKey(), DiplomacyIndex.Relation.COMMUNICATIONS, observer)
                    || index.has(observer, DiplomacyIndex.Relation.COMMUNICATIONS, entry.getKey())) {
                country.set(Visibility.FIRST_CONTACT_DAY, day);
            }
        }
    }
}
