package org.starledger.timeline.processors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.starledger.parser.model.MapValue;
import org.starledger.timeline.api.ITimelineProcessor;
import org.starledger.timeline.api.ProcessingContext;
import org.starledger.timeline.model.Entity;
import org.starledger.timeline.model.EntityKind;
import org.starledger.timeline.model.EventKind;
import org.starledger.timeline.model.EventSubject;
import org.starledger.timeline.pipeline.EventHistory;
import org.starledger.timeline.pipeline.Visibility;
import org.starledger.timeline.store.ITimelineTransaction;

import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Maintains {@code FACTION} entities for political factions and tracks who leads them.
 */
public class FactionProcessor implements ITimelineProcessor<EntityIndex> {

    private static final Logger log = LoggerFactory.getLogger(FactionProcessor.class);

    public static final String ID = "faction";

    public static final String COUNTRY = "country";
    public static final String ACTIVE = "active";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Set<String> dependencies() {
        return Set.of(CountryProcessor.ID, LeaderProcessor.ID);
    }

    @Override
    public EntityIndex process(ProcessingContext context) {
        EntityIndex countries = context.output(CountryProcessor.ID, EntityIndex.class);
        EntityIndex leaders = context.output(LeaderProcessor.ID, EntityIndex.class);
        ITimelineTransaction tx = context.transaction();
        Visibility visibility = Visibility.of(context);

        EntityIndex index = new EntityIndex(EntityKind.FACTION);
        for (Map.Entry<Long, MapValue> entry : context.gamestate().map("pop_factions").orElse(MapValue.EMPTY)
                .objectsById().entrySet()) {
            MapValue data = entry.getValue();
            OptionalLong countryId = data.longValue("country");
            if (countryId.isEmpty() || !countries.contains(countryId.getAsLong())) {
                continue;
            }
            long country = countryId.getAsLong();
            boolean known = visibility.hasMet(country);
            Entity faction = tx.getOrCreateEntity(EntityKind.FACTION, entry.getKey());
            if (!faction.has(COUNTRY)) {
                faction.set(COUNTRY, country);
                faction.set("type", data.string("type", "unknown"));
                EventHistory.recordMomentary(tx, EventKind.NEW_FACTION,
                        EventSubject.ofCountry(country).withFaction(entry.getKey()), null, context.day(), null, known);
            }
            faction.set("name", Names.render(data.get("name")));
            faction.set(ACTIVE, true);
            index.put(faction);

            EventSubject pattern = EventSubject.NONE.withFaction(entry.getKey());
            OptionalLong leader = data.longValue("leader");
            if (leader.isPresent() && leaders.contains(leader.getAsLong())) {
                EventHistory.closeAndOpen(tx, EventKind.FACTION_LEADER, pattern, new EventHistory.Fact(
                        EventSubject.ofCountry(country).withFaction(entry.getKey()).withLeader(leader.getAsLong()),
                        null, known));
            } else {
                log.debug("{} Could not find leader {} of faction {}", context.snapshot().logPrefix(),
                        leader.isPresent() ? leader.getAsLong() : "none", entry.getKey());
                EventHistory.closeAll(tx, EventKind.FACTION_LEADER, pattern);
            }
        }

        for (Entity faction : tx.entities(EntityKind.FACTION)) {
            if (!index.contains(faction.sourceId()) && faction.getBoolean(ACTIVE)) {
                faction.set(ACTIVE, false);
                EventHistory.closeAll(tx, EventKind.FACTION_LEADER, EventSubject.NONE.withFaction(faction.sourceId()));
            }
        }
        return index;
    }
}
