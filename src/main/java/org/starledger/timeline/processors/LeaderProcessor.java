package org.starledger.timeline.processors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.starledger.parser.model.GameDate;
import org.starledger.parser.model.MapValue;
import org.starledger.parser.model.Value;
import org.starledger.timeline.api.ITimelineProcessor;
import org.starledger.timeline.api.ProcessingContext;
import org.starledger.timeline.model.Disclosure;
import org.starledger.timeline.model.Entity;
import org.starledger.timeline.model.EntityKind;
import org.starledger.timeline.model.EventKind;
import org.starledger.timeline.model.EventSubject;
import org.starledger.timeline.pipeline.EventHistory;
import org.starledger.timeline.pipeline.Visibility;
import org.starledger.timeline.store.ITimelineTransaction;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Maintains {@code LEADER} entities and records recruitment, death, level and trait changes.
 * <p>
 * A leader is recruited when it first appears in a country's {@code owned_leaders}, and dies when it is
 * missing from the {@code leaders} table. A trait replaced by a higher level of the same trait
 * ({@code trait_x} to {@code trait_x_2}) counts as gained but not as lost. {@code subclass*} traits are
 * tracked as the leader's subclass.
 */
public class LeaderProcessor implements ITimelineProcessor<EntityIndex> {

    private static final Logger log = LoggerFactory.getLogger(LeaderProcessor.class);

    public static final String ID = "leader";

    public static final String ACTIVE = "active";
    public static final String COUNTRY = "country";

    private static final String SUBCLASS_PREFIX = "subclass";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Set<String> dependencies() {
        return Set.of(CountryProcessor.ID, SpeciesProcessor.ID);
    }

    @Override
    public EntityIndex process(ProcessingContext context) {
        EntityIndex countries = context.output(CountryProcessor.ID, EntityIndex.class);
        EntityIndex species = context.output(SpeciesProcessor.ID, EntityIndex.class);
        ITimelineTransaction tx = context.transaction();
        Visibility visibility = Visibility.of(context);
        MapValue leaders = context.gamestate().map("leaders").orElse(MapValue.EMPTY);

        EntityIndex index = new EntityIndex(EntityKind.LEADER);
        Set<Long> known = new HashSet<>();
        for (Entity leader : tx.entities(EntityKind.LEADER)) {
            index.put(leader);
            if (!leader.getBoolean(ACTIVE)) {
                continue;
            }
            known.add(leader.sourceId());
            Optional<MapValue> data = leaders.map(leader.sourceId());
            Long country = leader.getLong(COUNTRY).isPresent() ? leader.getLong(COUNTRY).getAsLong() : null;
            if (data.isEmpty()) {
                leader.set(ACTIVE, false);
                leader.set("last_day", context.day());
                EventHistory.recordMomentary(tx, EventKind.LEADER_DIED,
                        EventSubject.NONE.withCountry(country).withLeader(leader.sourceId()), null, context.day(), null,
                        visibility.reveals(country, Disclosure.ECONOMY));
            } else {
                update(context, leader, data.get(), species, visibility.reveals(country, Disclosure.MILITARY));
            }
        }

        MapValue countryData = context.gamestate().map("country").orElse(MapValue.EMPTY);
        for (Long countryId : countries.all().keySet()) {
            for (Long leaderId : countryData.map(countryId).orElse(MapValue.EMPTY).longs("owned_leaders")) {
                Optional<MapValue> data = leaders.map(leaderId);
                if (data.isEmpty() || known.contains(leaderId)) {
                    continue;
                }
                known.add(leaderId);
                index.put(recruit(context, countryId, leaderId, data.get(), species,
                        visibility.reveals(countryId, Disclosure.ECONOMY)));
            }
        }
        return index;
    }

    private Entity recruit(ProcessingContext context, long countryId, long leaderId, MapValue data,
                           EntityIndex species, boolean known) {
        int hired = context.day();
        for (String key : List.of("date", "start", "date_added")) {
            Optional<String> date = data.string(key);
            if (date.isPresent()) {
                hired = Math.min(hired, GameDate.tryToDays(date.get()).orElse(hired));
            }
        }
        Entity leader = context.transaction().getOrCreateEntity(EntityKind.LEADER, leaderId);
        leader.set(COUNTRY, countryId);
        leader.set(ACTIVE, true);
        leader.set("hired_day", hired);
        leader.set("age", data.doubleValue("age", 0.0));
        leader.set("level", data.longValue("level").orElse(-1));
        leader.setStrings("traits", traits(data));
        leader.set("subclass", subclass(data));
        setDescriptiveAttributes(context, leader, data, species);
        EventHistory.recordMomentary(context.transaction(), EventKind.LEADER_RECRUITED,
                EventSubject.ofCountry(countryId).withLeader(leaderId), null, hired, context.day(), known);
        return leader;
    }

    private void update(ProcessingContext context, Entity leader, MapValue data, EntityIndex species, boolean known) {
        ITimelineTransaction tx = context.transaction();
        Long country = leader.getLong(COUNTRY).isPresent() ? leader.getLong(COUNTRY).getAsLong() : null;
        EventSubject subject = EventSubject.NONE.withCountry(country).withLeader(leader.sourceId());

        long level = data.longValue("level").orElse(-1);
        if (leader.set("level", level)) {
            EventHistory.recordMomentary(tx, EventKind.LEVEL_UP, subject, Long.toString(level), context.day(), null, known);
        }

        List<String> oldTraits = leader.getStrings("traits");
        List<String> newTraits = traits(data);
        if (leader.setStrings("traits", newTraits)) {
            for (String lost : lostTraits(oldTraits, newTraits)) {
                EventHistory.recordMomentary(tx, EventKind.LOST_TRAIT, subject, lost, context.day(), null, known);
            }
            for (String gained : newTraits) {
                if (!oldTraits.contains(gained)) {
                    EventHistory.recordMomentary(tx, EventKind.GAINED_TRAIT, subject, gained, context.day(), null, known);
                }
            }
        }
        leader.set("subclass", subclass(data));
        setDescriptiveAttributes(context, leader, data, species);
    }

    private void setDescriptiveAttributes(ProcessingContext context, Entity leader, MapValue data, EntityIndex species) {
        MapValue name = data.map("name").orElse(MapValue.EMPTY);
        Optional<Value> firstName = name.get("first_name").or(() -> name.get("full_names"));
        leader.set("first_name", Names.render(firstName));
        leader.set("second_name", name.has("second_name") ? Names.render(name.get("second_name")) : "");
        leader.set("class", data.string("pre_ruler_class").orElse(data.string("class", "unknown class")));
        leader.set("gender", data.string("gender", "other"));
        long speciesId = data.longValue("species").orElse(-1);
        if (!species.contains(speciesId)) {
            log.warn("{} Invalid species id {} for leader {}", context.snapshot().logPrefix(), speciesId, leader.sourceId());
        }
        leader.set("species", speciesId);
    }

    static List<String> traits(MapValue data) {
        TreeSet<String> traits = new TreeSet<>();
        for (String trait : data.strings("traits")) {
            if (!trait.startsWith(SUBCLASS_PREFIX)) {
                traits.add(trait);
            }
        }
        return new ArrayList<>(traits);
    }

    static String subclass(MapValue data) {
        for (String trait : data.strings("traits")) {
            if (trait.startsWith(SUBCLASS_PREFIX)) {
                return trait;
            }
        }
        return "";
    }

    /**
     * Traits that disappeared without being replaced by another level of the same trait.
     */
    static List<String> lostTraits(List<String> oldTraits, List<String> newTraits) {
        List<String> lost = new ArrayList<>();
        for (String trait : oldTraits) {
            if (newTraits.contains(trait)) {
                continue;
            }
            boolean upgraded = newTraits.stream().anyMatch(t -> stripLevel(t).equals(stripLevel(trait)));
            if (!upgraded) {
                lost.add(trait);
            }
        }
        return lost;
    }

    static String stripLevel(String trait) {
        int end = trait.length();
        while (end > 0 && (Character.isDigit(trait.charAt(end - 1)) || trait.charAt(end - 1) == '_')) {
            end--;
        }
        return trait.substring(0, end);
    }
}
