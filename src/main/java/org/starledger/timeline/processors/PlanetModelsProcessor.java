package org.starledger.timeline.processors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.starledger.parser.model.GameDate;
import org.starledger.parser.model.MapValue;
import org.starledger.timeline.api.ITimelineProcessor;
import org.starledger.timeline.api.ProcessingContext;
import org.starledger.timeline.model.Entity;
import org.starledger.timeline.model.EntityKind;
import org.starledger.timeline.model.EventKind;
import org.starledger.timeline.model.EventSubject;
import org.starledger.timeline.model.HistoricalEvent;
import org.starledger.timeline.pipeline.EventHistory;
import org.starledger.timeline.pipeline.Visibility;
import org.starledger.timeline.store.ITimelineTransaction;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Maintains a {@code PLANET} entity for every planet referenced by a system and tracks colonization,
 * terraforming and planet destruction.
 * <p>
 * Colonization is open while {@code is_under_colonization = yes} and closed at the colonize date once the
 * planet carries one. A planet first seen already colonized gets no event. Events are attributed to the
 * planet's owner.
 */
public class PlanetModelsProcessor implements ITimelineProcessor<EntityIndex> {

    private static final Logger log = LoggerFactory.getLogger(PlanetModelsProcessor.class);

    public static final String ID = "planet_models";

    public static final String COLONIZE_DAY = "colonize_day";
    public static final String PLANET_CLASS = "class";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Set<String> dependencies() {
        return Set.of(SystemProcessor.ID, CountryProcessor.ID);
    }

    @Override
    public EntityIndex process(ProcessingContext context) {
        SystemIndex systems = context.output(SystemProcessor.ID, SystemIndex.class);
        MapValue planets = context.gamestate().map("planets").flatMap(p -> p.map("planet")).orElse(MapValue.EMPTY);
        MapValue galacticObjects = context.gamestate().map("galactic_object").orElse(MapValue.EMPTY);
        Visibility visibility = Visibility.of(context);

        EntityIndex index = new EntityIndex(EntityKind.PLANET);
        for (Map.Entry<Long, MapValue> system : galacticObjects.objectsById().entrySet()) {
            if (!systems.systems().contains(system.getKey())) {
                continue;
            }
            for (Long planetId : system.getValue().longs("planet")) {
                Optional<MapValue> data = planets.map(planetId);
                if (data.isEmpty()) {
                    continue;
                }
                Entity planet = context.transaction().findEntity(EntityKind.PLANET, planetId)
                        .orElseGet(() -> create(context, planetId, system.getKey(), data.get()));
                update(context, visibility, planet, system.getKey(), data.get());
                index.put(planet);
            }
        }
        return index;
    }

    private Entity create(ProcessingContext context, long planetId, long systemId, MapValue data) {
        Entity planet = context.transaction().getOrCreateEntity(EntityKind.PLANET, planetId);
        planet.set("system", systemId);
        planet.set(PLANET_CLASS, data.string("planet_class", "pc_unknown"));
        if (!data.isYes("is_under_colonization")) {
            colonizeDay(data).ifPresent(day -> planet.set(COLONIZE_DAY, day));
        }
        return planet;
    }

    private void update(ProcessingContext context, Visibility visibility, Entity planet, long systemId, MapValue data) {
        ITimelineTransaction tx = context.transaction();
        Long owner = data.longValue("owner").isPresent() ? data.longValue("owner").getAsLong() : null;
        boolean known = visibility.hasMet(owner);
        EventSubject subject = EventSubject.NONE.withCountry(owner).withSystem(systemId).withPlanet(planet.sourceId());

        String planetClass = data.string("planet_class", "pc_unknown");
        String previousClass = planet.getString(PLANET_CLASS).orElse(planetClass);
        if (!planetClass.equals(previousClass) && context.settings().destroyedPlanetClasses().contains(planetClass)) {
            EventHistory.recordMomentary(tx, EventKind.PLANET_DESTROYED, subject, planetClass, context.day(), null, known);
        }
        planet.set(PLANET_CLASS, planetClass);
        planet.set("name", Names.render(data.get("name")));
        if (owner != null) {
            planet.set("owner", owner);
        } else {
            planet.remove("owner");
        }

        updateColonization(context, planet, subject, data, known);
        updateTerraforming(context, planet, subject, data, planetClass, known);
    }

    private void updateColonization(ProcessingContext context, Entity planet, EventSubject subject, MapValue data,
                                    boolean known) {
        if (planet.has(COLONIZE_DAY)) {
            return;
        }
        ITimelineTransaction tx = context.transaction();
        EventSubject pattern = EventSubject.NONE.withPlanet(planet.sourceId());
        if (data.isYes("is_under_colonization")) {
            EventHistory.closeAndOpen(tx, EventKind.COLONIZATION, pattern, new EventHistory.Fact(subject, null, known));
            return;
        }
        OptionalInt colonized = colonizeDay(data);
        if (colonized.isEmpty()) {
            return;
        }
        planet.set(COLONIZE_DAY, colonized.getAsInt());
        for (HistoricalEvent open : tx.findEvents(EventKind.COLONIZATION, pattern, true)) {
            open.widenVisibility(known);
            EventHistory.closeAt(tx, open, Math.min(colonized.getAsInt(), context.day()));
        }
    }

    private void updateTerraforming(ProcessingContext context, Entity planet, EventSubject subject, MapValue data,
                                    String planetClass, boolean known) {
        List<EventHistory.Fact> facts = new ArrayList<>();
        Optional<MapValue> process = data.map("terraform_process");
        if (process.isPresent()) {
            Optional<String> target = process.get().string("planet_class");
            if (target.isPresent()) {
                facts.add(new EventHistory.Fact(subject, planetClass + "," + target.get(), known));
            } else {
                log.info("{} Unexpected target planet class for terraforming of planet {}",
                        context.snapshot().logPrefix(), planet.sourceId());
            }
        }
        EventHistory.reconcile(context.transaction(), EventKind.TERRAFORMING,
                EventSubject.NONE.withPlanet(planet.sourceId()), facts);
    }

    private static OptionalInt colonizeDay(MapValue data) {
        Optional<String> date = data.string("colonize_date");
        if (date.isEmpty() || "none".equals(date.get())) {
            return OptionalInt.empty();
        }
        return GameDate.tryToDays(date.get());
    }
}
