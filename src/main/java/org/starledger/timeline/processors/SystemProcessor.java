package org.starledger.timeline.processors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.starledger.parser.model.MapValue;
import org.starledger.timeline.api.ITimelineProcessor;
import org.starledger.timeline.api.ProcessingContext;
import org.starledger.timeline.model.Entity;
import org.starledger.timeline.model.EntityKind;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeSet;

/**
 * Maintains a {@code SYSTEM} entity per {@code galactic_object} entry and maps starbases to their system.
 */
public class SystemProcessor implements ITimelineProcessor<SystemIndex> {

    private static final Logger log = LoggerFactory.getLogger(SystemProcessor.class);

    public static final String ID = "systems";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public SystemIndex process(ProcessingContext context) {
        NavigableMap<Long, MapValue> galacticObjects = context.gamestate().map("galactic_object")
                .orElse(MapValue.EMPTY).objectsById();
        Map<Long, Long> starbaseSystems = new HashMap<>();
        for (Map.Entry<Long, MapValue> entry : galacticObjects.entrySet()) {
            List<Long> starbases = entry.getValue().longs("starbases");
            if (starbases.size() > 1) {
                log.debug("{} Found multiple starbases in system {}", context.snapshot().logPrefix(), entry.getKey());
            }
            for (Long starbase : starbases) {
                starbaseSystems.put(starbase, entry.getKey());
            }
        }

        SystemIndex index = new SystemIndex(starbaseSystems);
        for (Map.Entry<Long, MapValue> entry : galacticObjects.entrySet()) {
            long systemId = entry.getKey();
            MapValue data = entry.getValue();
            Entity system = context.transaction().getOrCreateEntity(EntityKind.SYSTEM, systemId);
            system.set("name", Names.render(data.get("name")));
            if (!system.has("star_class")) {
                MapValue coordinate = data.map("coordinate").orElse(MapValue.EMPTY);
                system.set("star_class", data.string("star_class", "Unknown"));
                system.set("x", coordinate.doubleValue("x", 0.0));
                system.set("y", coordinate.doubleValue("y", 0.0));
            }
            TreeSet<Long> neighbors = new TreeSet<>();
            for (MapValue hyperlane : data.maps("hyperlane")) {
                // self-links occur in older saves
                hyperlane.longValue("to").ifPresent(to -> {
                    if (to != systemId) {
                        neighbors.add(to);
                    }
                });
            }
            system.setLongs("hyperlanes", neighbors);
            index.systems().put(system);
        }
        return index;
    }
}
