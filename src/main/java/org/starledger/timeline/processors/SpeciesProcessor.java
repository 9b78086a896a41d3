package org.starledger.timeline.processors;

import org.starledger.parser.model.MapValue;
import org.starledger.timeline.api.ITimelineProcessor;
import org.starledger.timeline.api.ProcessingContext;
import org.starledger.timeline.model.Entity;
import org.starledger.timeline.model.EntityKind;

import java.util.Map;

/**
 * Maintains a {@code SPECIES} entity per {@code species_db} entry.
 */
public class SpeciesProcessor implements ITimelineProcessor<EntityIndex> {

    public static final String ID = "species";

    static final String ROBOT_CLASS = "ROBOT";

    @Override
    public String id() {
        return ID;
    }

    public static boolean isRobot(Entity species) {
        return ROBOT_CLASS.equals(species.getString("class").orElse(""));
    }

    @Override
    public EntityIndex process(ProcessingContext context) {
        EntityIndex index = new EntityIndex(EntityKind.SPECIES);
        for (Map.Entry<Long, MapValue> entry : context.gamestate().map("species_db").orElse(MapValue.EMPTY)
                .objectsById().entrySet()) {
            MapValue data = entry.getValue();
            Entity species = context.transaction().getOrCreateEntity(EntityKind.SPECIES, entry.getKey());
            if (!species.has("class")) {
                species.set("name", Names.render(data.get("name")));
                species.set("class", data.string("class", "Unknown Class"));
                species.set("base", data.longValue("base").orElse(-1));
                species.set("home_planet", data.longValue("home_planet").orElse(-1));
                species.setStrings("traits", data.map("traits").orElse(MapValue.EMPTY).strings("trait"));
            }
            index.put(species);
        }
        return index;
    }
}
