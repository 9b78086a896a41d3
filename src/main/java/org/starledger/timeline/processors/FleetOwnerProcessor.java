package org.starledger.timeline.processors;

import org.starledger.parser.model.MapValue;
import org.starledger.timeline.api.ITimelineProcessor;
import org.starledger.timeline.api.ProcessingContext;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Maps every fleet to the country owning it, from {@code country[*].fleets_manager.owned_fleets}.
 */
public class FleetOwnerProcessor implements ITimelineProcessor<IdLookup> {

    public static final String ID = "fleet_owner";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Set<String> dependencies() {
        return Set.of(CountryProcessor.ID);
    }

    @Override
    public IdLookup process(ProcessingContext context) {
        EntityIndex countries = context.output(CountryProcessor.ID, EntityIndex.class);
        Map<Long, Long> owners = new HashMap<>();
        for (Map.Entry<Long, MapValue> entry : context.gamestate().map("country").orElse(MapValue.EMPTY)
                .objectsById().entrySet()) {
            if (!countries.contains(entry.getKey())) {
                continue;
            }
            MapValue fleetsManager = entry.getValue().map("fleets_manager").orElse(MapValue.EMPTY);
            for (MapValue owned : fleetsManager.maps("owned_fleets")) {
                owned.longValue("fleet").ifPresent(fleet -> owners.put(fleet, entry.getKey()));
            }
        }
        return new IdLookup(owners);
    }
}
