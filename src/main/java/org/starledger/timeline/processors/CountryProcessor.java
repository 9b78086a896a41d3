package org.starledger.timeline.processors;

import org.starledger.parser.model.MapValue;
import org.starledger.timeline.api.ITimelineProcessor;
import org.starledger.timeline.api.ProcessingContext;
import org.starledger.timeline.api.SnapshotInfo;
import org.starledger.timeline.model.Attitude;
import org.starledger.timeline.model.Entity;
import org.starledger.timeline.model.EntityKind;
import org.starledger.timeline.pipeline.Visibility;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maintains a {@code COUNTRY} entity per {@code country} entry, including its attitude towards the observer.
 */
public class CountryProcessor implements ITimelineProcessor<EntityIndex> {

    public static final String ID = "country";

    private static final Set<String> REAL_COUNTRY_TYPES = Set.of("default", "fallen_empire", "awakened_fallen_empire");

    @Override
    public String id() {
        return ID;
    }

    /**
     * Countries that play the game, as opposed to spawned creatures, primitives or other special countries.
     */
    public static boolean isRealCountry(Entity country) {
        return REAL_COUNTRY_TYPES.contains(country.getString("type").orElse(""));
    }

    @Override
    public EntityIndex process(ProcessingContext context) {
        SnapshotInfo snapshot = context.snapshot();
        EntityIndex index = new EntityIndex(EntityKind.COUNTRY);
        for (Map.Entry<Long, MapValue> entry : context.gamestate().map("country").orElse(MapValue.EMPTY)
                .objectsById().entrySet()) {
            long countryId = entry.getKey();
            MapValue data = entry.getValue();
            Entity country = context.transaction().getOrCreateEntity(EntityKind.COUNTRY, countryId);

            List<String> colors = data.map("flag").orElse(MapValue.EMPTY).strings("colors");
            String primary = colors.isEmpty() ? "black" : colors.get(0);
            country.set("name", Names.render(data.get("name")));
            country.set("type", data.string("type", "default"));
            country.set("primary_color", primary);
            country.set("secondary_color", colors.size() >= 2 ? colors.get(1) : primary);
            country.set("observer", snapshot.isObserver(countryId));
            country.set("other_player", snapshot.isOtherPlayer(countryId));

            if (snapshot.isObserver(countryId)) {
                country.set(Visibility.ATTITUDE, Attitude.IS_PLAYER.id());
                if (!country.has(Visibility.FIRST_CONTACT_DAY)) {
                    country.set(Visibility.FIRST_CONTACT_DAY, 0);
                }
            } else {
                country.set(Visibility.ATTITUDE, attitudeTowardsObserver(data, snapshot).id());
            }
            index.put(country);
        }
        return index;
    }

    private static Attitude attitudeTowardsObserver(MapValue country, SnapshotInfo snapshot) {
        if (snapshot.isObserverMode()) {
            return Attitude.UNKNOWN;
        }
        for (MapValue attitude : country.map("ai").orElse(MapValue.EMPTY).maps("attitude")) {
            if (attitude.longValue("country").orElse(-1) == snapshot.observerCountry()) {
                return Attitude.parse(attitude.string("attitude", null));
            }
        }
        return Attitude.UNKNOWN;
    }
}
