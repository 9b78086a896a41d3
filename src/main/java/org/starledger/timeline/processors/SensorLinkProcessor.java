package org.starledger.timeline.processors;

import org.starledger.parser.model.MapValue;
import org.starledger.timeline.api.ITimelineProcessor;
import org.starledger.timeline.api.ProcessingContext;
import org.starledger.timeline.model.Entity;
import org.starledger.timeline.pipeline.Visibility;

import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Collects sensor links granted through trade deals and flags countries linked with the observer.
 */
public class SensorLinkProcessor implements ITimelineProcessor<IdRelation> {

    public static final String ID = "sensor_links";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Set<String> dependencies() {
        return Set.of(CountryProcessor.ID);
    }

    @Override
    public IdRelation process(ProcessingContext context) {
        IdRelation links = new IdRelation();
        for (MapValue deal : context.gamestate().map("trade_deal").orElse(MapValue.EMPTY).objectsById().values()) {
            MapValue first = deal.map("first").orElse(MapValue.EMPTY);
            MapValue second = deal.map("second").orElse(MapValue.EMPTY);
            OptionalLong from = first.longValue("country");
            OptionalLong to = second.longValue("country");
            if (from.isPresent() && to.isPresent() && second.isYes("sensor_link")) {
                links.add(from.getAsLong(), to.getAsLong());
            }
        }

        Long observer = context.snapshot().observerCountry();
        EntityIndex countries = context.output(CountryProcessor.ID, EntityIndex.class);
        for (Map.Entry<Long, Entity> entry : countries.all().entrySet()) {
            boolean linked = context.snapshot().isObserver(entry.getKey()) || links.contains(observer, entry.getKey());
            entry.getValue().set(Visibility.SENSOR_LINK, linked);
        }
        return links;
    }
}
