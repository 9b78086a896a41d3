package org.starledger.timeline.processors;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.starledger.parser.model.MapValue;
import org.starledger.timeline.api.ITimelineProcessor;
import org.starledger.timeline.api.ProcessingContext;
import org.starledger.timeline.model.Entity;
import org.starledger.timeline.model.EventKind;
import org.starledger.timeline.model.EventSubject;
import org.starledger.timeline.model.HistoricalEvent;
import org.starledger.timeline.pipeline.EventHistory;
import org.starledger.timeline.pipeline.Visibility;
import org.starledger.timeline.store.ITimelineTransaction;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Tracks each country's form of government.
 * <p>
 * The government is identified by its signature: the country name, government type, authority and the
 * sorted ethics and civics. A changed signature ends the current {@code government} event, opens a new one
 * and records a {@code government_reform} attributed to the ruler.
 */
public class GovernmentProcessor implements ITimelineProcessor<Void> {

    public static final String ID = "government";

    private static final Gson GSON = new Gson();

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Set<String> dependencies() {
        return Set.of(CountryProcessor.ID, RulerProcessor.ID);
    }

    @Override
    public Void process(ProcessingContext context) {
        EntityIndex countries = context.output(CountryProcessor.ID, EntityIndex.class);
        IdLookup rulers = context.output(RulerProcessor.ID, IdLookup.class);
        MapValue countryData = context.gamestate().map("country").orElse(MapValue.EMPTY);
        ITimelineTransaction tx = context.transaction();
        Visibility visibility = Visibility.of(context);

        for (Entity country : countries.all().values()) {
            MapValue data = countryData.map(country.sourceId()).orElse(MapValue.EMPTY);
            String signature = signature(data);
            country.set("personality", data.string("personality", "unknown_personality"));

            EventSubject subject = EventSubject.ofCountry(country.sourceId());
            boolean known = visibility.hasMet(country.sourceId());
            List<HistoricalEvent> open = tx.findEvents(EventKind.GOVERNMENT, subject, true);
            boolean reformed = open.stream().anyMatch(e -> !signature.equals(e.description().orElse(null)));
            EventHistory.closeAndOpen(tx, EventKind.GOVERNMENT, subject, new EventHistory.Fact(subject, signature, known));
            if (reformed) {
                EventHistory.recordMomentary(tx, EventKind.GOVERNMENT_REFORM,
                        subject.withLeader(rulers.get(country.sourceId()).orElse(null)), signature, context.day(),
                        null, known);
            }
        }
        return null;
    }

    /**
     * @return The government signature as JSON text with a stable key order.
     */
    static String signature(MapValue country) {
        MapValue government = country.map("government").orElse(MapValue.EMPTY);
        JsonObject signature = new JsonObject();
        signature.addProperty("name", Names.render(country.get("name")));
        signature.addProperty("type", government.string("type", "other"));
        signature.addProperty("authority", government.string("authority", "other"));
        signature.add("ethics", sorted(country.map("ethos").orElse(MapValue.EMPTY).strings("ethic")));
        signature.add("civics", sorted(government.strings("civics")));
        return GSON.toJson(signature);
    }

    private static JsonArray sorted(List<String> values) {
        JsonArray array = new JsonArray();
        new TreeSet<>(values).forEach(array::add);
        return array;
    }
}
