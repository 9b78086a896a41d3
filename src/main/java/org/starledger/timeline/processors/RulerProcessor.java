package org.starledger.timeline.processors;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.starledger.parser.model.GameDate;
import org.starledger.parser.model.MapValue;
import org.starledger.timeline.api.ITimelineProcessor;
import org.starledger.timeline.api.ProcessingContext;
import org.starledger.timeline.model.Disclosure;
import org.starledger.timeline.model.Entity;
import org.starledger.timeline.model.EventKind;
import org.starledger.timeline.model.EventSubject;
import org.starledger.timeline.model.HistoricalEvent;
import org.starledger.timeline.pipeline.EventHistory;
import org.starledger.timeline.pipeline.Visibility;
import org.starledger.timeline.store.ITimelineTransaction;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Tracks each country's ruler and capital, and records adopted traditions, ascension perks and edicts.
 * <p>
 * The ruler is a continuous fact per country; the event keeps the capital that was current when the ruler
 * took over. Traditions and ascension perks are recorded once when they first appear. An edict is recorded
 * each time it is activated, with its expiry day as end unless it is perpetual.
 */
public class RulerProcessor implements ITimelineProcessor<IdLookup> {

    private static final Logger log = LoggerFactory.getLogger(RulerProcessor.class);

    public static final String ID = "ruler";

    static final String CAPITAL = "capital";
    static final String TRADITIONS = "traditions";
    static final String ASCENSION_PERKS = "ascension_perks";
    static final String EDICTS = "edicts";

    private static final int PERPETUAL = -1;
    private static final String NO_EXPIRY_DATE = "1.01.01";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Set<String> dependencies() {
        return Set.of(CountryProcessor.ID, LeaderProcessor.ID, PlanetModelsProcessor.ID);
    }

    @Override
    public IdLookup process(ProcessingContext context) {
        EntityIndex countries = context.output(CountryProcessor.ID, EntityIndex.class);
        EntityIndex leaders = context.output(LeaderProcessor.ID, EntityIndex.class);
        EntityIndex planets = context.output(PlanetModelsProcessor.ID, EntityIndex.class);
        MapValue countryData = context.gamestate().map("country").orElse(MapValue.EMPTY);
        Visibility visibility = Visibility.of(context);

        Map<Long, Long> rulers = new HashMap<>();
        for (Entity country : countries.all().values()) {
            MapValue data = countryData.map(country.sourceId()).orElse(MapValue.EMPTY);
            OptionalLong rulerId = data.longValue("ruler");
            Long ruler = rulerId.isPresent() && leaders.contains(rulerId.getAsLong()) ? rulerId.getAsLong() : null;
            if (rulerId.isEmpty() && CountryProcessor.isRealCountry(country)) {
                log.info("{} Country {} has no ruler id", context.snapshot().logPrefix(), country.sourceId());
            }
            if (ruler != null) {
                rulers.put(country.sourceId(), ruler);
            }
            Optional<Entity> capital = updateCapital(context, visibility, country, ruler, data, planets);
            updateRuler(context.transaction(), visibility, country, ruler, capital);
            recordAdoptions(context, country, ruler, data.strings(TRADITIONS), TRADITIONS, EventKind.TRADITION,
                    visibility.reveals(country.sourceId(), Disclosure.ECONOMY));
            recordAdoptions(context, country, ruler, data.strings(ASCENSION_PERKS), ASCENSION_PERKS,
                    EventKind.ASCENSION_PERK, visibility.hasMet(country.sourceId()));
            recordEdicts(context, country, ruler, data, visibility.reveals(country.sourceId(), Disclosure.ECONOMY));
        }
        return new IdLookup(rulers);
    }

    private Optional<Entity> updateCapital(ProcessingContext context, Visibility visibility, Entity country, Long ruler,
                                           MapValue data, EntityIndex planets) {
        OptionalLong capitalId = data.longValue(CAPITAL);
        Optional<Entity> capital = capitalId.isPresent() ? planets.get(capitalId.getAsLong()) : Optional.empty();
        if (capital.isEmpty()) {
            return capital;
        }
        if (country.set(CAPITAL, capital.get().sourceId())) {
            EventHistory.recordMomentary(context.transaction(), EventKind.CAPITAL_RELOCATION,
                    planetSubject(country.sourceId(), ruler, capital), null, context.day(), null,
                    visibility.hasMet(country.sourceId()));
        }
        return capital;
    }

    private void updateRuler(ITimelineTransaction tx, Visibility visibility, Entity country, Long ruler,
                             Optional<Entity> capital) {
        boolean known = visibility.hasMet(country.sourceId());
        boolean holding = false;
        for (HistoricalEvent open : tx.findEvents(EventKind.RULED_EMPIRE, EventSubject.ofCountry(country.sourceId()), true)) {
            if (ruler != null && ruler.equals(open.subject().leader())) {
                open.extendTo(tx.day());
                open.widenVisibility(known);
                tx.updateEvent(open);
                holding = true;
            } else {
                open.widenVisibility(known);
                EventHistory.close(tx, open);
            }
        }
        if (ruler != null && !holding) {
            EventHistory.extendOrOpen(tx, EventKind.RULED_EMPIRE,
                    new EventHistory.Fact(planetSubject(country.sourceId(), ruler, capital), null, known));
        }
    }

    /**
     * Records the entries of {@code current} that were not adopted before and remembers them on the country.
     */
    private void recordAdoptions(ProcessingContext context, Entity country, Long ruler, List<String> current,
                                 String attribute, EventKind kind, boolean known) {
        List<String> adopted = country.getStrings(attribute);
        List<String> all = new ArrayList<>(adopted);
        for (String entry : current) {
            if (!adopted.contains(entry)) {
                EventHistory.recordMomentary(context.transaction(), kind,
                        EventSubject.ofCountry(country.sourceId()).withLeader(ruler), entry, context.day(), null, known);
                all.add(entry);
            }
        }
        country.setStrings(attribute, all);
    }

    private void recordEdicts(ProcessingContext context, Entity country, Long ruler, MapValue data, boolean known) {
        JsonElement stored = country.getJson(EDICTS);
        JsonObject previous = stored != null && stored.isJsonObject() ? stored.getAsJsonObject() : new JsonObject();
        JsonObject active = new JsonObject();
        for (MapValue edict : data.maps("edicts")) {
            Optional<String> name = edict.string("edict");
            if (name.isEmpty()) {
                continue;
            }
            int expiry = expiry(edict);
            active.addProperty(name.get(), expiry);
            if (previous.has(name.get()) && previous.get(name.get()).getAsInt() == expiry) {
                continue;
            }
            EventHistory.recordMomentary(context.transaction(), EventKind.EDICT,
                    EventSubject.ofCountry(country.sourceId()).withLeader(ruler), name.get(), context.day(),
                    expiry == PERPETUAL ? null : expiry, known);
        }
        country.setJson(EDICTS, active);
    }

    private static int expiry(MapValue edict) {
        Optional<String> date = edict.string("date");
        if (date.isEmpty() || NO_EXPIRY_DATE.equals(date.get()) || edict.isYes("perpetual")) {
            return PERPETUAL;
        }
        OptionalInt days = GameDate.tryToDays(date.get());
        return days.isPresent() ? Math.max(days.getAsInt(), 0) : PERPETUAL;
    }

    private static EventSubject planetSubject(long country, Long ruler, Optional<Entity> capital) {
        EventSubject subject = EventSubject.ofCountry(country).withLeader(ruler);
        if (capital.isPresent()) {
            OptionalLong system = capital.get().getLong("system");
            subject = subject.withPlanet(capital.get().sourceId())
                    .withSystem(system.isPresent() ? system.getAsLong() : null);
        }
        return subject;
    }
}
