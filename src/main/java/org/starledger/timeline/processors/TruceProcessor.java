package org.starledger.timeline.processors;

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
 * Resolves wars that disappeared from the snapshot.
 * <p>
 * A vanished war whose participants are exactly the parties of a war truce ended when the truce started.
 * Any other vanished war ended on the day before the current snapshot with an unknown resolution. Resolving
 * a war closes its participants' {@code war} events and records a {@code peace} event for each of them.
 */
public class TruceProcessor implements ITimelineProcessor<Void> {

    public static final String ID = "truces";

    public static final String TRUCE = "truce";
    public static final String RESOLUTION_UNKNOWN = "resolution_unknown";

    private static final String WAR_TRUCE_TYPE = "war";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Set<String> dependencies() {
        return Set.of(CountryProcessor.ID, RulerProcessor.ID, DiplomacyProcessor.ID, WarProcessor.ID);
    }

    @Override
    public Void process(ProcessingContext context) {
        EntityIndex activeWars = context.output(WarProcessor.ID, EntityIndex.class);
        IdLookup rulers = context.output(RulerProcessor.ID, IdLookup.class);
        DiplomacyIndex diplomacy = context.output(DiplomacyProcessor.ID, DiplomacyIndex.class);
        MapValue truces = context.gamestate().map("truce").orElse(MapValue.EMPTY);

        List<Entity> unresolved = new ArrayList<>();
        for (Entity war : context.transaction().entities(EntityKind.WAR)) {
            if (WarProcessor.IN_PROGRESS.equals(war.getString(WarProcessor.OUTCOME).orElse(""))
                    && !activeWars.contains(war.sourceId())) {
                unresolved.add(war);
            }
        }

        for (Map.Entry<Long, Set<Long>> truce : diplomacy.truceParties().entrySet()) {
            Optional<MapValue> info = truces.map(truce.getKey());
            if (info.isEmpty() || !WAR_TRUCE_TYPE.equals(info.get().string("truce_type", "other"))) {
                continue;
            }
            Optional<Entity> war = unresolved.stream()
                    .filter(w -> WarProcessor.participants(w).equals(truce.getValue()))
                    .findFirst();
            if (war.isEmpty()) {
                continue;
            }
            unresolved.remove(war.get());
            OptionalInt start = GameDate.tryToDays(info.get().string("start_date", "none"));
            resolve(context, war.get(), TRUCE, start.orElse(context.day() - 1), rulers);
        }
        for (Entity war : unresolved) {
            resolve(context, war, RESOLUTION_UNKNOWN, context.day() - 1, rulers);
        }
        return null;
    }

    private void resolve(ProcessingContext context, Entity war, String outcome, int endDay, IdLookup rulers) {
        ITimelineTransaction tx = context.transaction();
        Visibility visibility = Visibility.of(context);
        int startDay = (int) war.getLong("start_day").orElse(0);
        int end = Math.max(Math.min(endDay, context.day()), startDay);
        war.set(WarProcessor.OUTCOME, outcome);
        war.set("end_day", end);
        for (HistoricalEvent open : tx.findEvents(EventKind.WAR, EventSubject.NONE.withWar(war.sourceId()), true)) {
            EventHistory.closeAt(tx, open, end);
        }
        for (Long country : WarProcessor.participants(war)) {
            EventHistory.recordMomentary(tx, EventKind.PEACE,
                    EventSubject.ofCountry(country).withWar(war.sourceId()).withLeader(rulers.get(country).orElse(null)),
                    outcome, end, null, visibility.hasMet(country));
        }
    }
}
