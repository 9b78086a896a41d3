package org.starledger.timeline.processors;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
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
import org.starledger.timeline.pipeline.EventHistory;
import org.starledger.timeline.pipeline.Visibility;
import org.starledger.timeline.store.ITimelineTransaction;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Maintains {@code WAR} entities for the wars of the snapshot, keeps a {@code war} event open for each
 * participant and records battles.
 * <p>
 * A war entity stays in progress until {@link TruceProcessor} resolves it; wars that were resolved are not
 * updated again. Battles are identified by system, planet, combat type, victor and the war exhaustion they
 * caused; space battles that caused no exhaustion are ignored. The war entity remembers the identities of the
 * battles it currently lists.
 */
public class WarProcessor implements ITimelineProcessor<EntityIndex> {

    private static final Logger log = LoggerFactory.getLogger(WarProcessor.class);

    public static final String ID = "wars";

    public static final String OUTCOME = "outcome";
    public static final String IN_PROGRESS = "in_progress";
    public static final String PARTICIPANTS = "participants";

    static final String ARMY_COMBAT_TYPE = "armies";
    static final String BATTLES = "battles";

    private static final double MIN_EXHAUSTION = 0.001;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Set<String> dependencies() {
        return Set.of(RulerProcessor.ID, CountryProcessor.ID, SystemProcessor.ID, PlanetModelsProcessor.ID);
    }

    /**
     * @return The in-source ids of the countries taking part in {@code war}.
     */
    public static Set<Long> participants(Entity war) {
        Set<Long> result = new HashSet<>();
        JsonElement participants = war.getJson(PARTICIPANTS);
        if (participants != null && participants.isJsonArray()) {
            participants.getAsJsonArray().forEach(p -> result.add(p.getAsJsonObject().get("country").getAsLong()));
        }
        return result;
    }

    @Override
    public EntityIndex process(ProcessingContext context) {
        EntityIndex countries = context.output(CountryProcessor.ID, EntityIndex.class);
        Visibility visibility = Visibility.of(context);

        EntityIndex index = new EntityIndex(EntityKind.WAR);
        for (Map.Entry<Long, MapValue> entry : context.gamestate().map("war").orElse(MapValue.EMPTY)
                .objectsById().entrySet()) {
            Entity war = context.transaction().getOrCreateEntity(EntityKind.WAR, entry.getKey());
            MapValue data = entry.getValue();
            if (!war.has(OUTCOME)) {
                OptionalInt start = GameDate.tryToDays(data.string("start_date", ""));
                war.set("start_day", start.orElse(context.day()));
                war.set(OUTCOME, IN_PROGRESS);
            } else if (!IN_PROGRESS.equals(war.getString(OUTCOME).orElse(""))) {
                continue;
            }
            war.set("name", Names.render(data.get("name")));
            war.set("attacker_war_exhaustion", data.doubleValue("attacker_war_exhaustion", 0.0));
            war.set("defender_war_exhaustion", data.doubleValue("defender_war_exhaustion", 0.0));
            updateParticipants(context, visibility, war, data, countries);
            recordBattles(context, visibility, war, data);
            index.put(war);
        }
        return index;
    }

    private void updateParticipants(ProcessingContext context, Visibility visibility, Entity war, MapValue data,
                                    EntityIndex countries) {
        String attackerGoal = data.map("attacker_war_goal").flatMap(g -> g.string("type")).orElse(null);
        String defenderGoal = data.map("defender_war_goal").flatMap(g -> g.string("type")).orElse(null);

        JsonArray participants = new JsonArray();
        List<EventHistory.Fact> facts = new ArrayList<>();
        for (String side : List.of("attackers", "defenders")) {
            boolean attacker = side.equals("attackers");
            for (MapValue party : data.maps(side)) {
                OptionalLong country = party.longValue("country");
                if (country.isEmpty() || !countries.contains(country.getAsLong())) {
                    log.warn("{} Could not find country matching war participant {}", context.snapshot().logPrefix(), party);
                    continue;
                }
                OptionalLong callerId = party.longValue("caller");
                Long caller = callerId.isPresent() && countries.contains(callerId.getAsLong()) ? callerId.getAsLong() : null;
                String callType = party.string("call_type", "unknown");

                JsonObject participant = new JsonObject();
                participant.addProperty("country", country.getAsLong());
                participant.addProperty("attacker", attacker);
                participant.addProperty("call_type", callType);
                participant.addProperty("caller", caller);
                participant.addProperty("war_goal", attacker ? attackerGoal : defenderGoal);
                participants.add(participant);

                facts.add(new EventHistory.Fact(EventSubject.ofCountry(country.getAsLong()).withTargetCountry(caller)
                        .withWar(war.sourceId()), callType, visibility.hasMet(country.getAsLong())));
            }
        }
        war.setJson(PARTICIPANTS, participants);
        EventHistory.reconcile(context.transaction(), EventKind.WAR, EventSubject.NONE.withWar(war.sourceId()), facts);
    }

    private void recordBattles(ProcessingContext context, Visibility visibility, Entity war, MapValue data) {
        SystemIndex systems = context.output(SystemProcessor.ID, SystemIndex.class);
        EntityIndex planets = context.output(PlanetModelsProcessor.ID, EntityIndex.class);
        ITimelineTransaction tx = context.transaction();

        JsonElement stored = war.getJson(BATTLES);
        Set<String> recorded = new HashSet<>();
        if (stored != null && stored.isJsonArray()) {
            stored.getAsJsonArray().forEach(k -> recorded.add(k.getAsString()));
        }
        JsonArray current = new JsonArray();
        Set<String> currentKeys = new HashSet<>();

        for (MapValue battle : data.maps("battles")) {
            List<Long> attackers = battle.longs("attackers");
            List<Long> defenders = battle.longs("defenders");
            Optional<String> victory = battle.string("attacker_victory");
            if (attackers.isEmpty() || defenders.isEmpty() || victory.isEmpty()
                    || !(victory.get().equals("yes") || victory.get().equals("no"))) {
                continue;
            }
            OptionalLong planetId = battle.longValue("planet");
            Optional<Entity> planet = planetId.isPresent() ? planets.get(planetId.getAsLong()) : Optional.empty();
            Long system;
            if (planet.isPresent() && planet.get().getLong("system").isPresent()) {
                system = planet.get().getLong("system").getAsLong();
            } else {
                OptionalLong systemId = battle.longValue("system");
                if (systemId.isEmpty() || !systems.systems().contains(systemId.getAsLong())) {
                    continue;
                }
                system = systemId.getAsLong();
            }

            String type = battle.string("type", "other");
            double attackerExhaustion = battle.doubleValue("attacker_war_exhaustion", 0.0);
            double defenderExhaustion = battle.doubleValue("defender_war_exhaustion", 0.0);
            boolean armies = ARMY_COMBAT_TYPE.equals(type);
            if (attackerExhaustion + defenderExhaustion <= MIN_EXHAUSTION && !armies) {
                continue;
            }
            Long planetRef = planet.map(Entity::sourceId).orElse(null);
            String key = system + "|" + planetRef + "|" + type + "|" + victory.get() + "|" + attackerExhaustion + "|"
                    + defenderExhaustion;
            if (!currentKeys.add(key)) {
                continue;
            }
            current.add(key);
            if (recorded.contains(key)) {
                continue;
            }

            int day = GameDate.tryToDays(battle.string("date", "")).orElse(context.day());
            if (day < 0) {
                day = context.day();
            }
            boolean known = false;
            List<Long> combatants = new ArrayList<>(attackers);
            combatants.addAll(defenders);
            for (Long country : combatants) {
                known |= visibility.hasMet(country);
            }
            JsonObject description = new JsonObject();
            description.addProperty("type", type);
            description.addProperty("attacker_victory", victory.get().equals("yes"));
            description.add("attackers", ids(attackers));
            description.add("defenders", ids(defenders));
            description.addProperty("attacker_war_exhaustion", attackerExhaustion);
            description.addProperty("defender_war_exhaustion", defenderExhaustion);
            EventHistory.recordMomentary(tx, armies ? EventKind.ARMY_COMBAT : EventKind.FLEET_COMBAT,
                    EventSubject.NONE.withWar(war.sourceId()).withSystem(system).withPlanet(planetRef),
                    description.toString(), Math.min(day, context.day()), null, known);
        }
        war.setJson(BATTLES, current);
    }

    private static JsonArray ids(List<Long> ids) {
        JsonArray array = new JsonArray();
        ids.forEach(array::add);
        return array;
    }
}
