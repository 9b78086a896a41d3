package org.starledger.timeline.processors;

import org.starledger.parser.model.MapValue;
import org.starledger.timeline.api.ITimelineProcessor;
import org.starledger.timeline.api.ProcessingContext;
import org.starledger.timeline.model.Entity;
import org.starledger.timeline.model.EntityKind;
import org.starledger.timeline.model.EventKind;
import org.starledger.timeline.model.EventSubject;
import org.starledger.timeline.pipeline.EventHistory;
import org.starledger.timeline.pipeline.Visibility;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns diplomatic relations between real countries into continuous events.
 * <p>
 * Each relation a country holds towards another is an open event with the other country as target. Rivalries
 * and closed borders also produce the reverse event for the target. An event is closed on the day before the
 * first snapshot in which the relation no longer holds, including when one of the countries disappeared.
 */
public class DiplomacyEventsProcessor implements ITimelineProcessor<Void> {

    public static final String ID = "diplomacy_events";

    /**
     * An event kind driven by a relation, with the optional kind recorded for the receiving side.
     */
    record RelationEvent(EventKind kind, EventKind reverse, DiplomacyIndex.Relation relation) {}

    static final List<RelationEvent> RELATION_EVENTS = List.of(
            new RelationEvent(EventKind.SENT_RIVALRY, EventKind.RECEIVED_RIVALRY, DiplomacyIndex.Relation.RIVALRY),
            new RelationEvent(EventKind.CLOSED_BORDERS, EventKind.RECEIVED_CLOSED_BORDERS, DiplomacyIndex.Relation.CLOSED_BORDERS),
            new RelationEvent(EventKind.DEFENSIVE_PACT, null, DiplomacyIndex.Relation.DEFENSIVE_PACT),
            new RelationEvent(EventKind.FORMED_FEDERATION, null, DiplomacyIndex.Relation.FEDERATION),
            new RelationEvent(EventKind.NON_AGGRESSION_PACT, null, DiplomacyIndex.Relation.NON_AGGRESSION_PACT),
            new RelationEvent(EventKind.FIRST_CONTACT, null, DiplomacyIndex.Relation.COMMUNICATIONS),
            new RelationEvent(EventKind.COMMERCIAL_PACT, null, DiplomacyIndex.Relation.COMMERCIAL_PACT),
            new RelationEvent(EventKind.RESEARCH_AGREEMENT, null, DiplomacyIndex.Relation.RESEARCH_AGREEMENT),
            new RelationEvent(EventKind.MIGRATION_TREATY, null, DiplomacyIndex.Relation.MIGRATION_TREATY),
            new RelationEvent(EventKind.EMBASSY, null, DiplomacyIndex.Relation.EMBASSY));

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Set<String> dependencies() {
        return Set.of(DiplomacyProcessor.ID, CountryProcessor.ID, RulerProcessor.ID);
    }

    @Override
    public Void process(ProcessingContext context) {
        EntityIndex countries = context.output(CountryProcessor.ID, EntityIndex.class);
        DiplomacyIndex diplomacy = context.output(DiplomacyProcessor.ID, DiplomacyIndex.class);
        Visibility visibility = Visibility.of(context);
        List<Federation> federations = federations(context.gamestate());

        Map<EventKind, Map<Long, List<EventHistory.Fact>>> facts = new EnumMap<>(EventKind.class);
        for (Entity country : countries.all().values()) {
            if (!CountryProcessor.isRealCountry(country)) {
                continue;
            }
            long countryId = country.sourceId();
            for (RelationEvent relationEvent : RELATION_EVENTS) {
                for (Long target : diplomacy.targets(countryId, relationEvent.relation())) {
                    if (target == countryId || countries.get(target).filter(CountryProcessor::isRealCountry).isEmpty()) {
                        continue;
                    }
                    boolean known = visibility.hasMet(countryId) && visibility.hasMet(target);
                    String description = relationEvent.kind() == EventKind.FORMED_FEDERATION
                            ? federationName(federations, countryId, target) : null;
                    add(facts, relationEvent.kind(), countryId, target, description, known);
                    if (relationEvent.reverse() != null) {
                        add(facts, relationEvent.reverse(), target, countryId, null, known);
                    }
                }
            }
        }

        List<EventKind> kinds = new ArrayList<>();
        for (RelationEvent relationEvent : RELATION_EVENTS) {
            kinds.add(relationEvent.kind());
            if (relationEvent.reverse() != null) {
                kinds.add(relationEvent.reverse());
            }
        }
        for (Entity country : context.transaction().entities(EntityKind.COUNTRY)) {
            if (!CountryProcessor.isRealCountry(country)) {
                continue;
            }
            for (EventKind kind : kinds) {
                List<EventHistory.Fact> current = facts.getOrDefault(kind, Map.of())
                        .getOrDefault(country.sourceId(), List.of());
                EventHistory.reconcile(context.transaction(), kind, EventSubject.ofCountry(country.sourceId()), current);
            }
        }
        return null;
    }

    private static void add(Map<EventKind, Map<Long, List<EventHistory.Fact>>> facts, EventKind kind, long country,
                            long target, String description, boolean known) {
        facts.computeIfAbsent(kind, k -> new HashMap<>())
                .computeIfAbsent(country, k -> new ArrayList<>())
                .add(new EventHistory.Fact(EventSubject.ofCountry(country).withTargetCountry(target), description, known));
    }

    record Federation(String name, List<Long> members) {}

    private static List<Federation> federations(MapValue gamestate) {
        List<Federation> result = new ArrayList<>();
        for (MapValue federation : gamestate.map("federation").orElse(MapValue.EMPTY).objectsById().values()) {
            result.add(new Federation(Names.render(federation.get("name")), federation.longs("members")));
        }
        return result;
    }

    private static String federationName(List<Federation> federations, long country, long target) {
        for (Federation federation : federations) {
            if (federation.members().contains(country) && federation.members().contains(target)) {
                return federation.name();
            }
        }
        return null;
    }
}
