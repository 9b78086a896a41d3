package org.starledger.timeline.processors;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.starledger.parser.model.GameDate;
import org.starledger.parser.model.MapValue;
import org.starledger.parser.model.Value;
import org.starledger.timeline.api.ITimelineProcessor;
import org.starledger.timeline.api.ProcessingContext;
import org.starledger.timeline.model.Disclosure;
import org.starledger.timeline.model.Entity;
import org.starledger.timeline.model.EventKind;
import org.starledger.timeline.model.EventSubject;
import org.starledger.timeline.pipeline.EventHistory;
import org.starledger.timeline.pipeline.Visibility;
import org.starledger.timeline.store.ITimelineTransaction;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Tracks research leaders per research area and records completed technologies.
 * <p>
 * A technology is remembered on the country while it is at the head of a research queue and recorded as
 * researched once it shows up in the completed list, spanning from the day it was queued to the day before
 * completion was observed. A technology that leaves every queue without being completed is forgotten.
 * Repeatable technologies carry a {@code _level_N} suffix.
 */
public class ScientistEventsProcessor implements ITimelineProcessor<Void> {

    public static final String ID = "scientist_events";

    public static final List<String> RESEARCH_AREAS = List.of("physics", "society", "engineering");

    static final String RESEARCH_IN_PROGRESS = "research_in_progress";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Set<String> dependencies() {
        return Set.of(CountryProcessor.ID, LeaderProcessor.ID);
    }

    @Override
    public Void process(ProcessingContext context) {
        EntityIndex countries = context.output(CountryProcessor.ID, EntityIndex.class);
        EntityIndex leaders = context.output(LeaderProcessor.ID, EntityIndex.class);
        MapValue countryData = context.gamestate().map("country").orElse(MapValue.EMPTY);
        Visibility visibility = Visibility.of(context);

        for (Entity country : countries.all().values()) {
            Optional<MapValue> techStatus = countryData.map(country.sourceId()).flatMap(c -> c.map("tech_status"));
            if (techStatus.isEmpty()) {
                continue;
            }
            boolean known = visibility.reveals(country.sourceId(), Disclosure.TECHNOLOGY);
            Map<String, Long> researchLeaders = updateResearchLeaders(context.transaction(), country, techStatus.get(),
                    leaders, known);
            updateTechnologies(context, country, techStatus.get(), researchLeaders, known);
        }
        return null;
    }

    private Map<String, Long> updateResearchLeaders(ITimelineTransaction tx, Entity country, MapValue techStatus,
                                                    EntityIndex leaders, boolean known) {
        MapValue assigned = techStatus.map("leaders").orElse(MapValue.EMPTY);
        Map<String, Long> result = new HashMap<>();
        List<EventHistory.Fact> facts = new ArrayList<>();
        for (String area : RESEARCH_AREAS) {
            OptionalLong leader = assigned.longValue(area);
            if (leader.isPresent() && leaders.contains(leader.getAsLong())) {
                result.put(area, leader.getAsLong());
                facts.add(new EventHistory.Fact(
                        EventSubject.ofCountry(country.sourceId()).withLeader(leader.getAsLong()), area, known));
            }
        }
        EventHistory.reconcile(tx, EventKind.RESEARCH_LEADER, EventSubject.ofCountry(country.sourceId()), facts);
        return result;
    }

    private void updateTechnologies(ProcessingContext context, Entity country, MapValue techStatus,
                                    Map<String, Long> researchLeaders, boolean known) {
        Set<String> completed = completedTechnologies(techStatus);
        JsonElement stored = country.getJson(RESEARCH_IN_PROGRESS);
        JsonObject inProgress = stored != null && stored.isJsonObject() ? stored.getAsJsonObject() : new JsonObject();

        Set<String> queued = new HashSet<>();
        for (String area : RESEARCH_AREAS) {
            List<Value> queue = techStatus.list(area + "_queue");
            for (Value element : queue) {
                element.asMap().ifPresent(q -> q.string("technology").ifPresent(
                        t -> queued.add(levelled(t, q.longValue("level").orElse(1)))));
            }
            Optional<MapValue> head = queue.stream().findFirst().flatMap(Value::asMap);
            if (head.isEmpty()) {
                continue;
            }
            Optional<String> technology = head.get().string("technology");
            if (technology.isEmpty()) {
                continue;
            }
            String name = levelled(technology.get(), head.get().longValue("level").orElse(1));
            if (completed.contains(name) || inProgress.has(name)) {
                continue;
            }
            Optional<String> date = head.get().string("date");
            OptionalInt queuedOn = date.isPresent() ? GameDate.tryToDays(date.get()) : OptionalInt.empty();
            int start = queuedOn.orElse(context.day());
            JsonObject entry = new JsonObject();
            entry.addProperty("start", Math.min(start, context.day()));
            entry.addProperty("area", area);
            inProgress.add(name, entry);
        }

        JsonObject remaining = new JsonObject();
        for (Map.Entry<String, JsonElement> entry : inProgress.entrySet()) {
            if (!completed.contains(entry.getKey())) {
                if (queued.contains(entry.getKey())) {
                    remaining.add(entry.getKey(), entry.getValue());
                }
                continue;
            }
            JsonObject research = entry.getValue().getAsJsonObject();
            int start = research.get("start").getAsInt();
            Long leader = researchLeaders.get(research.get("area").getAsString());
            EventHistory.recordMomentary(context.transaction(), EventKind.RESEARCHED_TECHNOLOGY,
                    EventSubject.ofCountry(country.sourceId()).withLeader(leader), entry.getKey(), start,
                    context.day() - 1, known);
        }
        country.setJson(RESEARCH_IN_PROGRESS, remaining);
    }

    private static Set<String> completedTechnologies(MapValue techStatus) {
        List<String> technologies = techStatus.strings("technology");
        List<Long> levels = techStatus.longs("level");
        Set<String> completed = new HashSet<>();
        for (int i = 0; i < technologies.size(); i++) {
            completed.add(levelled(technologies.get(i), i < levels.size() ? levels.get(i) : 1));
        }
        return completed;
    }

    static String levelled(String technology, long level) {
        return level > 1 ? technology + "_level_" + level : technology;
    }
}
