package org.starledger.timeline.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import com.google.gson.JsonObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.starledger.parser.frontend.parser.FormatException;
import org.starledger.parser.frontend.parser.SnapshotParser;
import org.starledger.parser.model.MapValue;
import org.starledger.timeline.api.ExtractionSettings;
import org.starledger.timeline.api.ITimelineProcessor;
import org.starledger.timeline.api.ProcessingContext;
import org.starledger.timeline.model.EntityKind;
import org.starledger.timeline.model.EventFilter;
import org.starledger.timeline.model.EventKind;
import org.starledger.timeline.model.EventSubject;
import org.starledger.timeline.model.HistoricalEvent;
import org.starledger.timeline.processors.ProcessorRegistry;
import org.starledger.timeline.store.h2.H2TimelineStore;
import org.starledger.timeline.store.h2.InMemoryStores;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Imports small hand-written snapshots through the standard pipeline.
 */
@Tag("integration")
class TimelineExtractorTest {

    private static final String SERIES = "ada_42";

    private H2TimelineStore store;
    private TimelineExtractor extractor;

    @BeforeEach
    void setUp() {
        store = InMemoryStores.create("extractor-test");
        extractor = new TimelineExtractor(store, ProcessorRegistry.standardPipeline(), ExtractionSettings.defaults(), "");
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    /**
     * Two countries, one system and two leaders of the observer country 0.
     *
     * @param date           The snapshot date.
     * @param starbaseFleets Fleet ids of the stations of starbases 50 and 51 in system 1; 100 belongs to country
     *                       0, 101 to country 1. Empty for an unclaimed system.
     * @param physicsLeader  The leader heading physics research.
     */
    private static MapValue snapshot(String date, List<Integer> starbaseFleets, int physicsLeader)
            throws FormatException {
        return snapshot(date, starbaseFleets, physicsLeader, 10);
    }

    private static MapValue snapshot(String date, List<Integer> starbaseFleets, int physicsLeader, int ruler)
            throws FormatException {
        StringBuilder text = new StringBuilder();
        text.append("version=\"Cepheus v3.8.4\"\n");
        text.append("date=\"").append(date).append("\"\n");
        text.append("player={ { name=\"Ada\" country=0 } }\n");
        text.append("species_db={ 5={ name=\"Human\" class=\"HUM\" } }\n");
        text.append("leaders={\n");
        text.append("  10={ name={ first_name=\"Grace\" } species=5 level=2 date=\"2200.01.01\" }\n");
        text.append("  11={ name={ first_name=\"Alan\" } species=5 level=1 date=\"2200.01.01\" }\n");
        text.append("}\n");
        text.append("country={\n");
        text.append("  0={ name=\"Alpha\" type=default ruler=").append(ruler).append(" owned_leaders={ 10 11 }\n");
        text.append("      fleets_manager={ owned_fleets={ { fleet=100 } } }\n");
        text.append("      tech_status={ leaders={ physics=").append(physicsLeader).append(" } } }\n");
        text.append("  1={ name=\"Beta\" type=default fleets_manager={ owned_fleets={ { fleet=101 } } } }\n");
        text.append("}\n");
        StringBuilder starbases = new StringBuilder();
        StringBuilder stations = new StringBuilder();
        StringBuilder ships = new StringBuilder();
        for (int i = starbaseFleets.size() - 1; i >= 0; i--) {
            int starbase = 50 + i;
            int station = 200 + i;
            starbases.append(' ').append(starbase);
            stations.append(' ').append(starbase).append("={ station=").append(station).append(" }");
            ships.append(' ').append(station).append("={ fleet=").append(starbaseFleets.get(i)).append(" }");
        }
        text.append("galactic_object={ 1={ name=\"Sol\" starbases={").append(starbases).append(" } } }\n");
        if (!starbaseFleets.isEmpty()) {
            text.append("starbase_mgr={ starbases={").append(stations).append(" } }\n");
            text.append("ships={").append(ships).append(" }\n");
        }
        return SnapshotParser.parse(text.toString());
    }

    private List<HistoricalEvent> events(EventKind kind) {
        return store.events(SERIES, EventFilter.all().withKind(kind));
    }

    private static String describe(HistoricalEvent event) {
        return event.kind().id() + " " + event.subject() + " " + event.description().orElse("") + " ["
                + event.startDay() + "," + (event.isOpen() ? "open" : event.endDay().getAsInt()) + "] "
                + event.knownToObserver();
    }

    private ImportResult.Status importSnapshot(MapValue gamestate) {
        ImportResult result = extractor.importSnapshot(SERIES, gamestate);
        assertThat(result.cause()).isNull();
        return result.status();
    }

    // ==================== Scenarios ====================

    @Test
    @DisplayName("a system taken over by another country closes the earlier ownership")
    void ownershipChanges() throws FormatException {
        assertThat(importSnapshot(snapshot("2200.01.01", List.of(), 10))).isEqualTo(ImportResult.Status.COMMITTED);
        assertThat(importSnapshot(snapshot("2200.01.11", List.of(100), 10))).isEqualTo(ImportResult.Status.COMMITTED);
        assertThat(importSnapshot(snapshot("2200.01.21", List.of(101), 10))).isEqualTo(ImportResult.Status.COMMITTED);

        List<HistoricalEvent> expanded = events(EventKind.EXPANDED_TO_SYSTEM);
        assertThat(expanded).hasSize(1);
        assertThat(expanded.get(0).subject().country()).isEqualTo(0L);
        assertThat(expanded.get(0).subject().system()).isEqualTo(1L);
        assertThat(expanded.get(0).startDay()).isEqualTo(10);
        assertThat(expanded.get(0).endDay()).hasValue(19);

        List<HistoricalEvent> conquered = events(EventKind.CONQUERED_SYSTEM);
        assertThat(conquered).hasSize(1);
        assertThat(conquered.get(0).subject().country()).isEqualTo(1L);
        assertThat(conquered.get(0).subject().targetCountry()).isEqualTo(0L);
        assertThat(conquered.get(0).startDay()).isEqualTo(20);
        assertThat(conquered.get(0).isOpen()).isTrue();

        List<HistoricalEvent> lost = events(EventKind.LOST_SYSTEM);
        assertThat(lost).hasSize(1);
        assertThat(lost.get(0).subject().country()).isEqualTo(0L);
        assertThat(lost.get(0).subject().targetCountry()).isEqualTo(1L);
        assertThat(lost.get(0).startDay()).isEqualTo(20);
        assertThat(lost.get(0).knownToObserver()).isTrue();

        assertThat(store.findEntity(SERIES, EntityKind.SYSTEM, 1).orElseThrow().getLong("owner")).hasValue(1L);
    }

    @Test
    @DisplayName("a replaced research leader ends on the day before the successor starts")
    void researchLeaderSuccession() throws FormatException {
        importSnapshot(snapshot("2200.01.01", List.of(100), 10));
        importSnapshot(snapshot("2200.02.01", List.of(100), 10));
        importSnapshot(snapshot("2200.02.02", List.of(100), 11));

        List<HistoricalEvent> research = events(EventKind.RESEARCH_LEADER);
        assertThat(research).hasSize(2);
        assertThat(research.get(0).subject().leader()).isEqualTo(10L);
        assertThat(research.get(0).description()).hasValue("physics");
        assertThat(research.get(0).startDay()).isZero();
        assertThat(research.get(0).endDay()).hasValue(30);
        assertThat(research.get(1).subject().leader()).isEqualTo(11L);
        assertThat(research.get(1).startDay()).isEqualTo(31);
        assertThat(research.get(1).isOpen()).isTrue();
    }

    @Test
    void recruitedLeadersAreRecordedOnce() throws FormatException {
        importSnapshot(snapshot("2200.01.01", List.of(100), 10));
        importSnapshot(snapshot("2200.02.01", List.of(100), 10));

        assertThat(events(EventKind.LEADER_RECRUITED)).extracting(e -> e.subject().leader())
                .containsExactly(10L, 11L);
        assertThat(store.findEntity(SERIES, EntityKind.LEADER, 10).orElseThrow().getBoolean("active")).isTrue();
    }

    @Test
    @DisplayName("importing the same snapshot again yields the same history")
    void supersedingIsIdempotent() throws FormatException {
        importSnapshot(snapshot("2200.01.01", List.of(), 10));
        importSnapshot(snapshot("2200.01.11", List.of(100), 10));
        List<String> once = store.events(SERIES, EventFilter.all()).stream()
                .map(TimelineExtractorTest::describe).collect(Collectors.toList());

        assertThat(importSnapshot(snapshot("2200.01.11", List.of(100), 10)))
                .isEqualTo(ImportResult.Status.SUPERSEDED);

        List<String> twice = store.events(SERIES, EventFilter.all()).stream()
                .map(TimelineExtractorTest::describe).collect(Collectors.toList());
        assertThat(twice).containsExactlyInAnyOrderElementsOf(once);
        assertThat(store.snapshotDays(SERIES)).containsExactly(0, 10);
    }

    @Test
    void olderSnapshotIsRejected() throws FormatException {
        importSnapshot(snapshot("2200.01.21", List.of(100), 10));

        ImportResult result = extractor.importSnapshot(SERIES, snapshot("2200.01.11", List.of(101), 10));

        assertThat(result.status()).isEqualTo(ImportResult.Status.REJECTED_STALE);
        assertThat(result.day()).isEqualTo(10);
        assertThat(store.snapshotDays(SERIES)).containsExactly(20);
        assertThat(events(EventKind.CONQUERED_SYSTEM)).isEmpty();
    }

    @Test
    @DisplayName("the lowest starbase id wins a contested system")
    void contestedSystemGoesToLowestStarbase() throws FormatException {
        importSnapshot(snapshot("2200.01.01", List.of(100, 101), 10));

        List<HistoricalEvent> expanded = events(EventKind.EXPANDED_TO_SYSTEM);
        assertThat(expanded).hasSize(1);
        assertThat(expanded.get(0).subject().country()).isEqualTo(0L);
    }

    @Test
    @DisplayName("events of one kind and subject follow each other without overlapping")
    void historiesNeverOverlap() throws FormatException {
        importSnapshot(snapshot("2200.01.01", List.of(100), 10, 10));
        importSnapshot(snapshot("2200.01.11", List.of(101), 11, 11));
        importSnapshot(snapshot("2200.01.21", List.of(), 10, 11));
        importSnapshot(snapshot("2200.03.01", List.of(100), 11, 10));
        importSnapshot(snapshot("2200.03.11", List.of(101), 10, 10));

        Map<String, List<HistoricalEvent>> histories = store.events(SERIES, EventFilter.all()).stream()
                .sorted(Comparator.comparingLong(HistoricalEvent::id))
                .collect(Collectors.groupingBy(e -> e.kind().id() + " " + e.subject()));

        assertThat(histories.get("ruled_empire " + EventSubject.ofCountry(0).withLeader(10L)))
                .extracting(e -> e.startDay() + "-" + (e.isOpen() ? "open" : e.endDay().getAsInt()))
                .containsExactly("0-9", "60-open");
        assertThat(events(EventKind.LOST_SYSTEM)).filteredOn(e -> e.subject().country() == 0L)
                .extracting(HistoricalEvent::startDay).containsExactly(10, 70);
        histories.forEach((key, history) -> {
            for (int i = 0; i < history.size(); i++) {
                HistoricalEvent event = history.get(i);
                assertThat(event.observedUntil()).as(key).isGreaterThanOrEqualTo(event.startDay());
                if (!event.isOpen()) {
                    assertThat(event.endDay().getAsInt()).as(key).isGreaterThanOrEqualTo(event.startDay());
                }
                if (i == 0) {
                    continue;
                }
                HistoricalEvent earlier = history.get(i - 1);
                assertThat(earlier.isOpen()).as(key).isFalse();
                assertThat(earlier.startDay()).as(key).isLessThan(event.startDay());
                assertThat(earlier.endDay().getAsInt()).as(key).isLessThan(event.startDay());
            }
        });
    }

    @Test
    void seriesMetadataDescribesTheObserver() throws FormatException {
        importSnapshot(snapshot("2200.01.01", List.of(100), 10));

        JsonObject metadata = store.findSeries(SERIES).orElseThrow().metadata();
        assertThat(metadata.get("observer_country").getAsLong()).isZero();
        assertThat(metadata.get("observer_country_name").getAsString()).contains("Alpha");
        assertThat(metadata.get("last_date").getAsString()).isEqualTo("2200.01.01");
        assertThat(metadata.get("version").getAsString()).isEqualTo("Cepheus v3.8.4");
    }

    // ==================== Failures ====================

    @Test
    void invalidDateFails() throws FormatException {
        ImportResult result = extractor.importSnapshot(SERIES, SnapshotParser.parse("date=\"someday\""));

        assertThat(result.status()).isEqualTo(ImportResult.Status.FAILED);
        assertThat(result.day()).isEqualTo(-1);
        assertThat(result.cause()).isInstanceOf(IllegalArgumentException.class);
        assertThat(store.findSeries(SERIES)).isEmpty();
    }

    @Test
    void ambiguousMultiplayerObserverFails() throws FormatException {
        MapValue gamestate = SnapshotParser.parse("date=\"2200.01.01\" "
                + "player={ { name=\"Ada\" country=0 } { name=\"Bo\" country=1 } }");

        ImportResult result = extractor.importSnapshot(SERIES, gamestate);

        assertThat(result.status()).isEqualTo(ImportResult.Status.FAILED);
        assertThat(result.day()).isZero();
    }

    @Test
    void failedProcessingLeavesNoTrace() throws FormatException {
        TimelinePipeline failing = new TimelinePipeline().register(new ITimelineProcessor<Void>() {
            @Override
            public String id() {
                return "failing";
            }

            @Override
            public Void process(ProcessingContext context) {
                context.transaction().getOrCreateEntity(EntityKind.COUNTRY, 9).set("name", "x");
                throw new IllegalStateException("boom");
            }
        });
        TimelineExtractor failingExtractor = new TimelineExtractor(store, failing, ExtractionSettings.defaults(), "");

        ImportResult result = failingExtractor.importSnapshot(SERIES, snapshot("2200.01.01", List.of(), 10));

        assertThat(result.status()).isEqualTo(ImportResult.Status.FAILED);
        assertThat(result.cause()).hasMessage("boom");
        assertThat(store.snapshotDays(SERIES)).isEmpty();
        assertThat(store.findEntity(SERIES, EntityKind.COUNTRY, 9)).isEmpty();
    }
}
