package org.starledger.timeline.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.starledger.timeline.model.EventFilter;
import org.starledger.timeline.model.EventKind;
import org.starledger.timeline.model.EventSubject;
import org.starledger.timeline.model.HistoricalEvent;
import org.starledger.timeline.store.ITimelineTransaction;
import org.starledger.timeline.store.h2.H2TimelineStore;
import org.starledger.timeline.store.h2.InMemoryStores;

import java.util.List;
import java.util.function.Consumer;

@Tag("integration")
class EventHistoryTest {

    private static final EventSubject RULER = EventSubject.ofCountry(1).withLeader(10L);

    private H2TimelineStore store;

    @BeforeEach
    void setUp() {
        store = InMemoryStores.create("history-test");
        store.getOrCreateSeries("s");
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private void snapshot(int day, Consumer<ITimelineTransaction> writes) {
        try (ITimelineTransaction tx = store.begin("s", day)) {
            writes.accept(tx);
            tx.commit();
        }
    }

    private List<HistoricalEvent> events(EventKind kind) {
        return store.events("s", EventFilter.all().withKind(kind));
    }

    @Test
    void continuousFactIsExtendedWhileItHolds() {
        EventHistory.Fact fact = new EventHistory.Fact(RULER, null, true);
        snapshot(0, tx -> EventHistory.extendOrOpen(tx, EventKind.RULED_EMPIRE, fact));
        snapshot(30, tx -> EventHistory.extendOrOpen(tx, EventKind.RULED_EMPIRE, fact));

        List<HistoricalEvent> events = events(EventKind.RULED_EMPIRE);
        assertThat(events).hasSize(1);
        assertThat(events.get(0).startDay()).isZero();
        assertThat(events.get(0).isOpen()).isTrue();
        assertThat(events.get(0).observedUntil()).isEqualTo(30);
    }

    @Test
    void reopenedFactNeverStartsBeforeTheEarlierEnd() {
        EventHistory.Fact fact = new EventHistory.Fact(RULER, null, true);
        snapshot(0, tx -> EventHistory.extendOrOpen(tx, EventKind.RULED_EMPIRE, fact));
        snapshot(30, tx -> EventHistory.closeAll(tx, EventKind.RULED_EMPIRE, EventSubject.ofCountry(1)));
        snapshot(60, tx -> EventHistory.extendOrOpen(tx, EventKind.RULED_EMPIRE, fact, 5));

        List<HistoricalEvent> events = events(EventKind.RULED_EMPIRE);
        assertThat(events).hasSize(2);
        assertThat(events.get(0).endDay()).hasValue(29);
        assertThat(events.get(1).startDay()).isEqualTo(30);
        assertThat(events.get(1).isOpen()).isTrue();
    }

    @Test
    void reconcileClosesFactsThatStoppedHolding() {
        EventSubject pattern = EventSubject.ofCountry(1);
        EventHistory.Fact physics = new EventHistory.Fact(pattern.withLeader(10L), "physics", true);
        EventHistory.Fact society = new EventHistory.Fact(pattern.withLeader(11L), "society", true);
        EventHistory.Fact physicsByOther = new EventHistory.Fact(pattern.withLeader(12L), "physics", true);

        snapshot(0, tx -> EventHistory.reconcile(tx, EventKind.RESEARCH_LEADER, pattern, List.of(physics, society)));
        snapshot(30, tx -> EventHistory.reconcile(tx, EventKind.RESEARCH_LEADER, pattern,
                List.of(physicsByOther, society)));

        List<HistoricalEvent> events = events(EventKind.RESEARCH_LEADER);
        assertThat(events).hasSize(3);
        HistoricalEvent closed = events.stream().filter(e -> e.subject().leader() == 10L).findFirst().orElseThrow();
        assertThat(closed.endDay()).hasValue(29);
        HistoricalEvent kept = events.stream().filter(e -> e.subject().leader() == 11L).findFirst().orElseThrow();
        assertThat(kept.isOpen()).isTrue();
        assertThat(kept.startDay()).isZero();
        HistoricalEvent opened = events.stream().filter(e -> e.subject().leader() == 12L).findFirst().orElseThrow();
        assertThat(opened.startDay()).isEqualTo(30);
    }

    @Test
    void closeAndOpenReplacesTheOpenEvent() {
        EventSubject pattern = EventSubject.ofCountry(1);
        snapshot(0, tx -> EventHistory.closeAndOpen(tx, EventKind.GOVERNMENT, pattern,
                new EventHistory.Fact(pattern, "democracy", true)));
        snapshot(30, tx -> EventHistory.closeAndOpen(tx, EventKind.GOVERNMENT, pattern,
                new EventHistory.Fact(pattern, "oligarchy", true)));

        assertThat(events(EventKind.GOVERNMENT))
                .extracting(e -> e.description().orElseThrow() + "@" + e.startDay() + "-"
                        + (e.isOpen() ? "open" : e.endDay().getAsInt()))
                .containsExactly("democracy@0-29", "oligarchy@30-open");
    }

    @Test
    void momentaryEventsAreRecordedOnceAndWidened() {
        EventSubject subject = EventSubject.ofCountry(4);
        snapshot(0, tx -> EventHistory.recordMomentary(tx, EventKind.TRADITION, subject, "tr_expansion", 0, null,
                false));
        snapshot(30, tx -> {
            HistoricalEvent again = EventHistory.recordMomentary(tx, EventKind.TRADITION, subject, "tr_expansion",
                    0, null, true);
            assertThat(again.knownToObserver()).isTrue();
            EventHistory.recordMomentary(tx, EventKind.TRADITION, subject, "tr_expansion", 0, null, false);
        });

        List<HistoricalEvent> events = events(EventKind.TRADITION);
        assertThat(events).hasSize(1);
        assertThat(events.get(0).knownToObserver()).isTrue();
        assertThat(events.get(0).endDay()).hasValue(0);
    }

    @Test
    void momentaryEndIsClampedToStart() {
        snapshot(40, tx -> EventHistory.recordMomentary(tx, EventKind.EDICT, EventSubject.ofCountry(1), "edict",
                40, 20, true));

        assertThat(events(EventKind.EDICT).get(0).endDay()).hasValue(40);
    }

    @Test
    void shapeMismatchIsRejected() {
        try (ITimelineTransaction tx = store.begin("s", 0)) {
            assertThatThrownBy(() -> EventHistory.recordMomentary(tx, EventKind.WAR, EventSubject.NONE, null, 0,
                    null, true)).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("continuous");
            assertThatThrownBy(() -> EventHistory.extendOrOpen(tx, EventKind.PEACE,
                    new EventHistory.Fact(EventSubject.NONE, null, true)))
                    .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("momentary");
        }
    }

    @Test
    void wasRecordedRequiresExactSubject() {
        snapshot(0, tx -> EventHistory.recordMomentary(tx, EventKind.LEADER_DIED, RULER, null, 0, null, true));

        try (ITimelineTransaction tx = store.begin("s", 10)) {
            assertThat(EventHistory.wasRecorded(tx, EventKind.LEADER_DIED, RULER)).isTrue();
            assertThat(EventHistory.wasRecorded(tx, EventKind.LEADER_DIED, EventSubject.ofCountry(1))).isFalse();
        }
    }
}
