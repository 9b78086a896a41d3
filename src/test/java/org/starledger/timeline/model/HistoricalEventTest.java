package org.starledger.timeline.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class HistoricalEventTest {

    private static HistoricalEvent open(int start, int created) {
        return HistoricalEvent.draft(EventKind.RULED_EMPIRE, EventSubject.ofCountry(0).withLeader(5L), null,
                start, null, false, created);
    }

    @Test
    void draftStartsOpenAndObservedOnItsCreationDay() {
        HistoricalEvent event = open(10, 30);

        assertThat(event.id()).isZero();
        assertThat(event.isOpen()).isTrue();
        assertThat(event.endDay()).isEmpty();
        assertThat(event.observedUntil()).isEqualTo(30);
        assertThat(event.description()).isEmpty();
    }

    @Test
    void extendingMovesObservationForwardOnly() {
        HistoricalEvent event = open(0, 0);

        event.extendTo(60);
        event.extendTo(30);

        assertThat(event.observedUntil()).isEqualTo(60);
        assertThat(event.isOpen()).isTrue();
    }

    @Test
    void closeNeverEndsBeforeStart() {
        HistoricalEvent event = open(30, 30);

        event.close(29);

        assertThat(event.endDay()).hasValue(30);
        assertThat(event.observedUntil()).isEqualTo(30);
    }

    @Test
    void closedEventCannotBeExtendedOrClosedAgain() {
        HistoricalEvent event = open(0, 0);
        event.close(10);

        assertThatThrownBy(() -> event.extendTo(20)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> event.close(20)).isInstanceOf(IllegalStateException.class);
        assertThat(event.endDay()).hasValue(10);
    }

    @Test
    void visibilityOnlyWidens() {
        HistoricalEvent event = open(0, 0);

        assertThat(event.widenVisibility(false)).isFalse();
        assertThat(event.widenVisibility(true)).isTrue();
        assertThat(event.widenVisibility(false)).isFalse();
        assertThat(event.knownToObserver()).isTrue();
    }

    @Test
    void withIdKeepsState() {
        HistoricalEvent event = open(0, 0);
        event.close(5);

        HistoricalEvent stored = event.withId(9);

        assertThat(stored.id()).isEqualTo(9);
        assertThat(stored.endDay()).hasValue(5);
        assertThat(stored.subject()).isEqualTo(event.subject());
    }

    @Test
    void kindIdsRoundTrip() {
        assertThat(EventKind.RULED_EMPIRE.id()).isEqualTo("ruled_empire");
        assertThat(EventKind.fromId(" Fleet_Combat ")).isEqualTo(EventKind.FLEET_COMBAT);
        assertThat(EventKind.WAR.isContinuous()).isTrue();
        assertThat(EventKind.PEACE.isContinuous()).isFalse();
        assertThatThrownBy(() -> EventKind.fromId("coup")).isInstanceOf(IllegalArgumentException.class);
    }
}
