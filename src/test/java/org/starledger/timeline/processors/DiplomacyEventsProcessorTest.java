package org.starledger.timeline.processors;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.starledger.parser.frontend.parser.FormatException;
import org.starledger.timeline.model.EventKind;
import org.starledger.timeline.model.HistoricalEvent;

import java.util.List;

@Tag("integration")
class DiplomacyEventsProcessorTest {

    private SnapshotScenario scenario;

    @BeforeEach
    void setUp() {
        scenario = new SnapshotScenario("diplomacy-test");
    }

    @AfterEach
    void tearDown() {
        scenario.close();
    }

    /**
     * Countries 0 (observer) and 1 in contact, plus a primitive country 2 that country 0 rivals.
     *
     * @param alphaTowardsBeta Relation flags of country 0 towards country 1.
     * @param betaTowardsAlpha Relation flags of country 1 towards country 0.
     */
    private static String snapshot(String date, String alphaTowardsBeta, String betaTowardsAlpha) {
        return """
                date="%s"
                player={ { name="Ada" country=0 } }
                country={
                  0={ name="Alpha" type=default relations_manager={
                      relation={ country=1 communications=yes %s }
                      relation={ country=2 is_rival=yes } } }
                  1={ name="Beta" type=default relations_manager={ relation={ country=0 communications=yes %s } } }
                  2={ name="Gamma" type=primitive }
                }
                """.formatted(date, alphaTowardsBeta, betaTowardsAlpha);
    }

    private void importHistory() throws FormatException {
        scenario.importText(snapshot("2200.01.01", "is_rival=yes", "closed_borders=yes"));
        scenario.importText(snapshot("2200.02.01", "is_rival=yes", "closed_borders=yes"));
        scenario.importText(snapshot("2200.03.01", "", "closed_borders=yes"));
    }

    @Test
    @DisplayName("a rivalry is sent by one country, received by the other and ends the day before it is gone")
    void rivalryIsRecordedOnBothSides() throws FormatException {
        importHistory();

        List<HistoricalEvent> sent = scenario.events(EventKind.SENT_RIVALRY);
        assertThat(sent).hasSize(1);
        assertThat(sent.get(0).subject().country()).isZero();
        assertThat(sent.get(0).subject().targetCountry()).isEqualTo(1L);
        assertThat(sent.get(0).startDay()).isZero();
        assertThat(sent.get(0).endDay()).hasValue(59);
        assertThat(sent.get(0).knownToObserver()).isTrue();

        List<HistoricalEvent> received = scenario.events(EventKind.RECEIVED_RIVALRY);
        assertThat(received).hasSize(1);
        assertThat(received.get(0).subject().country()).isEqualTo(1L);
        assertThat(received.get(0).subject().targetCountry()).isZero();
        assertThat(received.get(0).endDay()).hasValue(59);
    }

    @Test
    void closedBordersStayOpenWhileTheyHold() throws FormatException {
        importHistory();

        List<HistoricalEvent> closed = scenario.events(EventKind.CLOSED_BORDERS);
        assertThat(closed).hasSize(1);
        assertThat(closed.get(0).subject().country()).isEqualTo(1L);
        assertThat(closed.get(0).subject().targetCountry()).isZero();
        assertThat(closed.get(0).isOpen()).isTrue();
        assertThat(closed.get(0).observedUntil()).isEqualTo(60);

        List<HistoricalEvent> received = scenario.events(EventKind.RECEIVED_CLOSED_BORDERS);
        assertThat(received).hasSize(1);
        assertThat(received.get(0).subject().country()).isZero();
        assertThat(received.get(0).subject().targetCountry()).isEqualTo(1L);
        assertThat(received.get(0).isOpen()).isTrue();
    }

    @Test
    void relationsWithCountriesThatDoNotPlayAreIgnored() throws FormatException {
        importHistory();

        assertThat(scenario.allEvents()).noneMatch(e -> Long.valueOf(2L).equals(e.subject().targetCountry()));
    }
}
