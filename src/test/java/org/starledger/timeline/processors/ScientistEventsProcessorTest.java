package org.starledger.timeline.processors;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.starledger.parser.frontend.parser.FormatException;
import org.starledger.timeline.model.EntityKind;
import org.starledger.timeline.model.EventKind;
import org.starledger.timeline.model.HistoricalEvent;

import java.util.List;

@Tag("integration")
class ScientistEventsProcessorTest {

    private SnapshotScenario scenario;

    @BeforeEach
    void setUp() {
        scenario = new SnapshotScenario("research-test");
    }

    @AfterEach
    void tearDown() {
        scenario.close();
    }

    /**
     * The observer country 0 with leader 10 heading physics research.
     *
     * @param techStatus Completed technologies and research queues.
     */
    private static String snapshot(String date, String techStatus) {
        return """
                date="%s"
                player={ { name="Ada" country=0 } }
                species_db={ 5={ name="Human" class="HUM" } }
                leaders={ 10={ name={ first_name="Grace" } species=5 level=1 } }
                country={ 0={ name="Alpha" type=default owned_leaders={ 10 }
                    tech_status={ leaders={ physics=10 } %s } } }
                """.formatted(date, techStatus);
    }

    private void importResearch() throws FormatException {
        scenario.importText(snapshot("2200.01.01", """
                technology="tech_lasers_1" level=1
                physics_queue={ { technology="tech_lasers_2" } }
                society_queue={ { technology="tech_genome_mapping" } }
                """));
        scenario.importText(snapshot("2200.02.01", """
                technology="tech_lasers_1" level=1 technology="tech_lasers_2" level=1
                physics_queue={ { technology="tech_lasers_3" } }
                society_queue={ }
                engineering_queue={ { technology="tech_repeatable_weapon" level=3 } }
                """));
        scenario.importText(snapshot("2200.03.01", """
                technology="tech_lasers_1" level=1 technology="tech_lasers_2" level=1
                technology="tech_repeatable_weapon" level=3
                physics_queue={ { technology="tech_lasers_3" } }
                """));
    }

    @Test
    @DisplayName("a technology spans from being queued to the day before its completion was seen")
    void researchedTechnologies() throws FormatException {
        importResearch();

        List<HistoricalEvent> researched = scenario.events(EventKind.RESEARCHED_TECHNOLOGY);
        assertThat(researched).extracting(e -> e.description().orElseThrow())
                .containsExactly("tech_lasers_2", "tech_repeatable_weapon_level_3");
        assertThat(researched.get(0).startDay()).isZero();
        assertThat(researched.get(0).endDay()).hasValue(29);
        assertThat(researched.get(0).subject().leader()).isEqualTo(10L);
        assertThat(researched.get(1).startDay()).isEqualTo(30);
        assertThat(researched.get(1).endDay()).hasValue(59);
        assertThat(researched.get(1).subject().leader()).isNull();
    }

    @Test
    @DisplayName("only technologies that are still queued are remembered as in progress")
    void abandonedResearchIsForgotten() throws FormatException {
        importResearch();

        assertThat(scenario.entity(EntityKind.COUNTRY, 0).getJson(ScientistEventsProcessor.RESEARCH_IN_PROGRESS)
                .getAsJsonObject().keySet()).containsExactly("tech_lasers_3");
    }

    @Test
    void researchLeaderIsOpenWhileAssigned() throws FormatException {
        importResearch();

        List<HistoricalEvent> leaders = scenario.events(EventKind.RESEARCH_LEADER);
        assertThat(leaders).hasSize(1);
        assertThat(leaders.get(0).description()).hasValue("physics");
        assertThat(leaders.get(0).isOpen()).isTrue();
    }
}
