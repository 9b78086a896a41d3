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
class PlanetModelsProcessorTest {

    private SnapshotScenario scenario;

    @BeforeEach
    void setUp() {
        scenario = new SnapshotScenario("planet-test");
    }

    @AfterEach
    void tearDown() {
        scenario.close();
    }

    /**
     * The observer country 0 owning planets 20, 21 and 22 of system 1.
     */
    private static String snapshot(String date, String planets) {
        return """
                date="%s"
                player={ { name="Ada" country=0 } }
                country={ 0={ name="Alpha" type=default } }
                galactic_object={ 1={ name="Sol" planet={ 20 21 22 } } }
                planets={ planet={ %s } }
                """.formatted(date, planets);
    }

    private void importFirstMonth() throws FormatException {
        scenario.importText(snapshot("2200.01.01", """
                20={ name="Mars" planet_class="pc_arid" owner=0 is_under_colonization=yes }
                21={ name="Earth" planet_class="pc_continental" owner=0 colonize_date="2200.01.01" }
                22={ name="Venus" planet_class="pc_toxic" owner=0 terraform_process={ planet_class="pc_ocean" } }
                """));
        scenario.importText(snapshot("2200.02.01", """
                20={ name="Mars" planet_class="pc_arid" owner=0 colonize_date="2200.01.25" }
                21={ name="Earth" planet_class="pc_shattered" owner=0 colonize_date="2200.01.01" }
                22={ name="Venus" planet_class="pc_ocean" owner=0 }
                """));
    }

    @Test
    @DisplayName("colonization runs until the colonize date of the finished colony")
    void colonizationClosesAtColonizeDate() throws FormatException {
        importFirstMonth();

        List<HistoricalEvent> colonization = scenario.events(EventKind.COLONIZATION);
        assertThat(colonization).hasSize(1);
        assertThat(colonization.get(0).subject().planet()).isEqualTo(20L);
        assertThat(colonization.get(0).subject().country()).isZero();
        assertThat(colonization.get(0).subject().system()).isEqualTo(1L);
        assertThat(colonization.get(0).startDay()).isZero();
        assertThat(colonization.get(0).endDay()).hasValue(24);
        assertThat(scenario.entity(EntityKind.PLANET, 20).getLong(PlanetModelsProcessor.COLONIZE_DAY)).hasValue(24);
    }

    @Test
    void terraformingEndsWhenTheProcessDisappears() throws FormatException {
        importFirstMonth();

        List<HistoricalEvent> terraforming = scenario.events(EventKind.TERRAFORMING);
        assertThat(terraforming).hasSize(1);
        assertThat(terraforming.get(0).subject().planet()).isEqualTo(22L);
        assertThat(terraforming.get(0).description()).hasValue("pc_toxic,pc_ocean");
        assertThat(terraforming.get(0).startDay()).isZero();
        assertThat(terraforming.get(0).endDay()).hasValue(29);
        assertThat(scenario.entity(EntityKind.PLANET, 22).getString(PlanetModelsProcessor.PLANET_CLASS))
                .hasValue("pc_ocean");
    }

    @Test
    @DisplayName("a planet turning into a destroyed class is recorded once")
    void destroyedPlanetIsRecordedOnce() throws FormatException {
        importFirstMonth();
        scenario.importText(snapshot("2200.03.01", """
                20={ name="Mars" planet_class="pc_arid" owner=0 colonize_date="2200.01.25" }
                21={ name="Earth" planet_class="pc_shattered" }
                22={ name="Venus" planet_class="pc_ocean" owner=0 }
                """));

        List<HistoricalEvent> destroyed = scenario.events(EventKind.PLANET_DESTROYED);
        assertThat(destroyed).hasSize(1);
        assertThat(destroyed.get(0).subject().planet()).isEqualTo(21L);
        assertThat(destroyed.get(0).subject().country()).isZero();
        assertThat(destroyed.get(0).description()).hasValue("pc_shattered");
        assertThat(destroyed.get(0).startDay()).isEqualTo(30);
        assertThat(scenario.entity(EntityKind.PLANET, 21).has("owner")).isFalse();
    }

    @Test
    void planetsFirstSeenAsColoniesHaveNoColonization() throws FormatException {
        importFirstMonth();

        assertThat(scenario.events(EventKind.COLONIZATION)).noneMatch(e -> e.subject().planet() == 21L);
        assertThat(scenario.entity(EntityKind.PLANET, 21).getLong(PlanetModelsProcessor.COLONIZE_DAY)).hasValue(0);
    }
}
