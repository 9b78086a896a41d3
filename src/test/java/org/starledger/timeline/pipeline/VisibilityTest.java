package org.starledger.timeline.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.starledger.timeline.api.SnapshotInfo;
import org.starledger.timeline.model.Attitude;
import org.starledger.timeline.model.Disclosure;
import org.starledger.timeline.model.Entity;
import org.starledger.timeline.model.EntityKind;
import org.starledger.timeline.store.ITimelineTransaction;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class VisibilityTest {

    @Mock
    private ITimelineTransaction transaction;

    private final SnapshotInfo observed = new SnapshotInfo("s", 100, "2200.04.11", 0L, Set.of());

    @BeforeEach
    void setUp() {
        when(transaction.findEntity(eq(EntityKind.COUNTRY), anyLong())).thenReturn(Optional.empty());
    }

    private Entity country(long id, Attitude attitude, boolean met) {
        Entity country = new Entity(EntityKind.COUNTRY, id, 0);
        country.set(Visibility.ATTITUDE, attitude.id());
        if (met) {
            country.set(Visibility.FIRST_CONTACT_DAY, 12);
        }
        when(transaction.findEntity(EntityKind.COUNTRY, id)).thenReturn(Optional.of(country));
        return country;
    }

    @Test
    void observerKnowsItself() {
        Visibility visibility = new Visibility(observed, transaction);

        assertThat(visibility.hasMet(0L)).isTrue();
        assertThat(visibility.reveals(0L, Disclosure.MILITARY)).isTrue();
    }

    @Test
    void unmetCountryRevealsNothing() {
        country(3, Attitude.FRIENDLY, false);
        Visibility visibility = new Visibility(observed, transaction);

        assertThat(visibility.hasMet(3L)).isFalse();
        assertThat(visibility.reveals(3L, Disclosure.CONTACT)).isFalse();
        assertThat(visibility.reveals(3L, Disclosure.DEMOGRAPHY)).isFalse();
    }

    @Test
    void disclosureFollowsAttitude() {
        country(3, Attitude.CORDIAL, true);
        Visibility visibility = new Visibility(observed, transaction);

        assertThat(visibility.reveals(3L, Disclosure.CONTACT)).isTrue();
        assertThat(visibility.reveals(3L, Disclosure.ECONOMY)).isTrue();
        assertThat(visibility.reveals(3L, Disclosure.TECHNOLOGY)).isFalse();
        assertThat(visibility.reveals(3L, Disclosure.MILITARY)).isFalse();
    }

    @Test
    void sensorLinkRevealsEverything() {
        country(3, Attitude.HOSTILE, true).set(Visibility.SENSOR_LINK, true);
        Visibility visibility = new Visibility(observed, transaction);

        assertThat(visibility.reveals(3L, Disclosure.MILITARY)).isTrue();
    }

    @Test
    void observerModeRevealsEverything() {
        Visibility visibility = new Visibility(new SnapshotInfo("s", 0, "2200.01.01", null, Set.of()), transaction);

        assertThat(visibility.hasMet(99L)).isTrue();
        assertThat(visibility.hasMet(null)).isTrue();
        assertThat(visibility.reveals(99L, Disclosure.MILITARY)).isTrue();
    }

    @Test
    void hasMetAnyIgnoresNulls() {
        country(3, Attitude.NEUTRAL, true);
        Visibility visibility = new Visibility(observed, transaction);

        assertThat(visibility.hasMet(null)).isFalse();
        assertThat(visibility.hasMetAny(null, 5L)).isFalse();
        assertThat(visibility.hasMetAny(null, 3L)).isTrue();
    }
}
