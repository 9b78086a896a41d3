package org.starledger.timeline.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.google.gson.JsonObject;

@Tag("unit")
class EntityTest {

    @Test
    void newEntityIsDirtyAndRestoredEntityIsClean() {
        assertThat(new Entity(EntityKind.COUNTRY, 1, 0).isDirty()).isTrue();
        assertThat(new Entity(EntityKind.COUNTRY, 1, 0, new JsonObject()).isDirty()).isFalse();
    }

    @Test
    void settersReportChanges() {
        Entity leader = new Entity(EntityKind.LEADER, 7, 0, new JsonObject());

        assertThat(leader.set("level", 2)).isTrue();
        assertThat(leader.set("level", 2)).isFalse();
        assertThat(leader.isDirty()).isTrue();

        leader.markClean();
        assertThat(leader.set("level", 3)).isTrue();
        assertThat(leader.isDirty()).isTrue();
        assertThat(leader.getLong("level")).hasValue(3L);
    }

    @Test
    void typedGettersIgnoreOtherShapes() {
        Entity country = new Entity(EntityKind.COUNTRY, 0, 0);
        country.set("name", "Earth");
        country.set("observer", true);
        country.setLongs("planets", List.of(3L, 1L));

        assertThat(country.getLong("name")).isEmpty();
        assertThat(country.getString("name")).contains("Earth");
        assertThat(country.getBoolean("observer")).isTrue();
        assertThat(country.getBoolean("name")).isFalse();
        assertThat(country.getLongs("planets")).containsExactly(3L, 1L);
        assertThat(country.getDouble("missing", 1.5)).isEqualTo(1.5);
    }

    @Test
    void removingAbsentAttributeChangesNothing() {
        Entity system = new Entity(EntityKind.SYSTEM, 4, 0, new JsonObject());
        system.set("owner", 2);
        system.markClean();

        assertThat(system.remove("owner")).isTrue();
        assertThat(system.remove("owner")).isFalse();
        assertThat(system.has("owner")).isFalse();
    }

    @Test
    void attributesAreCopied() {
        Entity war = new Entity(EntityKind.WAR, 1, 0);
        war.set("name", "Great War");

        JsonObject copy = war.attributes();
        copy.addProperty("name", "changed");

        assertThat(war.getString("name")).contains("Great War");
    }
}
