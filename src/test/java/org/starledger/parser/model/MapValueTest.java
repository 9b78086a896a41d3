package org.starledger.parser.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.starledger.parser.frontend.parser.FormatException;
import org.starledger.parser.frontend.parser.SnapshotParser;

@Tag("unit")
class MapValueTest {

    @Test
    void accessorsReturnEmptyOnUnexpectedShapes() throws FormatException {
        MapValue doc = SnapshotParser.parse("name=\"Earth\" size=12 block={ a=1 } list={ 1 2 }");

        assertThat(doc.longValue("name")).isEmpty();
        assertThat(doc.string("size")).isEmpty();
        assertThat(doc.map("list")).isEmpty();
        assertThat(doc.map("missing")).isEmpty();
        assertThat(doc.string("missing", "fallback")).isEqualTo("fallback");
        assertThat(doc.doubleValue("size", 0.0)).isEqualTo(12.0);
    }

    @Test
    void listNormalizesSingleValues() throws FormatException {
        MapValue doc = SnapshotParser.parse("one=5 many={ 5 6 } mixed={ 1 x 2 }");

        assertThat(doc.longs("one")).containsExactly(5L);
        assertThat(doc.longs("many")).containsExactly(5L, 6L);
        assertThat(doc.longs("mixed")).containsExactly(1L, 2L);
        assertThat(doc.strings("mixed")).containsExactly("x");
    }

    @Test
    void objectsByIdSkipsDeletedEntriesAndTextKeys() throws FormatException {
        MapValue doc = SnapshotParser.parse("leaders={ 7={ name=a } 3={ name=b } 5=none version=2 }");

        MapValue leaders = doc.map("leaders").orElseThrow();
        assertThat(leaders.objectsById()).containsOnlyKeys(3L, 7L);
        assertThat(leaders.objectsById().firstKey()).isEqualTo(3L);
    }

    @Test
    void isYesOnlyForYes() throws FormatException {
        MapValue doc = SnapshotParser.parse("a=yes b=no c=1");

        assertThat(doc.isYes("a")).isTrue();
        assertThat(doc.isYes("b")).isFalse();
        assertThat(doc.isYes("c")).isFalse();
        assertThat(doc.isYes("d")).isFalse();
    }

    @Test
    void numericKeysSortBeforeTextKeys() {
        assertThat(Key.of(10).compareTo(Key.of(9))).isPositive();
        assertThat(Key.of(10).compareTo(Key.of("a"))).isNegative();
        assertThat(Key.of("b").compareTo(Key.of("a"))).isPositive();
        assertThat(Key.of(4).id()).hasValue(4L);
        assertThat(Key.of("4").id()).isEmpty();
    }
}
