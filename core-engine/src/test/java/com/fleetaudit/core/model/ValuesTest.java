package com.fleetaudit.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link Values}.
 */
class ValuesTest {

    @Test
    @DisplayName("Should read numbers, booleans and numeric strings as doubles")
    void shouldConvertToDouble() {
        assertThat(Values.toDouble(3L)).contains(3.0);
        assertThat(Values.toDouble(2.5f)).contains(2.5);
        assertThat(Values.toDouble(true)).contains(1.0);
        assertThat(Values.toDouble(" 42.5 ")).contains(42.5);
        assertThat(Values.toDouble("1e3")).contains(1000.0);
        assertThat(Values.toDouble("-inf")).contains(Double.NEGATIVE_INFINITY);
        assertThat(Values.toDouble("12 GB")).isEmpty();
        assertThat(Values.toDouble(null)).isEmpty();
        assertThat(Values.toDouble(List.of(1))).isEmpty();
    }

    @Test
    @DisplayName("Should treat null and empty containers as empty, but not empty strings")
    void shouldDetectEmptiness() {
        assertThat(Values.isEmpty(null)).isTrue();
        assertThat(Values.isEmpty(List.of())).isTrue();
        assertThat(Values.isEmpty(Map.of())).isTrue();
        assertThat(Values.isEmpty("")).isFalse();
        assertThat(Values.isEmpty(0)).isFalse();
    }

    @Test
    @DisplayName("Should compare numbers by value regardless of boxed type")
    void shouldCompareLoosely() {
        assertThat(Values.looselyEquals(0, 0L)).isTrue();
        assertThat(Values.looselyEquals(1.0, 1L)).isTrue();
        assertThat(Values.looselyEquals("1", 1L)).isFalse();
        assertThat(Values.looselyEquals(null, null)).isTrue();
        assertThat(Values.looselyEquals(false, false)).isTrue();
    }

    @Test
    @DisplayName("Should copy sequences and ignore everything else")
    void shouldCopyLists() {
        List<Object> copy = Values.asList(List.of("a", "b"));
        copy.add("c");

        assertThat(copy).containsExactly("a", "b", "c");
        assertThat(Values.asList(new Object[]{1, 2})).containsExactly(1, 2);
        assertThat(Values.asList("abc")).isEmpty();
        assertThat(Values.asList(null)).isEmpty();
    }

    @Test
    @DisplayName("Should render null as an empty string and booleans capitalised")
    void shouldStringify() {
        assertThat(Values.stringify(null)).isEmpty();
        assertThat(Values.stringify(1.5)).isEqualTo("1.5");
        assertThat(Values.stringify(true)).isEqualTo("True");
        assertThat(Values.stringify(false)).isEqualTo("False");
    }
}
