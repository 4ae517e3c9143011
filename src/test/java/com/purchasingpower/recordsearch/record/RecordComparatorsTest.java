package com.purchasingpower.recordsearch.record;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Record Comparators Tests")
class RecordComparatorsTest {

    private static SearchableRecord colored(String id, String color) {
        return SearchableRecord.builder().id(id).color(color).build();
    }

    private static List<String> sorted(SearchableRecord... records) {
        List<SearchableRecord> list = new ArrayList<>(Arrays.asList(records));
        list.sort(RecordComparators.standard());
        return list.stream().map(SearchableRecord::getId).toList();
    }

    @Test
    @DisplayName("Colors order by hue, highest first")
    void colors_ShouldOrderByHue() {
        assertThat(sorted(
                colored("red", "168, 50, 50"),
                colored("green", "70, 168, 50"),
                colored("blue", "50, 54, 168")))
                .containsExactly("blue", "green", "red");
    }

    @Test
    @DisplayName("Channels compare as numbers, not text")
    void channels_ShouldCompareNumerically() {
        assertThat(sorted(
                colored("dim", "20, 0, 0"),
                colored("bright", "100, 0, 0")))
                .containsExactly("bright", "dim");
    }

    @Test
    @DisplayName("Colors come before shades, brighter shades first")
    void shades_ShouldFollowColors() {
        assertThat(sorted(
                colored("black", "0, 0, 0"),
                colored("gray", "127, 127, 127"),
                colored("white", "255, 255, 255"),
                colored("red", "255, 0, 0")))
                .containsExactly("red", "white", "gray", "black");
    }

    @Test
    @DisplayName("Missing or malformed colors sort last")
    void invalidColors_ShouldSortLast() {
        assertThat(sorted(
                colored("missing", null),
                colored("malformed", "red"),
                colored("out-of-range", "256, 0, 0"),
                colored("black", "0, 0, 0")))
                .containsExactly("black", "malformed", "missing", "out-of-range");
    }

    @Test
    @DisplayName("Equal colors fall back to id order")
    void equalColors_ShouldOrderById() {
        assertThat(sorted(
                colored("b", "255, 255, 255"),
                colored("a", "255, 255, 255")))
                .containsExactly("a", "b");
    }

    @Test
    @DisplayName("HSV conversion matches known colors")
    void fromRgb_ShouldConvert() {
        RecordComparators.Hsv orange = RecordComparators.Hsv.fromRgb(255, 128, 0);

        assertThat(orange.hue()).isCloseTo(30.1, within(0.1));
        assertThat(orange.saturation()).isEqualTo(100.0);
        assertThat(orange.value()).isEqualTo(100.0);
        assertThat(RecordComparators.Hsv.parse(" 10 ,20, 30 ")).isNotNull();
        assertThat(RecordComparators.Hsv.parse("10, 20")).isNull();
    }
}
