package com.purchasingpower.recordsearch.index;

import com.purchasingpower.recordsearch.normalize.Normalizers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SearchIndexColumn Tests")
class SearchIndexColumnTest {

    private BitPositionRegistry registry;
    private SearchIndexColumn column;

    @BeforeEach
    void setUp() {
        registry = new BitPositionRegistry();
        column = new SearchIndexColumn("animal", registry, ColumnDescription.normalizedBy(Normalizers.CASEFOLD));
    }

    @Test
    @DisplayName("Adding the same normalized value twice returns the same position")
    void add_ShouldBeIdempotentOnNormalizedValue() {
        int dog = column.add("Dog");

        assertThat(column.add("DOG")).isEqualTo(dog);
        assertThat(column.add("dog")).isEqualTo(dog);
        assertThat(column.size()).isEqualTo(1);
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("get finds values by their normalized form")
    void get_ShouldLookUpNormalizedValue() {
        int cat = column.add("cat");

        assertThat(column.get("CAT")).hasValue(cat);
        assertThat(column.get("bird")).isEmpty();
    }

    @Test
    @DisplayName("delete relinquishes the position and ignores unknown values")
    void delete_ShouldReleasePosition() {
        int cat = column.add("cat");
        column.add("dog");

        column.delete("Cat");
        column.delete("bird");

        assertThat(column.get("cat")).isEmpty();
        assertThat(column.size()).isEqualTo(1);
        assertThat(registry.getField().get(cat)).isFalse();
        assertThat(column.add("fish")).isEqualTo(cat);
    }

    @Test
    @DisplayName("Columns sharing a registry never share positions")
    void sharedRegistry_ShouldKeepPositionsDistinct() {
        SearchIndexColumn other = new SearchIndexColumn("color", registry, ColumnDescription.defaults());

        int dog = column.add("dog");
        int red = other.add("dog");

        assertThat(dog).isNotEqualTo(red);
    }

    @Test
    @DisplayName("Every claimed position maps back to exactly one value")
    void iteration_ShouldBeBijective() {
        // Given: a mix of adds and deletes
        column.add("a");
        column.add("b");
        column.add("c");
        column.delete("b");
        column.add("d");
        column.add("A");

        // When
        List<String> values = new ArrayList<>();
        Set<Integer> positions = new HashSet<>();
        for (IndexColumn.Entry entry : column) {
            values.add(entry.value());
            positions.add(entry.position());
        }

        // Then: insertion order and one position per value
        assertThat(values).containsExactly("a", "c", "d");
        assertThat(positions).hasSize(3);
        assertThat(registry.getField().cardinality()).isEqualTo(3);
        positions.forEach(position -> assertThat(registry.getField().get(position)).isTrue());
    }

    @Test
    @DisplayName("Iterator does not allow removal")
    void iterator_ShouldBeUnmodifiable() {
        column.add("a");

        assertThatThrownBy(() -> {
            Iterator<IndexColumn.Entry> iterator = column.iterator();
            iterator.next();
            iterator.remove();
        }).isInstanceOf(UnsupportedOperationException.class);
    }
}
