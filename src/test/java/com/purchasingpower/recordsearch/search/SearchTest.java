package com.purchasingpower.recordsearch.search;

import com.purchasingpower.recordsearch.exception.NoSuchColumnException;
import com.purchasingpower.recordsearch.index.BitVector;
import com.purchasingpower.recordsearch.index.ColumnDescription;
import com.purchasingpower.recordsearch.index.SearchIndex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Search Tests")
class SearchTest {

    private static final String COLUMN = "test";

    private static BitVector indexWord(String item, SearchIndex index) {
        return BitVector.fromPosition(index.column(COLUMN).add(item));
    }

    private static Search<String> search(SearchOptions<String> options, String... items) {
        Search<String> search = new Search<>(Map.of(COLUMN, ColumnDescription.defaults()),
                SearchTest::indexWord, options);
        search.addItems(List.of(items));
        search.reset();
        return search;
    }

    private static SearchOptions<String> selectAll() {
        return SearchOptions.<String>builder().resetToAll(true).build();
    }

    @Test
    @DisplayName("Effects compose in order: filter, filter, then add")
    void effects_ShouldComposeInOrder() {
        // Given
        Search<String> search = search(selectAll(), "foo", "bar", "baz");

        // When
        search.search(COLUMN, SearchCondition.STARTS_WITH, "ba", SearchEffect.FILTER);
        search.search(COLUMN, SearchCondition.INCLUDES, "ar", SearchEffect.FILTER);
        search.search(COLUMN, SearchCondition.EQUALS, "foo", SearchEffect.ADD);

        // Then
        assertThat(search.getResults()).containsExactlyInAnyOrder("foo", "bar");
    }

    @Test
    @DisplayName("Higher scores rank first")
    void results_ShouldRankByScore() {
        Search<String> search = search(SearchOptions.defaults(), "doge", "dog");

        search.search(COLUMN, SearchCondition.STARTS_WITH, "dog", SearchEffect.ADD);

        assertThat(search.getResults()).containsExactly("dog", "doge");
    }

    @Test
    @DisplayName("Reset with select-all returns every item exactly once")
    void reset_SelectAll_ShouldReturnEverything() {
        Search<String> search = search(selectAll(), "a", "b", "c");

        search.reset();
        search.reset();

        assertThat(search.getResults()).containsExactlyInAnyOrder("a", "b", "c");
    }

    @Test
    @DisplayName("Reset without select-all returns nothing")
    void reset_Default_ShouldReturnNothing() {
        Search<String> search = search(SearchOptions.defaults(), "a", "b");

        search.search(COLUMN, SearchCondition.INCLUDES, "a", SearchEffect.ADD);
        search.reset();

        assertThat(search.getResults()).isEmpty();
    }

    @Test
    @DisplayName("Equal scores are ordered by the comparator in natural order")
    void ties_ShouldUseComparator() {
        SearchOptions<String> options = SearchOptions.<String>builder()
                .resetToAll(true)
                .compareItem(Comparator.naturalOrder())
                .build();
        Search<String> search = search(options, "cherry", "apple", "banana");

        assertThat(search.getResults()).containsExactly("apple", "banana", "cherry");
    }

    @Test
    @DisplayName("Without a comparator, ties keep insertion order")
    void ties_WithoutComparator_ShouldKeepInsertionOrder() {
        Search<String> search = search(selectAll(), "cherry", "apple", "banana");

        assertThat(search.getResults()).containsExactly("cherry", "apple", "banana");
    }

    @Test
    @DisplayName("With ranking disabled only the comparator orders results")
    void rankingDisabled_ShouldIgnoreScores() {
        SearchOptions<String> options = SearchOptions.<String>builder()
                .resultRanking(false)
                .compareItem(Comparator.<String>naturalOrder().reversed())
                .build();
        Search<String> search = search(options, "dog", "doge");

        search.search(COLUMN, SearchCondition.STARTS_WITH, "dog", SearchEffect.ADD);

        assertThat(search.getResults()).containsExactly("doge", "dog");
    }

    @Test
    @DisplayName("Weight scales an operation's influence on ranking")
    void weight_ShouldScaleScores() {
        Search<String> search = search(SearchOptions.defaults(), "alpha", "beta");

        // Given: beta matches a heavily weighted operation, alpha a light one
        search.search(COLUMN, SearchCondition.INCLUDES, "alpha", SearchEffect.ADD, 0.1f);
        search.search(COLUMN, SearchCondition.INCLUDES, "beta", SearchEffect.ADD, 10f);

        assertThat(search.getResults()).containsExactly("beta", "alpha");
    }

    @Test
    @DisplayName("Results are memoized until the next operation")
    void results_ShouldBeMemoized() {
        Search<String> search = search(selectAll(), "a", "b");

        List<String> first = search.getResults();
        assertThat(search.getResults()).isSameAs(first);

        search.search(COLUMN, SearchCondition.INCLUDES, "a", SearchEffect.FILTER);
        assertThat(search.getResults()).isNotSameAs(first).containsExactly("a");
    }

    @Test
    @DisplayName("Results cannot be modified")
    void results_ShouldBeUnmodifiable() {
        Search<String> search = search(selectAll(), "a");

        assertThatThrownBy(() -> search.getResults().add("b")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Items added after reset are searchable and keep earlier scores")
    void addItems_AfterReset_ShouldGrowScores() {
        // Given
        Search<String> search = search(SearchOptions.defaults(), "dog");
        search.search(COLUMN, SearchCondition.STARTS_WITH, "dog", SearchEffect.ADD);

        // When: the index grows between reset and the next operation
        search.addItems(List.of("doggo"));
        search.search(COLUMN, SearchCondition.STARTS_WITH, "dog", SearchEffect.ADD);

        // Then
        assertThat(search.getResults()).containsExactly("dog", "doggo");
        assertThat(search.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Searching an unknown column fails loudly")
    void search_UnknownColumn_ShouldThrow() {
        Search<String> search = search(SearchOptions.defaults(), "a");

        assertThatThrownBy(() -> search.search("nope", SearchCondition.MATCHES, "a", SearchEffect.ADD))
                .isInstanceOf(NoSuchColumnException.class);
    }
}
