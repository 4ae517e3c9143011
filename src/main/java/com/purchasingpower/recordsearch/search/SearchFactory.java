package com.purchasingpower.recordsearch.search;

import com.google.common.base.Preconditions;
import com.purchasingpower.recordsearch.index.BitVector;
import com.purchasingpower.recordsearch.index.ColumnDescription;
import com.purchasingpower.recordsearch.index.SearchIndex;
import com.purchasingpower.recordsearch.index.SearchIndexColumn;
import com.purchasingpower.recordsearch.normalize.Normalizer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Builds {@link Search} instances over a fixed collection of items.
 *
 * <pre>{@code
 * SealedSearch<Animal> search = new SearchFactory<>(animals)
 *     .withColumn("name", Animal::getName, Normalizers.standard())
 *     .withMultiValueColumn("tag", Animal::getTags, Normalizers.standard())
 *     .withSorting(Comparator.comparing(Animal::getName))
 *     .build();
 * }</pre>
 *
 * @param <T> The item type
 * @since 1.0.0
 */
public class SearchFactory<T> {

    private final List<T> items;
    private final Map<String, ColumnSource<T>> columns = new LinkedHashMap<>();
    private Comparator<? super T> sorting;
    private boolean inclusiveDefaults = false;
    private boolean resultRanking = true;
    private FuzzyMatcher fuzzyMatcher;

    /**
     * @param items The items to search through
     */
    public SearchFactory(Collection<? extends T> items) {
        Preconditions.checkNotNull(items, "Items cannot be null");
        this.items = new ArrayList<>(items);
    }

    /**
     * Adds a single-valued column. Items whose getter returns {@code null} contribute nothing.
     *
     * @param name The column name
     * @param getter Extracts the value to index
     * @param normalizer Normalizes both stored values and queries, or {@code null} for none
     */
    public SearchFactory<T> withColumn(String name, Function<? super T, String> getter, Normalizer normalizer) {
        Preconditions.checkNotNull(getter, "Getter cannot be null");
        return withMultiValueColumn(name, item -> {
            String value = getter.apply(item);
            return value == null ? Collections.emptyList() : Collections.singletonList(value);
        }, normalizer);
    }

    /**
     * Adds a column where each item may contribute several values.
     *
     * @param name The column name
     * @param getter Extracts the values to index
     * @param normalizer Normalizes both stored values and queries, or {@code null} for none
     */
    public SearchFactory<T> withMultiValueColumn(String name,
                                                 Function<? super T, ? extends Collection<String>> getter,
                                                 Normalizer normalizer) {
        Preconditions.checkNotNull(name, "Column name cannot be null");
        Preconditions.checkNotNull(getter, "Getter cannot be null");
        Preconditions.checkArgument(!columns.containsKey(name), "Column '%s' is already declared", name);

        columns.put(name, new ColumnSource<>(getter, ColumnDescription.normalizedBy(normalizer)));
        return this;
    }

    /**
     * Adds a sorting rule for results with equal score. Rules apply in the order added.
     */
    public SearchFactory<T> withSorting(Comparator<? super T> comparator) {
        Preconditions.checkNotNull(comparator, "Comparator cannot be null");
        if (sorting == null) {
            sorting = comparator;
        } else {
            Comparator<? super T> previous = sorting;
            sorting = (a, b) -> {
                int result = previous.compare(a, b);
                return result != 0 ? result : comparator.compare(a, b);
            };
        }
        return this;
    }

    /**
     * Whether searches with no operations select every item.
     */
    public SearchFactory<T> withInclusiveDefaults(boolean enabled) {
        this.inclusiveDefaults = enabled;
        return this;
    }

    /**
     * Whether scores order the results.
     */
    public SearchFactory<T> withResultRanking(boolean enabled) {
        this.resultRanking = enabled;
        return this;
    }

    public SearchFactory<T> withFuzzyMatcher(FuzzyMatcher matcher) {
        this.fuzzyMatcher = matcher;
        return this;
    }

    /**
     * Indexes the items and returns a search that is already reset.
     */
    public SealedSearch<T> build() {
        Map<String, ColumnDescription> descriptions = new LinkedHashMap<>();
        columns.forEach((name, source) -> descriptions.put(name, source.description));

        SearchOptions.SearchOptionsBuilder<T> options = SearchOptions.<T>builder()
                .resetToAll(inclusiveDefaults)
                .resultRanking(resultRanking)
                .compareItem(sorting);
        if (fuzzyMatcher != null) {
            options.fuzzyMatcher(fuzzyMatcher);
        }

        Search<T> search = new Search<>(descriptions, this::indexItem, options.build());
        search.addItems(items);
        search.reset();
        return search;
    }

    private BitVector indexItem(T item, SearchIndex index) {
        BitVector.Builder vector = BitVector.builder();

        for (Map.Entry<String, ColumnSource<T>> entry : columns.entrySet()) {
            SearchIndexColumn column = index.column(entry.getKey());
            Collection<String> values = entry.getValue().getter.apply(item);
            if (values == null) {
                continue;
            }

            for (String value : values) {
                if (value != null) {
                    vector.set(column.add(value));
                }
            }
        }

        return vector.build();
    }

    private static final class ColumnSource<T> {
        private final Function<? super T, ? extends Collection<String>> getter;
        private final ColumnDescription description;

        private ColumnSource(Function<? super T, ? extends Collection<String>> getter, ColumnDescription description) {
            this.getter = getter;
            this.description = description;
        }
    }
}
