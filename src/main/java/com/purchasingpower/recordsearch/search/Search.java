package com.purchasingpower.recordsearch.search;

import com.google.common.base.Preconditions;
import com.purchasingpower.recordsearch.index.BitVector;
import com.purchasingpower.recordsearch.index.ColumnDescription;
import com.purchasingpower.recordsearch.index.SearchIndex;
import com.purchasingpower.recordsearch.index.SearchIndexColumn;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A searchable collection of items.
 *
 * <p>Items are indexed once when added. Each {@link #search} call evaluates a condition
 * against one column and folds the matching positions into a running selection.
 * {@link #getResults()} then returns every item that shares at least one position with
 * the selection, ordered by accumulated score.
 *
 * <p><b>Thread Safety:</b> Not thread safe. Callers serialize access.
 *
 * @param <T> The item type
 * @since 1.0.0
 */
@Slf4j
public class Search<T> implements SealedSearch<T> {

    private final SearchIndex index;
    private final ItemIndexer<? super T> indexer;
    private final boolean resetToAll;
    private final FuzzyMatcher fuzzyMatcher;
    private final Comparator<ScoredItem<T>> resultOrder;
    private final List<ScoredItem<T>> indexedItems = new ArrayList<>();

    private BitVector selection = BitVector.EMPTY;
    private float[] scores = new float[0];
    private List<T> memoizedResults;

    public Search(Map<String, ColumnDescription> columns, ItemIndexer<? super T> indexer, SearchOptions<T> options) {
        Preconditions.checkNotNull(indexer, "Item indexer cannot be null");
        SearchOptions<T> resolved = options == null ? SearchOptions.defaults() : options;

        this.index = new SearchIndex(columns);
        this.indexer = indexer;
        this.resetToAll = resolved.isResetToAll();
        this.fuzzyMatcher = resolved.getFuzzyMatcher();
        this.resultOrder = buildResultOrder(resolved);
    }

    private static <T> Comparator<ScoredItem<T>> buildResultOrder(SearchOptions<T> options) {
        Comparator<? super T> compareItem = options.getCompareItem();
        Comparator<ScoredItem<T>> byValue = compareItem == null
                ? (a, b) -> 0
                : (a, b) -> compareItem.compare(a.value, b.value);

        if (!options.isResultRanking()) {
            return byValue;
        }

        Comparator<ScoredItem<T>> byScore = (a, b) -> Float.compare(b.score, a.score);
        return byScore.thenComparing(byValue);
    }

    @Override
    public SearchIndex getIndex() {
        return index;
    }

    /**
     * Adds items to the search, indexing each one.
     *
     * @param items The items to add
     */
    public void addItems(Collection<? extends T> items) {
        for (T item : items) {
            indexedItems.add(new ScoredItem<>(item, indexer.index(item, index)));
        }

        ensureScoreCapacity();
        log.debug("Indexed {} items ({} total, {} positions)", items.size(), indexedItems.size(), index.size());
    }

    @Override
    public void reset() {
        selection = resetToAll ? index.getBitfield() : BitVector.EMPTY;
        scores = new float[index.size()];
        memoizedResults = null;
    }

    @Override
    public void search(String column, SearchCondition condition, String text, SearchEffect effect) {
        search(column, condition, text, effect, 1f);
    }

    @Override
    public void search(String column, SearchCondition condition, String text, SearchEffect effect, float weight) {
        Preconditions.checkNotNull(condition, "Condition cannot be null");
        Preconditions.checkNotNull(effect, "Effect cannot be null");
        Preconditions.checkNotNull(text, "Search text cannot be null");

        SearchIndexColumn indexColumn = index.column(column);
        memoizedResults = null;
        ensureScoreCapacity();

        float[] delta = new float[scores.length];
        BitVector matched = condition.apply(indexColumn, indexColumn.normalize(text), delta, fuzzyMatcher);
        selection = effect.apply(selection, matched);

        for (int i = 0; i < scores.length; i++) {
            scores[i] += delta[i] * weight;
        }

        log.trace("{} {} {} \"{}\" matched {} positions", effect, column, condition, text, matched.cardinality());
    }

    @Override
    public List<T> getResults() {
        if (memoizedResults != null) {
            return memoizedResults;
        }

        List<ScoredItem<T>> selected = new ArrayList<>();
        for (ScoredItem<T> item : indexedItems) {
            if (item.vector.intersects(selection)) {
                item.score = (float) item.vector.stream()
                        .mapToDouble(position -> position < scores.length ? scores[position] : 0f)
                        .sum();
                selected.add(item);
            }
        }

        // List.sort is stable, so ties without a comparator keep insertion order.
        selected.sort(resultOrder);

        memoizedResults = Collections.unmodifiableList(selected.stream()
                .map(item -> item.value)
                .collect(Collectors.toList()));
        return memoizedResults;
    }

    /**
     * The number of items added to this search.
     */
    public int size() {
        return indexedItems.size();
    }

    private void ensureScoreCapacity() {
        int required = index.size();
        if (required > scores.length) {
            scores = Arrays.copyOf(scores, required);
        }
    }

    private static final class ScoredItem<T> {
        private final T value;
        private final BitVector vector;
        private float score;

        private ScoredItem(T value, BitVector vector) {
            this.value = value;
            this.vector = vector;
        }
    }
}
