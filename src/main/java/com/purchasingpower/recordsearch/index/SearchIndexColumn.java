package com.purchasingpower.recordsearch.index;

import com.google.common.base.Preconditions;
import com.google.common.collect.Iterators;
import com.purchasingpower.recordsearch.normalize.Normalizer;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * An indexed property (a column).
 *
 * <p>Stores a bijective mapping between normalized property values and bit positions
 * claimed from the registry shared by every column of a {@link SearchIndex}. Adding a
 * value that is already present returns its existing position; deleting a value
 * relinquishes its position so it can be recycled.
 *
 * @since 1.0.0
 */
public class SearchIndexColumn implements IndexColumn {

    private final String name;
    private final BitPositionRegistry registry;
    private final Normalizer normalizer;
    private final Map<String, Integer> entries = new LinkedHashMap<>();

    public SearchIndexColumn(String name, BitPositionRegistry registry, ColumnDescription description) {
        this.name = Preconditions.checkNotNull(name, "Column name cannot be null");
        this.registry = Preconditions.checkNotNull(registry, "Registry cannot be null");
        this.normalizer = description == null ? ColumnDescription.defaults().normalizer() : description.normalizer();
    }

    public String getName() {
        return name;
    }

    @Override
    public String normalize(String value) {
        return normalizer.normalize(value);
    }

    /**
     * Adds a value to the column.
     *
     * @param value The raw value
     * @return The bit position associated with the normalized value
     */
    public int add(String value) {
        String normalized = normalize(value);

        Integer existing = entries.get(normalized);
        if (existing != null) {
            return existing;
        }

        int claimed = registry.claim();
        entries.put(normalized, claimed);
        return claimed;
    }

    /**
     * Removes a value from the column. Does nothing if the value is not present.
     *
     * @param value The raw value
     */
    public void delete(String value) {
        String normalized = normalize(value);

        Integer existing = entries.get(normalized);
        if (existing == null) {
            return;
        }

        registry.relinquish(existing);
        entries.remove(normalized);
    }

    @Override
    public OptionalInt get(String value) {
        Integer position = entries.get(normalize(value));
        return position == null ? OptionalInt.empty() : OptionalInt.of(position);
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public Iterator<Entry> iterator() {
        return Iterators.unmodifiableIterator(
                Iterators.transform(entries.entrySet().iterator(), e -> new Entry(e.getKey(), e.getValue())));
    }

    @Override
    public String toString() {
        return "SearchIndexColumn{name=" + name + ", size=" + entries.size() + "}";
    }
}
